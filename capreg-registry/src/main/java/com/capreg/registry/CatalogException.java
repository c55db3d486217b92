package com.capreg.registry;

/**
 * Base type for errors returned by {@link Catalog} operations. Subclasses discriminate the failure
 * so callers (e.g. an HTTP layer) can map them to status codes.
 */
public abstract class CatalogException extends RuntimeException {

    protected CatalogException(String message) {
        super(message);
    }
}
