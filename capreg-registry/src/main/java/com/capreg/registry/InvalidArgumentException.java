package com.capreg.registry;

/**
 * Malformed input to a catalog operation: blank id or type, negative paging bounds, or a value of the
 * wrong concrete type at an adapter boundary.
 */
public final class InvalidArgumentException extends CatalogException {

    public InvalidArgumentException(String message) {
        super(message);
    }
}
