package com.capreg.registry;

/**
 * Thrown when an operation references an id that is absent from the catalog, or soft-deleted where the
 * operation requires a live entry.
 */
public final class EntryNotFoundException extends CatalogException {

    private final String id;

    public EntryNotFoundException(String id) {
        super("Entry not found: " + id);
        this.id = id;
    }

    public String getId() {
        return id;
    }
}
