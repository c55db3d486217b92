package com.capreg.registry;

/**
 * Thrown by {@link Catalog#create(Entry)} when the id is already taken (live or tombstoned).
 * {@link Catalog#register(Capability)} never throws this; it upserts.
 */
public final class EntryAlreadyExistsException extends CatalogException {

    private final String id;

    public EntryAlreadyExistsException(String id) {
        super("Entry already exists: " + id);
        this.id = id;
    }

    public String getId() {
        return id;
    }
}
