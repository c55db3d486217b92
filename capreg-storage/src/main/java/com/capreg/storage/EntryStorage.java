package com.capreg.storage;

import com.capreg.registry.Entry;

import java.util.List;
import java.util.Optional;

/**
 * Storage-level backend over concrete {@link Entry} values. Implementations keep the same versioning and
 * tombstone rules as the catalog; {@link StorageCatalogAdapter} exposes any implementation as a
 * {@link com.capreg.registry.Catalog}.
 */
public interface EntryStorage {

    /** Stores a new entry with version 1; fails if the id exists (live or tombstoned). */
    Entry createItem(Entry item);

    /** Creates or replaces content (version + 1, tombstone cleared). */
    Entry upsertItem(Entry item);

    /** Live entry for id, empty if absent or deleted. */
    Optional<Entry> getItem(String id);

    /** Replaces content of a live entry; fails not-found for absent or deleted ids. */
    Entry updateItem(Entry item);

    /** Soft-deletes; fails not-found for unknown ids, no-op for already-deleted ones. */
    void deleteItem(String id);

    /** Clears the tombstone; fails not-found for unknown ids. */
    Entry restoreItem(String id);

    /** All live entries. */
    List<Entry> listItems();

    /** One page of live entries; empty when offset is past the end. */
    List<Entry> listItems(int limit, int offset);
}
