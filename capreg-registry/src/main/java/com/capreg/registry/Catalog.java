package com.capreg.registry;

import java.util.List;
import java.util.Optional;

/**
 * Operation set of a capability catalog. Implementations are safe for concurrent use; operations on the
 * same id are linearizable, operations on different ids are unordered relative to each other.
 * <p>
 * List results are snapshots with no defined order; callers must not depend on ordering, and paging is
 * only consistent while the catalog is not mutated between pages.
 *
 * @see InMemoryCatalog
 */
public interface Catalog {

    /**
     * Upserts a capability. A new id is created with version 1; an existing id (live or soft-deleted) has
     * its name, type and metadata replaced, its version incremented and its tombstone cleared.
     *
     * @param capability value to register
     * @return the stored entry after the call
     * @throws InvalidArgumentException if capability is null or its id or type is blank
     */
    Entry register(Capability capability);

    /**
     * Strict create. A blank id is replaced by a generated one.
     *
     * @return the created entry (version 1)
     * @throws EntryAlreadyExistsException if the id already exists, including as a tombstone
     * @throws InvalidArgumentException    if the type is blank
     */
    Entry create(Entry entry);

    /** Returns the live entry for id; empty if absent or soft-deleted. */
    Optional<Entry> get(String id);

    /**
     * Replaces name, type and metadata of a live entry and increments its version.
     *
     * @throws EntryNotFoundException   if the id is absent or soft-deleted
     * @throws InvalidArgumentException if id or type is blank
     */
    Entry update(Entry entry);

    /**
     * Soft-deletes the entry. Unregistering an already-deleted id is a no-op.
     *
     * @throws EntryNotFoundException if the id was never registered
     */
    void unregister(String id);

    /**
     * Clears the tombstone of a soft-deleted entry, keeping its version. Restoring a live entry is a no-op.
     *
     * @return the live entry
     * @throws EntryNotFoundException if the id was never registered
     */
    Entry restore(String id);

    /** All live entries. */
    List<Entry> list();

    /** Live entries whose type equals {@code type}. */
    List<Entry> listByType(String type);

    /**
     * Up to {@code limit} live entries starting at {@code offset}. Returns an empty list when offset is at or
     * past the end.
     *
     * @throws InvalidArgumentException if limit or offset is negative
     */
    List<Entry> listPaginated(int limit, int offset);

    /** Number of live entries. */
    int size();
}
