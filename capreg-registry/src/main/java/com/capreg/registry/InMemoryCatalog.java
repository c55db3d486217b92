package com.capreg.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;

/**
 * Thread-safe in-memory {@link Catalog}. Entries live in a single map guarded by a read/write lock:
 * mutations hold the write lock for the whole map, queries hold the read lock, so list operations see
 * one consistent snapshot. Deleted entries stay in the map as tombstones; nothing is ever removed.
 * <p>
 * Construct one per application and pass it explicitly (e.g. to the plugin loader); there is no shared
 * instance.
 */
public final class InMemoryCatalog implements Catalog {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCatalog.class);

    private final Map<String, Entry> entries = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Clock clock;

    public InMemoryCatalog() {
        this(Clock.systemUTC());
    }

    /** @param clock source of createdAt/updatedAt timestamps */
    public InMemoryCatalog(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Entry register(Capability capability) {
        if (capability == null) {
            throw new InvalidArgumentException("capability must not be null");
        }
        // capability may come from a plugin module: read it once, outside the lock
        Entry snapshot = Entry.snapshotOf(capability);
        CatalogPreconditions.requireRegistrable(snapshot);
        String id = snapshot.getId();
        Entry stored;
        lock.writeLock().lock();
        try {
            Instant now = clock.instant();
            Entry existing = entries.get(id);
            stored = existing == null
                    ? Entry.fromCapability(snapshot, now)
                    : existing.withContent(snapshot, now);
            entries.put(id, stored);
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Registered id={} type={} version={}", id, stored.getType(), stored.getVersion());
        return stored;
    }

    @Override
    public Entry create(Entry entry) {
        if (entry == null) {
            throw new InvalidArgumentException("entry must not be null");
        }
        String id = entry.getId().isBlank() ? UUID.randomUUID().toString() : entry.getId();
        Entry candidate = entry.withId(id);
        CatalogPreconditions.requireRegistrable(candidate);
        lock.writeLock().lock();
        try {
            if (entries.containsKey(id)) {
                throw new EntryAlreadyExistsException(id);
            }
            Entry created = Entry.fromCapability(candidate, clock.instant());
            entries.put(id, created);
            log.debug("Created id={} type={}", id, created.getType());
            return created;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<Entry> get(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        lock.readLock().lock();
        try {
            Entry e = entries.get(id.trim());
            return (e == null || e.isDeleted()) ? Optional.empty() : Optional.of(e);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Entry update(Entry entry) {
        CatalogPreconditions.requireUpdatable(entry);
        String id = entry.getId();
        lock.writeLock().lock();
        try {
            Entry existing = entries.get(id);
            if (existing == null || existing.isDeleted()) {
                throw new EntryNotFoundException(id);
            }
            Entry updated = existing.withContent(entry, clock.instant());
            entries.put(id, updated);
            return updated;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void unregister(String id) {
        String key = CatalogPreconditions.requireId(id);
        lock.writeLock().lock();
        try {
            Entry existing = entries.get(key);
            if (existing == null) {
                throw new EntryNotFoundException(key);
            }
            if (!existing.isDeleted()) {
                entries.put(key, existing.withDeleted(true, clock.instant()));
            }
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Unregistered id={}", key);
    }

    @Override
    public Entry restore(String id) {
        String key = CatalogPreconditions.requireId(id);
        lock.writeLock().lock();
        try {
            Entry existing = entries.get(key);
            if (existing == null) {
                throw new EntryNotFoundException(key);
            }
            if (!existing.isDeleted()) {
                return existing;
            }
            Entry restored = existing.withDeleted(false, clock.instant());
            entries.put(key, restored);
            return restored;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<Entry> list() {
        return snapshot(e -> true);
    }

    @Override
    public List<Entry> listByType(String type) {
        if (type == null) {
            return List.of();
        }
        String t = type.trim();
        return snapshot(e -> e.getType().equals(t));
    }

    @Override
    public List<Entry> listPaginated(int limit, int offset) {
        return CatalogPreconditions.page(list(), limit, offset);
    }

    @Override
    public int size() {
        lock.readLock().lock();
        try {
            int n = 0;
            for (Entry e : entries.values()) {
                if (!e.isDeleted()) n++;
            }
            return n;
        } finally {
            lock.readLock().unlock();
        }
    }

    private List<Entry> snapshot(Predicate<Entry> filter) {
        lock.readLock().lock();
        try {
            List<Entry> out = new ArrayList<>(entries.size());
            for (Entry e : entries.values()) {
                if (!e.isDeleted() && filter.test(e)) {
                    out.add(e);
                }
            }
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }
}
