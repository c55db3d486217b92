package com.capreg.storage;

import com.capreg.registry.CatalogPreconditions;
import com.capreg.registry.Entry;
import com.capreg.registry.EntryAlreadyExistsException;
import com.capreg.registry.EntryNotFoundException;
import com.capreg.registry.InvalidArgumentException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory {@link EntryStorage} backed by a {@link ConcurrentHashMap}. Each mutation runs inside a
 * per-key {@code compute}, so operations on one id are atomic without a map-wide lock. Listings iterate
 * the live map and are weakly consistent: a concurrent write on another id may or may not be visible.
 */
public final class MemoryStorage implements EntryStorage {

    private static final Logger log = LoggerFactory.getLogger(MemoryStorage.class);

    private final Map<String, Entry> items = new ConcurrentHashMap<>();
    private final Clock clock;

    public MemoryStorage() {
        this(Clock.systemUTC());
    }

    public MemoryStorage(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Entry createItem(Entry item) {
        if (item == null) {
            throw new InvalidArgumentException("item must not be null");
        }
        String id = item.getId().isBlank() ? UUID.randomUUID().toString() : item.getId();
        Entry candidate = item.withId(id);
        CatalogPreconditions.requireRegistrable(candidate);
        Entry created = Entry.fromCapability(candidate, clock.instant());
        if (items.putIfAbsent(id, created) != null) {
            throw new EntryAlreadyExistsException(id);
        }
        log.debug("Stored new item id={}", id);
        return created;
    }

    @Override
    public Entry upsertItem(Entry item) {
        CatalogPreconditions.requireRegistrable(item);
        return items.compute(item.getId(), (id, existing) -> {
            Instant now = clock.instant();
            return existing == null ? Entry.fromCapability(item, now) : existing.withContent(item, now);
        });
    }

    @Override
    public Optional<Entry> getItem(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        Entry e = items.get(id.trim());
        return (e == null || e.isDeleted()) ? Optional.empty() : Optional.of(e);
    }

    @Override
    public Entry updateItem(Entry item) {
        CatalogPreconditions.requireUpdatable(item);
        Entry updated = items.computeIfPresent(item.getId(), (id, existing) ->
                existing.isDeleted() ? existing : existing.withContent(item, clock.instant()));
        if (updated == null || updated.isDeleted()) {
            throw new EntryNotFoundException(item.getId());
        }
        return updated;
    }

    @Override
    public void deleteItem(String id) {
        String key = CatalogPreconditions.requireId(id);
        Entry result = items.computeIfPresent(key, (k, existing) ->
                existing.isDeleted() ? existing : existing.withDeleted(true, clock.instant()));
        if (result == null) {
            throw new EntryNotFoundException(key);
        }
    }

    @Override
    public Entry restoreItem(String id) {
        String key = CatalogPreconditions.requireId(id);
        Entry result = items.computeIfPresent(key, (k, existing) ->
                existing.isDeleted() ? existing.withDeleted(false, clock.instant()) : existing);
        if (result == null) {
            throw new EntryNotFoundException(key);
        }
        return result;
    }

    @Override
    public List<Entry> listItems() {
        List<Entry> out = new ArrayList<>();
        for (Entry e : items.values()) {
            if (!e.isDeleted()) {
                out.add(e);
            }
        }
        return out;
    }

    @Override
    public List<Entry> listItems(int limit, int offset) {
        return CatalogPreconditions.page(listItems(), limit, offset);
    }
}
