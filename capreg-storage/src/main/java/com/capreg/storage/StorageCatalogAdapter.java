package com.capreg.storage;

import com.capreg.registry.Capability;
import com.capreg.registry.Catalog;
import com.capreg.registry.Entry;
import com.capreg.registry.InvalidArgumentException;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Exposes an {@link EntryStorage} as a {@link Catalog}, so callers and the plugin loader hold one
 * storage-agnostic handle. The adapter only translates: {@link #register(Capability)} accepts concrete
 * {@link Entry} values and rejects any other capability type; everything else delegates.
 */
public final class StorageCatalogAdapter implements Catalog {

    private final EntryStorage storage;

    public StorageCatalogAdapter(EntryStorage storage) {
        this.storage = Objects.requireNonNull(storage, "storage");
    }

    @Override
    public Entry register(Capability capability) {
        if (!(capability instanceof Entry)) {
            throw new InvalidArgumentException("invalid item type: expected " + Entry.class.getName() + " but got "
                    + (capability == null ? "null" : capability.getClass().getName()));
        }
        return storage.upsertItem((Entry) capability);
    }

    @Override
    public Entry create(Entry entry) {
        return storage.createItem(entry);
    }

    @Override
    public Optional<Entry> get(String id) {
        return storage.getItem(id);
    }

    @Override
    public Entry update(Entry entry) {
        return storage.updateItem(entry);
    }

    @Override
    public void unregister(String id) {
        storage.deleteItem(id);
    }

    @Override
    public Entry restore(String id) {
        return storage.restoreItem(id);
    }

    @Override
    public List<Entry> list() {
        return storage.listItems();
    }

    @Override
    public List<Entry> listByType(String type) {
        if (type == null) {
            return List.of();
        }
        String t = type.trim();
        return storage.listItems().stream()
                .filter(e -> e.getType().equals(t))
                .collect(Collectors.toList());
    }

    @Override
    public List<Entry> listPaginated(int limit, int offset) {
        return storage.listItems(limit, offset);
    }

    @Override
    public int size() {
        return storage.listItems().size();
    }
}
