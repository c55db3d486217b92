package com.capreg.registry;

import java.util.List;

/**
 * Argument checks and paging shared by {@link Catalog} implementations, so every backend rejects the same
 * inputs with the same {@link InvalidArgumentException} messages.
 */
public final class CatalogPreconditions {

    private CatalogPreconditions() {
    }

    /** Checks a capability passed to {@link Catalog#register(Capability)}. */
    public static void requireRegistrable(Capability capability) {
        if (capability == null) {
            throw new InvalidArgumentException("capability must not be null");
        }
        requireId(capability.getId());
        requireType(capability.getType(), capability.getId());
    }

    /** Checks an entry passed to update: id and type must be non-blank. */
    public static void requireUpdatable(Entry entry) {
        if (entry == null) {
            throw new InvalidArgumentException("entry must not be null");
        }
        requireId(entry.getId());
        requireType(entry.getType(), entry.getId());
    }

    /** Returns the trimmed id; throws if null or blank. */
    public static String requireId(String id) {
        if (id == null || id.isBlank()) {
            throw new InvalidArgumentException("id must be non-blank");
        }
        return id.trim();
    }

    private static void requireType(String type, String id) {
        if (type == null || type.isBlank()) {
            throw new InvalidArgumentException("type must be non-blank for id " + id);
        }
    }

    /**
     * Slice of {@code items} for the given page; empty when offset is at or past the end.
     *
     * @throws InvalidArgumentException if limit or offset is negative
     */
    public static <T> List<T> page(List<T> items, int limit, int offset) {
        if (limit < 0 || offset < 0) {
            throw new InvalidArgumentException("limit and offset must be >= 0 (limit=" + limit + ", offset=" + offset + ")");
        }
        if (offset >= items.size() || limit == 0) {
            return List.of();
        }
        int end = (int) Math.min((long) offset + limit, items.size());
        return List.copyOf(items.subList(offset, end));
    }
}
