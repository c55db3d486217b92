package com.capreg.registry;

import java.util.Map;

/**
 * Contract a value must satisfy to be registered in a {@link Catalog}: a stable identity and a type tag.
 * Any concrete descriptor (container, repository, generic API, ...) implementing it can be passed to
 * {@link Catalog#register(Capability)}; the catalog copies what it needs and keeps no reference to the value.
 * <p>
 * Only {@link #getId()} and {@link #getType()} are required. Implementations that carry a display name or
 * metadata override the default methods.
 */
public interface Capability {

    /** Identity, unique within a catalog. Must be non-blank to be registered. */
    String getId();

    /** Type tag (e.g. "API"); used for filtered listing. Must be non-blank to be registered. */
    String getType();

    /** Human-readable label. Defaults to the id. */
    default String getName() {
        return getId();
    }

    /** Free-form metadata; replaces the stored metadata on every registration. Empty by default. */
    default Map<String, Object> getMetadata() {
        return Map.of();
    }
}
