package com.capreg.plugin.builtin;

import com.capreg.registry.Capability;
import com.capreg.registry.Entry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Descriptor of an API exposed by a built-in plugin. Type is always {@value #TYPE}.
 */
public final class ApiDescriptor implements Capability {

    public static final String TYPE = "API";

    private final String id;
    private final String name;
    private final Map<String, Object> metadata;

    public ApiDescriptor(String id, String name) {
        this(id, name, Map.of());
    }

    public ApiDescriptor(String id, String name, Map<String, Object> metadata) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = name;
        this.metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public String getType() {
        return TYPE;
    }

    @Override
    public String getName() {
        return name != null && !name.isBlank() ? name : id;
    }

    @Override
    public Map<String, Object> getMetadata() {
        return metadata;
    }

    /**
     * Entry form of this descriptor. Hooks register the entry so that storage-backed catalogs, which only
     * accept {@link Entry} values, take it as well.
     */
    public Entry toEntry() {
        return Entry.builder().id(id).type(TYPE).name(getName()).metadata(metadata).build();
    }

    @Override
    public String toString() {
        return "ApiDescriptor{id='" + id + "', name='" + getName() + "'}";
    }
}
