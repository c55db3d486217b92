package com.capreg.registry;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable snapshot of a registered capability: identity, type tag, display name, metadata, version
 * and soft-delete state. The catalog replaces the stored snapshot on every mutation, so an instance
 * handed to a caller never changes underneath it.
 * <p>
 * Wire shape: {@code {id, type, name, metadata, createdAt, updatedAt, version}}. The tombstone flag is
 * internal and not serialized.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"id", "type", "name", "metadata", "createdAt", "updatedAt", "version"})
public final class Entry implements Capability {

    private final String id;
    private final String type;
    private final String name;
    private final Map<String, Object> metadata;
    private final long version;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final boolean deleted;

    @JsonCreator
    public Entry(@JsonProperty("id") String id,
                 @JsonProperty("type") String type,
                 @JsonProperty("name") String name,
                 @JsonProperty("metadata") Map<String, Object> metadata,
                 @JsonProperty("version") long version,
                 @JsonProperty("createdAt") Instant createdAt,
                 @JsonProperty("updatedAt") Instant updatedAt) {
        this(id, type, name, metadata, version, createdAt, updatedAt, false);
    }

    private Entry(String id, String type, String name, Map<String, Object> metadata,
                  long version, Instant createdAt, Instant updatedAt, boolean deleted) {
        this.id = id != null ? id.trim() : "";
        this.type = type != null ? type.trim() : "";
        this.name = name != null ? name : "";
        this.metadata = copyOf(metadata);
        this.version = version;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
        this.deleted = deleted;
    }

    /**
     * Reads each attribute of {@code capability} exactly once and returns it as an entry with version 0 and no
     * timestamps. A blank name is replaced by the id. Callers validate and store this copy so that a capability
     * whose getters change between calls cannot slip past validation.
     */
    public static Entry snapshotOf(Capability capability) {
        String id = capability.getId();
        String type = capability.getType();
        String name = capability.getName();
        Map<String, Object> metadata = capability.getMetadata();
        return new Entry(id, type, (name == null || name.isBlank()) ? id : name, metadata, 0L, null, null, false);
    }

    /** Builds a new entry from a capability, version 1, created and updated at {@code now}. */
    public static Entry fromCapability(Capability capability, Instant now) {
        Entry s = snapshotOf(capability);
        return new Entry(s.id, s.type, s.name, s.metadata, 1L, now, now, false);
    }

    /** Copy with name, type and metadata replaced, version bumped and tombstone cleared. */
    public Entry withContent(Capability capability, Instant now) {
        Entry s = snapshotOf(capability);
        return new Entry(id, s.type, s.name, s.metadata, version + 1, createdAt, now, false);
    }

    /** Copy with the tombstone flag set or cleared; version unchanged. */
    public Entry withDeleted(boolean deleted, Instant now) {
        return new Entry(id, type, name, metadata, version, createdAt, now, deleted);
    }

    /** Copy carrying the given id (used when the id is generated on create). */
    public Entry withId(String newId) {
        return new Entry(newId, type, name, metadata, version, createdAt, updatedAt, deleted);
    }

    private static Map<String, Object> copyOf(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return Map.of();
        }
        // LinkedHashMap keeps caller order and tolerates null values from JSON
        return Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .type(type)
                .name(name)
                .metadata(metadata)
                .version(version)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    @Override
    @JsonProperty("id")
    public String getId() {
        return id;
    }

    @Override
    @JsonProperty("type")
    public String getType() {
        return type;
    }

    @Override
    @JsonProperty("name")
    public String getName() {
        return name;
    }

    /** Unmodifiable; never null. */
    @Override
    @JsonProperty("metadata")
    public Map<String, Object> getMetadata() {
        return metadata;
    }

    /** 1 on creation, incremented once per successful update. */
    @JsonProperty("version")
    public long getVersion() {
        return version;
    }

    @JsonProperty("createdAt")
    public Instant getCreatedAt() {
        return createdAt;
    }

    @JsonProperty("updatedAt")
    public Instant getUpdatedAt() {
        return updatedAt;
    }

    /** Tombstone flag. Deleted entries are invisible to get and list operations. */
    @JsonIgnore
    public boolean isDeleted() {
        return deleted;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Entry that = (Entry) o;
        return version == that.version
                && deleted == that.deleted
                && id.equals(that.id)
                && type.equals(that.type)
                && name.equals(that.name)
                && metadata.equals(that.metadata)
                && Objects.equals(createdAt, that.createdAt)
                && Objects.equals(updatedAt, that.updatedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, type, name, metadata, version, createdAt, updatedAt, deleted);
    }

    @Override
    public String toString() {
        return "Entry{id='" + id + "', type='" + type + "', name='" + name + "', version=" + version
                + (deleted ? ", deleted" : "") + "}";
    }

    /**
     * Builder for caller-side entries passed to {@link Catalog#create(Entry)} and {@link Catalog#update(Entry)}.
     * Version and timestamps are assigned by the catalog; setting them here only matters for deserialized copies.
     */
    public static final class Builder {
        private String id;
        private String type;
        private String name;
        private Map<String, Object> metadata = Map.of();
        private long version;
        private Instant createdAt;
        private Instant updatedAt;

        private Builder() {
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata != null ? metadata : Map.of();
            return this;
        }

        public Builder version(long version) {
            this.version = version;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Entry build() {
            return new Entry(id, type, name, metadata, version, createdAt, updatedAt, false);
        }
    }
}
