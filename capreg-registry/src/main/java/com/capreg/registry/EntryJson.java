package com.capreg.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.List;

/**
 * JSON codec for the entry wire shape used at the HTTP boundary:
 * {@code {"id","type","name","metadata","createdAt","updatedAt","version"}} with RFC 3339 timestamps
 * (e.g. {@code 2024-05-01T10:15:30Z}).
 */
public final class EntryJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private EntryJson() {
    }

    /** Shared mapper configured for entries; do not reconfigure. */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static String toJson(Entry entry) {
        try {
            return MAPPER.writeValueAsString(entry);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize entry " + entry.getId(), e);
        }
    }

    public static String toJson(List<Entry> entries) {
        try {
            return MAPPER.writeValueAsString(entries);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize entry list", e);
        }
    }

    /**
     * Parses one entry.
     *
     * @throws InvalidArgumentException if the JSON is malformed
     */
    public static Entry fromJson(String json) {
        if (json == null || json.isBlank()) {
            throw new InvalidArgumentException("entry JSON must be non-blank");
        }
        try {
            return MAPPER.readValue(json, Entry.class);
        } catch (JsonProcessingException e) {
            throw new InvalidArgumentException("Invalid entry JSON: " + e.getOriginalMessage());
        }
    }

    /** Parses a JSON array of entries. */
    public static List<Entry> listFromJson(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return MAPPER.readValue(json, new TypeReference<List<Entry>>() { });
        } catch (JsonProcessingException e) {
            throw new InvalidArgumentException("Invalid entry list JSON: " + e.getOriginalMessage());
        }
    }
}
