package com.capreg.registry;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EntryJsonTest {

    private static final String SAMPLE_JSON = """
            {
              "id": "git",
              "type": "API",
              "name": "Git API",
              "metadata": {"url": "https://example.org/git", "retries": 3, "tags": ["scm", "vcs"]},
              "createdAt": "2024-05-01T10:00:00Z",
              "updatedAt": "2024-05-01T10:05:00Z",
              "version": 4
            }
            """;

    @Test
    void fromJson_parsesWireShape() {
        Entry e = EntryJson.fromJson(SAMPLE_JSON);

        assertEquals("git", e.getId());
        assertEquals("API", e.getType());
        assertEquals("Git API", e.getName());
        assertEquals(4, e.getVersion());
        assertEquals(Instant.parse("2024-05-01T10:00:00Z"), e.getCreatedAt());
        assertEquals(Instant.parse("2024-05-01T10:05:00Z"), e.getUpdatedAt());
        assertEquals("https://example.org/git", e.getMetadata().get("url"));
        assertEquals(3, e.getMetadata().get("retries"));
        assertEquals(List.of("scm", "vcs"), e.getMetadata().get("tags"));
        assertFalse(e.isDeleted());
    }

    @Test
    void toJson_writesRfc3339TimestampsAndOmitsTombstone() {
        Entry e = Entry.builder().id("docker").type("API").name("Docker API")
                .metadata(Map.of("socket", "/var/run/docker.sock"))
                .version(2)
                .createdAt(Instant.parse("2024-05-01T10:00:00Z"))
                .updatedAt(Instant.parse("2024-05-02T08:30:00Z"))
                .build();

        String json = EntryJson.toJson(e);

        assertTrue(json.contains("\"createdAt\":\"2024-05-01T10:00:00Z\""), json);
        assertTrue(json.contains("\"updatedAt\":\"2024-05-02T08:30:00Z\""), json);
        assertTrue(json.contains("\"version\":2"), json);
        assertFalse(json.contains("deleted"), json);
        assertEquals(e, EntryJson.fromJson(json));
    }

    @Test
    void listFromJson_readsArray() {
        List<Entry> entries = EntryJson.listFromJson("[" + SAMPLE_JSON + "," + SAMPLE_JSON.replace("\"git\"", "\"git2\"") + "]");
        assertEquals(2, entries.size());
        assertEquals("git2", entries.get(1).getId());
    }

    @Test
    void fromJson_malformedIsInvalidArgument() {
        assertThrows(InvalidArgumentException.class, () -> EntryJson.fromJson("{not json"));
        assertThrows(InvalidArgumentException.class, () -> EntryJson.fromJson(" "));
    }
}
