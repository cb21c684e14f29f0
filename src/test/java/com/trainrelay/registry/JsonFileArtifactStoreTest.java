package com.trainrelay.registry;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonFileArtifactStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldAssignMonotonicVersionsPerName() throws IOException {
        JsonFileArtifactStore store = store();

        Artifact first = store.createVersion("p1-c1", Map.of(), Map.of(Artifact.TAG_LINEAGE_HASH, "aaa"));
        Artifact second = store.createVersion("p1-c1", Map.of(), Map.of(Artifact.TAG_LINEAGE_HASH, "bbb"));
        Artifact other = store.createVersion("p1-c2", Map.of(), Map.of());

        assertEquals(1, first.version());
        assertEquals(2, second.version());
        assertEquals(1, other.version());
        assertEquals("p1-c1:v2", second.reference());
    }

    @Test
    void shouldPersistAcrossInstancesAndFilterByTags() throws IOException {
        JsonFileArtifactStore writer = store();
        assertTrue(writer.isEmpty());
        writer.createVersion("m", Map.of("model_path", "jobs/1"), Map.of(Artifact.TAG_LINEAGE_HASH, "h1", Artifact.TAG_UNIT_ID, "U"));
        writer.createVersion("m", Map.of("model_path", "jobs/2"), Map.of(Artifact.TAG_LINEAGE_HASH, "h2", Artifact.TAG_UNIT_ID, "U"));
        writer.createVersion("m", Map.of("model_path", "jobs/3"), Map.of(Artifact.TAG_LINEAGE_HASH, "h1", Artifact.TAG_UNIT_ID, "U"));

        JsonFileArtifactStore reader = store();
        List<Artifact> matching = reader.list("m", Map.of(Artifact.TAG_LINEAGE_HASH, "h1"));

        assertFalse(reader.isEmpty());
        assertEquals(List.of(1, 3), matching.stream().map(Artifact::version).toList());
        assertEquals(3, reader.latest("m", Map.of(Artifact.TAG_LINEAGE_HASH, "h1")).orElseThrow().version());
        assertEquals("jobs/2", reader.get("m", 2).orElseThrow().payload().get("model_path"));
        assertEquals(Instant.parse("2026-02-01T00:00:00Z"), reader.get("m", 2).orElseThrow().createdAt());
        assertTrue(reader.get("m", 9).isEmpty());
        assertTrue(reader.latest("unknown", Map.of()).isEmpty());
    }

    @Test
    void shouldResolveEnvironmentFileInsideDirectory() {
        JsonFileArtifactStore store = JsonFileArtifactStore.inDirectory(tempDir, "shared");

        assertEquals("shared", store.environment());
        assertTrue(store.toString().contains("shared-registry.json"));
    }

    @Test
    void shouldRejectBlankNames() {
        assertThrows(IllegalArgumentException.class, () -> store().createVersion(" ", Map.of(), Map.of()));
    }

    private JsonFileArtifactStore store() {
        return new JsonFileArtifactStore("dev", tempDir.resolve("dev-registry.json"),
                Clock.fixed(Instant.parse("2026-02-01T00:00:00Z"), ZoneOffset.UTC));
    }
}
