package com.trainrelay.lineage;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.trainrelay.config.UnitConfig;
import com.trainrelay.registry.Artifact;
import com.trainrelay.support.InMemoryArtifactStore;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LineageResolverTest {

    private final LineageResolver resolver = new LineageResolver();
    private final InMemoryArtifactStore shared = new InMemoryArtifactStore("shared");

    @Test
    void shouldResolveAnyConfigurationWithTheSameCanonicalForm() throws IOException {
        UnitConfig unit = UnitConfig.of("U1", "u1", Map.of("window", 30, "features", List.of("a", "b")));
        shared.createVersion("u1", Map.of(), Map.of(Artifact.TAG_LINEAGE_HASH, unit.lineageHash()));

        Map<String, Object> reordered = new LinkedHashMap<>();
        reordered.put("features", List.of("a", "b"));
        reordered.put("window", 30);
        reordered.put("metadata", Map.of("generated_at", "later"));

        Optional<Artifact> resolved = resolver.resolve(UnitConfig.of("U1", "u1", reordered), shared);

        assertTrue(resolved.isPresent());
        assertEquals(1, resolved.get().version());
    }

    @Test
    void shouldReturnNothingForADifferentConfiguration() throws IOException {
        UnitConfig promoted = UnitConfig.of("U1", "u1", Map.of("window", 30));
        shared.createVersion("u1", Map.of(), Map.of(Artifact.TAG_LINEAGE_HASH, promoted.lineageHash()));

        assertTrue(resolver.resolve(UnitConfig.of("U1", "u1", Map.of("window", 31)), shared).isEmpty());
    }

    @Test
    void shouldPreferTheHighestVersionSharingTheHash() throws IOException {
        UnitConfig unit = UnitConfig.of("U1", "u1", Map.of("window", 30));
        shared.createVersion("u1", Map.of(), Map.of(Artifact.TAG_LINEAGE_HASH, unit.lineageHash()));
        shared.createVersion("u1", Map.of(), Map.of(Artifact.TAG_LINEAGE_HASH, "other"));
        shared.createVersion("u1", Map.of(), Map.of(Artifact.TAG_LINEAGE_HASH, unit.lineageHash()));

        assertEquals(3, resolver.resolve(unit, shared).orElseThrow().version());
    }

    @Test
    void shouldResolveEveryUnit() throws IOException {
        UnitConfig promoted = UnitConfig.of("U1", "u1", Map.of("window", 30));
        UnitConfig pending = UnitConfig.of("U2", "u2", Map.of("window", 30));
        shared.createVersion("u1", Map.of(), Map.of(Artifact.TAG_LINEAGE_HASH, promoted.lineageHash()));

        Map<String, Optional<Artifact>> resolved = resolver.resolveAll(List.of(promoted, pending), shared);

        assertEquals(List.of("U1", "U2"), List.copyOf(resolved.keySet()));
        assertTrue(resolved.get("U1").isPresent());
        assertTrue(resolved.get("U2").isEmpty());
    }
}
