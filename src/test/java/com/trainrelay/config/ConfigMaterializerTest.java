package com.trainrelay.config;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigMaterializerTest {

    @TempDir
    Path tempDir;

    private final ConfigMaterializer materializer = new ConfigMaterializer();

    @Test
    void shouldLoadCircuitLayoutAndDeriveIdentity() throws IOException, URISyntaxException {
        Path master = Path.of(getClass().getResource("/fixtures/master-units.yaml").toURI());

        List<UnitConfig> units = materializer.load(master);

        assertEquals(3, units.size());
        assertEquals("P1_C1", units.get(0).unitId());
        assertEquals("p1-c1", units.get(0).modelName());
        assertEquals("P2_C1", units.get(2).unitId());
        assertEquals("custom-p2", units.get(2).modelName());
        assertEquals(LineageHasher.hash(units.get(0).parameters()), units.get(0).lineageHash());
    }

    @Test
    void shouldHashEntryContentRegardlessOfFieldOrder() throws IOException {
        Path master = tempDir.resolve("units.yaml");
        Files.writeString(master, """
                units:
                  - unit_id: A
                    model_name: shared-model
                    window: 30
                """);
        Map<String, Object> reordered = new LinkedHashMap<>();
        reordered.put("window", 30);
        reordered.put("unit_id", "A");
        reordered.put("model_name", "shared-model");

        List<UnitConfig> units = materializer.load(master);

        assertEquals(1, units.size());
        assertEquals(LineageHasher.hash(reordered), units.get(0).lineageHash());
    }

    @Test
    void shouldRejectDuplicateUnitIds() {
        Map<String, Object> first = new LinkedHashMap<>(Map.of("plant_id", "P1", "circuit_id", "C1"));
        Map<String, Object> second = new LinkedHashMap<>(Map.of("unit_id", "P1_C1"));

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> materializer.materialize(List.of(first, second)));
        assertTrue(error.getMessage().contains("P1_C1"));
    }

    @Test
    void shouldRejectEntriesWithoutIdentity() {
        assertThrows(IllegalArgumentException.class,
                () -> materializer.materialize(List.of(Map.of("window", 30))));
    }

    @Test
    void shouldFailOnMissingMasterFile() {
        assertThrows(IllegalArgumentException.class, () -> materializer.load(tempDir.resolve("missing.yaml")));
    }

    @Test
    void shouldReturnNoUnitsForEmptyList() throws IOException {
        Path master = tempDir.resolve("empty.yaml");
        Files.writeString(master, "units: []\n");

        assertTrue(materializer.load(master).isEmpty());
    }

    @Test
    void shouldWriteUnitFilesWhoseHashSurvivesTheMetadataSection() throws IOException {
        UnitConfig unit = UnitConfig.of("P1_C1", "p1-c1", Map.of("plant_id", "P1", "circuit_id", "C1", "window", 30));
        Clock clock = Clock.fixed(Instant.parse("2026-03-01T08:00:00Z"), ZoneOffset.UTC);

        List<Path> written = materializer.writeUnitFiles(List.of(unit), tempDir.resolve("out"), clock);

        assertEquals(1, written.size());
        assertEquals("P1_C1.yaml", written.get(0).getFileName().toString());
        String content = Files.readString(written.get(0));
        assertTrue(content.contains("lineage_hash: \"" + unit.lineageHash() + "\"") || content.contains("lineage_hash: " + unit.lineageHash()), content);
        assertTrue(content.contains("2026-03-01T08:00:00Z"), content);

        UnitConfig reread = materializer.readUnitFile(written.get(0));
        assertEquals(unit.unitId(), reread.unitId());
        assertEquals(unit.lineageHash(), reread.lineageHash());
    }
}
