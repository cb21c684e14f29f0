package com.trainrelay.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

public class ConfigMaterializer {
    private static final Logger log = LoggerFactory.getLogger(ConfigMaterializer.class);
    private static final String METADATA_DESCRIPTION = "Deterministic lineage fingerprint of the unit configuration";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public List<UnitConfig> load(Path masterFile) throws IOException {
        if (!Files.exists(masterFile)) {
            throw new IllegalArgumentException("Master config not found: " + masterFile.toAbsolutePath().normalize());
        }
        Map<String, Object> root = yamlMapper.readValue(masterFile.toFile(), new TypeReference<LinkedHashMap<String, Object>>() {
        });
        if (root == null) {
            log.warn("materialize.empty file={}", masterFile);
            return List.of();
        }
        Object entries = root.containsKey("units") ? root.get("units") : root.get("circuits");
        if (entries == null) {
            log.warn("materialize.empty file={}", masterFile);
            return List.of();
        }
        if (!(entries instanceof List<?> list)) {
            throw new IllegalArgumentException("Expected a list under 'units' in " + masterFile);
        }
        List<Map<String, Object>> maps = new ArrayList<>();
        for (Object entry : list) {
            if (!(entry instanceof Map<?, ?> map)) {
                throw new IllegalArgumentException("Every unit entry must be a mapping, got: " + entry);
            }
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((key, value) -> copy.put(String.valueOf(key), value));
            maps.add(copy);
        }
        List<UnitConfig> units = materialize(maps);
        log.info("materialize.loaded file={} units={}", masterFile, units.size());
        return units;
    }

    public List<UnitConfig> materialize(List<Map<String, Object>> entries) {
        List<UnitConfig> units = new ArrayList<>(entries.size());
        Set<String> seen = new LinkedHashSet<>();
        for (Map<String, Object> entry : entries) {
            String unitId = unitId(entry);
            if (!seen.add(unitId)) {
                throw new IllegalArgumentException("Duplicate unit id in master config: " + unitId);
            }
            units.add(UnitConfig.of(unitId, modelName(entry, unitId), entry));
        }
        return units;
    }

    public List<Path> writeUnitFiles(List<UnitConfig> units, Path outputDir, Clock clock) throws IOException {
        Files.createDirectories(outputDir);
        List<Path> written = new ArrayList<>(units.size());
        String generatedAt = clock.instant().toString();
        for (UnitConfig unit : units) {
            Map<String, Object> document = new LinkedHashMap<>(unit.parameters());
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("lineage_hash", unit.lineageHash());
            metadata.put("generated_at", generatedAt);
            metadata.put("description", METADATA_DESCRIPTION);
            document.put("metadata", metadata);

            Path target = outputDir.resolve(unit.unitId() + ".yaml");
            yamlMapper.writeValue(target.toFile(), document);
            written.add(target);
            log.info("materialize.unit unit={} hash={} file={}", unit.unitId(), unit.lineageHash(), target.getFileName());
        }
        return written;
    }

    public UnitConfig readUnitFile(Path unitFile) throws IOException {
        Map<String, Object> document = yamlMapper.readValue(unitFile.toFile(), new TypeReference<LinkedHashMap<String, Object>>() {
        });
        String unitId = unitId(document);
        return UnitConfig.of(unitId, modelName(document, unitId), document);
    }

    static String unitId(Map<String, Object> entry) {
        Object explicit = entry.get("unit_id");
        if (explicit != null && !String.valueOf(explicit).isBlank()) {
            return String.valueOf(explicit).trim();
        }
        Object plant = entry.get("plant_id");
        Object circuit = entry.get("circuit_id");
        if (plant != null && circuit != null) {
            return plant + "_" + circuit;
        }
        throw new IllegalArgumentException("Unit entry needs unit_id or plant_id + circuit_id: " + entry.keySet());
    }

    static String modelName(Map<String, Object> entry, String unitId) {
        Object explicit = entry.get("model_name");
        if (explicit != null && !String.valueOf(explicit).isBlank()) {
            return String.valueOf(explicit).trim();
        }
        return unitId.toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
