package com.trainrelay.lineage;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.trainrelay.config.LineageHasher;
import com.trainrelay.config.UnitConfig;
import com.trainrelay.registry.Artifact;
import com.trainrelay.registry.ArtifactStore;

public class LineageResolver {
    private static final Logger log = LoggerFactory.getLogger(LineageResolver.class);

    public Optional<Artifact> resolve(UnitConfig unit, ArtifactStore store) throws IOException {
        String hash = LineageHasher.hash(unit.parameters());
        Optional<Artifact> artifact = store.latest(unit.modelName(), Map.of(Artifact.TAG_LINEAGE_HASH, hash));
        if (artifact.isEmpty()) {
            log.info("lineage.unresolved unit={} model={} hash={} environment={}", unit.unitId(), unit.modelName(), hash, store.environment());
        }
        return artifact;
    }

    public Map<String, Optional<Artifact>> resolveAll(List<UnitConfig> units, ArtifactStore store) throws IOException {
        Map<String, Optional<Artifact>> resolved = new LinkedHashMap<>();
        for (UnitConfig unit : units) {
            resolved.put(unit.unitId(), resolve(unit, store));
        }
        return resolved;
    }
}
