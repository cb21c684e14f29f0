package com.trainrelay.selection;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.trainrelay.config.UnitConfig;
import com.trainrelay.registry.Artifact;
import com.trainrelay.registry.ArtifactStore;

/**
 * Decides which units need training. Auto mode compares each unit's lineage hash with the
 * versions already registered in the training environment; manual mode takes an explicit
 * id list and validates it against the master configuration.
 */
public class ChangeSelector {
    private static final Logger log = LoggerFactory.getLogger(ChangeSelector.class);

    private final ArtifactStore trainingStore;
    private final BaselineProbe baselineProbe;

    public ChangeSelector(ArtifactStore trainingStore) {
        this(trainingStore, BaselineProbe.registryBacked(trainingStore));
    }

    public ChangeSelector(ArtifactStore trainingStore, BaselineProbe baselineProbe) {
        this.trainingStore = trainingStore;
        this.baselineProbe = baselineProbe;
    }

    public SelectionResult select(List<UnitConfig> units, SelectionRequest request) throws IOException {
        return switch (request.mode()) {
            case MANUAL -> selectManual(units, request.manualUnitIds());
            case AUTO -> selectChanged(units, request.allowFullRetrainWithoutBaseline());
        };
    }

    private SelectionResult selectManual(List<UnitConfig> units, List<String> requestedIds) {
        Set<String> requested = new LinkedHashSet<>();
        for (String id : requestedIds) {
            if (id != null && !id.isBlank()) {
                requested.add(id.trim());
            }
        }
        if (requested.isEmpty()) {
            throw new IllegalArgumentException("Manual selection requires at least one unit id");
        }

        Set<String> known = new LinkedHashSet<>();
        units.forEach(unit -> known.add(unit.unitId()));
        List<String> unknown = requested.stream().filter(id -> !known.contains(id)).toList();
        if (!unknown.isEmpty()) {
            throw new IllegalArgumentException("Unknown unit ids: " + String.join(", ", unknown));
        }

        List<UnitConfig> selected = new ArrayList<>();
        List<UnitConfig> skipped = new ArrayList<>();
        for (UnitConfig unit : units) {
            (requested.contains(unit.unitId()) ? selected : skipped).add(unit);
        }
        log.info("selection.manual selected={} skipped={}", selected.size(), skipped.size());
        return new SelectionResult(SelectionMode.MANUAL, selected, skipped, false);
    }

    private SelectionResult selectChanged(List<UnitConfig> units, boolean allowFullRetrain) throws IOException {
        if (!baselineProbe.baselineExists()) {
            if (!allowFullRetrain) {
                throw new IllegalStateException("No baseline exists in environment '" + trainingStore.environment()
                        + "'; a full retrain of all " + units.size() + " units requires explicit opt-in");
            }
            log.warn("selection.full-retrain environment={} units={} reason=no-baseline", trainingStore.environment(), units.size());
            return new SelectionResult(SelectionMode.AUTO, units, List.of(), true);
        }

        List<UnitConfig> selected = new ArrayList<>();
        List<UnitConfig> skipped = new ArrayList<>();
        for (UnitConfig unit : units) {
            List<Artifact> matching = trainingStore.list(unit.modelName(), Map.of(Artifact.TAG_LINEAGE_HASH, unit.lineageHash()));
            if (matching.isEmpty()) {
                selected.add(unit);
                log.debug("selection.changed unit={} hash={}", unit.unitId(), unit.lineageHash());
            } else {
                skipped.add(unit);
            }
        }
        log.info("selection.auto selected={} unchanged={}", selected.size(), skipped.size());
        return new SelectionResult(SelectionMode.AUTO, selected, skipped, false);
    }
}
