package com.trainrelay.selection;

import java.io.IOException;

import com.trainrelay.registry.ArtifactStore;

@FunctionalInterface
public interface BaselineProbe {
    boolean baselineExists() throws IOException;

    static BaselineProbe registryBacked(ArtifactStore trainingStore) {
        return () -> !trainingStore.isEmpty();
    }
}
