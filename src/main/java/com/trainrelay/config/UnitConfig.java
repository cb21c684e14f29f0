package com.trainrelay.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record UnitConfig(String unitId, String modelName, Map<String, Object> parameters, String lineageHash) {
    public UnitConfig {
        Objects.requireNonNull(unitId, "unitId");
        Objects.requireNonNull(modelName, "modelName");
        Objects.requireNonNull(lineageHash, "lineageHash");
        parameters = parameters == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public static UnitConfig of(String unitId, String modelName, Map<String, Object> parameters) {
        return new UnitConfig(unitId, modelName, parameters, LineageHasher.hash(parameters));
    }
}
