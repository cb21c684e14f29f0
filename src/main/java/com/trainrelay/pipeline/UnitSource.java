package com.trainrelay.pipeline;

import java.io.IOException;
import java.util.List;

import com.trainrelay.config.UnitConfig;

@FunctionalInterface
public interface UnitSource {
    List<UnitConfig> load() throws IOException;
}
