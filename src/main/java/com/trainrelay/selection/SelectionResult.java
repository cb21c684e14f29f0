package com.trainrelay.selection;

import java.util.List;

import com.trainrelay.config.UnitConfig;

public record SelectionResult(SelectionMode mode, List<UnitConfig> selected, List<UnitConfig> skipped, boolean fullRetrain) {
    public SelectionResult {
        selected = selected == null ? List.of() : List.copyOf(selected);
        skipped = skipped == null ? List.of() : List.copyOf(skipped);
    }

    public boolean isEmpty() {
        return selected.isEmpty();
    }
}
