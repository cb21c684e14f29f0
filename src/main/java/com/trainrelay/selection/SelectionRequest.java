package com.trainrelay.selection;

import java.util.List;
import java.util.Objects;

public record SelectionRequest(SelectionMode mode, List<String> manualUnitIds, boolean allowFullRetrainWithoutBaseline) {
    public SelectionRequest {
        Objects.requireNonNull(mode, "mode");
        manualUnitIds = manualUnitIds == null ? List.of() : List.copyOf(manualUnitIds);
    }

    public static SelectionRequest auto(boolean allowFullRetrainWithoutBaseline) {
        return new SelectionRequest(SelectionMode.AUTO, List.of(), allowFullRetrainWithoutBaseline);
    }

    public static SelectionRequest manual(List<String> unitIds) {
        return new SelectionRequest(SelectionMode.MANUAL, unitIds, false);
    }
}
