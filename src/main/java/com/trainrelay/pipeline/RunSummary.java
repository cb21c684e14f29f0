package com.trainrelay.pipeline;

import java.util.List;
import java.util.Map;

import com.trainrelay.selection.SelectionMode;

public record RunSummary(
        String runId,
        SelectionMode mode,
        List<String> selected,
        int submitted,
        int completed,
        int failed,
        int retried,
        int registered,
        int promoted,
        int pendingPromotions,
        int rejectedPromotions,
        int timedOutPromotions,
        Map<String, String> errors,
        Outcome outcome) {
    public RunSummary {
        selected = selected == null ? List.of() : List.copyOf(selected);
        errors = errors == null ? Map.of() : Map.copyOf(errors);
    }

    public enum Outcome {
        SUCCEEDED,
        NOTHING_TO_DO
    }

    static RunSummary nothingToDo(String runId, SelectionMode mode) {
        return new RunSummary(runId, mode, List.of(), 0, 0, 0, 0, 0, 0, 0, 0, 0, Map.of(), Outcome.NOTHING_TO_DO);
    }
}
