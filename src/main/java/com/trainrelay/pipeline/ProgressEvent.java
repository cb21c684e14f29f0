package com.trainrelay.pipeline;

import java.time.Instant;

public record ProgressEvent(String runId, String unitId, Stage stage, String state, Instant timestamp) {
    public static final String RUN_SCOPE = "*";

    public enum Stage {
        SELECTION,
        SUBMISSION,
        MONITOR,
        RETRY,
        REGISTRATION,
        PROMOTION,
        RUN
    }
}
