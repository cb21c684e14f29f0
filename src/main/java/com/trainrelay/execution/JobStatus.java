package com.trainrelay.execution;

import java.util.Locale;

public enum JobStatus {
    QUEUED,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELED;
    }

    public static JobStatus fromRemote(String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Job status must not be blank");
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "completed", "succeeded" -> COMPLETED;
            case "failed", "notresponding" -> FAILED;
            case "canceled", "cancelled" -> CANCELED;
            case "queued", "notstarted", "starting", "preparing" -> QUEUED;
            default -> RUNNING;
        };
    }
}
