package com.trainrelay.execution;

import java.util.List;

public record MonitorResult(List<TrainingJob> completed, List<TrainingJob> failed, List<TrainingJob> timedOut) {
    public MonitorResult {
        completed = completed == null ? List.of() : List.copyOf(completed);
        failed = failed == null ? List.of() : List.copyOf(failed);
        timedOut = timedOut == null ? List.of() : List.copyOf(timedOut);
    }

    public static MonitorResult empty() {
        return new MonitorResult(List.of(), List.of(), List.of());
    }

    public int total() {
        return completed.size() + failed.size();
    }

    public List<TrainingJob> retryable() {
        return failed.stream().filter(job -> !job.isTimedOut()).toList();
    }
}
