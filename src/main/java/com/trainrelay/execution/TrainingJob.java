package com.trainrelay.execution;

import java.time.Instant;
import java.util.Objects;

public final class TrainingJob {
    private final String unitId;
    private final String modelName;
    private final String jobHandle;
    private final String lineageHash;
    private final int attempt;
    private final Instant submittedAt;
    private volatile JobStatus status = JobStatus.QUEUED;
    private volatile boolean timedOut;

    public TrainingJob(String unitId, String modelName, String jobHandle, String lineageHash, int attempt, Instant submittedAt) {
        this.unitId = Objects.requireNonNull(unitId, "unitId");
        this.modelName = Objects.requireNonNull(modelName, "modelName");
        this.jobHandle = Objects.requireNonNull(jobHandle, "jobHandle");
        this.lineageHash = Objects.requireNonNull(lineageHash, "lineageHash");
        this.attempt = attempt;
        this.submittedAt = submittedAt;
    }

    public String getUnitId() {
        return unitId;
    }

    public String getModelName() {
        return modelName;
    }

    public String getJobHandle() {
        return jobHandle;
    }

    public String getLineageHash() {
        return lineageHash;
    }

    public int getAttempt() {
        return attempt;
    }

    public Instant getSubmittedAt() {
        return submittedAt;
    }

    public JobStatus getStatus() {
        return status;
    }

    public boolean isTimedOut() {
        return timedOut;
    }

    public boolean isRetry() {
        return attempt > 1;
    }

    boolean updateStatus(JobStatus next) {
        Objects.requireNonNull(next, "next");
        if (status.isTerminal() || status == next) {
            return false;
        }
        status = next;
        return true;
    }

    void markTimedOut() {
        if (!status.isTerminal()) {
            timedOut = true;
        }
    }

    @Override
    public String toString() {
        return "TrainingJob{" +
                "unitId=" + unitId +
                ", handle=" + jobHandle +
                ", attempt=" + attempt +
                ", status=" + status +
                (timedOut ? ", timedOut" : "") +
                '}';
    }
}
