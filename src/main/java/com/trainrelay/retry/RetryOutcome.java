package com.trainrelay.retry;

import java.util.List;

import com.trainrelay.approval.ApprovalDecision;
import com.trainrelay.execution.TrainingJob;

public record RetryOutcome(
        ApprovalDecision decision,
        List<TrainingJob> completed,
        List<TrainingJob> failed,
        int retried,
        int retrySucceeded) {
    public RetryOutcome {
        completed = completed == null ? List.of() : List.copyOf(completed);
        failed = failed == null ? List.of() : List.copyOf(failed);
    }

    public boolean attempted() {
        return decision == ApprovalDecision.APPROVED;
    }
}
