package com.trainrelay.retry;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.trainrelay.approval.ApprovalChannel;
import com.trainrelay.approval.ApprovalDecision;
import com.trainrelay.approval.ApprovalRequest;
import com.trainrelay.config.UnitConfig;
import com.trainrelay.execution.JobMonitor;
import com.trainrelay.execution.JobSubmitter;
import com.trainrelay.execution.MonitorResult;
import com.trainrelay.execution.TrainingJob;

public class RetryCoordinator {
    private static final Logger log = LoggerFactory.getLogger(RetryCoordinator.class);

    private final ApprovalChannel approvalChannel;
    private final JobSubmitter submitter;
    private final JobMonitor monitor;
    private final Duration approvalTimeout;
    private final boolean enabled;
    private final Clock clock;

    public RetryCoordinator(
            ApprovalChannel approvalChannel,
            JobSubmitter submitter,
            JobMonitor monitor,
            Duration approvalTimeout,
            boolean enabled,
            Clock clock) {
        this.approvalChannel = approvalChannel;
        this.submitter = submitter;
        this.monitor = monitor;
        this.approvalTimeout = approvalTimeout;
        this.enabled = enabled;
        this.clock = clock;
    }

    public RetryOutcome retryFailed(String runId, MonitorResult original, Map<String, UnitConfig> unitsById)
            throws IOException, InterruptedException {
        List<TrainingJob> retryable = original.retryable();
        if (!enabled || retryable.isEmpty()) {
            return unchanged(null, original);
        }

        Instant now = clock.instant();
        Map<String, String> summary = new LinkedHashMap<>();
        summary.put("run_id", runId);
        summary.put("failed_count", Integer.toString(retryable.size()));
        summary.put("failed_units", retryable.stream().map(TrainingJob::getUnitId).collect(Collectors.joining(",")));
        summary.put("completed_count", Integer.toString(original.completed().size()));
        ApprovalRequest request = new ApprovalRequest(retryRequestId(runId), "retry failed training units", summary, now, now.plus(approvalTimeout));

        ApprovalDecision decision = awaitDecision(approvalChannel.open(request));
        if (decision != ApprovalDecision.APPROVED) {
            log.warn("retry.skipped run={} decision={} failed={}", runId, decision, summary.get("failed_units"));
            return unchanged(decision, original);
        }

        List<UnitConfig> units = new ArrayList<>(retryable.size());
        int nextAttempt = 1;
        for (TrainingJob job : retryable) {
            UnitConfig unit = unitsById.get(job.getUnitId());
            if (unit == null) {
                throw new IllegalStateException("No unit configuration for failed job " + job);
            }
            units.add(unit);
            nextAttempt = Math.max(nextAttempt, job.getAttempt() + 1);
        }
        log.info("retry.approved run={} units={} attempt={}", runId, units.size(), nextAttempt);

        List<TrainingJob> resubmitted = submitter.submitBatch(units, nextAttempt);
        MonitorResult retried = monitor.await(resubmitted);

        List<TrainingJob> completed = new ArrayList<>(original.completed());
        completed.addAll(retried.completed());
        List<TrainingJob> failed = new ArrayList<>(retried.failed());
        failed.addAll(original.timedOut());
        log.info("retry.done run={} retried={} succeeded={} stillFailed={}", runId, units.size(), retried.completed().size(), failed.size());
        return new RetryOutcome(decision, completed, failed, units.size(), retried.completed().size());
    }

    static String retryRequestId(String runId) {
        return "retry:" + runId;
    }

    private ApprovalDecision awaitDecision(CompletableFuture<ApprovalDecision> pending) throws InterruptedException {
        try {
            return pending.get();
        } catch (ExecutionException e) {
            log.error("retry.approval.failed reason={}", e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
            return ApprovalDecision.TIMED_OUT;
        }
    }

    private static RetryOutcome unchanged(ApprovalDecision decision, MonitorResult original) {
        return new RetryOutcome(decision, original.completed(), original.failed(), 0, 0);
    }
}
