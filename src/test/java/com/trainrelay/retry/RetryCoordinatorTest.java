package com.trainrelay.retry;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.trainrelay.approval.ApprovalDecision;
import com.trainrelay.approval.ApprovalRequest;
import com.trainrelay.config.UnitConfig;
import com.trainrelay.execution.AdmissionControl;
import com.trainrelay.execution.JobMonitor;
import com.trainrelay.execution.JobStatus;
import com.trainrelay.execution.JobSubmitter;
import com.trainrelay.execution.MonitorResult;
import com.trainrelay.execution.TrainingJob;
import com.trainrelay.runtime.BackoffPolicy;
import com.trainrelay.support.FakeExecutionService;
import com.trainrelay.support.ManualClock;
import com.trainrelay.support.RecordingSleeper;
import com.trainrelay.support.ScriptedApprovalChannel;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryCoordinatorTest {

    private final ManualClock clock = new ManualClock(Instant.parse("2026-04-01T00:00:00Z"));
    private final RecordingSleeper sleeper = new RecordingSleeper(clock);
    private final Map<String, UnitConfig> units = new LinkedHashMap<>();

    RetryCoordinatorTest() {
        for (String id : List.of("U1", "U2", "U3")) {
            units.put(id, UnitConfig.of(id, id.toLowerCase(), Map.of("unit_id", id)));
        }
    }

    @Test
    void shouldResubmitFailedUnitsAndKeepEarlierCompletions() throws Exception {
        FakeExecutionService execution = new FakeExecutionService()
                .script("U1", 1, JobStatus.COMPLETED)
                .script("U2", 1, JobStatus.FAILED)
                .script("U2", 2, JobStatus.RUNNING, JobStatus.COMPLETED);
        ScriptedApprovalChannel approvals = new ScriptedApprovalChannel().decideOnOpen("retry:run-1", ApprovalDecision.APPROVED);
        RetryCoordinator coordinator = coordinator(execution, approvals, true);
        MonitorResult original = firstPass(execution, "U1", "U2");

        RetryOutcome outcome = coordinator.retryFailed("run-1", original, units);

        assertEquals(ApprovalDecision.APPROVED, outcome.decision());
        assertEquals(1, outcome.retried());
        assertEquals(1, outcome.retrySucceeded());
        assertTrue(outcome.completed().containsAll(original.completed()));
        assertEquals(List.of("U1", "U2"), outcome.completed().stream().map(TrainingJob::getUnitId).toList());
        TrainingJob retried = outcome.completed().get(1);
        assertEquals(2, retried.getAttempt());
        assertTrue(retried.isRetry());
        assertTrue(outcome.failed().isEmpty());

        ApprovalRequest request = approvals.opened().get(0);
        assertEquals("U2", request.summary().get("failed_units"));
        assertEquals("1", request.summary().get("completed_count"));
    }

    @Test
    void shouldLeaveResultsUntouchedWhenRetryIsRejected() throws Exception {
        FakeExecutionService execution = new FakeExecutionService()
                .script("U1", 1, JobStatus.COMPLETED)
                .script("U2", 1, JobStatus.FAILED);
        ScriptedApprovalChannel approvals = new ScriptedApprovalChannel().decideOnOpen("retry:run-2", ApprovalDecision.REJECTED);
        MonitorResult original = firstPass(execution, "U1", "U2");
        int submittedBefore = execution.submitCalls();

        RetryOutcome outcome = coordinator(execution, approvals, true).retryFailed("run-2", original, units);

        assertEquals(ApprovalDecision.REJECTED, outcome.decision());
        assertEquals(original.completed(), outcome.completed());
        assertEquals(original.failed(), outcome.failed());
        assertEquals(0, outcome.retried());
        assertEquals(submittedBefore, execution.submitCalls());
    }

    @Test
    void shouldNotAskForApprovalWhenNothingFailedOrRetryDisabled() throws Exception {
        FakeExecutionService execution = new FakeExecutionService().script("U2", 1, JobStatus.FAILED);
        ScriptedApprovalChannel approvals = new ScriptedApprovalChannel();
        MonitorResult original = firstPass(execution, "U2");

        RetryOutcome disabled = coordinator(execution, approvals, false).retryFailed("run-3", original, units);
        RetryOutcome clean = coordinator(execution, approvals, true).retryFailed("run-3", MonitorResult.empty(), units);

        assertNull(disabled.decision());
        assertNull(clean.decision());
        assertTrue(approvals.opened().isEmpty());
        assertEquals(1, disabled.failed().size());
    }

    @Test
    void shouldNotRetryJobsStillRunningRemotely() throws Exception {
        FakeExecutionService execution = new FakeExecutionService()
                .script("U1", 1, JobStatus.COMPLETED)
                .script("U3", 1, JobStatus.RUNNING);
        ScriptedApprovalChannel approvals = new ScriptedApprovalChannel().decideAllOnOpen(ApprovalDecision.APPROVED);
        MonitorResult original = firstPass(execution, "U1", "U3");

        RetryOutcome outcome = coordinator(execution, approvals, true).retryFailed("run-4", original, units);

        assertEquals(1, original.timedOut().size());
        assertNull(outcome.decision());
        assertTrue(approvals.opened().isEmpty());
        assertEquals(List.of("U3"), outcome.failed().stream().map(TrainingJob::getUnitId).toList());
    }

    private RetryCoordinator coordinator(FakeExecutionService execution, ScriptedApprovalChannel approvals, boolean enabled) {
        JobSubmitter submitter = new JobSubmitter(execution, new AdmissionControl(5), 0, Duration.ZERO, sleeper, clock);
        return new RetryCoordinator(approvals, submitter, monitor(execution), Duration.ofHours(4), enabled, clock);
    }

    private JobMonitor monitor(FakeExecutionService execution) {
        return new JobMonitor(execution, BackoffPolicy.ofMillis(30_000, 300_000, Duration.ofHours(3).toMillis()),
                Duration.ofHours(4), sleeper, clock);
    }

    private MonitorResult firstPass(FakeExecutionService execution, String... unitIds) throws Exception {
        JobSubmitter submitter = new JobSubmitter(execution, new AdmissionControl(5), 0, Duration.ZERO, sleeper, clock);
        List<UnitConfig> batch = Arrays.stream(unitIds).map(units::get).toList();
        return monitor(execution).await(submitter.submitBatch(batch, 1));
    }
}
