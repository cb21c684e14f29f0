package com.trainrelay.execution;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import com.trainrelay.config.UnitConfig;
import com.trainrelay.support.FakeExecutionService;
import com.trainrelay.support.ManualClock;
import com.trainrelay.support.RecordingSleeper;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobSubmitterTest {

    private final ManualClock clock = new ManualClock(Instant.parse("2026-04-01T00:00:00Z"));

    @Test
    void shouldSubmitEveryUnitWithDeterministicJobNames() throws Exception {
        FakeExecutionService execution = new FakeExecutionService();
        JobSubmitter submitter = submitter(execution, new RecordingSleeper(clock));
        List<UnitConfig> units = List.of(unit("U1"), unit("U2"), unit("U3"));

        List<TrainingJob> jobs = submitter.submitBatch(units, 1);

        assertEquals(3, jobs.size());
        assertEquals(List.of("U1", "U2", "U3"), jobs.stream().map(TrainingJob::getUnitId).toList());
        assertTrue(jobs.stream().allMatch(job -> job.getStatus() == JobStatus.QUEUED && job.getAttempt() == 1));
        assertTrue(execution.submittedNames().contains("U1_" + units.get(0).lineageHash() + "_a1"));
    }

    @Test
    void shouldRetryTransientSubmissionFailuresWithLinearBackoff() throws Exception {
        FakeExecutionService execution = new FakeExecutionService().failSubmissions("U1", 2);
        RecordingSleeper sleeper = new RecordingSleeper(clock);
        JobSubmitter submitter = submitter(execution, sleeper);

        List<TrainingJob> jobs = submitter.submitBatch(List.of(unit("U1")), 1);

        assertEquals(1, jobs.size());
        assertEquals(3, execution.submitCalls());
        assertEquals(List.of(Duration.ofSeconds(30), Duration.ofSeconds(60)), sleeper.sleeps());
    }

    @Test
    void shouldCancelAlreadySubmittedJobsWhenAnyUnitExhaustsRetries() throws Exception {
        FakeExecutionService execution = new FakeExecutionService().failSubmissions("U2", 3);
        JobSubmitter submitter = new JobSubmitter(execution, new AdmissionControl(1), 2, Duration.ofSeconds(30),
                new RecordingSleeper(clock), clock);

        SubmissionAbortedException error = assertThrows(SubmissionAbortedException.class,
                () -> submitter.submitBatch(List.of(unit("U1"), unit("U2"), unit("U3")), 1));

        assertEquals(List.of("U2"), List.copyOf(error.failedUnits().keySet()));
        assertTrue(error.cancelledHandles().contains("job-1"));
        assertEquals(error.cancelledHandles(), execution.cancelled());
    }

    @Test
    void shouldNeverExceedTheAdmissionCap() throws Exception {
        AdmissionControl admission = new AdmissionControl(2);
        AtomicInteger peak = new AtomicInteger();
        AtomicInteger counter = new AtomicInteger();
        ExecutionService slow = new ExecutionService() {
            @Override
            public String submit(String jobName, Map<String, Object> parameters, Map<String, String> tags) {
                peak.accumulateAndGet(admission.inFlight(), Math::max);
                try {
                    Thread.sleep(20);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return "job-" + counter.incrementAndGet();
            }

            @Override
            public JobStatus status(String handle) {
                return JobStatus.COMPLETED;
            }

            @Override
            public void cancel(String handle) {
            }
        };
        JobSubmitter submitter = new JobSubmitter(slow, admission, 0, Duration.ZERO, new RecordingSleeper(clock), clock);

        List<TrainingJob> jobs = submitter.submitBatch(List.of(unit("U1"), unit("U2"), unit("U3"), unit("U4"), unit("U5")), 1);

        assertEquals(5, jobs.size());
        assertTrue(peak.get() <= 2, "peak in flight was " + peak.get());
        assertEquals(0, admission.inFlight());
    }

    @Test
    void shouldReturnNothingForEmptyBatch() throws Exception {
        JobSubmitter submitter = submitter(new FakeExecutionService(), new RecordingSleeper(clock));

        assertTrue(submitter.submitBatch(List.of(), 1).isEmpty());
    }

    @Test
    void shouldAbortImmediatelyWhenRetriesAreDisabled() {
        ExecutionService broken = new ExecutionService() {
            @Override
            public String submit(String jobName, Map<String, Object> parameters, Map<String, String> tags) throws IOException {
                throw new IOException("connection refused");
            }

            @Override
            public JobStatus status(String handle) {
                return JobStatus.RUNNING;
            }

            @Override
            public void cancel(String handle) {
            }
        };
        JobSubmitter submitter = new JobSubmitter(broken, new AdmissionControl(5), 0, Duration.ZERO, new RecordingSleeper(clock), clock);

        SubmissionAbortedException error = assertThrows(SubmissionAbortedException.class,
                () -> submitter.submitBatch(List.of(unit("U1")), 1));
        assertTrue(error.getMessage().contains("U1"));
    }

    private JobSubmitter submitter(ExecutionService execution, RecordingSleeper sleeper) {
        return new JobSubmitter(execution, new AdmissionControl(AdmissionControl.DEFAULT_CAPACITY), 2, Duration.ofSeconds(30), sleeper, clock);
    }

    private static UnitConfig unit(String id) {
        return UnitConfig.of(id, id.toLowerCase(), Map.of("unit_id", id, "window", 30));
    }
}
