package com.trainrelay.execution;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.trainrelay.config.UnitConfig;
import com.trainrelay.registry.Artifact;

public class JobSubmitter {
    private static final Logger log = LoggerFactory.getLogger(JobSubmitter.class);

    private final ExecutionService executionService;
    private final AdmissionControl admissionControl;
    private final int maxRetries;
    private final Duration retryBackoff;
    private final Sleeper sleeper;
    private final Clock clock;

    public JobSubmitter(ExecutionService executionService, AdmissionControl admissionControl, int maxRetries, Duration retryBackoff) {
        this(executionService, admissionControl, maxRetries, retryBackoff, Sleeper.SYSTEM, Clock.systemUTC());
    }

    public JobSubmitter(
            ExecutionService executionService,
            AdmissionControl admissionControl,
            int maxRetries,
            Duration retryBackoff,
            Sleeper sleeper,
            Clock clock) {
        if (maxRetries < 0 || retryBackoff.isNegative()) {
            throw new IllegalArgumentException("submission retry settings must be >= 0");
        }
        this.executionService = executionService;
        this.admissionControl = admissionControl;
        this.maxRetries = maxRetries;
        this.retryBackoff = retryBackoff;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    public List<TrainingJob> submitBatch(List<UnitConfig> units, int attempt) throws IOException, InterruptedException {
        if (units.isEmpty()) {
            return List.of();
        }
        AtomicBoolean aborted = new AtomicBoolean(false);
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(units.size(), admissionControl.capacity()));
        List<Future<SubmissionOutcome>> futures = new ArrayList<>(units.size());
        try {
            for (UnitConfig unit : units) {
                futures.add(pool.submit(() -> submitGuarded(unit, attempt, aborted)));
            }

            List<TrainingJob> submitted = new ArrayList<>(units.size());
            Map<String, String> failures = new LinkedHashMap<>();
            for (Future<SubmissionOutcome> future : futures) {
                SubmissionOutcome outcome = await(future);
                if (outcome.job() != null) {
                    submitted.add(outcome.job());
                } else if (outcome.error() != null) {
                    failures.put(outcome.unitId(), outcome.error());
                }
            }

            if (!failures.isEmpty()) {
                List<String> cancelled = cancelAll(submitted);
                log.error("submission.aborted failed={} cancelled={}", failures.keySet(), cancelled.size());
                throw new SubmissionAbortedException(failures, cancelled);
            }
            log.info("submission.batch attempt={} submitted={}", attempt, submitted.size());
            return submitted;
        } finally {
            pool.shutdownNow();
        }
    }

    private SubmissionOutcome submitGuarded(UnitConfig unit, int attempt, AtomicBoolean aborted) {
        try {
            admissionControl.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return SubmissionOutcome.failed(unit.unitId(), "interrupted while waiting for admission");
        }
        try {
            if (aborted.get()) {
                return SubmissionOutcome.skipped(unit.unitId());
            }
            TrainingJob job = submitWithRetries(unit, attempt);
            return SubmissionOutcome.submitted(job);
        } catch (IOException e) {
            aborted.set(true);
            return SubmissionOutcome.failed(unit.unitId(), e.getMessage());
        } catch (InterruptedException e) {
            aborted.set(true);
            Thread.currentThread().interrupt();
            return SubmissionOutcome.failed(unit.unitId(), "interrupted during submission backoff");
        } finally {
            admissionControl.release();
        }
    }

    private TrainingJob submitWithRetries(UnitConfig unit, int attempt) throws IOException, InterruptedException {
        String jobName = jobName(unit, attempt);
        Map<String, String> tags = new LinkedHashMap<>();
        tags.put(Artifact.TAG_UNIT_ID, unit.unitId());
        tags.put(Artifact.TAG_MODEL_NAME, unit.modelName());
        tags.put(Artifact.TAG_LINEAGE_HASH, unit.lineageHash());
        tags.put("attempt", Integer.toString(attempt));

        IOException last = null;
        int maxAttempts = maxRetries + 1;
        for (int call = 1; call <= maxAttempts; call++) {
            try {
                String handle = executionService.submit(jobName, unit.parameters(), tags);
                log.info("submission.accepted unit={} handle={} hash={} attempt={}", unit.unitId(), handle, unit.lineageHash(), attempt);
                return new TrainingJob(unit.unitId(), unit.modelName(), handle, unit.lineageHash(), attempt, clock.instant());
            } catch (IOException e) {
                last = e;
                if (call == maxAttempts) {
                    break;
                }
                Duration backoff = retryBackoff.multipliedBy(call);
                log.warn("submission.retry unit={} call={} maxCalls={} backoffMs={} reason={}",
                        unit.unitId(), call, maxAttempts, backoff.toMillis(), e.getMessage());
                sleeper.sleep(backoff);
            }
        }
        throw last;
    }

    private List<String> cancelAll(List<TrainingJob> submitted) {
        List<String> cancelled = new ArrayList<>();
        for (TrainingJob job : submitted) {
            try {
                executionService.cancel(job.getJobHandle());
                cancelled.add(job.getJobHandle());
            } catch (IOException e) {
                log.error("submission.cancel.failed unit={} handle={} reason={}", job.getUnitId(), job.getJobHandle(), e.getMessage());
            }
        }
        return cancelled;
    }

    private static SubmissionOutcome await(Future<SubmissionOutcome> future) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Submission task failed unexpectedly", e.getCause());
        }
    }

    static String jobName(UnitConfig unit, int attempt) {
        return unit.unitId() + "_" + unit.lineageHash() + "_a" + attempt;
    }

    private record SubmissionOutcome(String unitId, TrainingJob job, String error) {
        static SubmissionOutcome submitted(TrainingJob job) {
            return new SubmissionOutcome(job.getUnitId(), job, null);
        }

        static SubmissionOutcome failed(String unitId, String error) {
            return new SubmissionOutcome(unitId, null, error == null ? "unknown submission error" : error);
        }

        static SubmissionOutcome skipped(String unitId) {
            return new SubmissionOutcome(unitId, null, null);
        }
    }
}
