package com.trainrelay.pipeline;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.trainrelay.config.UnitConfig;
import com.trainrelay.execution.JobMonitor;
import com.trainrelay.execution.JobSubmitter;
import com.trainrelay.execution.MonitorResult;
import com.trainrelay.execution.SubmissionAbortedException;
import com.trainrelay.execution.TrainingJob;
import com.trainrelay.pipeline.ProgressEvent.Stage;
import com.trainrelay.promotion.PromotionCoordinator;
import com.trainrelay.promotion.PromotionReport;
import com.trainrelay.promotion.PromotionRequest;
import com.trainrelay.registration.ModelRegistrar;
import com.trainrelay.registration.RegistrationResult;
import com.trainrelay.registration.RegistrationThresholdException;
import com.trainrelay.retry.RetryCoordinator;
import com.trainrelay.retry.RetryOutcome;
import com.trainrelay.selection.ChangeSelector;
import com.trainrelay.selection.SelectionMode;
import com.trainrelay.selection.SelectionRequest;
import com.trainrelay.selection.SelectionResult;

public class TrainingRunCoordinator {
    private static final Logger log = LoggerFactory.getLogger(TrainingRunCoordinator.class);

    private final UnitSource unitSource;
    private final ChangeSelector selector;
    private final JobSubmitter submitter;
    private final JobMonitor monitor;
    private final RetryCoordinator retryCoordinator;
    private final ModelRegistrar registrar;
    private final PromotionCoordinator promotionCoordinator;
    private final ProgressListener progress;
    private final boolean allowFullRetrainWithoutBaseline;
    private final Duration promotionWait;
    private final Clock clock;

    public TrainingRunCoordinator(
            UnitSource unitSource,
            ChangeSelector selector,
            JobSubmitter submitter,
            JobMonitor monitor,
            RetryCoordinator retryCoordinator,
            ModelRegistrar registrar,
            PromotionCoordinator promotionCoordinator,
            ProgressListener progress,
            boolean allowFullRetrainWithoutBaseline,
            Duration promotionWait,
            Clock clock) {
        this.unitSource = unitSource;
        this.selector = selector;
        this.submitter = submitter;
        this.monitor = monitor;
        this.retryCoordinator = retryCoordinator;
        this.registrar = registrar;
        this.promotionCoordinator = promotionCoordinator;
        this.progress = progress == null ? ProgressListener.NONE : progress;
        this.allowFullRetrainWithoutBaseline = allowFullRetrainWithoutBaseline;
        this.promotionWait = promotionWait;
        this.clock = clock;
    }

    public RunSummary run(SelectionMode mode, List<String> manualUnitIds) throws IOException, InterruptedException {
        String runId = "run-" + clock.millis();
        List<UnitConfig> units = unitSource.load();
        SelectionRequest request = mode == SelectionMode.MANUAL
                ? SelectionRequest.manual(manualUnitIds)
                : SelectionRequest.auto(allowFullRetrainWithoutBaseline);
        SelectionResult selection = selector.select(units, request);
        List<String> selectedIds = selection.selected().stream().map(UnitConfig::unitId).toList();
        selection.selected().forEach(unit -> emit(runId, unit.unitId(), Stage.SELECTION, "selected"));
        log.info("run.selected run={} mode={} selected={} skipped={} fullRetrain={}",
                runId, mode, selectedIds.size(), selection.skipped().size(), selection.fullRetrain());

        if (selection.isEmpty()) {
            emit(runId, ProgressEvent.RUN_SCOPE, Stage.RUN, "nothing-to-do");
            log.info("run.nothing-to-do run={} units={}", runId, units.size());
            return RunSummary.nothingToDo(runId, mode);
        }

        Map<String, UnitConfig> unitsById = new LinkedHashMap<>();
        selection.selected().forEach(unit -> unitsById.put(unit.unitId(), unit));

        List<TrainingJob> submitted;
        try {
            submitted = submitter.submitBatch(selection.selected(), 1);
        } catch (SubmissionAbortedException e) {
            emit(runId, ProgressEvent.RUN_SCOPE, Stage.SUBMISSION, "aborted");
            RunSummary partial = summary(runId, mode, selectedIds, 0, MonitorResult.empty(), null, null, null, Map.of());
            throw new RunFailedException(Stage.SUBMISSION, e.getMessage(), e.failedUnits(), partial, e);
        }
        submitted.forEach(job -> emit(runId, job.getUnitId(), Stage.SUBMISSION, job.getJobHandle()));

        MonitorResult monitored = monitor.await(submitted);
        monitored.completed().forEach(job -> emit(runId, job.getUnitId(), Stage.MONITOR, "completed"));
        monitored.failed().forEach(job -> emit(runId, job.getUnitId(), Stage.MONITOR, job.isTimedOut() ? "timed-out" : "failed"));

        RetryOutcome retried;
        try {
            retried = retryCoordinator.retryFailed(runId, monitored, unitsById);
        } catch (SubmissionAbortedException e) {
            RunSummary partial = summary(runId, mode, selectedIds, submitted.size(), monitored, null, null, null, Map.of());
            throw new RunFailedException(Stage.RETRY, e.getMessage(), e.failedUnits(), partial, e);
        }
        if (retried.attempted()) {
            retried.completed().stream()
                    .filter(TrainingJob::isRetry)
                    .forEach(job -> emit(runId, job.getUnitId(), Stage.RETRY, "completed"));
        }

        Map<String, String> errors = new LinkedHashMap<>();
        retried.failed().forEach(job -> errors.put(job.getUnitId(), "training " + (job.isTimedOut() ? "timed out" : job.getStatus())));
        if (retried.completed().isEmpty()) {
            RunSummary partial = summary(runId, mode, selectedIds, submitted.size(), monitored, retried, null, null, errors);
            throw new RunFailedException(Stage.MONITOR, "No training job completed out of " + submitted.size() + " submitted", errors, partial, null);
        }

        RegistrationResult registration;
        try {
            registration = registrar.register(retried.completed());
        } catch (RegistrationThresholdException e) {
            errors.putAll(e.result().failures());
            RunSummary partial = summary(runId, mode, selectedIds, submitted.size(), monitored, retried, e.result(), null, errors);
            throw new RunFailedException(Stage.REGISTRATION, e.getMessage(), e.result().failures(), partial, e);
        }
        errors.putAll(registration.failures());
        registration.registered().forEach(artifact -> emit(runId, artifact.unitId(), Stage.REGISTRATION, artifact.reference()));

        Map<String, CompletableFuture<PromotionRequest>> promotions = promotionCoordinator.open(runId, registration.registered());
        PromotionReport report;
        try {
            report = promotionCoordinator.collect(promotions, promotionWait);
        } catch (IOException e) {
            emit(runId, ProgressEvent.RUN_SCOPE, Stage.PROMOTION, "failed");
            RunSummary partial = summary(runId, mode, selectedIds, submitted.size(), monitored, retried, registration, null, errors);
            throw new RunFailedException(Stage.PROMOTION, "Promotion state unavailable: " + e.getMessage(), errors, partial, e);
        }
        errors.putAll(report.errors());
        for (PromotionRequest promotion : report.requests()) {
            emit(runId, promotion.unitId(), Stage.PROMOTION, promotion.approvalState() + "/" + promotion.propagationState());
        }

        RunSummary summary = summary(runId, mode, selectedIds, submitted.size(), monitored, retried, registration, report, errors);
        emit(runId, ProgressEvent.RUN_SCOPE, Stage.RUN, "succeeded");
        log.info("run.done run={} submitted={} completed={} retried={} registered={} promoted={} pendingPromotions={}",
                runId, summary.submitted(), summary.completed(), summary.retried(), summary.registered(),
                summary.promoted(), summary.pendingPromotions());
        return summary;
    }

    private RunSummary summary(
            String runId,
            SelectionMode mode,
            List<String> selectedIds,
            int submitted,
            MonitorResult monitored,
            RetryOutcome retried,
            RegistrationResult registration,
            PromotionReport report,
            Map<String, String> errors) {
        return new RunSummary(
                runId,
                mode,
                selectedIds,
                submitted,
                monitored.completed().size(),
                retried == null ? monitored.failed().size() : retried.failed().size(),
                retried == null ? 0 : retried.retried(),
                registration == null ? 0 : registration.registered().size(),
                report == null ? 0 : (int) report.confirmed(),
                report == null ? 0 : (int) report.pending(),
                report == null ? 0 : (int) report.rejected(),
                report == null ? 0 : (int) (report.approvalTimedOut() + report.propagationTimedOut()),
                errors,
                RunSummary.Outcome.SUCCEEDED);
    }

    private void emit(String runId, String unitId, Stage stage, String state) {
        progress.onEvent(new ProgressEvent(runId, unitId, stage, state, clock.instant()));
    }
}
