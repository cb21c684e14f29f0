package com.trainrelay.promotion;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.trainrelay.approval.ApprovalChannel;
import com.trainrelay.approval.ApprovalDecision;
import com.trainrelay.approval.ApprovalRecord;
import com.trainrelay.approval.ApprovalRequest;
import com.trainrelay.execution.Sleeper;
import com.trainrelay.registry.Artifact;
import com.trainrelay.registry.ArtifactStore;
import com.trainrelay.runtime.BackoffPolicy;

/**
 * Moves artifacts from the training registry into the shared registry, one independent
 * request per artifact. A request waits on its own approval future, so no thread or lock is
 * held while a decision is outstanding; once approved it copies the artifact and polls the
 * shared registry until the copy is visible or the visibility ceiling passes. A copy that
 * never becomes visible is reported, not rolled back.
 */
public class PromotionCoordinator {
    private static final Logger log = LoggerFactory.getLogger(PromotionCoordinator.class);
    private static final Duration PROPAGATION_GRACE = Duration.ofSeconds(30);

    private final ApprovalChannel approvalChannel;
    private final ArtifactStore trainingStore;
    private final ArtifactStore sharedStore;
    private final PromotionLedger ledger;
    private final Duration approvalTimeout;
    private final BackoffPolicy visibilityPolicy;
    private final Sleeper sleeper;
    private final Clock clock;
    private final Executor executor;

    public PromotionCoordinator(
            ApprovalChannel approvalChannel,
            ArtifactStore trainingStore,
            ArtifactStore sharedStore,
            PromotionLedger ledger,
            Duration approvalTimeout,
            BackoffPolicy visibilityPolicy,
            Sleeper sleeper,
            Clock clock,
            Executor executor) {
        this.approvalChannel = approvalChannel;
        this.trainingStore = trainingStore;
        this.sharedStore = sharedStore;
        this.ledger = ledger;
        this.approvalTimeout = approvalTimeout;
        this.visibilityPolicy = visibilityPolicy;
        this.sleeper = sleeper;
        this.clock = clock;
        this.executor = executor;
    }

    public Map<String, CompletableFuture<PromotionRequest>> open(String runId, List<Artifact> artifacts) {
        Map<String, CompletableFuture<PromotionRequest>> tasks = new LinkedHashMap<>();
        for (Artifact artifact : artifacts) {
            String requestId = PromotionRequest.requestIdFor(artifact.unitId(), artifact.name(), artifact.version());
            try {
                tasks.put(requestId, openOne(runId, requestId, artifact));
            } catch (IOException e) {
                log.error("promotion.open.failed request={} artifact={} reason={}", requestId, artifact.reference(), e.getMessage());
                tasks.put(requestId, CompletableFuture.failedFuture(e));
            }
        }
        return tasks;
    }

    public Map<String, CompletableFuture<PromotionRequest>> resume() throws IOException {
        Map<String, CompletableFuture<PromotionRequest>> tasks = new LinkedHashMap<>();
        for (PromotionRequest request : ledger.unresolved()) {
            log.info("promotion.resumed request={} approval={} propagation={}",
                    request.requestId(), request.approvalState(), request.propagationState());
            tasks.put(request.requestId(), attach(request, Map.of()));
        }
        return tasks;
    }

    public PromotionReport collect(Map<String, CompletableFuture<PromotionRequest>> tasks, Duration decisionWait)
            throws IOException, InterruptedException {
        await(tasks.values(), decisionWait);
        approvalChannel.refresh();
        List<CompletableFuture<PromotionRequest>> propagating = new ArrayList<>();
        for (Map.Entry<String, CompletableFuture<PromotionRequest>> entry : tasks.entrySet()) {
            if (!entry.getValue().isDone() && isDecided(entry.getKey())) {
                propagating.add(entry.getValue());
            }
        }
        if (!propagating.isEmpty()) {
            Duration propagationWait = visibilityPolicy.ceiling().plus(PROPAGATION_GRACE);
            log.info("promotion.collect.awaiting-propagation requests={} maxWaitMs={}", propagating.size(), propagationWait.toMillis());
            await(propagating, propagationWait);
        }

        List<PromotionRequest> requests = new ArrayList<>();
        Map<String, String> errors = new LinkedHashMap<>();
        for (Map.Entry<String, CompletableFuture<PromotionRequest>> entry : tasks.entrySet()) {
            CompletableFuture<PromotionRequest> task = entry.getValue();
            if (task.isDone() && !task.isCompletedExceptionally()) {
                requests.add(task.join());
                continue;
            }
            if (task.isCompletedExceptionally()) {
                errors.put(entry.getKey(), failureMessage(task));
            }
            try {
                ledger.get(entry.getKey()).ifPresent(requests::add);
            } catch (IOException e) {
                log.warn("promotion.collect.ledger-unreadable request={} reason={}", entry.getKey(), e.getMessage());
                errors.putIfAbsent(entry.getKey(), "ledger unreadable: " + e.getMessage());
            }
        }
        return new PromotionReport(requests, errors);
    }

    private CompletableFuture<PromotionRequest> openOne(String runId, String requestId, Artifact artifact) throws IOException {
        Optional<PromotionRequest> existing = ledger.get(requestId);
        if (existing.isPresent()) {
            return existing.get().isResolved()
                    ? CompletableFuture.completedFuture(existing.get())
                    : attach(existing.get(), artifact.payload());
        }
        Instant now = clock.instant();
        PromotionRequest request = new PromotionRequest(
                requestId,
                runId,
                trainingStore.environment(),
                artifact.name(),
                artifact.version(),
                artifact.unitId(),
                artifact.lineageHash(),
                ApprovalState.PENDING,
                PropagationState.NOT_STARTED,
                now,
                now.plus(approvalTimeout),
                null,
                "",
                now);
        ledger.put(request);
        log.info("promotion.opened request={} artifact={} hash={} deadline={}",
                requestId, artifact.reference(), artifact.lineageHash(), request.deadline());
        return attach(request, artifact.payload());
    }

    private boolean isDecided(String requestId) throws IOException {
        Optional<PromotionRequest> recorded = ledger.get(requestId);
        if (recorded.isPresent() && recorded.get().approvalState() != ApprovalState.PENDING) {
            return true;
        }
        return approvalChannel.find(requestId).map(ApprovalRecord::isDecided).orElse(false);
    }

    private static void await(Collection<CompletableFuture<PromotionRequest>> tasks, Duration maxWait) throws InterruptedException {
        CompletableFuture<Void> all = CompletableFuture.allOf(tasks.toArray(CompletableFuture[]::new));
        try {
            all.get(Math.max(0L, maxWait.toMillis()), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.info("promotion.collect.partial waitedMs={} outstanding={}", maxWait.toMillis(),
                    tasks.stream().filter(task -> !task.isDone()).count());
        } catch (ExecutionException e) {
            log.debug("promotion.collect.task-failed reason={}", e.getMessage());
        }
    }

    private CompletableFuture<PromotionRequest> attach(PromotionRequest request, Map<String, String> metrics) {
        if (request.approvalState() == ApprovalState.APPROVED) {
            return CompletableFuture.supplyAsync(() -> propagate(request), executor);
        }
        Map<String, String> summary = new LinkedHashMap<>(metrics);
        summary.put("unit_id", request.unitId());
        summary.put("artifact", request.artifactReference());
        summary.put("lineage_hash", request.lineageHash());
        summary.put("source_environment", request.sourceEnvironment());
        summary.put("run_id", request.runId());
        ApprovalRequest approval = new ApprovalRequest(
                request.requestId(),
                "promote " + request.artifactReference() + " to " + sharedStore.environment(),
                summary,
                request.openedAt(),
                request.deadline());
        try {
            return approvalChannel.open(approval)
                    .thenApplyAsync(decision -> onDecision(request.requestId(), decision), executor);
        } catch (IOException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private PromotionRequest onDecision(String requestId, ApprovalDecision decision) {
        try {
            PromotionRequest current = ledger.get(requestId)
                    .orElseThrow(() -> new IllegalStateException("Promotion request vanished from ledger: " + requestId));
            PromotionRequest decided = current.withApproval(ApprovalState.from(decision), "approval " + decision, clock.instant());
            ledger.put(decided);
            log.info("promotion.decision request={} decision={}", requestId, decision);
            if (decision != ApprovalDecision.APPROVED) {
                return decided;
            }
            return propagate(decided);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private PromotionRequest propagate(PromotionRequest request) {
        try {
            Optional<Artifact> alreadyShared = sharedStore.latest(request.modelName(), Map.of(Artifact.TAG_LINEAGE_HASH, request.lineageHash()));
            if (alreadyShared.isPresent()) {
                log.info("promotion.already-shared request={} sharedArtifact={}", request.requestId(), alreadyShared.get().reference());
                return record(request.withPropagation(PropagationState.CONFIRMED, alreadyShared.get().version(),
                        "already present in " + sharedStore.environment(), clock.instant()));
            }

            Optional<Artifact> source = trainingStore.get(request.modelName(), request.version());
            if (source.isEmpty()) {
                return record(request.withPropagation(PropagationState.TIMED_OUT, null,
                        "source artifact " + request.artifactReference() + " not found in " + trainingStore.environment(), clock.instant()));
            }

            record(request.withPropagation(PropagationState.COPYING, null, "copy started", clock.instant()));
            Map<String, String> tags = new LinkedHashMap<>(source.get().tags());
            tags.put(Artifact.TAG_PROMOTED_FROM, trainingStore.environment());
            tags.put(Artifact.TAG_SOURCE_VERSION, Integer.toString(request.version()));
            Artifact copy = sharedStore.createVersion(request.modelName(), source.get().payload(), tags);
            log.info("promotion.copied request={} sharedArtifact={}", request.requestId(), copy.reference());

            return record(awaitVisibility(request, copy));
        } catch (IOException e) {
            log.error("promotion.copy.failed request={} reason={}", request.requestId(), e.getMessage());
            return recordQuietly(request.withPropagation(PropagationState.TIMED_OUT, null, "copy failed: " + e.getMessage(), clock.instant()));
        }
    }

    private PromotionRequest awaitVisibility(PromotionRequest request, Artifact copy) throws IOException {
        Instant start = clock.instant();
        Duration delay = visibilityPolicy.initialDelay();
        while (true) {
            if (sharedStore.get(copy.name(), copy.version()).isPresent()) {
                log.info("promotion.confirmed request={} sharedArtifact={}", request.requestId(), copy.reference());
                return request.withPropagation(PropagationState.CONFIRMED, copy.version(), "visible in " + sharedStore.environment(), clock.instant());
            }
            Duration elapsed = Duration.between(start, clock.instant());
            if (visibilityPolicy.exhausted(elapsed)) {
                log.warn("promotion.visibility.timeout request={} sharedArtifact={} elapsedMs={} action=verify-manually",
                        request.requestId(), copy.reference(), elapsed.toMillis());
                return request.withPropagation(PropagationState.TIMED_OUT, copy.version(),
                        "copy not visible within " + visibilityPolicy.ceiling().toSeconds() + "s; verify manually", clock.instant());
            }
            try {
                sleeper.sleep(visibilityPolicy.boundedDelay(delay, elapsed));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return request.withPropagation(PropagationState.TIMED_OUT, copy.version(), "interrupted while awaiting visibility", clock.instant());
            }
            delay = visibilityPolicy.next(delay);
        }
    }

    private PromotionRequest record(PromotionRequest request) throws IOException {
        ledger.put(request);
        return request;
    }

    private PromotionRequest recordQuietly(PromotionRequest request) {
        try {
            return record(request);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String failureMessage(CompletableFuture<PromotionRequest> task) {
        try {
            task.join();
            return "";
        } catch (CompletionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            return cause.getMessage();
        }
    }
}
