package com.trainrelay.approval;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.trainrelay.runtime.JsonFiles;

/**
 * Approval channel backed by a JSON file keyed by request id. Decisions may be recorded by
 * this process ({@link #decide}) or by another process writing the same file, in which case
 * {@link #refresh()} picks them up. Every read-modify-write holds an OS lock on a sibling
 * {@code .lock} file, so a timeout written here cannot overwrite a decision written there.
 */
public class FileApprovalChannel implements ApprovalChannel, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(FileApprovalChannel.class);
    private static final String SYSTEM_ACTOR = "system";
    // FileLock is held per JVM, so channels on the same file in one process queue here first.
    private static final Map<Path, Object> FILE_MONITORS = new ConcurrentHashMap<>();

    private final Path approvalsPath;
    private final Path lockPath;
    private final Clock clock;
    private final ObjectMapper mapper = JsonMapper.builder().findAndAddModules().build();
    private final Map<String, CompletableFuture<ApprovalDecision>> waiters = new ConcurrentHashMap<>();
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
        Thread thread = new Thread(runnable, "approval-channel");
        thread.setDaemon(true);
        return thread;
    });

    public FileApprovalChannel(Path approvalsPath) {
        this(approvalsPath, Clock.systemUTC());
    }

    public FileApprovalChannel(Path approvalsPath, Clock clock) {
        this.approvalsPath = approvalsPath;
        this.lockPath = approvalsPath.resolveSibling(approvalsPath.getFileName() + ".lock");
        this.clock = clock;
    }

    @Override
    public synchronized CompletableFuture<ApprovalDecision> open(ApprovalRequest request) throws IOException {
        ApprovalRecord record = locked(() -> {
            Map<String, ApprovalRecord> records = load();
            ApprovalRecord existing = records.get(request.requestId());
            if (existing != null) {
                return existing;
            }
            ApprovalRecord created = ApprovalRecord.pending(request);
            records.put(request.requestId(), created);
            save(records);
            log.info("approval.opened request={} subject={} deadline={}", request.requestId(), request.subject(), request.deadline());
            return created;
        });
        if (record.isDecided()) {
            log.info("approval.resumed request={} decision={}", request.requestId(), record.decision());
            return CompletableFuture.completedFuture(record.decision());
        }

        CompletableFuture<ApprovalDecision> future = waiters.computeIfAbsent(request.requestId(), ignored -> new CompletableFuture<>());
        Duration remaining = Duration.between(clock.instant(), record.request().deadline());
        if (remaining.isNegative() || remaining.isZero()) {
            expire(request.requestId());
        } else {
            scheduler.schedule(this::expireQuietly, remaining.toMillis(), TimeUnit.MILLISECONDS);
        }
        return future;
    }

    @Override
    public synchronized void decide(String requestId, ApprovalDecision decision, String actor) throws IOException {
        boolean recorded = locked(() -> {
            Map<String, ApprovalRecord> records = load();
            ApprovalRecord record = records.get(requestId);
            if (record == null) {
                throw new IllegalArgumentException("Unknown approval request: " + requestId);
            }
            if (record.isDecided()) {
                if (record.decision() == decision) {
                    return false;
                }
                throw new IllegalStateException("Approval request " + requestId + " already resolved as " + record.decision());
            }
            records.put(requestId, record.decide(decision, actor == null || actor.isBlank() ? "operator" : actor, clock.instant()));
            save(records);
            return true;
        });
        if (recorded) {
            log.info("approval.decided request={} decision={} actor={}", requestId, decision, actor);
            complete(requestId, decision);
        }
    }

    @Override
    public synchronized Optional<ApprovalRecord> find(String requestId) throws IOException {
        return Optional.ofNullable(load().get(requestId));
    }

    @Override
    public synchronized List<ApprovalRecord> pending() throws IOException {
        return load().values().stream().filter(record -> !record.isDecided()).toList();
    }

    @Override
    public synchronized void refresh() throws IOException {
        Map<String, ApprovalRecord> records = load();
        for (String requestId : List.copyOf(waiters.keySet())) {
            ApprovalRecord record = records.get(requestId);
            if (record != null && record.isDecided()) {
                complete(requestId, record.decision());
            }
        }
        expire(null);
    }

    public void startRefresh(Duration interval) {
        if (interval.isZero() || interval.isNegative()) {
            return;
        }
        scheduler.scheduleWithFixedDelay(() -> {
            try {
                refresh();
            } catch (IOException e) {
                log.warn("approval.refresh.failed file={} reason={}", approvalsPath, e.getMessage());
            }
        }, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }

    private void expireQuietly() {
        try {
            synchronized (this) {
                expire(null);
            }
        } catch (IOException e) {
            log.warn("approval.expire.failed file={} reason={}", approvalsPath, e.getMessage());
        }
    }

    private void expire(String onlyRequestId) throws IOException {
        List<String> expired = locked(() -> {
            Map<String, ApprovalRecord> records = load();
            List<String> timedOut = new ArrayList<>();
            for (ApprovalRecord record : List.copyOf(records.values())) {
                String requestId = record.request().requestId();
                if (record.isDecided() || (onlyRequestId != null && !onlyRequestId.equals(requestId))) {
                    continue;
                }
                if (!clock.instant().isBefore(record.request().deadline())) {
                    records.put(requestId, record.decide(ApprovalDecision.TIMED_OUT, SYSTEM_ACTOR, clock.instant()));
                    timedOut.add(requestId);
                    log.warn("approval.timed-out request={} deadline={}", requestId, record.request().deadline());
                }
            }
            if (!timedOut.isEmpty()) {
                save(records);
            }
            return timedOut;
        });
        expired.forEach(requestId -> complete(requestId, ApprovalDecision.TIMED_OUT));
    }

    private void complete(String requestId, ApprovalDecision decision) {
        CompletableFuture<ApprovalDecision> waiter = waiters.remove(requestId);
        if (waiter != null) {
            waiter.complete(decision);
        }
    }

    private <T> T locked(LockedAction<T> action) throws IOException {
        Object monitor = FILE_MONITORS.computeIfAbsent(approvalsPath.toAbsolutePath().normalize(), ignored -> new Object());
        synchronized (monitor) {
            Files.createDirectories(lockPath.toAbsolutePath().getParent());
            try (FileChannel channel = FileChannel.open(lockPath, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                    FileLock lock = channel.lock()) {
                return action.run();
            }
        }
    }

    private Map<String, ApprovalRecord> load() throws IOException {
        if (!Files.exists(approvalsPath) || Files.size(approvalsPath) == 0L) {
            return new TreeMap<>();
        }
        return mapper.readValue(approvalsPath.toFile(), new TypeReference<TreeMap<String, ApprovalRecord>>() {
        });
    }

    private void save(Map<String, ApprovalRecord> records) throws IOException {
        JsonFiles.writeAtomically(mapper, approvalsPath, records);
    }

    @FunctionalInterface
    private interface LockedAction<T> {
        T run() throws IOException;
    }
}
