package com.trainrelay;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.trainrelay.approval.ApprovalDecision;
import com.trainrelay.approval.FileApprovalChannel;
import com.trainrelay.config.ConfigMaterializer;
import com.trainrelay.config.ConfigValidator;
import com.trainrelay.config.UnitConfig;
import com.trainrelay.execution.AdmissionControl;
import com.trainrelay.execution.ExecutionService;
import com.trainrelay.execution.HttpExecutionService;
import com.trainrelay.execution.JobMonitor;
import com.trainrelay.execution.JobSubmitter;
import com.trainrelay.execution.Sleeper;
import com.trainrelay.lineage.LineageResolver;
import com.trainrelay.pipeline.ProgressEventLog;
import com.trainrelay.pipeline.RunFailedException;
import com.trainrelay.pipeline.RunSummary;
import com.trainrelay.pipeline.TrainingRunCoordinator;
import com.trainrelay.promotion.PromotionCoordinator;
import com.trainrelay.promotion.PromotionLedger;
import com.trainrelay.promotion.PromotionReport;
import com.trainrelay.promotion.PromotionRequest;
import com.trainrelay.registration.ModelRegistrar;
import com.trainrelay.registry.Artifact;
import com.trainrelay.registry.ArtifactStore;
import com.trainrelay.registry.JsonFileArtifactStore;
import com.trainrelay.retry.RetryCoordinator;
import com.trainrelay.runtime.AppConfig;
import com.trainrelay.selection.ChangeSelector;
import com.trainrelay.selection.SelectionMode;

import okhttp3.OkHttpClient;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "train-relay",
        mixinStandardHelpOptions = true,
        version = "train-relay 0.1.0",
        description = "Selects, trains, registers and promotes training units.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);
    private static final long PROPAGATION_GRACE_MS = 30_000L;

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    String configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "run")
    Mode mode;

    @Option(names = "--selection", description = "Unit selection for run mode: auto or manual", defaultValue = "auto")
    String selection;

    @Option(names = "--units", split = ",", description = "Comma-separated unit ids for manual selection")
    List<String> manualUnits;

    @Option(names = "--allow-full-retrain", description = "Train every unit when no baseline exists yet")
    boolean allowFullRetrain;

    @Option(names = "--request-id", description = "Approval request id for approve/reject modes")
    String requestId;

    @Option(names = "--actor", description = "Who records the decision", defaultValue = "${sys:user.name}")
    String actor;

    @Option(names = "--output-dir", description = "Directory for per-unit config files in materialize mode", defaultValue = ".trainrelay/units")
    Path outputDir;

    @Option(names = "--environment", description = "Registry environment queried in resolve mode (defaults to the shared environment)")
    String environment;

    @Option(names = "--wait-ms", description = "How long to wait for undecided promotions before reporting them as pending; approved ones always finish")
    Long waitMs;

    private final ObjectMapper jsonMapper = JsonMapper.builder().findAndAddModules().build();
    private PrintStream out = System.out;
    private Clock clock = Clock.systemUTC();
    private ExecutionService executionServiceOverride;

    enum Mode {
        materialize,
        run,
        approve,
        reject,
        pending,
        promotions,
        resolve
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    Main withOutput(PrintStream output, Clock runClock) {
        this.out = output;
        this.clock = runClock;
        return this;
    }

    Main withExecutionService(ExecutionService executionService) {
        this.executionServiceOverride = executionService;
        return this;
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config = loadConfig(Path.of(configPath));
        log.info("Starting train-relay in {} mode", mode);
        log.info("Using config file: {}", configPath);
        try {
            return switch (mode) {
                case materialize -> runMaterialize(config);
                case run -> runTraining(config);
                case approve -> runDecision(config, ApprovalDecision.APPROVED);
                case reject -> runDecision(config, ApprovalDecision.REJECTED);
                case pending -> runPending(config);
                case promotions -> runPromotions(config);
                case resolve -> runResolve(config);
            };
        } catch (IllegalArgumentException e) {
            log.error("Invalid arguments: {}", e.getMessage());
            return 2;
        }
    }

    private int runMaterialize(AppConfig config) throws IOException {
        ConfigMaterializer materializer = new ConfigMaterializer();
        List<UnitConfig> units = materializer.load(Path.of(config.getPaths().getMasterConfig()));
        List<String> problems = new ConfigValidator(config.getValidation().getRequiredFields()).validate(units);
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Invalid unit config: {}", problem));
            print(Map.of("problems", problems));
            return 1;
        }
        List<Path> written = materializer.writeUnitFiles(units, outputDir, clock);
        Map<String, String> hashes = new LinkedHashMap<>();
        units.forEach(unit -> hashes.put(unit.unitId(), unit.lineageHash()));
        log.info("Materialized {} unit configs into {}", written.size(), outputDir);
        print(hashes);
        return 0;
    }

    private int runTraining(AppConfig config) throws IOException, InterruptedException {
        SelectionMode selectionMode = SelectionMode.parse(selection);
        if (selectionMode == SelectionMode.MANUAL && (manualUnits == null || manualUnits.isEmpty())) {
            log.error("--units is required for manual selection");
            return 2;
        }

        ExecutorService promotionPool = daemonPool("promotion");
        try (FileApprovalChannel channel = new FileApprovalChannel(Path.of(config.getPaths().getApprovals()), clock)) {
            channel.startRefresh(Duration.ofMillis(config.getPromotion().getApprovalRefreshMs()));
            ArtifactStore trainingStore = trainingStore(config);
            ExecutionService executionService = executionService(config);

            AppConfig.SubmissionConfig submission = config.getSubmission();
            JobSubmitter submitter = new JobSubmitter(
                    executionService,
                    new AdmissionControl(submission.getMaxInFlight()),
                    submission.getMaxRetries(),
                    Duration.ofMillis(submission.getRetryBackoffMs()),
                    Sleeper.SYSTEM,
                    clock);
            JobMonitor monitor = new JobMonitor(
                    executionService,
                    config.getMonitor().toBackoffPolicy(),
                    Duration.ofMillis(config.getMonitor().getNoticeIntervalMs()),
                    Sleeper.SYSTEM,
                    clock);
            RetryCoordinator retryCoordinator = new RetryCoordinator(
                    channel,
                    submitter,
                    monitor,
                    Duration.ofMillis(config.getRetry().getApprovalTimeoutMs()),
                    config.getRetry().isEnabled(),
                    clock);
            TrainingRunCoordinator coordinator = new TrainingRunCoordinator(
                    () -> loadValidatedUnits(config),
                    new ChangeSelector(trainingStore),
                    submitter,
                    monitor,
                    retryCoordinator,
                    new ModelRegistrar(trainingStore, config.getRegistration().getMinSuccessFraction()),
                    promotionCoordinator(config, channel, trainingStore, promotionPool),
                    new ProgressEventLog(Path.of(config.getPaths().getProgressEvents())),
                    allowFullRetrain || config.getSelection().isAllowFullRetrainWithoutBaseline(),
                    promotionWait(config),
                    clock);

            try {
                RunSummary summary = coordinator.run(selectionMode, manualUnits == null ? List.of() : manualUnits);
                print(summary);
                return 0;
            } catch (RunFailedException e) {
                log.error("Run failed at stage {}: {} unitErrors={}", e.stage(), e.getMessage(), e.unitErrors());
                print(e.summary());
                return 1;
            }
        } finally {
            drain(promotionPool, config);
        }
    }

    private int runDecision(AppConfig config, ApprovalDecision decision) throws IOException {
        if (requestId == null || requestId.isBlank()) {
            log.error("--request-id is required in {} mode", mode);
            return 2;
        }
        try (FileApprovalChannel channel = new FileApprovalChannel(Path.of(config.getPaths().getApprovals()), clock)) {
            channel.decide(requestId, decision, actor);
            log.info("Recorded decision={} request={} actor={}", decision, requestId, actor);
            print(channel.find(requestId).orElseThrow());
        }
        return 0;
    }

    private int runPending(AppConfig config) throws IOException {
        try (FileApprovalChannel channel = new FileApprovalChannel(Path.of(config.getPaths().getApprovals()), clock)) {
            channel.refresh();
            print(channel.pending());
        }
        return 0;
    }

    private int runPromotions(AppConfig config) throws IOException, InterruptedException {
        ExecutorService promotionPool = daemonPool("promotion");
        try (FileApprovalChannel channel = new FileApprovalChannel(Path.of(config.getPaths().getApprovals()), clock)) {
            channel.startRefresh(Duration.ofMillis(config.getPromotion().getApprovalRefreshMs()));
            PromotionCoordinator coordinator = promotionCoordinator(config, channel, trainingStore(config), promotionPool);
            Map<String, CompletableFuture<PromotionRequest>> resumed = coordinator.resume();
            PromotionReport report = coordinator.collect(resumed, promotionWait(config));
            log.info("Promotions resumed={} confirmed={} pending={} rejected={}",
                    resumed.size(), report.confirmed(), report.pending(), report.rejected());
            print(report);
        } finally {
            drain(promotionPool, config);
        }
        return 0;
    }

    private int runResolve(AppConfig config) throws IOException {
        String target = environment == null || environment.isBlank()
                ? config.getPromotion().getSharedEnvironment()
                : environment;
        ArtifactStore store = JsonFileArtifactStore.inDirectory(Path.of(config.getPaths().getRegistryDir()), target);
        List<UnitConfig> units = new ConfigMaterializer().load(Path.of(config.getPaths().getMasterConfig()));
        Map<String, Optional<Artifact>> resolved = new LineageResolver().resolveAll(units, store);
        Map<String, String> references = new LinkedHashMap<>();
        resolved.forEach((unitId, artifact) -> references.put(unitId, artifact.map(Artifact::reference).orElse(null)));
        print(references);
        return 0;
    }

    private static List<UnitConfig> loadValidatedUnits(AppConfig config) throws IOException {
        List<UnitConfig> units = new ConfigMaterializer().load(Path.of(config.getPaths().getMasterConfig()));
        List<String> problems = new ConfigValidator(config.getValidation().getRequiredFields()).validate(units);
        if (!problems.isEmpty()) {
            throw new IllegalArgumentException("Master config is invalid: " + String.join("; ", problems));
        }
        return units;
    }

    private PromotionCoordinator promotionCoordinator(
            AppConfig config,
            FileApprovalChannel channel,
            ArtifactStore trainingStore,
            ExecutorService executor) {
        AppConfig.PromotionConfig promotion = config.getPromotion();
        return new PromotionCoordinator(
                channel,
                trainingStore,
                JsonFileArtifactStore.inDirectory(Path.of(config.getPaths().getRegistryDir()), promotion.getSharedEnvironment()),
                new PromotionLedger(Path.of(config.getPaths().getPromotionLedger())),
                promotion.approvalTimeout(),
                promotion.toVisibilityPolicy(),
                Sleeper.SYSTEM,
                clock,
                executor);
    }

    private ArtifactStore trainingStore(AppConfig config) {
        return JsonFileArtifactStore.inDirectory(
                Path.of(config.getPaths().getRegistryDir()),
                config.getRegistration().getTrainingEnvironment());
    }

    private ExecutionService executionService(AppConfig config) {
        if (executionServiceOverride != null) {
            return executionServiceOverride;
        }
        AppConfig.ExecutionConfig execution = config.getExecution();
        OkHttpClient httpClient = new OkHttpClient.Builder()
                .callTimeout(execution.getHttpTimeoutMs(), TimeUnit.MILLISECONDS)
                .build();
        String token = execution.getApiTokenEnv() == null ? null : System.getenv(execution.getApiTokenEnv());
        return new HttpExecutionService(httpClient, execution.getBaseUrl(), token);
    }

    private Duration promotionWait(AppConfig config) {
        return Duration.ofMillis(waitMs != null ? waitMs : config.getPromotion().getRunWaitMs());
    }

    private void print(Object value) throws IOException {
        out.println(jsonMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value));
    }

    private static void drain(ExecutorService pool, AppConfig config) throws InterruptedException {
        pool.shutdown();
        long waitMs = config.getPromotion().getVisibilityCeilingMs() + PROPAGATION_GRACE_MS;
        if (!pool.awaitTermination(waitMs, TimeUnit.MILLISECONDS)) {
            log.warn("Promotion copies still running after {} ms; stopping them", waitMs);
            pool.shutdownNow();
        }
    }

    private static ExecutorService daemonPool(String name) {
        return Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, name);
            thread.setDaemon(true);
            return thread;
        });
    }

    private AppConfig loadConfig(Path config) throws IOException {
        if (!Files.exists(config)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        return mapper.readValue(config.toFile(), AppConfig.class);
    }
}
