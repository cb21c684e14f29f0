package com.trainrelay.runtime;

import java.time.Duration;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private PathsConfig paths = new PathsConfig();
    private ExecutionConfig execution = new ExecutionConfig();
    private SelectionConfig selection = new SelectionConfig();
    private SubmissionConfig submission = new SubmissionConfig();
    private MonitorConfig monitor = new MonitorConfig();
    private RetryConfig retry = new RetryConfig();
    private RegistrationConfig registration = new RegistrationConfig();
    private PromotionConfig promotion = new PromotionConfig();
    private ValidationConfig validation = new ValidationConfig();

    public PathsConfig getPaths() {
        return paths;
    }

    public void setPaths(PathsConfig paths) {
        this.paths = paths == null ? new PathsConfig() : paths;
    }

    public ExecutionConfig getExecution() {
        return execution;
    }

    public void setExecution(ExecutionConfig execution) {
        this.execution = execution == null ? new ExecutionConfig() : execution;
    }

    public SelectionConfig getSelection() {
        return selection;
    }

    public void setSelection(SelectionConfig selection) {
        this.selection = selection == null ? new SelectionConfig() : selection;
    }

    public SubmissionConfig getSubmission() {
        return submission;
    }

    public void setSubmission(SubmissionConfig submission) {
        this.submission = submission == null ? new SubmissionConfig() : submission;
    }

    public MonitorConfig getMonitor() {
        return monitor;
    }

    public void setMonitor(MonitorConfig monitor) {
        this.monitor = monitor == null ? new MonitorConfig() : monitor;
    }

    public RetryConfig getRetry() {
        return retry;
    }

    public void setRetry(RetryConfig retry) {
        this.retry = retry == null ? new RetryConfig() : retry;
    }

    public RegistrationConfig getRegistration() {
        return registration;
    }

    public void setRegistration(RegistrationConfig registration) {
        this.registration = registration == null ? new RegistrationConfig() : registration;
    }

    public PromotionConfig getPromotion() {
        return promotion;
    }

    public void setPromotion(PromotionConfig promotion) {
        this.promotion = promotion == null ? new PromotionConfig() : promotion;
    }

    public ValidationConfig getValidation() {
        return validation;
    }

    public void setValidation(ValidationConfig validation) {
        this.validation = validation == null ? new ValidationConfig() : validation;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PathsConfig {
        private String masterConfig = "config/units.yaml";
        private String registryDir = ".trainrelay/registries";
        private String promotionLedger = ".trainrelay/promotions.json";
        private String approvals = ".trainrelay/approvals.json";
        private String progressEvents = ".trainrelay/progress-events.jsonl";

        public String getMasterConfig() {
            return masterConfig;
        }

        public void setMasterConfig(String masterConfig) {
            this.masterConfig = masterConfig;
        }

        public String getRegistryDir() {
            return registryDir;
        }

        public void setRegistryDir(String registryDir) {
            this.registryDir = registryDir;
        }

        public String getPromotionLedger() {
            return promotionLedger;
        }

        public void setPromotionLedger(String promotionLedger) {
            this.promotionLedger = promotionLedger;
        }

        public String getApprovals() {
            return approvals;
        }

        public void setApprovals(String approvals) {
            this.approvals = approvals;
        }

        public String getProgressEvents() {
            return progressEvents;
        }

        public void setProgressEvents(String progressEvents) {
            this.progressEvents = progressEvents;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ExecutionConfig {
        private String baseUrl = "http://localhost:8080/api";
        private String apiTokenEnv = "TRAINRELAY_EXECUTION_TOKEN";
        private long httpTimeoutMs = 30000;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiTokenEnv() {
            return apiTokenEnv;
        }

        public void setApiTokenEnv(String apiTokenEnv) {
            this.apiTokenEnv = apiTokenEnv;
        }

        public long getHttpTimeoutMs() {
            return httpTimeoutMs;
        }

        public void setHttpTimeoutMs(long httpTimeoutMs) {
            this.httpTimeoutMs = httpTimeoutMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SelectionConfig {
        private boolean allowFullRetrainWithoutBaseline = false;

        public boolean isAllowFullRetrainWithoutBaseline() {
            return allowFullRetrainWithoutBaseline;
        }

        public void setAllowFullRetrainWithoutBaseline(boolean allowFullRetrainWithoutBaseline) {
            this.allowFullRetrainWithoutBaseline = allowFullRetrainWithoutBaseline;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ValidationConfig {
        private List<String> requiredFields = List.of();

        public List<String> getRequiredFields() {
            return requiredFields;
        }

        public void setRequiredFields(List<String> requiredFields) {
            this.requiredFields = requiredFields == null ? List.of() : requiredFields;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SubmissionConfig {
        private int maxInFlight = 5;
        private int maxRetries = 2;
        private long retryBackoffMs = 30000;

        public int getMaxInFlight() {
            return maxInFlight;
        }

        public void setMaxInFlight(int maxInFlight) {
            this.maxInFlight = maxInFlight;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public long getRetryBackoffMs() {
            return retryBackoffMs;
        }

        public void setRetryBackoffMs(long retryBackoffMs) {
            this.retryBackoffMs = retryBackoffMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MonitorConfig {
        private long initialPollMs = 30000;
        private long maxPollMs = 300000;
        private long maxWaitMs = Duration.ofHours(3).toMillis();
        private long noticeIntervalMs = Duration.ofHours(4).toMillis();

        public long getInitialPollMs() {
            return initialPollMs;
        }

        public void setInitialPollMs(long initialPollMs) {
            this.initialPollMs = initialPollMs;
        }

        public long getMaxPollMs() {
            return maxPollMs;
        }

        public void setMaxPollMs(long maxPollMs) {
            this.maxPollMs = maxPollMs;
        }

        public long getMaxWaitMs() {
            return maxWaitMs;
        }

        public void setMaxWaitMs(long maxWaitMs) {
            this.maxWaitMs = maxWaitMs;
        }

        public long getNoticeIntervalMs() {
            return noticeIntervalMs;
        }

        public void setNoticeIntervalMs(long noticeIntervalMs) {
            this.noticeIntervalMs = noticeIntervalMs;
        }

        public BackoffPolicy toBackoffPolicy() {
            return BackoffPolicy.ofMillis(initialPollMs, maxPollMs, maxWaitMs);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RetryConfig {
        private boolean enabled = true;
        private long approvalTimeoutMs = Duration.ofHours(4).toMillis();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getApprovalTimeoutMs() {
            return approvalTimeoutMs;
        }

        public void setApprovalTimeoutMs(long approvalTimeoutMs) {
            this.approvalTimeoutMs = approvalTimeoutMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RegistrationConfig {
        private double minSuccessFraction = 0.9;
        private String trainingEnvironment = "dev";

        public double getMinSuccessFraction() {
            return minSuccessFraction;
        }

        public void setMinSuccessFraction(double minSuccessFraction) {
            this.minSuccessFraction = minSuccessFraction;
        }

        public String getTrainingEnvironment() {
            return trainingEnvironment;
        }

        public void setTrainingEnvironment(String trainingEnvironment) {
            this.trainingEnvironment = trainingEnvironment;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PromotionConfig {
        public static final Duration MIN_APPROVAL_TIMEOUT = Duration.ofHours(24);
        public static final Duration MAX_APPROVAL_TIMEOUT = Duration.ofDays(30);

        private String sharedEnvironment = "shared";
        private long approvalTimeoutMs = Duration.ofDays(7).toMillis();
        private long visibilityInitialPollMs = 2000;
        private long visibilityMaxPollMs = 30000;
        private long visibilityCeilingMs = 120000;
        private long approvalRefreshMs = 60000;
        private long runWaitMs = 0;

        public String getSharedEnvironment() {
            return sharedEnvironment;
        }

        public void setSharedEnvironment(String sharedEnvironment) {
            this.sharedEnvironment = sharedEnvironment;
        }

        public long getApprovalTimeoutMs() {
            return approvalTimeoutMs;
        }

        public void setApprovalTimeoutMs(long approvalTimeoutMs) {
            this.approvalTimeoutMs = approvalTimeoutMs;
        }

        public long getVisibilityInitialPollMs() {
            return visibilityInitialPollMs;
        }

        public void setVisibilityInitialPollMs(long visibilityInitialPollMs) {
            this.visibilityInitialPollMs = visibilityInitialPollMs;
        }

        public long getVisibilityMaxPollMs() {
            return visibilityMaxPollMs;
        }

        public void setVisibilityMaxPollMs(long visibilityMaxPollMs) {
            this.visibilityMaxPollMs = visibilityMaxPollMs;
        }

        public long getVisibilityCeilingMs() {
            return visibilityCeilingMs;
        }

        public void setVisibilityCeilingMs(long visibilityCeilingMs) {
            this.visibilityCeilingMs = visibilityCeilingMs;
        }

        public long getApprovalRefreshMs() {
            return approvalRefreshMs;
        }

        public void setApprovalRefreshMs(long approvalRefreshMs) {
            this.approvalRefreshMs = approvalRefreshMs;
        }

        public long getRunWaitMs() {
            return runWaitMs;
        }

        public void setRunWaitMs(long runWaitMs) {
            this.runWaitMs = runWaitMs;
        }

        public Duration approvalTimeout() {
            Duration timeout = Duration.ofMillis(approvalTimeoutMs);
            if (timeout.compareTo(MIN_APPROVAL_TIMEOUT) < 0 || timeout.compareTo(MAX_APPROVAL_TIMEOUT) > 0) {
                throw new IllegalArgumentException("promotion.approvalTimeoutMs must be between 24h and 30 days, got " + timeout);
            }
            return timeout;
        }

        public BackoffPolicy toVisibilityPolicy() {
            return BackoffPolicy.ofMillis(visibilityInitialPollMs, visibilityMaxPollMs, visibilityCeilingMs);
        }
    }
}
