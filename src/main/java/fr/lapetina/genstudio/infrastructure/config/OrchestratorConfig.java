package fr.lapetina.genstudio.infrastructure.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root configuration object for the orchestrator.
 * Designed to be populated from YAML; loaded once at start and not modified afterwards.
 */
public class OrchestratorConfig {

    private ServerConfig server = new ServerConfig();
    private OrchestratorSettings orchestrator = new OrchestratorSettings();
    private RetryConfig retry = new RetryConfig();
    private CircuitBreakerConfig circuitBreaker = new CircuitBreakerConfig();
    private List<ProviderConfig> providers = new ArrayList<>();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public ServerConfig getServer() { return server; }
    public void setServer(ServerConfig server) { this.server = server; }

    public OrchestratorSettings getOrchestrator() { return orchestrator; }
    public void setOrchestrator(OrchestratorSettings orchestrator) { this.orchestrator = orchestrator; }

    public RetryConfig getRetry() { return retry; }
    public void setRetry(RetryConfig retry) { this.retry = retry; }

    public CircuitBreakerConfig getCircuitBreaker() { return circuitBreaker; }
    public void setCircuitBreaker(CircuitBreakerConfig circuitBreaker) { this.circuitBreaker = circuitBreaker; }

    public List<ProviderConfig> getProviders() { return providers; }
    public void setProviders(List<ProviderConfig> providers) { this.providers = providers; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * HTTP server configuration.
     */
    public static class ServerConfig {
        private int port = 8080;
        private String host = "0.0.0.0";
        private int backlog = 100;
        private int threads = 16;
        private int maxEventStreams = 64;
        private long eventHeartbeatMs = 15_000;

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getBacklog() { return backlog; }
        public void setBacklog(int backlog) { this.backlog = backlog; }

        public int getThreads() { return threads; }
        public void setThreads(int threads) { this.threads = threads; }

        public int getMaxEventStreams() { return maxEventStreams; }
        public void setMaxEventStreams(int maxEventStreams) { this.maxEventStreams = maxEventStreams; }

        public long getEventHeartbeatMs() { return eventHeartbeatMs; }
        public void setEventHeartbeatMs(long eventHeartbeatMs) { this.eventHeartbeatMs = eventHeartbeatMs; }
    }

    /**
     * Concurrency budget and transition pipeline settings.
     */
    public static class OrchestratorSettings {
        private int maxConcurrency = 4;
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private long cancelGracePeriodMs = 10_000;
        private long completedTaskRetentionMs = 48L * 60 * 60 * 1000;
        private long retentionSweepIntervalMs = 60_000;

        public int getMaxConcurrency() { return maxConcurrency; }
        public void setMaxConcurrency(int maxConcurrency) { this.maxConcurrency = maxConcurrency; }

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }

        public long getCancelGracePeriodMs() { return cancelGracePeriodMs; }
        public void setCancelGracePeriodMs(long cancelGracePeriodMs) { this.cancelGracePeriodMs = cancelGracePeriodMs; }

        public long getCompletedTaskRetentionMs() { return completedTaskRetentionMs; }
        public void setCompletedTaskRetentionMs(long completedTaskRetentionMs) { this.completedTaskRetentionMs = completedTaskRetentionMs; }

        public long getRetentionSweepIntervalMs() { return retentionSweepIntervalMs; }
        public void setRetentionSweepIntervalMs(long retentionSweepIntervalMs) { this.retentionSweepIntervalMs = retentionSweepIntervalMs; }
    }

    /**
     * Retry policy configuration.
     */
    public static class RetryConfig {
        private int maxAttempts = 3;
        private int unknownMaxAttempts = 2;
        private long baseDelayMs = 500;
        private long maxDelayMs = 30_000;
        private boolean waitForOpenBreaker = false;

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

        public int getUnknownMaxAttempts() { return unknownMaxAttempts; }
        public void setUnknownMaxAttempts(int unknownMaxAttempts) { this.unknownMaxAttempts = unknownMaxAttempts; }

        public long getBaseDelayMs() { return baseDelayMs; }
        public void setBaseDelayMs(long baseDelayMs) { this.baseDelayMs = baseDelayMs; }

        public long getMaxDelayMs() { return maxDelayMs; }
        public void setMaxDelayMs(long maxDelayMs) { this.maxDelayMs = maxDelayMs; }

        public boolean isWaitForOpenBreaker() { return waitForOpenBreaker; }
        public void setWaitForOpenBreaker(boolean waitForOpenBreaker) { this.waitForOpenBreaker = waitForOpenBreaker; }
    }

    /**
     * Per-provider circuit breaker configuration.
     */
    public static class CircuitBreakerConfig {
        private int failureThreshold = 5;
        private long cooldownMs = 30_000;
        private long cooldownJitterMs = 1_000;

        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }

        public long getCooldownMs() { return cooldownMs; }
        public void setCooldownMs(long cooldownMs) { this.cooldownMs = cooldownMs; }

        public long getCooldownJitterMs() { return cooldownJitterMs; }
        public void setCooldownJitterMs(long cooldownJitterMs) { this.cooldownJitterMs = cooldownJitterMs; }
    }

    /**
     * Individual generation provider configuration.
     */
    public static class ProviderConfig {
        private String id;
        private String type;
        private String baseUrl;
        private String apiKey;
        private String apiKeyEnv;
        private String model;
        private long timeoutMs = 300_000;
        private long connectTimeoutMs = 10_000;
        private long pollIntervalMs = 5_000;
        private int maxConcurrency = 2;
        private Integer maxAttempts;
        private boolean enabled = true;
        private RateLimitConfig rateLimit;
        private Map<String, Object> options = new LinkedHashMap<>();

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }

        public String getApiKeyEnv() { return apiKeyEnv; }
        public void setApiKeyEnv(String apiKeyEnv) { this.apiKeyEnv = apiKeyEnv; }

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }

        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

        public long getPollIntervalMs() { return pollIntervalMs; }
        public void setPollIntervalMs(long pollIntervalMs) { this.pollIntervalMs = pollIntervalMs; }

        public int getMaxConcurrency() { return maxConcurrency; }
        public void setMaxConcurrency(int maxConcurrency) { this.maxConcurrency = maxConcurrency; }

        public Integer getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(Integer maxAttempts) { this.maxAttempts = maxAttempts; }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public RateLimitConfig getRateLimit() { return rateLimit; }
        public void setRateLimit(RateLimitConfig rateLimit) { this.rateLimit = rateLimit; }

        public Map<String, Object> getOptions() { return options; }
        public void setOptions(Map<String, Object> options) { this.options = options != null ? options : new LinkedHashMap<>(); }

        /**
         * Returns the inline key, falling back to the environment variable named by {@code apiKeyEnv}.
         */
        public String resolveApiKey() {
            if (apiKey != null && !apiKey.isBlank()) {
                return apiKey;
            }
            if (apiKeyEnv != null && !apiKeyEnv.isBlank()) {
                String fromEnv = System.getenv(apiKeyEnv);
                if (fromEnv != null && !fromEnv.isBlank()) {
                    return fromEnv;
                }
            }
            return null;
        }
    }

    /**
     * Optional per-provider request rate: at most maxRequests attempts started per window.
     */
    public static class RateLimitConfig {
        private int maxRequests = 10;
        private long windowMs = 60_000;

        public int getMaxRequests() { return maxRequests; }
        public void setMaxRequests(int maxRequests) { this.maxRequests = maxRequests; }

        public long getWindowMs() { return windowMs; }
        public void setWindowMs(long windowMs) { this.windowMs = windowMs; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "genstudio";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
