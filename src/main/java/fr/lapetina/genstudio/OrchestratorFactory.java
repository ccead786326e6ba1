package fr.lapetina.genstudio;

import fr.lapetina.genstudio.domain.policy.RetryPolicy;
import fr.lapetina.genstudio.domain.provider.ProviderAdapter;
import fr.lapetina.genstudio.infrastructure.config.ConfigLoader;
import fr.lapetina.genstudio.infrastructure.config.ConfigLoader.ConfigurationException;
import fr.lapetina.genstudio.infrastructure.config.OrchestratorConfig;
import fr.lapetina.genstudio.infrastructure.config.OrchestratorConfig.ProviderConfig;
import fr.lapetina.genstudio.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.genstudio.infrastructure.provider.ProviderAdapterFactory;
import fr.lapetina.genstudio.infrastructure.provider.ProviderRegistry;
import fr.lapetina.genstudio.infrastructure.provider.RegisteredProvider;
import fr.lapetina.genstudio.infrastructure.resilience.CircuitBreaker;
import fr.lapetina.genstudio.infrastructure.resilience.CircuitBreakerRegistry;
import fr.lapetina.genstudio.infrastructure.resilience.RateLimiter;
import fr.lapetina.genstudio.orchestrator.TaskOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;

/**
 * Factory for creating a fully-wired orchestrator from configuration.
 * This is the primary entry point for obtaining a configured TaskOrchestrator.
 *
 * <p>Usage:
 * <pre>{@code
 * try (OrchestratorFactory factory = OrchestratorFactory.create("config.yaml").start()) {
 *     TaskOrchestrator orchestrator = factory.getOrchestrator();
 *     // use orchestrator...
 * }
 * }</pre>
 */
public class OrchestratorFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorFactory.class);

    private final OrchestratorConfig config;
    private final MetricsRegistry metricsRegistry;
    private final CircuitBreakerRegistry breakers;
    private final ProviderRegistry providerRegistry;
    private final TaskOrchestrator orchestrator;

    /**
     * @param adapterOverrides adapters to use instead of the configured type, keyed by provider ID
     * @param clock            time source for breakers, rate limiters and task timestamps
     */
    protected OrchestratorFactory(String configPath, Map<String, ProviderAdapter> adapterOverrides, Clock clock) {
        log.info("Initializing OrchestratorFactory from config: {}", configPath);

        // Load configuration
        this.config = new ConfigLoader(configPath).load();

        // Initialize metrics
        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix());

        // Initialize circuit breakers
        OrchestratorConfig.CircuitBreakerConfig breakerConfig = config.getCircuitBreaker();
        this.breakers = new CircuitBreakerRegistry(
                breakerConfig.getFailureThreshold(),
                Duration.ofMillis(breakerConfig.getCooldownMs()),
                Duration.ofMillis(breakerConfig.getCooldownJitterMs()),
                clock
        );

        // Initialize provider registry
        this.providerRegistry = new ProviderRegistry();
        loadProviders(adapterOverrides, clock);

        // Build orchestrator
        this.orchestrator = TaskOrchestrator.builder()
                .fromConfig(config)
                .providerRegistry(providerRegistry)
                .circuitBreakers(breakers)
                .metricsRegistry(metricsRegistry)
                .clock(clock)
                .build();

        // Register breaker metrics
        registerBreakerMetrics();

        log.info("OrchestratorFactory initialized with {} providers", providerRegistry.size());
    }

    protected OrchestratorFactory(String configPath, Map<String, ProviderAdapter> adapterOverrides) {
        this(configPath, adapterOverrides, Clock.systemUTC());
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static OrchestratorFactory create(String configPath) {
        return new OrchestratorFactory(configPath, Map.of());
    }

    /**
     * Creates a factory from the default configuration (config.yaml).
     */
    public static OrchestratorFactory create() {
        return create("config.yaml");
    }

    /**
     * Starts the orchestrator.
     */
    public OrchestratorFactory start() {
        orchestrator.start();
        log.info("Orchestrator started");
        return this;
    }

    public TaskOrchestrator getOrchestrator() {
        return orchestrator;
    }

    public ProviderRegistry getProviderRegistry() {
        return providerRegistry;
    }

    public CircuitBreakerRegistry getCircuitBreakers() {
        return breakers;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public OrchestratorConfig getConfig() {
        return config;
    }

    private void loadProviders(Map<String, ProviderAdapter> adapterOverrides, Clock clock) {
        for (ProviderConfig providerConfig : config.getProviders()) {
            if (!providerConfig.isEnabled()) {
                log.info("Provider disabled, skipping: providerId={}", providerConfig.getId());
                continue;
            }

            if (!ProviderAdapterFactory.isSupported(providerConfig.getType())) {
                throw new ConfigurationException("Unknown provider type '" + providerConfig.getType() +
                        "' for provider " + providerConfig.getId() +
                        ". Available: " + ProviderAdapterFactory.getRegisteredTypes());
            }

            ProviderAdapter adapter = adapterOverrides.get(providerConfig.getId());
            if (adapter == null) {
                adapter = createAdapter(providerConfig);
            }

            RegisteredProvider provider = RegisteredProvider.builder()
                    .id(providerConfig.getId())
                    .adapter(adapter)
                    .maxConcurrency(providerConfig.getMaxConcurrency())
                    .timeout(Duration.ofMillis(providerConfig.getTimeoutMs()))
                    .pollInterval(Duration.ofMillis(providerConfig.getPollIntervalMs()))
                    .retryPolicy(retryPolicyFor(providerConfig))
                    .rateLimiter(rateLimiterFor(providerConfig, clock))
                    .build();
            providerRegistry.register(provider);
            breakers.forProvider(provider.getId());
            log.debug("Registered provider: {}", provider);
        }
    }

    private ProviderAdapter createAdapter(ProviderConfig providerConfig) {
        String apiKey = providerConfig.resolveApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            throw new ConfigurationException("No API key for provider " + providerConfig.getId() +
                    " (set apiKey or the variable named by apiKeyEnv)");
        }
        try {
            return ProviderAdapterFactory.create(providerConfig, apiKey)
                    .orElseThrow(() -> new ConfigurationException(
                            "Cannot create adapter for provider " + providerConfig.getId()));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new ConfigurationException("Invalid settings for provider " + providerConfig.getId() +
                    ": " + e.getMessage(), e);
        }
    }

    private static RateLimiter rateLimiterFor(ProviderConfig providerConfig, Clock clock) {
        OrchestratorConfig.RateLimitConfig rateLimit = providerConfig.getRateLimit();
        if (rateLimit == null) {
            return null;
        }
        return new RateLimiter(providerConfig.getId(), rateLimit.getMaxRequests(),
                Duration.ofMillis(rateLimit.getWindowMs()), clock);
    }

    private RetryPolicy retryPolicyFor(ProviderConfig providerConfig) {
        OrchestratorConfig.RetryConfig retry = config.getRetry();
        int maxAttempts = providerConfig.getMaxAttempts() != null
                ? providerConfig.getMaxAttempts()
                : retry.getMaxAttempts();
        return RetryPolicy.builder()
                .maxAttempts(maxAttempts)
                .unknownMaxAttempts(Math.min(retry.getUnknownMaxAttempts(), maxAttempts))
                .baseDelay(Duration.ofMillis(retry.getBaseDelayMs()))
                .maxDelay(Duration.ofMillis(retry.getMaxDelayMs()))
                .waitForOpenBreaker(retry.isWaitForOpenBreaker())
                .build();
    }

    private void registerBreakerMetrics() {
        for (RegisteredProvider provider : providerRegistry.getAll()) {
            CircuitBreaker breaker = breakers.forProvider(provider.getId());
            metricsRegistry.registerBreakerState(provider.getId(), () -> {
                return switch (breaker.getState()) {
                    case CLOSED -> 0;
                    case HALF_OPEN -> 1;
                    case OPEN -> 2;
                };
            });
        }
    }

    @Override
    public void close() {
        log.info("Shutting down OrchestratorFactory...");

        try {
            orchestrator.close();
        } catch (Exception e) {
            log.warn("Error closing orchestrator", e);
        }

        try {
            providerRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing provider registry", e);
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        log.info("OrchestratorFactory shut down");
    }
}
