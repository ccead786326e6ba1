package fr.lapetina.genstudio.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Loads the orchestrator configuration once, at process start.
 *
 * Supports:
 * - Loading from the file system, falling back to the classpath
 * - Validation of the loaded values
 *
 * Configuration is immutable for the lifetime of the orchestrator; a restart picks up changes.
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final Path configPath;
    private final Yaml yaml;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(OrchestratorConfig.class, loaderOptions));
    }

    /**
     * Loads and validates configuration from file or classpath.
     *
     * @return The loaded configuration
     * @throws ConfigurationException if loading or validation fails
     */
    public OrchestratorConfig load() {
        OrchestratorConfig config = loadFromPath();
        validate(config);
        log.info("Configuration loaded: providers={}, maxConcurrency={}",
                config.getProviders().size(), config.getOrchestrator().getMaxConcurrency());
        return config;
    }

    private OrchestratorConfig loadFromPath() {
        // Try file system first
        if (Files.exists(configPath)) {
            return loadFromFile(configPath);
        }

        // Try classpath
        String classpathResource = configPath.toString();
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    private OrchestratorConfig loadFromFile(Path path) {
        log.info("Loading configuration from file: {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            return parse(is, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    /**
     * Loads and validates configuration from an input stream.
     */
    public OrchestratorConfig loadFromStream(InputStream inputStream) {
        OrchestratorConfig config = parse(inputStream, "stream");
        validate(config);
        return config;
    }

    private OrchestratorConfig parse(InputStream inputStream, String source) {
        try {
            OrchestratorConfig config = yaml.load(inputStream);
            return config != null ? config : new OrchestratorConfig();
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid YAML in " + source + ": " + e.getMessage(), e);
        }
    }

    /**
     * Checks the configuration for values the orchestrator cannot run with.
     *
     * @throws ConfigurationException listing every problem found
     */
    public static void validate(OrchestratorConfig config) {
        List<String> problems = new ArrayList<>();

        OrchestratorConfig.ServerConfig server = config.getServer();
        if (server.getThreads() < 1 || server.getMaxEventStreams() < 1) {
            problems.add("server.threads and server.maxEventStreams must be >= 1");
        }
        if (server.getEventHeartbeatMs() <= 0) {
            problems.add("server.eventHeartbeatMs must be > 0");
        }

        OrchestratorConfig.OrchestratorSettings orchestrator = config.getOrchestrator();
        if (orchestrator.getMaxConcurrency() < 1) {
            problems.add("orchestrator.maxConcurrency must be >= 1");
        }
        if (Integer.bitCount(orchestrator.getRingBufferSize()) != 1) {
            problems.add("orchestrator.ringBufferSize must be a power of 2");
        }
        if (orchestrator.getCancelGracePeriodMs() < 0) {
            problems.add("orchestrator.cancelGracePeriodMs must not be negative");
        }

        OrchestratorConfig.RetryConfig retry = config.getRetry();
        if (retry.getMaxAttempts() < 1) {
            problems.add("retry.maxAttempts must be >= 1");
        }
        if (retry.getUnknownMaxAttempts() < 1) {
            problems.add("retry.unknownMaxAttempts must be >= 1");
        }
        if (retry.getBaseDelayMs() <= 0) {
            problems.add("retry.baseDelayMs must be > 0");
        }
        if (retry.getMaxDelayMs() < retry.getBaseDelayMs()) {
            problems.add("retry.maxDelayMs must be >= retry.baseDelayMs");
        }

        OrchestratorConfig.CircuitBreakerConfig breaker = config.getCircuitBreaker();
        if (breaker.getFailureThreshold() < 1) {
            problems.add("circuitBreaker.failureThreshold must be >= 1");
        }
        if (breaker.getCooldownMs() < 0 || breaker.getCooldownJitterMs() < 0) {
            problems.add("circuitBreaker cooldown values must not be negative");
        }

        Set<String> ids = new HashSet<>();
        for (OrchestratorConfig.ProviderConfig provider : config.getProviders()) {
            String id = provider.getId();
            if (id == null || id.isBlank()) {
                problems.add("providers[].id is required");
                continue;
            }
            if (!ids.add(id)) {
                problems.add("duplicate provider id: " + id);
            }
            if (provider.getType() == null || provider.getType().isBlank()) {
                problems.add("provider " + id + ": type is required");
            }
            if (provider.getMaxConcurrency() < 1) {
                problems.add("provider " + id + ": maxConcurrency must be >= 1");
            }
            if (provider.getMaxAttempts() != null && provider.getMaxAttempts() < 1) {
                problems.add("provider " + id + ": maxAttempts must be >= 1");
            }
            if (provider.getTimeoutMs() <= 0 || provider.getPollIntervalMs() <= 0) {
                problems.add("provider " + id + ": timeoutMs and pollIntervalMs must be > 0");
            }
            OrchestratorConfig.RateLimitConfig rateLimit = provider.getRateLimit();
            if (rateLimit != null && (rateLimit.getMaxRequests() < 1 || rateLimit.getWindowMs() <= 0)) {
                problems.add("provider " + id + ": rateLimit needs maxRequests >= 1 and windowMs > 0");
            }
        }

        if (!problems.isEmpty()) {
            throw new ConfigurationException("Invalid configuration: " + String.join("; ", problems));
        }
    }

    /**
     * Creates a default configuration.
     */
    public static OrchestratorConfig createDefault() {
        return new OrchestratorConfig();
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
