package fr.lapetina.genstudio.infrastructure.metrics;

import fr.lapetina.genstudio.domain.model.ErrorKind;
import fr.lapetina.genstudio.domain.model.TaskStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Task transition counters per provider and status
 * - Attempt latency timers per provider and outcome
 * - Error counters per provider and kind
 * - Concurrency, ring buffer and breaker gauges
 * - JVM and system metrics
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Counter> transitionCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> latencyTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> errorCounters = new ConcurrentHashMap<>();

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("genstudio");
    }

    /**
     * Counts a task entering {@code status}.
     */
    public void incrementTransition(String providerId, TaskStatus status) {
        String key = providerId + ":" + status.name();
        transitionCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_task_transitions_total")
                        .description("Task lifecycle transitions")
                        .tag("provider", providerId)
                        .tag("status", status.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Records how long one adapter attempt took.
     */
    public void recordAttemptLatency(String providerId, String outcome, Duration latency) {
        String key = providerId + ":" + outcome;
        latencyTimers.computeIfAbsent(key, k ->
                Timer.builder(prefix + "_attempt_latency")
                        .description("Adapter attempt latency")
                        .tag("provider", providerId)
                        .tag("outcome", outcome)
                        .publishPercentileHistogram()
                        .publishPercentiles(0.5, 0.9, 0.99)
                        .register(registry)
        ).record(latency);
    }

    public void incrementErrorCount(String providerId, ErrorKind kind) {
        String key = providerId + ":" + kind.name();
        errorCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_errors_total")
                        .description("Classified attempt failures")
                        .tag("provider", providerId)
                        .tag("kind", kind.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Registers the global concurrency and ring buffer gauges.
     */
    public void registerOrchestratorGauges(
            Supplier<Number> inFlightAttempts,
            Supplier<Number> reservedSlots,
            Supplier<Number> ringBufferRemaining
    ) {
        gauge(prefix + "_inflight_attempts", "Attempts currently holding a concurrency slot", inFlightAttempts);
        gauge(prefix + "_reserved_slots", "Tasks queued for admission or running an attempt", reservedSlots);
        gauge(prefix + "_ringbuffer_remaining", "Remaining capacity in the ring buffer", ringBufferRemaining);
    }

    /**
     * Registers a gauge for a provider's breaker (0=closed, 1=half-open, 2=open).
     */
    public void registerBreakerState(String providerId, Supplier<Number> stateValue) {
        Gauge.builder(prefix + "_breaker_state", stateValue, s -> s.get().doubleValue())
                .description("Circuit breaker state (0=CLOSED, 1=HALF_OPEN, 2=OPEN)")
                .tag("provider", providerId)
                .strongReference(true)
                .register(registry);
    }

    private void gauge(String name, String description, Supplier<Number> value) {
        Gauge.builder(name, value, s -> s.get().doubleValue())
                .description(description)
                .strongReference(true)
                .register(registry);
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
