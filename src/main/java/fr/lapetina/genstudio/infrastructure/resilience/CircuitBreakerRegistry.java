package fr.lapetina.genstudio.infrastructure.resilience;

import fr.lapetina.genstudio.domain.model.ProviderHealth;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Holds one {@link CircuitBreaker} per provider, created lazily on first use
 * and kept for the lifetime of the process.
 */
public final class CircuitBreakerRegistry {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerRegistry.class);

    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final int failureThreshold;
    private final Duration cooldown;
    private final Duration cooldownJitter;
    private final Clock clock;
    private final DoubleSupplier jitterSource;

    public CircuitBreakerRegistry(
            int failureThreshold,
            Duration cooldown,
            Duration cooldownJitter,
            Clock clock,
            DoubleSupplier jitterSource
    ) {
        this.failureThreshold = failureThreshold;
        this.cooldown = cooldown;
        this.cooldownJitter = cooldownJitter;
        this.clock = clock;
        this.jitterSource = jitterSource;
    }

    public CircuitBreakerRegistry(int failureThreshold, Duration cooldown, Duration cooldownJitter, Clock clock) {
        this(failureThreshold, cooldown, cooldownJitter, clock, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * Returns the breaker for a provider, creating it on first use.
     */
    public CircuitBreaker forProvider(String providerId) {
        return breakers.computeIfAbsent(providerId, id -> {
            log.debug("Creating circuit breaker: providerId={}, failureThreshold={}, cooldown={}",
                    id, failureThreshold, cooldown);
            return new CircuitBreaker(id, failureThreshold, cooldown, cooldownJitter, clock, jitterSource);
        });
    }

    public Optional<CircuitBreaker> find(String providerId) {
        return Optional.ofNullable(breakers.get(providerId));
    }

    /**
     * Health view of a provider. A provider whose breaker was never used reports CLOSED.
     */
    public ProviderHealth health(String providerId) {
        CircuitBreaker breaker = forProvider(providerId);
        return new ProviderHealth(providerId, breaker.getState(), breaker.getConsecutiveFailures());
    }

    public int size() {
        return breakers.size();
    }
}
