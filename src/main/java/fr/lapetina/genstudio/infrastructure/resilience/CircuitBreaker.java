package fr.lapetina.genstudio.infrastructure.resilience;

import fr.lapetina.genstudio.domain.model.BreakerState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Circuit breaker protecting one generation provider.
 *
 * States:
 * - CLOSED: calls pass through; consecutive failures are counted
 * - OPEN: failure threshold reached, calls are rejected without reaching the provider
 * - HALF_OPEN: cooldown elapsed, exactly one trial call is let through at a time
 *
 * Callers obtain a {@link Permit} before calling the provider and report the outcome
 * against that permit. Only the trial's outcome can close or reopen a HALF_OPEN breaker.
 *
 * Thread-safe; all state changes are serialized on the instance monitor.
 */
public final class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    /**
     * Result of asking the breaker for permission to call the provider.
     */
    public enum Permit {
        /** Breaker closed, normal call */
        ALLOWED,
        /** The single half-open trial */
        TRIAL,
        /** Call must not reach the provider */
        REJECTED;

        public boolean isGranted() {
            return this != REJECTED;
        }
    }

    private final String providerId;
    private final int failureThreshold;
    private final Duration cooldown;
    private final Duration cooldownJitter;
    private final Clock clock;
    private final DoubleSupplier jitterSource;

    private BreakerState state = BreakerState.CLOSED;
    private int consecutiveFailures;
    private boolean halfOpenTrialInFlight;
    private Instant openedAt;
    private Instant retryAt;
    private Instant lastFailureTime;

    public CircuitBreaker(
            String providerId,
            int failureThreshold,
            Duration cooldown,
            Duration cooldownJitter,
            Clock clock,
            DoubleSupplier jitterSource
    ) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1, got " + failureThreshold);
        }
        if (cooldown.isNegative()) {
            throw new IllegalArgumentException("cooldown must not be negative");
        }
        this.providerId = providerId;
        this.failureThreshold = failureThreshold;
        this.cooldown = cooldown;
        this.cooldownJitter = cooldownJitter != null ? cooldownJitter : Duration.ZERO;
        this.clock = clock;
        this.jitterSource = jitterSource;
    }

    public CircuitBreaker(String providerId, int failureThreshold, Duration cooldown, Clock clock) {
        this(providerId, failureThreshold, cooldown, Duration.ZERO, clock, () -> 0.0);
    }

    public CircuitBreaker(String providerId) {
        this(providerId, 5, Duration.ofSeconds(30), Duration.ofSeconds(1),
                Clock.systemUTC(), () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * Asks whether a call to the provider may proceed.
     */
    public synchronized Permit tryAcquire() {
        refreshState();

        switch (state) {
            case CLOSED:
                return Permit.ALLOWED;

            case HALF_OPEN:
                if (halfOpenTrialInFlight) {
                    return Permit.REJECTED;
                }
                halfOpenTrialInFlight = true;
                log.info("Circuit breaker letting trial through: providerId={}", providerId);
                return Permit.TRIAL;

            case OPEN:
            default:
                return Permit.REJECTED;
        }
    }

    /**
     * Records a successful call made under the given permit.
     */
    public synchronized void recordSuccess(Permit permit) {
        if (permit == Permit.TRIAL) {
            halfOpenTrialInFlight = false;
            if (state == BreakerState.HALF_OPEN) {
                state = BreakerState.CLOSED;
                consecutiveFailures = 0;
                openedAt = null;
                retryAt = null;
                log.info("Circuit breaker CLOSED after successful trial: providerId={}", providerId);
            }
            return;
        }

        if (permit == Permit.ALLOWED && state == BreakerState.CLOSED) {
            consecutiveFailures = 0;
        }
    }

    /**
     * Records a failed call made under the given permit.
     */
    public synchronized void recordFailure(Permit permit) {
        lastFailureTime = clock.instant();

        if (permit == Permit.TRIAL) {
            halfOpenTrialInFlight = false;
            if (state == BreakerState.HALF_OPEN) {
                consecutiveFailures++;
                open();
                log.warn("Circuit breaker OPENED (trial failed): providerId={}, retryAt={}", providerId, retryAt);
            }
            return;
        }

        if (permit == Permit.ALLOWED && state == BreakerState.CLOSED) {
            consecutiveFailures++;
            if (consecutiveFailures >= failureThreshold) {
                open();
                log.warn("Circuit breaker OPENED: providerId={}, failures={}, retryAt={}",
                        providerId, consecutiveFailures, retryAt);
            }
        }
    }

    /**
     * Returns a permit without a verdict on provider health.
     * Used when the call was cancelled or failed for reasons unrelated to the provider.
     */
    public synchronized void release(Permit permit) {
        if (permit == Permit.TRIAL) {
            halfOpenTrialInFlight = false;
            log.debug("Circuit breaker trial released without verdict: providerId={}", providerId);
        }
    }

    /**
     * Forces the circuit to a specific state. For testing/admin use.
     */
    public synchronized void forceState(BreakerState newState) {
        BreakerState old = state;
        state = newState;
        halfOpenTrialInFlight = false;
        if (newState == BreakerState.CLOSED) {
            consecutiveFailures = 0;
            openedAt = null;
            retryAt = null;
        }
        if (newState == BreakerState.OPEN) {
            open();
        }
        log.info("Circuit breaker forced from {} to {}: providerId={}", old, newState, providerId);
    }

    public synchronized BreakerState getState() {
        refreshState();
        return state;
    }

    public synchronized int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public synchronized boolean isTrialInFlight() {
        return halfOpenTrialInFlight;
    }

    public synchronized Instant getOpenedAt() {
        return openedAt;
    }

    public synchronized Instant getLastFailureTime() {
        return lastFailureTime;
    }

    /**
     * Time left before an OPEN breaker lets a trial through; zero otherwise.
     */
    public synchronized Duration remainingCooldown() {
        if (state != BreakerState.OPEN || retryAt == null) {
            return Duration.ZERO;
        }
        Duration remaining = Duration.between(clock.instant(), retryAt);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    public String getProviderId() {
        return providerId;
    }

    private void open() {
        state = BreakerState.OPEN;
        openedAt = clock.instant();
        long jitterMs = (long) (cooldownJitter.toMillis() * Math.max(0.0, Math.min(1.0, jitterSource.getAsDouble())));
        retryAt = openedAt.plus(cooldown).plusMillis(jitterMs);
    }

    private void refreshState() {
        if (state == BreakerState.OPEN && retryAt != null && !clock.instant().isBefore(retryAt)) {
            state = BreakerState.HALF_OPEN;
            halfOpenTrialInFlight = false;
            log.info("Circuit breaker transitioning to HALF_OPEN: providerId={}", providerId);
        }
    }

    @Override
    public synchronized String toString() {
        return "CircuitBreaker{" +
                "providerId='" + providerId + '\'' +
                ", state=" + state +
                ", failures=" + consecutiveFailures +
                ", trialInFlight=" + halfOpenTrialInFlight +
                '}';
    }
}
