package fr.lapetina.genstudio.domain.policy;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-failure decision computed by {@link RetryPolicy}. Not persisted.
 */
public record RetryDecision(boolean shouldRetry, Duration delay, String reason) {

    public RetryDecision {
        Objects.requireNonNull(delay, "Delay is required");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("Delay must not be negative");
        }
    }

    public static RetryDecision retryAfter(Duration delay, String reason) {
        return new RetryDecision(true, delay, reason);
    }

    public static RetryDecision stop(String reason) {
        return new RetryDecision(false, Duration.ZERO, reason);
    }
}
