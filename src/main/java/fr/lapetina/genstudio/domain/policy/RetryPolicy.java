package fr.lapetina.genstudio.domain.policy;

import fr.lapetina.genstudio.domain.model.ErrorKind;
import fr.lapetina.genstudio.domain.model.TaskError;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Decides whether and when a failed attempt is retried.
 *
 * <p>Delay for attempt {@code n} is {@code min(base * 2^(n-1), maxDelay)} plus a uniform
 * jitter in {@code [0, base]}, the sum being capped at {@code maxDelay}. The policy is
 * immutable and safe to share between threads.
 *
 * <ul>
 *   <li>{@code TRANSIENT}, {@code RATE_LIMITED}: up to {@code maxAttempts} attempts</li>
 *   <li>{@code UNKNOWN}: up to {@code min(maxAttempts, unknownMaxAttempts)} attempts</li>
 *   <li>{@code INVALID_REQUEST}, {@code AUTH_FAILURE}: never retried</li>
 *   <li>{@code PROVIDER_UNAVAILABLE}: retried after the breaker cooldown only when
 *       {@code waitForOpenBreaker} is set; not counted against the attempt budget</li>
 * </ul>
 */
public final class RetryPolicy {

    private final int maxAttempts;
    private final int unknownMaxAttempts;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final boolean waitForOpenBreaker;
    private final DoubleSupplier jitterSource;

    private RetryPolicy(Builder builder) {
        if (builder.maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + builder.maxAttempts);
        }
        if (builder.unknownMaxAttempts < 1) {
            throw new IllegalArgumentException("unknownMaxAttempts must be >= 1, got " + builder.unknownMaxAttempts);
        }
        if (builder.baseDelay.isNegative() || builder.baseDelay.isZero()) {
            throw new IllegalArgumentException("baseDelay must be positive");
        }
        if (builder.maxDelay.compareTo(builder.baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= baseDelay");
        }
        this.maxAttempts = builder.maxAttempts;
        this.unknownMaxAttempts = builder.unknownMaxAttempts;
        this.baseDelay = builder.baseDelay;
        this.maxDelay = builder.maxDelay;
        this.waitForOpenBreaker = builder.waitForOpenBreaker;
        this.jitterSource = Objects.requireNonNull(builder.jitterSource, "Jitter source is required");
    }

    /**
     * Decides the follow-up of a failed attempt.
     *
     * @param error            classified failure
     * @param attempt          number of adapter calls made so far (1 after the first call)
     * @param breakerRemaining time left before the provider breaker allows a trial
     */
    public RetryDecision decide(TaskError error, int attempt, Duration breakerRemaining) {
        ErrorKind kind = error.kind();

        switch (kind) {
            case INVALID_REQUEST, AUTH_FAILURE -> {
                return RetryDecision.stop(kind + " is not retryable");
            }
            case PROVIDER_UNAVAILABLE -> {
                if (!waitForOpenBreaker) {
                    return RetryDecision.stop("Circuit breaker open and no fallback configured");
                }
                Duration wait = breakerRemaining != null && !breakerRemaining.isNegative()
                        ? breakerRemaining
                        : Duration.ZERO;
                Duration delay = min(max(wait, baseDelay).plus(jitter()), maxDelay);
                return RetryDecision.retryAfter(delay, "Waiting for circuit breaker cooldown");
            }
            default -> {
                int budget = kind == ErrorKind.UNKNOWN ? Math.min(maxAttempts, unknownMaxAttempts) : maxAttempts;
                if (attempt >= budget) {
                    return RetryDecision.stop("Attempts exhausted (" + attempt + "/" + budget + ")");
                }
                Duration delay = computeDelay(attempt);
                if (kind == ErrorKind.RATE_LIMITED && error.retryAfter() != null) {
                    delay = max(delay, error.retryAfter());
                }
                return RetryDecision.retryAfter(delay, "Attempt " + attempt + "/" + budget + " failed");
            }
        }
    }

    /**
     * Exponential delay for the given attempt, without jitter.
     * Non-decreasing in {@code attempt} and never above {@code maxDelay}.
     */
    public Duration backoff(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1, got " + attempt);
        }
        long maxMs = maxDelay.toMillis();
        long exponential = baseDelay.toMillis();
        // Doubling stops at maxDelay, so large attempt counts cannot overflow
        for (int i = 1; i < attempt && exponential < maxMs; i++) {
            exponential *= 2;
        }
        return Duration.ofMillis(Math.min(exponential, maxMs));
    }

    /**
     * Exponential delay plus jitter, capped at {@code maxDelay}.
     */
    public Duration computeDelay(int attempt) {
        return min(backoff(attempt).plus(jitter()), maxDelay);
    }

    private Duration jitter() {
        double factor = jitterSource.getAsDouble();
        factor = Math.max(0.0, Math.min(1.0, factor));
        return Duration.ofMillis((long) (baseDelay.toMillis() * factor));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public int getUnknownMaxAttempts() {
        return unknownMaxAttempts;
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public boolean isWaitForOpenBreaker() {
        return waitForOpenBreaker;
    }

    /**
     * Returns a builder initialised with this policy's settings.
     */
    public Builder toBuilder() {
        return new Builder()
                .maxAttempts(maxAttempts)
                .unknownMaxAttempts(unknownMaxAttempts)
                .baseDelay(baseDelay)
                .maxDelay(maxDelay)
                .waitForOpenBreaker(waitForOpenBreaker)
                .jitterSource(jitterSource);
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    private static Duration max(Duration a, Duration b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    @Override
    public String toString() {
        return "RetryPolicy{" +
                "maxAttempts=" + maxAttempts +
                ", unknownMaxAttempts=" + unknownMaxAttempts +
                ", baseDelay=" + baseDelay +
                ", maxDelay=" + maxDelay +
                ", waitForOpenBreaker=" + waitForOpenBreaker +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static RetryPolicy defaults() {
        return builder().build();
    }

    public static final class Builder {
        private int maxAttempts = 3;
        private int unknownMaxAttempts = 2;
        private Duration baseDelay = Duration.ofMillis(500);
        private Duration maxDelay = Duration.ofSeconds(30);
        private boolean waitForOpenBreaker = false;
        private DoubleSupplier jitterSource = () -> ThreadLocalRandom.current().nextDouble();

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder unknownMaxAttempts(int unknownMaxAttempts) {
            this.unknownMaxAttempts = unknownMaxAttempts;
            return this;
        }

        public Builder baseDelay(Duration baseDelay) {
            this.baseDelay = Objects.requireNonNull(baseDelay, "baseDelay");
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = Objects.requireNonNull(maxDelay, "maxDelay");
            return this;
        }

        public Builder waitForOpenBreaker(boolean waitForOpenBreaker) {
            this.waitForOpenBreaker = waitForOpenBreaker;
            return this;
        }

        /**
         * Source of jitter factors in {@code [0, 1]}. Tests pass a constant.
         */
        public Builder jitterSource(DoubleSupplier jitterSource) {
            this.jitterSource = jitterSource;
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(this);
        }
    }
}
