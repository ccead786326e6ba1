package fr.lapetina.genstudio.infrastructure.provider;

import fr.lapetina.genstudio.domain.policy.RetryPolicy;
import fr.lapetina.genstudio.domain.provider.ProviderAdapter;
import fr.lapetina.genstudio.infrastructure.resilience.RateLimiter;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A provider adapter together with the settings the orchestrator applies around it.
 * Thread-safe; the slot counter is read by the health view while the transition thread updates it.
 */
public final class RegisteredProvider {

    private final String id;
    private final ProviderAdapter adapter;
    private final int maxConcurrency;
    private final Duration timeout;
    private final Duration pollInterval;
    private final RetryPolicy retryPolicy;
    private final RateLimiter rateLimiter;

    private final AtomicInteger inFlight = new AtomicInteger(0);

    private RegisteredProvider(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Provider ID is required");
        this.adapter = Objects.requireNonNull(builder.adapter, "Adapter is required");
        this.retryPolicy = Objects.requireNonNull(builder.retryPolicy, "Retry policy is required");
        if (builder.maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be >= 1 for provider " + builder.id);
        }
        this.maxConcurrency = builder.maxConcurrency;
        this.timeout = builder.timeout;
        this.pollInterval = builder.pollInterval;
        this.rateLimiter = builder.rateLimiter;
    }

    public String getId() {
        return id;
    }

    public ProviderAdapter getAdapter() {
        return adapter;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    /**
     * Request-rate limit applied at admission, if one is configured.
     */
    public Optional<RateLimiter> getRateLimiter() {
        return Optional.ofNullable(rateLimiter);
    }

    /**
     * Takes a request permit; always succeeds when no rate limit is configured.
     */
    public boolean tryAcquireRatePermit() {
        return rateLimiter == null || rateLimiter.tryAcquire();
    }

    public int getInFlight() {
        return inFlight.get();
    }

    public boolean hasCapacity() {
        return inFlight.get() < maxConcurrency;
    }

    /**
     * Attempts to take one of this provider's attempt slots.
     * @return true if slot acquired, false if at capacity
     */
    public boolean tryAcquireSlot() {
        while (true) {
            int current = inFlight.get();
            if (current >= maxConcurrency) {
                return false;
            }
            if (inFlight.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    public void releaseSlot() {
        inFlight.updateAndGet(current -> current > 0 ? current - 1 : 0);
    }

    @Override
    public String toString() {
        return "RegisteredProvider{" +
                "id='" + id + '\'' +
                ", adapter=" + adapter.getClass().getSimpleName() +
                ", inFlight=" + inFlight.get() + "/" + maxConcurrency +
                ", timeout=" + timeout +
                (rateLimiter != null ? ", rateLimit=" + rateLimiter.getMaxRequests() + "/" + rateLimiter.getWindow() : "") +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private ProviderAdapter adapter;
        private int maxConcurrency = 2;
        private Duration timeout = Duration.ofMinutes(5);
        private Duration pollInterval = Duration.ofSeconds(5);
        private RetryPolicy retryPolicy = RetryPolicy.defaults();
        private RateLimiter rateLimiter;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder adapter(ProviderAdapter adapter) {
            this.adapter = adapter;
            return this;
        }

        public Builder maxConcurrency(int maxConcurrency) {
            this.maxConcurrency = maxConcurrency;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = Objects.requireNonNull(timeout, "timeout");
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder rateLimiter(RateLimiter rateLimiter) {
            this.rateLimiter = rateLimiter;
            return this;
        }

        public RegisteredProvider build() {
            return new RegisteredProvider(this);
        }
    }
}
