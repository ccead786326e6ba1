package fr.lapetina.genstudio.infrastructure.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Sliding-window request limiter for one provider: at most {@code maxRequests}
 * attempts may start within any {@code window}.
 *
 * <p>Non-blocking. Callers that are refused ask {@link #timeUntilNextPermit()} when to try again.
 */
public class RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private final String providerId;
    private final int maxRequests;
    private final Duration window;
    private final Clock clock;

    // Start times of the permits granted inside the current window, oldest first
    private final Deque<Instant> granted = new ArrayDeque<>();

    public RateLimiter(String providerId, int maxRequests, Duration window, Clock clock) {
        if (maxRequests < 1) {
            throw new IllegalArgumentException("maxRequests must be >= 1 for provider " + providerId);
        }
        Objects.requireNonNull(window, "Window is required");
        if (window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("Rate limit window must be positive for provider " + providerId);
        }
        this.providerId = providerId;
        this.maxRequests = maxRequests;
        this.window = window;
        this.clock = Objects.requireNonNull(clock, "Clock is required");
    }

    /**
     * Takes a permit if the window has room.
     */
    public synchronized boolean tryAcquire() {
        Instant now = clock.instant();
        evictBefore(now.minus(window));
        if (granted.size() >= maxRequests) {
            log.debug("Rate limit reached: providerId={}, maxRequests={}, windowMs={}",
                    providerId, maxRequests, window.toMillis());
            return false;
        }
        granted.addLast(now);
        return true;
    }

    /**
     * Time until the oldest permit leaves the window; zero when a permit is available now.
     */
    public synchronized Duration timeUntilNextPermit() {
        Instant now = clock.instant();
        evictBefore(now.minus(window));
        if (granted.size() < maxRequests) {
            return Duration.ZERO;
        }
        Duration wait = Duration.between(now, granted.peekFirst().plus(window));
        return wait.isNegative() ? Duration.ZERO : wait;
    }

    public synchronized int getAvailablePermits() {
        evictBefore(clock.instant().minus(window));
        return maxRequests - granted.size();
    }

    public int getMaxRequests() {
        return maxRequests;
    }

    public Duration getWindow() {
        return window;
    }

    private void evictBefore(Instant cutoff) {
        while (!granted.isEmpty() && !granted.peekFirst().isAfter(cutoff)) {
            granted.pollFirst();
        }
    }

    @Override
    public String toString() {
        return "RateLimiter{providerId='" + providerId + "', maxRequests=" + maxRequests +
                ", window=" + window + '}';
    }
}
