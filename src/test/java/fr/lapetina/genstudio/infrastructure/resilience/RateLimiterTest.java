package fr.lapetina.genstudio.infrastructure.resilience;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RateLimiterTest {

    private MutableClock clock;
    private RateLimiter rateLimiter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        // 3 requests per 10s
        rateLimiter = new RateLimiter("video-a", 3, Duration.ofSeconds(10), clock);
    }

    @Test
    @DisplayName("should grant permits up to the limit within one window")
    void shouldGrantPermitsUpToLimit() {
        assertThat(rateLimiter.tryAcquire()).isTrue();
        assertThat(rateLimiter.tryAcquire()).isTrue();
        assertThat(rateLimiter.tryAcquire()).isTrue();

        assertThat(rateLimiter.tryAcquire()).isFalse();
        assertThat(rateLimiter.getAvailablePermits()).isZero();
    }

    @Test
    @DisplayName("should report the wait until the oldest permit leaves the window")
    void shouldReportWaitUntilNextPermit() {
        assertThat(rateLimiter.timeUntilNextPermit()).isZero();

        rateLimiter.tryAcquire();
        clock.advance(Duration.ofSeconds(2));
        rateLimiter.tryAcquire();
        rateLimiter.tryAcquire();
        clock.advance(Duration.ofSeconds(3));

        assertThat(rateLimiter.timeUntilNextPermit()).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("should slide the window instead of resetting it")
    void shouldSlideWindow() {
        rateLimiter.tryAcquire();
        clock.advance(Duration.ofSeconds(6));
        rateLimiter.tryAcquire();
        rateLimiter.tryAcquire();
        assertThat(rateLimiter.tryAcquire()).isFalse();

        // Only the first permit has left the window
        clock.advance(Duration.ofSeconds(4));
        assertThat(rateLimiter.getAvailablePermits()).isEqualTo(1);
        assertThat(rateLimiter.tryAcquire()).isTrue();
        assertThat(rateLimiter.tryAcquire()).isFalse();

        clock.advance(Duration.ofSeconds(6));
        assertThat(rateLimiter.getAvailablePermits()).isEqualTo(2);
    }

    @Test
    @DisplayName("should reject a limit below one or a non-positive window")
    void shouldRejectInvalidSettings() {
        assertThatThrownBy(() -> new RateLimiter("video-a", 0, Duration.ofSeconds(1), clock))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxRequests");
        assertThatThrownBy(() -> new RateLimiter("video-a", 1, Duration.ZERO, clock))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("window");
    }
}
