package fr.lapetina.genstudio.infrastructure.provider;

import fr.lapetina.genstudio.domain.policy.RetryPolicy;
import fr.lapetina.genstudio.infrastructure.resilience.MutableClock;
import fr.lapetina.genstudio.infrastructure.resilience.RateLimiter;
import fr.lapetina.genstudio.integration.ScriptedProviderAdapter;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RegisteredProviderTest {

    private RegisteredProvider provider(int maxConcurrency) {
        return RegisteredProvider.builder()
                .id("luma")
                .adapter(new ScriptedProviderAdapter("luma"))
                .maxConcurrency(maxConcurrency)
                .timeout(Duration.ofSeconds(30))
                .pollInterval(Duration.ofSeconds(1))
                .retryPolicy(RetryPolicy.builder().build())
                .build();
    }

    @Test
    @DisplayName("should hand out at most maxConcurrency slots")
    void shouldHandOutAtMostMaxConcurrencySlots() {
        RegisteredProvider provider = provider(2);

        assertThat(provider.tryAcquireSlot()).isTrue();
        assertThat(provider.tryAcquireSlot()).isTrue();
        assertThat(provider.tryAcquireSlot()).isFalse();
        assertThat(provider.hasCapacity()).isFalse();

        provider.releaseSlot();

        assertThat(provider.hasCapacity()).isTrue();
        assertThat(provider.getInFlight()).isEqualTo(1);
    }

    @Test
    @DisplayName("should gate attempt starts on the rate limiter when one is configured")
    void shouldGateAttemptStartsOnRateLimiter() {
        MutableClock clock = new MutableClock();
        RegisteredProvider limited = RegisteredProvider.builder()
                .id("luma")
                .adapter(new ScriptedProviderAdapter("luma"))
                .maxConcurrency(4)
                .timeout(Duration.ofSeconds(30))
                .pollInterval(Duration.ofSeconds(1))
                .retryPolicy(RetryPolicy.builder().build())
                .rateLimiter(new RateLimiter("luma", 1, Duration.ofSeconds(5), clock))
                .build();

        assertThat(limited.tryAcquireRatePermit()).isTrue();
        assertThat(limited.tryAcquireRatePermit()).isFalse();
        clock.advance(Duration.ofSeconds(5));
        assertThat(limited.tryAcquireRatePermit()).isTrue();

        RegisteredProvider unlimited = provider(1);
        assertThat(unlimited.getRateLimiter()).isEmpty();
        assertThat(unlimited.tryAcquireRatePermit()).isTrue();
        assertThat(unlimited.tryAcquireRatePermit()).isTrue();
    }

    @Test
    @DisplayName("should never count below zero")
    void shouldNeverCountBelowZero() {
        RegisteredProvider provider = provider(1);

        provider.releaseSlot();
        provider.releaseSlot();

        assertThat(provider.getInFlight()).isZero();
        assertThat(provider.tryAcquireSlot()).isTrue();
        assertThat(provider.tryAcquireSlot()).isFalse();
    }

    @Test
    @DisplayName("should keep the slot cap under contention")
    void shouldKeepSlotCapUnderContention() throws Exception {
        RegisteredProvider provider = provider(3);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger acquired = new AtomicInteger();

        for (int i = 0; i < 32; i++) {
            executor.submit(() -> {
                start.await();
                if (provider.tryAcquireSlot()) {
                    acquired.incrementAndGet();
                }
                return null;
            });
        }
        start.countDown();
        executor.shutdown();
        assertThat(executor.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

        assertThat(acquired.get()).isEqualTo(3);
        assertThat(provider.getInFlight()).isEqualTo(3);
    }

    @Test
    @DisplayName("should reject a non-positive concurrency limit")
    void shouldRejectNonPositiveConcurrencyLimit() {
        assertThatThrownBy(() -> provider(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("luma");
    }
}
