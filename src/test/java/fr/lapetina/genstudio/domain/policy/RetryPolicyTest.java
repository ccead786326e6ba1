package fr.lapetina.genstudio.domain.policy;

import fr.lapetina.genstudio.domain.model.ErrorKind;
import fr.lapetina.genstudio.domain.model.TaskError;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    private final RetryPolicy policy = RetryPolicy.builder()
            .maxAttempts(3)
            .unknownMaxAttempts(2)
            .baseDelay(Duration.ofMillis(500))
            .maxDelay(Duration.ofSeconds(30))
            .jitterSource(() -> 0.0)
            .build();

    @Test
    @DisplayName("should double the delay per attempt")
    void shouldDoubleDelayPerAttempt() {
        assertThat(policy.backoff(1)).isEqualTo(Duration.ofMillis(500));
        assertThat(policy.backoff(2)).isEqualTo(Duration.ofMillis(1000));
        assertThat(policy.backoff(3)).isEqualTo(Duration.ofMillis(2000));
    }

    @Test
    @DisplayName("should never exceed max delay, even for huge attempt numbers")
    void shouldCapDelayAtMax() {
        assertThat(policy.backoff(7)).isEqualTo(Duration.ofSeconds(30));
        assertThat(policy.backoff(1_000)).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    @DisplayName("should keep delays non-decreasing")
    void shouldKeepDelaysMonotonic() {
        Duration previous = Duration.ZERO;
        for (int attempt = 1; attempt <= 20; attempt++) {
            Duration current = policy.backoff(attempt);
            assertThat(current).isGreaterThanOrEqualTo(previous);
            previous = current;
        }
    }

    @Test
    @DisplayName("should cap jittered delay at max delay")
    void shouldCapJitteredDelay() {
        RetryPolicy jittered = policy.toBuilder().jitterSource(() -> 1.0).build();

        assertThat(jittered.computeDelay(1)).isEqualTo(Duration.ofMillis(1000));
        assertThat(jittered.computeDelay(10)).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    @DisplayName("should retry transient errors until attempts are exhausted")
    void shouldRetryTransientUntilExhausted() {
        TaskError error = TaskError.of(ErrorKind.TRANSIENT, "HTTP 503");

        RetryDecision first = policy.decide(error, 1, Duration.ZERO);
        RetryDecision second = policy.decide(error, 2, Duration.ZERO);
        RetryDecision third = policy.decide(error, 3, Duration.ZERO);

        assertThat(first.shouldRetry()).isTrue();
        assertThat(first.delay()).isEqualTo(Duration.ofMillis(500));
        assertThat(second.shouldRetry()).isTrue();
        assertThat(second.delay()).isEqualTo(Duration.ofMillis(1000));
        assertThat(third.shouldRetry()).isFalse();
    }

    @Test
    @DisplayName("should never retry invalid requests or auth failures")
    void shouldNotRetryFatalErrors() {
        assertThat(policy.decide(TaskError.of(ErrorKind.INVALID_REQUEST, "bad"), 1, Duration.ZERO).shouldRetry())
                .isFalse();
        assertThat(policy.decide(TaskError.of(ErrorKind.AUTH_FAILURE, "401"), 1, Duration.ZERO).shouldRetry())
                .isFalse();
    }

    @Test
    @DisplayName("should bound unknown errors by unknownMaxAttempts")
    void shouldBoundUnknownErrors() {
        TaskError error = TaskError.of(ErrorKind.UNKNOWN, "weird");

        assertThat(policy.decide(error, 1, Duration.ZERO).shouldRetry()).isTrue();
        assertThat(policy.decide(error, 2, Duration.ZERO).shouldRetry()).isFalse();
    }

    @Test
    @DisplayName("should honour a longer Retry-After hint for rate limits")
    void shouldHonourRetryAfter() {
        TaskError error = new TaskError(ErrorKind.RATE_LIMITED, "slow down", Duration.ofSeconds(7));

        RetryDecision decision = policy.decide(error, 1, Duration.ZERO);

        assertThat(decision.shouldRetry()).isTrue();
        assertThat(decision.delay()).isEqualTo(Duration.ofSeconds(7));
    }

    @Test
    @DisplayName("should fail fast on an open breaker unless waiting is enabled")
    void shouldHandleProviderUnavailable() {
        TaskError error = TaskError.of(ErrorKind.PROVIDER_UNAVAILABLE, "breaker open");

        assertThat(policy.decide(error, 1, Duration.ofSeconds(20)).shouldRetry()).isFalse();

        RetryPolicy waiting = policy.toBuilder().waitForOpenBreaker(true).build();
        RetryDecision decision = waiting.decide(error, 1, Duration.ofSeconds(20));
        assertThat(decision.shouldRetry()).isTrue();
        assertThat(decision.delay()).isEqualTo(Duration.ofSeconds(20));
    }

    @Test
    @DisplayName("should reject invalid configuration")
    void shouldRejectInvalidConfiguration() {
        assertThatThrownBy(() -> RetryPolicy.builder().maxAttempts(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RetryPolicy.builder().baseDelay(Duration.ZERO).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RetryPolicy.builder()
                .baseDelay(Duration.ofSeconds(2))
                .maxDelay(Duration.ofSeconds(1))
                .build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
