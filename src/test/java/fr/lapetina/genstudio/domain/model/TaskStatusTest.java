package fr.lapetina.genstudio.domain.model;

import org.junit.jupiter.api.*;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;

class TaskStatusTest {

    @ParameterizedTest
    @EnumSource(value = TaskStatus.class, names = {"SUCCEEDED", "FAILED", "CANCELLED"})
    @DisplayName("should allow no transition out of a terminal state")
    void shouldAllowNoTransitionOutOfTerminalState(TaskStatus status) {
        assertThat(status.isTerminal()).isTrue();
        assertThat(status.allowedTransitions()).isEmpty();
    }

    @Test
    @DisplayName("should only leave Queued by admission or cancellation")
    void shouldOnlyLeaveQueuedByAdmissionOrCancellation() {
        assertThat(TaskStatus.QUEUED.allowedTransitions())
                .containsExactlyInAnyOrder(TaskStatus.RUNNING, TaskStatus.CANCELLED);
        assertThat(TaskStatus.QUEUED.canTransitionTo(TaskStatus.SUCCEEDED)).isFalse();
        assertThat(TaskStatus.QUEUED.canTransitionTo(TaskStatus.FAILED)).isFalse();
    }

    @Test
    @DisplayName("should allow Running to stay Running across retries")
    void shouldAllowRunningToStayRunning() {
        assertThat(TaskStatus.RUNNING.canTransitionTo(TaskStatus.RUNNING)).isTrue();
        assertThat(TaskStatus.RUNNING.canTransitionTo(TaskStatus.QUEUED)).isFalse();
    }

    @Test
    @DisplayName("should classify error kinds by disposition")
    void shouldClassifyErrorKindsByDisposition() {
        assertThat(ErrorKind.INVALID_REQUEST.isFatal()).isTrue();
        assertThat(ErrorKind.AUTH_FAILURE.isFatal()).isTrue();
        assertThat(ErrorKind.TRANSIENT.isFatal()).isFalse();
        assertThat(ErrorKind.INVALID_REQUEST.countsTowardBreaker()).isFalse();
        assertThat(ErrorKind.AUTH_FAILURE.countsTowardBreaker()).isTrue();
        assertThat(ErrorKind.PROVIDER_UNAVAILABLE.disposition()).isEqualTo(ErrorKind.Disposition.CIRCUIT_TRIP);
    }
}
