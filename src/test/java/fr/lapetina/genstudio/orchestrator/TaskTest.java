package fr.lapetina.genstudio.orchestrator;

import fr.lapetina.genstudio.domain.model.ErrorKind;
import fr.lapetina.genstudio.domain.model.GenerationRequest;
import fr.lapetina.genstudio.domain.model.GenerationResult;
import fr.lapetina.genstudio.domain.model.HistoryEntry;
import fr.lapetina.genstudio.domain.model.TaskError;
import fr.lapetina.genstudio.domain.model.TaskSnapshot;
import fr.lapetina.genstudio.domain.model.TaskStatus;
import fr.lapetina.genstudio.infrastructure.resilience.MutableClock;
import fr.lapetina.genstudio.orchestrator.exception.InvalidStateTransitionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaskTest {

    private MutableClock clock;
    private Task task;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        task = new Task("task-1", "video-a", GenerationRequest.ofPrompt("a red fox"), clock);
    }

    @Test
    @DisplayName("should start Queued with a creation entry")
    void shouldStartQueued() {
        TaskSnapshot snapshot = task.snapshot();

        assertThat(snapshot.status()).isEqualTo(TaskStatus.QUEUED);
        assertThat(snapshot.attempt()).isZero();
        assertThat(snapshot.history()).hasSize(1);
        assertThat(snapshot.result()).isNull();
        assertThat(snapshot.lastError()).isNull();
        assertThat(task.timelineSize()).isEqualTo(1);
    }

    @Test
    @DisplayName("should publish the creation snapshot to a subscriber without any transition")
    void shouldPublishCreationSnapshot() throws Exception {
        Task created = new Task("task-2", "video-b", GenerationRequest.ofPrompt("a blue heron"), clock);

        TaskSnapshot first = created.awaitSnapshot(0, 1, TimeUnit.SECONDS, () -> false);

        assertThat(first).isNotNull();
        assertThat(first.status()).isEqualTo(TaskStatus.QUEUED);
        assertThat(first.history()).singleElement()
                .extracting(HistoryEntry::note)
                .isEqualTo("Task created");
        assertThat(created.awaitSnapshot(1, 10, TimeUnit.MILLISECONDS, () -> false)).isNull();
    }

    @Test
    @DisplayName("should count attempts and keep the last error after a retry")
    void shouldRecordRetry() {
        task.start();
        task.beginAttempt();
        clock.advance(Duration.ofSeconds(1));
        TaskError error = TaskError.of(ErrorKind.TRANSIENT, "HTTP 503");
        task.scheduleRetry(error, "Retry scheduled");
        task.beginAttempt();

        TaskSnapshot snapshot = task.snapshot();
        assertThat(snapshot.status()).isEqualTo(TaskStatus.RUNNING);
        assertThat(snapshot.attempt()).isEqualTo(2);
        assertThat(snapshot.lastError()).isEqualTo(error);
        assertThat(snapshot.history()).extracting(HistoryEntry::note)
                .containsExactly("Task created", "Admitted", "Attempt 1 started", "Retry scheduled", "Attempt 2 started");
    }

    @Test
    @DisplayName("should set result and full progress on success")
    void shouldSucceed() {
        task.start();
        task.beginAttempt();
        task.updateProgress(0.4);
        task.succeed(GenerationResult.of("https://cdn.example/out.mp4"));

        TaskSnapshot snapshot = task.snapshot();
        assertThat(snapshot.status()).isEqualTo(TaskStatus.SUCCEEDED);
        assertThat(snapshot.result().outputUrl()).isEqualTo("https://cdn.example/out.mp4");
        assertThat(snapshot.progress()).isEqualTo(1.0);
        assertThat(snapshot.lastEntry().status()).isEqualTo(TaskStatus.SUCCEEDED);
    }

    @Test
    @DisplayName("should reject any transition out of a terminal state")
    void shouldRejectTransitionsFromTerminal() {
        task.cancel("Cancelled while queued");

        assertThatThrownBy(() -> task.start())
                .isInstanceOf(InvalidStateTransitionException.class);
        assertThatThrownBy(() -> task.fail(TaskError.of(ErrorKind.UNKNOWN, "late")))
                .isInstanceOf(InvalidStateTransitionException.class);
        assertThat(task.snapshot().status()).isEqualTo(TaskStatus.CANCELLED);
    }

    @Test
    @DisplayName("should not let a queued task succeed directly")
    void shouldNotSucceedFromQueued() {
        assertThatThrownBy(() -> task.succeed(GenerationResult.of("https://x")))
                .isInstanceOf(InvalidStateTransitionException.class)
                .hasMessageContaining("QUEUED -> SUCCEEDED");
    }

    @Test
    @DisplayName("should keep progress monotonic without adding history")
    void shouldKeepProgressMonotonic() {
        task.start();
        task.updateProgress(0.6);
        task.updateProgress(0.3);

        assertThat(task.snapshot().progress()).isEqualTo(0.6);
        assertThat(task.timelineSize()).isEqualTo(2);
    }

    @Test
    @DisplayName("should never move updatedAt backwards")
    void shouldKeepUpdatedAtMonotonic() {
        Instant start = Instant.parse("2024-01-01T00:00:10Z");
        MutableClock moving = new MutableClock(start);
        Task clocked = new Task("task-2", "image", GenerationRequest.ofPrompt("x"), moving);
        moving.advance(Duration.ofSeconds(-5));

        clocked.start();

        assertThat(clocked.updatedAt()).isEqualTo(start);
    }

    @Test
    @DisplayName("should report the cancellation flag only once")
    void shouldRequestCancelOnce() {
        assertThat(task.requestCancel()).isTrue();
        assertThat(task.requestCancel()).isFalse();
        assertThat(task.isCancelRequested()).isTrue();
    }
}
