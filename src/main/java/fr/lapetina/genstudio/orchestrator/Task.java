package fr.lapetina.genstudio.orchestrator;

import fr.lapetina.genstudio.domain.model.GenerationRequest;
import fr.lapetina.genstudio.domain.model.GenerationResult;
import fr.lapetina.genstudio.domain.model.HistoryEntry;
import fr.lapetina.genstudio.domain.model.TaskError;
import fr.lapetina.genstudio.domain.model.TaskSnapshot;
import fr.lapetina.genstudio.domain.model.TaskStatus;
import fr.lapetina.genstudio.infrastructure.resilience.CircuitBreaker;
import fr.lapetina.genstudio.orchestrator.exception.InvalidStateTransitionException;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

/**
 * Live task record. Never leaves the orchestrator package; callers get {@link TaskSnapshot}s.
 *
 * Lifecycle fields are guarded by the monitor and only mutated by the transition thread.
 * Every history entry is paired with a snapshot appended to the timeline, which
 * subscriptions replay in order.
 *
 * The scheduling fields ({@code phase}, {@code permit}, timer handles) belong to the
 * transition thread alone and are not synchronized.
 */
final class Task {

    /**
     * Where a running task currently sits in the scheduling loop.
     */
    enum Phase {
        WAITING_ADMISSION,
        ATTEMPT_IN_FLIGHT,
        BACKOFF
    }

    private final String id;
    private final String providerId;
    private final GenerationRequest request;
    private final Instant createdAt;
    private final Clock clock;

    private TaskStatus status;
    private int attempt;
    private double progress;
    private TaskError lastError;
    private GenerationResult result;
    private Instant updatedAt;
    private final List<HistoryEntry> history = new ArrayList<>();
    private final List<TaskSnapshot> timeline = new ArrayList<>();

    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);

    // Owned by the transition thread
    private Phase phase;
    private CircuitBreaker.Permit permit;
    private ScheduledFuture<?> retryHandle;
    private ScheduledFuture<?> graceHandle;

    Task(String id, String providerId, GenerationRequest request, Clock clock) {
        this.id = Objects.requireNonNull(id, "Task ID is required");
        this.providerId = Objects.requireNonNull(providerId, "Provider ID is required");
        this.request = Objects.requireNonNull(request, "Request is required");
        this.clock = clock;
        this.createdAt = clock.instant();
        this.updatedAt = createdAt;
        this.status = TaskStatus.QUEUED;
        synchronized (this) {
            append(TaskStatus.QUEUED, "Task created");
        }
    }

    String id() {
        return id;
    }

    String providerId() {
        return providerId;
    }

    GenerationRequest request() {
        return request;
    }

    synchronized TaskStatus status() {
        return status;
    }

    synchronized int attempt() {
        return attempt;
    }

    synchronized boolean isTerminal() {
        return status.isTerminal();
    }

    synchronized Instant updatedAt() {
        return updatedAt;
    }

    // ==================== TRANSITIONS ====================

    /**
     * Queued to Running on first admission.
     */
    synchronized void start() {
        checkTransition(TaskStatus.RUNNING);
        status = TaskStatus.RUNNING;
        append(TaskStatus.RUNNING, "Admitted");
    }

    /**
     * Counts a new adapter attempt.
     *
     * @return the attempt number, starting at 1
     */
    synchronized int beginAttempt() {
        checkTransition(TaskStatus.RUNNING);
        attempt++;
        append(TaskStatus.RUNNING, "Attempt " + attempt + " started");
        return attempt;
    }

    /**
     * Running to Running: an attempt failed and another one is scheduled.
     */
    synchronized void scheduleRetry(TaskError error, String note) {
        checkTransition(TaskStatus.RUNNING);
        lastError = error;
        append(TaskStatus.RUNNING, note);
    }

    synchronized void succeed(GenerationResult generationResult) {
        checkTransition(TaskStatus.SUCCEEDED);
        result = Objects.requireNonNull(generationResult, "Result is required");
        progress = 1.0;
        status = TaskStatus.SUCCEEDED;
        append(TaskStatus.SUCCEEDED, "Succeeded: " + generationResult.outputUrl());
    }

    synchronized void fail(TaskError error) {
        checkTransition(TaskStatus.FAILED);
        lastError = Objects.requireNonNull(error, "Error is required");
        status = TaskStatus.FAILED;
        append(TaskStatus.FAILED, "Failed: " + error);
    }

    synchronized void cancel(String note) {
        checkTransition(TaskStatus.CANCELLED);
        status = TaskStatus.CANCELLED;
        append(TaskStatus.CANCELLED, note);
    }

    /**
     * Records provider-reported progress. Not a transition: no history entry, no snapshot.
     */
    synchronized void updateProgress(double value) {
        if (!status.isTerminal()) {
            progress = Math.max(progress, Math.max(0.0, Math.min(1.0, value)));
        }
    }

    private void checkTransition(TaskStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidStateTransitionException(id, status, target);
        }
    }

    private void append(TaskStatus entryStatus, String note) {
        Instant now = clock.instant();
        if (now.isBefore(updatedAt)) {
            now = updatedAt;
        }
        updatedAt = now;
        history.add(new HistoryEntry(now, entryStatus, note));
        timeline.add(buildSnapshot());
        notifyAll();
    }

    // ==================== SNAPSHOTS ====================

    synchronized TaskSnapshot snapshot() {
        return buildSnapshot();
    }

    private TaskSnapshot buildSnapshot() {
        return new TaskSnapshot(
                id,
                providerId,
                request,
                status,
                attempt,
                progress,
                lastError,
                result,
                createdAt,
                updatedAt,
                history
        );
    }

    synchronized int timelineSize() {
        return timeline.size();
    }

    /**
     * Waits until the timeline holds an entry at {@code index}.
     * A timeout of {@code Long.MAX_VALUE} waits without limit.
     *
     * @return the snapshot, or null if the timeout elapsed or {@code abandoned} turned true
     */
    synchronized TaskSnapshot awaitSnapshot(int index, long timeout, TimeUnit unit, BooleanSupplier abandoned)
            throws InterruptedException {
        boolean unbounded = timeout == Long.MAX_VALUE;
        long deadline = unbounded ? 0L : System.nanoTime() + unit.toNanos(timeout);
        while (index >= timeline.size()) {
            if (abandoned.getAsBoolean()) {
                return null;
            }
            if (unbounded) {
                wait();
                continue;
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return null;
            }
            TimeUnit.NANOSECONDS.timedWait(this, remaining);
        }
        return timeline.get(index);
    }

    /**
     * Wakes waiting subscribers so they re-check their abandon condition.
     */
    synchronized void wakeSubscribers() {
        notifyAll();
    }

    // ==================== CANCELLATION FLAG ====================

    /**
     * @return true if this call set the flag
     */
    boolean requestCancel() {
        return cancelRequested.compareAndSet(false, true);
    }

    boolean isCancelRequested() {
        return cancelRequested.get();
    }

    // ==================== TRANSITION-THREAD STATE ====================

    Phase phase() {
        return phase;
    }

    void phase(Phase newPhase) {
        this.phase = newPhase;
    }

    CircuitBreaker.Permit takePermit() {
        CircuitBreaker.Permit taken = permit;
        permit = null;
        return taken;
    }

    void permit(CircuitBreaker.Permit newPermit) {
        this.permit = newPermit;
    }

    void retryHandle(ScheduledFuture<?> handle) {
        this.retryHandle = handle;
    }

    void cancelRetryTimer() {
        if (retryHandle != null) {
            retryHandle.cancel(false);
            retryHandle = null;
        }
    }

    boolean hasGraceTimer() {
        return graceHandle != null;
    }

    void graceHandle(ScheduledFuture<?> handle) {
        this.graceHandle = handle;
    }

    void cancelGraceTimer() {
        if (graceHandle != null) {
            graceHandle.cancel(false);
            graceHandle = null;
        }
    }

    @Override
    public String toString() {
        return "Task{id='" + id + "', providerId='" + providerId + "', status=" + status() + ", attempt=" + attempt() + '}';
    }
}
