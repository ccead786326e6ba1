package fr.lapetina.genstudio.domain.event;

/**
 * Event object for the LMAX Disruptor ring buffer.
 *
 * This is a mutable holder reused across the ring buffer. Producers fill it through
 * one of the {@code initialize} methods; the transition handler reads it and clears it.
 *
 * IMPORTANT: This class is intentionally mutable for Disruptor performance.
 * It should never be accessed outside the publish/handle cycle.
 */
public final class OrchestratorEvent {

    private EventType type;
    private String taskId;

    // Attempt number the event refers to; used to drop stale timer and completion events
    private int attempt;
    private AttemptOutcome outcome;

    private long publishedAtNanos;

    /**
     * Clears the event for reuse.
     * Called by the EventFactory and at the end of processing.
     */
    public void clear() {
        this.type = null;
        this.taskId = null;
        this.attempt = 0;
        this.outcome = null;
        this.publishedAtNanos = 0L;
    }

    public void initialize(EventType type, String taskId) {
        initialize(type, taskId, 0);
    }

    public void initialize(EventType type, String taskId, int attempt) {
        clear();
        this.type = type;
        this.taskId = taskId;
        this.attempt = attempt;
        this.publishedAtNanos = System.nanoTime();
    }

    /**
     * Initializes the event with the outcome of an attempt.
     */
    public void initializeCompletion(String taskId, int attempt, AttemptOutcome outcome) {
        initialize(EventType.ATTEMPT_COMPLETED, taskId, attempt);
        this.outcome = outcome;
    }

    public EventType getType() {
        return type;
    }

    public String getTaskId() {
        return taskId;
    }

    public int getAttempt() {
        return attempt;
    }

    public AttemptOutcome getOutcome() {
        return outcome;
    }

    public long getPublishedAtNanos() {
        return publishedAtNanos;
    }

    @Override
    public String toString() {
        return "OrchestratorEvent{" +
                "type=" + type +
                ", taskId=" + taskId +
                ", attempt=" + attempt +
                ", outcome=" + (outcome != null ? outcome.type() : "null") +
                '}';
    }
}
