package fr.lapetina.genstudio.orchestrator.exception;

/**
 * Thrown by submit when a new task cannot be accepted.
 *
 * This occurs when:
 * - All concurrency slots are reserved and the caller asked not to queue
 * - The transition ring buffer is full
 * - The orchestrator is not running
 */
public final class CapacityExceededException extends OrchestrationException {

    private final Reason reason;

    public CapacityExceededException(Reason reason) {
        super("Capacity exceeded: " + reason.getMessage());
        this.reason = reason;
    }

    public CapacityExceededException(Reason reason, String details) {
        super("Capacity exceeded: " + reason.getMessage() + " - " + details);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    public enum Reason {
        CONCURRENCY_BUDGET_SATURATED("All concurrency slots are reserved"),
        RING_BUFFER_FULL("Ring buffer is full"),
        NOT_RUNNING("Orchestrator is not running");

        private final String message;

        Reason(String message) {
            this.message = message;
        }

        public String getMessage() {
            return message;
        }
    }
}
