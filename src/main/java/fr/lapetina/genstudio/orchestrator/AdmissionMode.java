package fr.lapetina.genstudio.orchestrator;

/**
 * What {@code submit} does when every concurrency slot is already reserved.
 */
public enum AdmissionMode {
    /** Fail synchronously with {@code CapacityExceededException} */
    REJECT_WHEN_SATURATED,

    /** Accept the task in Queued; it is admitted in FIFO order as slots free up */
    QUEUE
}
