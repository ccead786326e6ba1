package fr.lapetina.genstudio.domain.event;

/**
 * Kind of transition request travelling through the ring buffer.
 */
public enum EventType {
    /** A new task was registered in Queued and waits for admission */
    SUBMITTED,

    /** An adapter attempt returned, successfully or not */
    ATTEMPT_COMPLETED,

    /** A backoff timer elapsed; the task competes for a slot again */
    RETRY_DUE,

    /** A caller asked for cancellation */
    CANCEL_REQUESTED,

    /** The grace period granted to an in-flight attempt after a cancellation ran out */
    CANCEL_GRACE_EXPIRED,

    /** A provider's rate-limit window moved on; queued tasks may be admitted */
    ADMISSION_DUE
}
