package fr.lapetina.genstudio.domain.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle state of a generation task.
 *
 * <pre>
 * QUEUED ──► RUNNING ──► SUCCEEDED
 *   │          │  ▲ └──► FAILED
 *   │          └──┘ (retry scheduled)
 *   └──────────┴──────► CANCELLED
 * </pre>
 */
public enum TaskStatus {
    /** Accepted, waiting for a concurrency slot */
    QUEUED,

    /** Admitted; an attempt is in flight or a retry is scheduled */
    RUNNING,

    /** Provider returned a result */
    SUCCEEDED,

    /** Retries exhausted, fatal error, or provider unavailable */
    FAILED,

    /** Cancelled on caller request */
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }

    /**
     * Returns the states reachable from this one. Terminal states have none.
     */
    public Set<TaskStatus> allowedTransitions() {
        return switch (this) {
            case QUEUED -> EnumSet.of(RUNNING, CANCELLED);
            case RUNNING -> EnumSet.of(RUNNING, SUCCEEDED, FAILED, CANCELLED);
            case SUCCEEDED, FAILED, CANCELLED -> EnumSet.noneOf(TaskStatus.class);
        };
    }

    public boolean canTransitionTo(TaskStatus next) {
        return allowedTransitions().contains(next);
    }
}
