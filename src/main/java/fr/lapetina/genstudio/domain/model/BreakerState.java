package fr.lapetina.genstudio.domain.model;

/**
 * Circuit breaker state of a provider.
 */
public enum BreakerState {
    /** Calls pass through */
    CLOSED,

    /** Calls fail fast without reaching the provider */
    OPEN,

    /** A single trial call is allowed through */
    HALF_OPEN
}
