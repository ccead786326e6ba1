package fr.lapetina.genstudio.domain.model;

/**
 * Closed error taxonomy for provider failures.
 * Each kind carries a fixed disposition used by the retry policy.
 */
public enum ErrorKind {
    /** Network timeout, 5xx, connection reset */
    TRANSIENT(Disposition.RETRYABLE, true),

    /** Provider throttled the call (429); honours Retry-After */
    RATE_LIMITED(Disposition.RETRYABLE, true),

    /** Malformed input or unsupported parameter */
    INVALID_REQUEST(Disposition.FATAL, false),

    /** Missing or rejected credential */
    AUTH_FAILURE(Disposition.FATAL, true),

    /** Circuit breaker refused the call; the adapter was not contacted */
    PROVIDER_UNAVAILABLE(Disposition.CIRCUIT_TRIP, false),

    /** Unclassified failure */
    UNKNOWN(Disposition.RETRYABLE, true);

    private final Disposition disposition;
    private final boolean countsTowardBreaker;

    ErrorKind(Disposition disposition, boolean countsTowardBreaker) {
        this.disposition = disposition;
        this.countsTowardBreaker = countsTowardBreaker;
    }

    public Disposition disposition() {
        return disposition;
    }

    /**
     * Whether a failure of this kind is evidence that the provider is unhealthy.
     */
    public boolean countsTowardBreaker() {
        return countsTowardBreaker;
    }

    public boolean isFatal() {
        return disposition == Disposition.FATAL;
    }

    public enum Disposition {
        RETRYABLE,
        CIRCUIT_TRIP,
        FATAL
    }
}
