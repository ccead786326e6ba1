package fr.lapetina.genstudio.domain.provider;

import java.time.Duration;

/**
 * Raw shape of a provider failure, before classification.
 *
 * @param statusCode HTTP-like status code, or null when the failure was not a response
 * @param timeout    whether the call timed out
 * @param message    provider or transport message
 * @param retryAfter provider hint for the minimum wait before retrying, may be null
 */
public record ProviderFailure(Integer statusCode, boolean timeout, String message, Duration retryAfter) {

    public ProviderFailure {
        if (message == null) {
            message = "";
        }
    }

    public static ProviderFailure httpStatus(int statusCode, String message) {
        return new ProviderFailure(statusCode, false, message, null);
    }

    public static ProviderFailure httpStatus(int statusCode, String message, Duration retryAfter) {
        return new ProviderFailure(statusCode, false, message, retryAfter);
    }

    public static ProviderFailure timedOut(String message) {
        return new ProviderFailure(null, true, message, null);
    }

    /**
     * Failure reported by the provider for a job that ran and did not produce output.
     */
    public static ProviderFailure jobFailed(String message) {
        return new ProviderFailure(null, false, message, null);
    }

    public boolean hasStatusCode() {
        return statusCode != null;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (statusCode != null) {
            sb.append("HTTP ").append(statusCode).append(": ");
        }
        if (timeout) {
            sb.append("timeout: ");
        }
        sb.append(message);
        return sb.toString();
    }
}
