package fr.lapetina.genstudio.domain.policy;

import fr.lapetina.genstudio.domain.model.ErrorKind;
import fr.lapetina.genstudio.domain.model.TaskError;
import fr.lapetina.genstudio.domain.provider.ProviderException;
import fr.lapetina.genstudio.domain.provider.ProviderFailure;

import java.io.IOException;
import java.net.ConnectException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

/**
 * Maps raw provider failures onto the closed {@link ErrorKind} taxonomy.
 *
 * <p>Classification is pure: it looks at the status code, the timeout flag and the
 * message, in that order of precedence, and keeps no state between calls.
 */
public final class ErrorClassifier {

    private static final Pattern RATE_LIMIT_PATTERN = Pattern.compile(
            "rate[ _-]?limit|too many requests|throttl", Pattern.CASE_INSENSITIVE);

    private static final Pattern AUTH_PATTERN = Pattern.compile(
            "unauthori[sz]ed|invalid api key|api key|forbidden|credential|authenticat", Pattern.CASE_INSENSITIVE);

    private static final Pattern INVALID_PATTERN = Pattern.compile(
            "invalid|unsupported|malformed|bad request|validation", Pattern.CASE_INSENSITIVE);

    private static final Pattern TRANSIENT_PATTERN = Pattern.compile(
            "timed out|timeout|connection reset|connection refused|temporarily unavailable|service unavailable|overloaded",
            Pattern.CASE_INSENSITIVE);

    /**
     * Classifies any throwable surfaced by an adapter call.
     */
    public TaskError classify(Throwable throwable) {
        Throwable cause = unwrap(throwable);

        if (cause instanceof ProviderException providerException) {
            return classify(providerException.getFailure());
        }
        if (cause instanceof TimeoutException || cause instanceof HttpTimeoutException) {
            return TaskError.of(ErrorKind.TRANSIENT, describe("Timed out", cause));
        }
        if (cause instanceof ConnectException) {
            return TaskError.of(ErrorKind.TRANSIENT, describe("Connection failed", cause));
        }
        if (cause instanceof IOException) {
            ErrorKind byMessage = classifyMessage(cause.getMessage());
            return TaskError.of(byMessage != null ? byMessage : ErrorKind.TRANSIENT, describe("I/O error", cause));
        }
        if (cause instanceof IllegalArgumentException) {
            return TaskError.of(ErrorKind.INVALID_REQUEST, describe("Invalid request", cause));
        }

        ErrorKind byMessage = classifyMessage(cause.getMessage());
        return TaskError.of(byMessage != null ? byMessage : ErrorKind.UNKNOWN, describe("Unexpected error", cause));
    }

    /**
     * Classifies a raw failure reported by a provider.
     */
    public TaskError classify(ProviderFailure failure) {
        String message = failure.toString();

        if (failure.timeout()) {
            return TaskError.of(ErrorKind.TRANSIENT, message);
        }
        if (failure.hasStatusCode()) {
            ErrorKind kind = classifyStatus(failure.statusCode());
            if (kind != null) {
                Duration retryAfter = kind == ErrorKind.RATE_LIMITED ? failure.retryAfter() : null;
                return new TaskError(kind, message, retryAfter);
            }
        }

        ErrorKind byMessage = classifyMessage(failure.message());
        if (byMessage == ErrorKind.RATE_LIMITED) {
            return new TaskError(byMessage, message, failure.retryAfter());
        }
        return TaskError.of(byMessage != null ? byMessage : ErrorKind.UNKNOWN, message);
    }

    /**
     * Maps a status code onto a kind, or null when the code says nothing.
     */
    ErrorKind classifyStatus(int statusCode) {
        if (statusCode == 429) {
            return ErrorKind.RATE_LIMITED;
        }
        if (statusCode == 401 || statusCode == 402 || statusCode == 403) {
            return ErrorKind.AUTH_FAILURE;
        }
        if (statusCode == 408 || statusCode >= 500 && statusCode < 600) {
            return ErrorKind.TRANSIENT;
        }
        if (statusCode >= 400 && statusCode < 500) {
            return ErrorKind.INVALID_REQUEST;
        }
        return null;
    }

    ErrorKind classifyMessage(String message) {
        if (message == null || message.isBlank()) {
            return null;
        }
        // Rate limiting first: "too many requests" must not be read as an invalid request
        if (RATE_LIMIT_PATTERN.matcher(message).find()) {
            return ErrorKind.RATE_LIMITED;
        }
        if (AUTH_PATTERN.matcher(message).find()) {
            return ErrorKind.AUTH_FAILURE;
        }
        if (TRANSIENT_PATTERN.matcher(message).find()) {
            return ErrorKind.TRANSIENT;
        }
        if (INVALID_PATTERN.matcher(message).find()) {
            return ErrorKind.INVALID_REQUEST;
        }
        return null;
    }

    private static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(String prefix, Throwable cause) {
        String message = cause.getMessage();
        if (message == null || message.isBlank()) {
            return prefix + " (" + cause.getClass().getSimpleName() + ")";
        }
        return prefix + ": " + message;
    }
}
