package fr.lapetina.genstudio.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Duration;
import java.util.Objects;

/**
 * Classified error attached to a task.
 *
 * @param kind       machine-readable error kind
 * @param message    human-readable description
 * @param retryAfter provider-supplied minimum wait, if any
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskError(ErrorKind kind, String message, Duration retryAfter) {

    public TaskError {
        Objects.requireNonNull(kind, "Error kind is required");
        if (message == null || message.isBlank()) {
            message = kind.name();
        }
    }

    public static TaskError of(ErrorKind kind, String message) {
        return new TaskError(kind, message, null);
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
