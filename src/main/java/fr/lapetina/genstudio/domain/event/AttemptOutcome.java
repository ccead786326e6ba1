package fr.lapetina.genstudio.domain.event;

import fr.lapetina.genstudio.domain.model.GenerationResult;

import java.time.Duration;
import java.util.Objects;

/**
 * What one adapter attempt produced. Exactly one of {@code result} and {@code failure}
 * is set for SUCCEEDED and FAILED; neither is set for CANCELLED.
 */
public record AttemptOutcome(Type type, GenerationResult result, Throwable failure, Duration elapsed) {

    public enum Type {
        SUCCEEDED,
        FAILED,
        CANCELLED
    }

    public AttemptOutcome {
        Objects.requireNonNull(type, "Outcome type is required");
        if (elapsed == null) {
            elapsed = Duration.ZERO;
        }
    }

    public static AttemptOutcome succeeded(GenerationResult result, Duration elapsed) {
        return new AttemptOutcome(Type.SUCCEEDED, Objects.requireNonNull(result, "result"), null, elapsed);
    }

    public static AttemptOutcome failed(Throwable failure, Duration elapsed) {
        return new AttemptOutcome(Type.FAILED, null, Objects.requireNonNull(failure, "failure"), elapsed);
    }

    public static AttemptOutcome cancelled(Duration elapsed) {
        return new AttemptOutcome(Type.CANCELLED, null, null, elapsed);
    }

    public boolean isSucceeded() {
        return type == Type.SUCCEEDED;
    }

    public boolean isFailed() {
        return type == Type.FAILED;
    }

    public boolean isCancelled() {
        return type == Type.CANCELLED;
    }
}
