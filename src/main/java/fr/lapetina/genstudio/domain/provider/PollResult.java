package fr.lapetina.genstudio.domain.provider;

import fr.lapetina.genstudio.domain.model.GenerationResult;

import java.util.Objects;

/**
 * Outcome of polling a provider job.
 */
public record PollResult(State state, double progress, GenerationResult result, ProviderFailure failure) {

    public enum State {
        PENDING,
        SUCCEEDED,
        FAILED
    }

    public PollResult {
        Objects.requireNonNull(state, "State is required");
        if (state == State.SUCCEEDED) {
            Objects.requireNonNull(result, "Succeeded poll requires a result");
        }
        if (state == State.FAILED) {
            Objects.requireNonNull(failure, "Failed poll requires a failure");
        }
        progress = Math.max(0.0, Math.min(1.0, progress));
    }

    public static PollResult pending() {
        return new PollResult(State.PENDING, 0.0, null, null);
    }

    public static PollResult pending(double progress) {
        return new PollResult(State.PENDING, progress, null, null);
    }

    public static PollResult succeeded(GenerationResult result) {
        return new PollResult(State.SUCCEEDED, 1.0, result, null);
    }

    public static PollResult failed(ProviderFailure failure) {
        return new PollResult(State.FAILED, 0.0, null, failure);
    }

    public boolean isPending() {
        return state == State.PENDING;
    }

    public boolean isSucceeded() {
        return state == State.SUCCEEDED;
    }

    public boolean isFailed() {
        return state == State.FAILED;
    }
}
