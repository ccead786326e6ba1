package fr.lapetina.genstudio.domain.provider;

import java.util.Objects;

/**
 * Thrown (or used to complete a future exceptionally) by adapters when a provider call fails.
 * Carries the raw failure shape so it can be classified without parsing the message.
 */
public class ProviderException extends RuntimeException {

    private final String providerId;
    private final ProviderFailure failure;

    public ProviderException(String providerId, ProviderFailure failure) {
        super(providerId + " failed: " + failure);
        this.providerId = providerId;
        this.failure = Objects.requireNonNull(failure, "Failure is required");
    }

    public ProviderException(String providerId, ProviderFailure failure, Throwable cause) {
        super(providerId + " failed: " + failure, cause);
        this.providerId = providerId;
        this.failure = Objects.requireNonNull(failure, "Failure is required");
    }

    public String getProviderId() {
        return providerId;
    }

    public ProviderFailure getFailure() {
        return failure;
    }
}
