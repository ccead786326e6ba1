package fr.lapetina.genstudio.domain.model;

/**
 * Read-only provider health view for display and diagnostics.
 */
public record ProviderHealth(String providerId, BreakerState state, int consecutiveFailures) {

    public boolean isAvailable() {
        return state != BreakerState.OPEN;
    }
}
