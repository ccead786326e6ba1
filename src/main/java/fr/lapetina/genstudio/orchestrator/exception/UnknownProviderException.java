package fr.lapetina.genstudio.orchestrator.exception;

public final class UnknownProviderException extends OrchestrationException {

    private final String providerId;

    public UnknownProviderException(String providerId) {
        super("Unknown provider: " + providerId);
        this.providerId = providerId;
    }

    public String getProviderId() {
        return providerId;
    }
}
