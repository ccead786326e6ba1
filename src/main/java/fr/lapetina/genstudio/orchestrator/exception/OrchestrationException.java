package fr.lapetina.genstudio.orchestrator.exception;

/**
 * Base class for errors returned synchronously to orchestrator callers.
 * Failures that happen during execution are never thrown; they are recorded on the task.
 */
public abstract class OrchestrationException extends RuntimeException {

    protected OrchestrationException(String message) {
        super(message);
    }
}
