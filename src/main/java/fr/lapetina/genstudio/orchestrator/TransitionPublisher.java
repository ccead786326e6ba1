package fr.lapetina.genstudio.orchestrator;

import fr.lapetina.genstudio.domain.event.AttemptOutcome;
import fr.lapetina.genstudio.domain.event.EventType;

/**
 * Internal producer side of the ring buffer, used by workers and timers.
 * Implementations never drop an event while the orchestrator is running.
 */
interface TransitionPublisher {

    void publish(EventType type, String taskId, int attempt);

    void publishCompletion(String taskId, int attempt, AttemptOutcome outcome);
}
