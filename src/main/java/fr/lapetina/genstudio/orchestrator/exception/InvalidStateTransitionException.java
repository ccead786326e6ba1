package fr.lapetina.genstudio.orchestrator.exception;

import fr.lapetina.genstudio.domain.model.TaskStatus;

/**
 * Thrown when an operation would move a task along an edge the lifecycle does not allow,
 * for instance cancelling a task that already finished.
 */
public final class InvalidStateTransitionException extends OrchestrationException {

    private final String taskId;
    private final TaskStatus from;
    private final TaskStatus to;

    public InvalidStateTransitionException(String taskId, TaskStatus from, TaskStatus to) {
        super("Invalid transition for task " + taskId + ": " + from + " -> " + to);
        this.taskId = taskId;
        this.from = from;
        this.to = to;
    }

    public String getTaskId() {
        return taskId;
    }

    public TaskStatus getFrom() {
        return from;
    }

    public TaskStatus getTo() {
        return to;
    }
}
