package fr.lapetina.genstudio.orchestrator.exception;

public final class TaskNotFoundException extends OrchestrationException {

    private final String taskId;

    public TaskNotFoundException(String taskId) {
        super("Task not found: " + taskId);
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}
