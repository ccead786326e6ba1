package fr.lapetina.genstudio.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable copy of a task at one point of its lifecycle.
 * Callers only ever see snapshots, never the live task.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskSnapshot(
        String id,
        String providerId,
        GenerationRequest request,
        TaskStatus status,
        int attempt,
        double progress,
        TaskError lastError,
        GenerationResult result,
        Instant createdAt,
        Instant updatedAt,
        List<HistoryEntry> history
) {
    public TaskSnapshot {
        Objects.requireNonNull(id, "Task ID is required");
        Objects.requireNonNull(status, "Status is required");
        history = history != null ? List.copyOf(history) : List.of();
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * Returns the most recent history entry.
     */
    @JsonIgnore
    public HistoryEntry lastEntry() {
        return history.isEmpty() ? null : history.get(history.size() - 1);
    }

    @Override
    public String toString() {
        return "TaskSnapshot{" +
                "id='" + id + '\'' +
                ", providerId='" + providerId + '\'' +
                ", status=" + status +
                ", attempt=" + attempt +
                ", lastError=" + lastError +
                '}';
    }
}
