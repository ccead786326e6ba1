package fr.lapetina.genstudio.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One line of a task's append-only history.
 */
public record HistoryEntry(Instant timestamp, TaskStatus status, String note) {

    public HistoryEntry {
        Objects.requireNonNull(timestamp, "Timestamp is required");
        Objects.requireNonNull(status, "Status is required");
        if (note == null) {
            note = "";
        }
    }
}
