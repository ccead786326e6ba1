package fr.lapetina.genstudio.orchestrator;

import fr.lapetina.genstudio.domain.model.TaskSnapshot;
import fr.lapetina.genstudio.orchestrator.exception.TaskNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Authoritative in-memory store of tasks.
 *
 * Lookups are safe from any thread. Only the orchestrator adds or evicts tasks;
 * everything handed out of this class is a snapshot.
 */
public final class TaskRegistry {

    private static final Logger log = LoggerFactory.getLogger(TaskRegistry.class);

    private final Map<String, Task> tasks = new ConcurrentHashMap<>();

    void add(Task task) {
        if (tasks.putIfAbsent(task.id(), task) != null) {
            throw new IllegalStateException("Duplicate task ID: " + task.id());
        }
    }

    void remove(String taskId) {
        tasks.remove(taskId);
    }

    Optional<Task> find(String taskId) {
        if (taskId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tasks.get(taskId));
    }

    /**
     * @throws TaskNotFoundException if no task has this ID
     */
    Task require(String taskId) {
        return find(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
    }

    public Optional<TaskSnapshot> findSnapshot(String taskId) {
        return find(taskId).map(Task::snapshot);
    }

    /**
     * Returns a snapshot of every task, oldest first.
     */
    public List<TaskSnapshot> snapshots() {
        return tasks.values().stream()
                .map(Task::snapshot)
                .sorted(Comparator.comparing(TaskSnapshot::createdAt).thenComparing(TaskSnapshot::id))
                .toList();
    }

    public int size() {
        return tasks.size();
    }

    /**
     * Drops terminal tasks whose last transition happened before {@code cutoff}.
     *
     * @return the number of evicted tasks
     */
    int evictTerminalBefore(Instant cutoff) {
        int evicted = 0;
        for (Task task : tasks.values()) {
            if (task.isTerminal() && task.updatedAt().isBefore(cutoff) && tasks.remove(task.id(), task)) {
                evicted++;
            }
        }
        if (evicted > 0) {
            log.info("Evicted finished tasks: count={}, cutoff={}, remaining={}", evicted, cutoff, tasks.size());
        }
        return evicted;
    }
}
