package fr.lapetina.genstudio.orchestrator;

import fr.lapetina.genstudio.domain.model.TaskSnapshot;

import java.time.Duration;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy, finite sequence of snapshots for one task.
 *
 * Every transition is delivered in the order it happened, starting with the Queued
 * snapshot and ending with the terminal one. Reads block until the next snapshot exists.
 * A new subscription replays the task from its creation.
 *
 * Not thread-safe: one consumer per subscription. {@link #close()} may be called from
 * another thread to release a blocked reader.
 */
public final class TaskSubscription implements Iterator<TaskSnapshot>, AutoCloseable {

    private final Task task;
    private int cursor;
    private TaskSnapshot pending;
    private boolean finished;
    private volatile boolean closed;

    TaskSubscription(Task task) {
        this.task = task;
    }

    public String getTaskId() {
        return task.id();
    }

    /**
     * Blocks until the next snapshot is available or the sequence ended.
     * An interrupt ends the sequence and keeps the thread's interrupt flag set.
     */
    @Override
    public boolean hasNext() {
        if (pending != null) {
            return true;
        }
        if (finished || closed) {
            return false;
        }
        try {
            pending = task.awaitSnapshot(cursor, Long.MAX_VALUE, TimeUnit.NANOSECONDS, () -> closed);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            finished = true;
            return false;
        }
        if (pending == null) {
            finished = true;
            return false;
        }
        return true;
    }

    @Override
    public TaskSnapshot next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Subscription for task " + task.id() + " is finished");
        }
        return consume();
    }

    /**
     * Waits at most {@code timeout} for the next snapshot.
     *
     * @return the snapshot, or empty if none arrived in time or the sequence ended
     */
    public Optional<TaskSnapshot> next(Duration timeout) throws InterruptedException {
        if (pending == null) {
            if (finished || closed) {
                return Optional.empty();
            }
            pending = task.awaitSnapshot(cursor, timeout.toNanos(), TimeUnit.NANOSECONDS, () -> closed);
            if (pending == null) {
                return Optional.empty();
            }
        }
        return Optional.of(consume());
    }

    private TaskSnapshot consume() {
        TaskSnapshot snapshot = pending;
        pending = null;
        cursor++;
        if (snapshot.isTerminal()) {
            finished = true;
        }
        return snapshot;
    }

    /**
     * Returns the remaining snapshots as a sequential stream. Closing the stream closes the subscription.
     */
    public Stream<TaskSnapshot> stream() {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL),
                false
        ).onClose(this::close);
    }

    @Override
    public void close() {
        closed = true;
        task.wakeSubscribers();
    }
}
