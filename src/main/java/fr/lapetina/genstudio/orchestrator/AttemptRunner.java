package fr.lapetina.genstudio.orchestrator;

import fr.lapetina.genstudio.domain.event.AttemptOutcome;
import fr.lapetina.genstudio.domain.provider.PollResult;
import fr.lapetina.genstudio.domain.provider.ProviderAdapter;
import fr.lapetina.genstudio.domain.provider.ProviderException;
import fr.lapetina.genstudio.domain.provider.ProviderJobRef;
import fr.lapetina.genstudio.infrastructure.provider.RegisteredProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives one adapter attempt: submit, then poll until the job settles, all bounded by the
 * provider timeout.
 *
 * Adapter calls are started on the worker pool and never on the transition thread; polls
 * are scheduled on the timer. The cancellation flag is checked before submit and before
 * every poll. Each attempt reports exactly one {@link AttemptOutcome} back through the
 * ring buffer.
 *
 * IMPORTANT: this class never touches task lifecycle state. Progress is the only thing it
 * writes, and progress is not a transition.
 */
final class AttemptRunner {

    private static final Logger log = LoggerFactory.getLogger(AttemptRunner.class);

    private final ExecutorService workerPool;
    private final ScheduledExecutorService timer;
    private final TransitionPublisher publisher;

    AttemptRunner(ExecutorService workerPool, ScheduledExecutorService timer, TransitionPublisher publisher) {
        this.workerPool = workerPool;
        this.timer = timer;
        this.publisher = publisher;
    }

    /**
     * Starts an attempt asynchronously.
     */
    void start(Task task, int attemptNumber, RegisteredProvider provider) {
        Attempt attempt = new Attempt(task, attemptNumber, provider);
        try {
            workerPool.execute(attempt::begin);
        } catch (RejectedExecutionException e) {
            attempt.report(AttemptOutcome.failed(e, Duration.ZERO));
        }
    }

    private final class Attempt {
        private final Task task;
        private final int number;
        private final RegisteredProvider provider;
        private final ProviderAdapter adapter;
        private final long startNanos;
        private final long deadlineNanos;
        private final AtomicBoolean reported = new AtomicBoolean(false);
        private volatile ProviderJobRef jobRef;

        Attempt(Task task, int number, RegisteredProvider provider) {
            this.task = task;
            this.number = number;
            this.provider = provider;
            this.adapter = provider.getAdapter();
            this.startNanos = System.nanoTime();
            this.deadlineNanos = startNanos + provider.getTimeout().toNanos();
        }

        void begin() {
            if (task.isCancelRequested()) {
                log.info("Attempt skipped, cancellation requested: taskId={}, attempt={}", task.id(), number);
                report(AttemptOutcome.cancelled(elapsed()));
                return;
            }

            log.info("Dispatching attempt: taskId={}, providerId={}, attempt={}, timeoutMs={}",
                    task.id(), provider.getId(), number, provider.getTimeout().toMillis());

            CompletableFuture<ProviderJobRef> submitted;
            try {
                submitted = adapter.submit(task.request());
            } catch (RuntimeException e) {
                report(AttemptOutcome.failed(e, elapsed()));
                return;
            }

            submitted
                    .orTimeout(Math.max(1, remainingMillis()), TimeUnit.MILLISECONDS)
                    .whenComplete((ref, throwable) -> {
                        if (throwable != null) {
                            report(AttemptOutcome.failed(throwable, elapsed()));
                            return;
                        }
                        if (ref == null) {
                            report(AttemptOutcome.failed(new IllegalStateException(
                                    "Provider " + provider.getId() + " returned no job reference"), elapsed()));
                            return;
                        }
                        jobRef = ref;
                        log.debug("Job submitted: taskId={}, providerId={}, jobId={}",
                                task.id(), provider.getId(), ref.jobId());
                        schedulePoll();
                    });
        }

        private void schedulePoll() {
            long remaining = remainingMillis();
            if (remaining <= 0) {
                timedOut();
                return;
            }
            long delay = Math.min(provider.getPollInterval().toMillis(), remaining);
            try {
                timer.schedule(this::poll, delay, TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                report(AttemptOutcome.failed(e, elapsed()));
            }
        }

        private void poll() {
            if (reported.get()) {
                return;
            }
            if (task.isCancelRequested()) {
                cancelAtProvider();
                return;
            }
            if (remainingMillis() <= 0) {
                timedOut();
                return;
            }

            CompletableFuture<PollResult> polled;
            try {
                polled = adapter.poll(jobRef);
            } catch (RuntimeException e) {
                report(AttemptOutcome.failed(e, elapsed()));
                return;
            }

            polled
                    .orTimeout(Math.max(1, remainingMillis()), TimeUnit.MILLISECONDS)
                    .whenComplete((result, throwable) -> {
                        if (throwable != null) {
                            report(AttemptOutcome.failed(throwable, elapsed()));
                        } else if (result.isSucceeded()) {
                            report(AttemptOutcome.succeeded(result.result(), elapsed()));
                        } else if (result.isFailed()) {
                            report(AttemptOutcome.failed(
                                    new ProviderException(provider.getId(), result.failure()), elapsed()));
                        } else {
                            task.updateProgress(result.progress());
                            schedulePoll();
                        }
                    });
        }

        /**
         * Asks the provider to stop the job, then reports the cancellation once it answers.
         */
        private void cancelAtProvider() {
            log.info("Cancelling job at provider: taskId={}, providerId={}, jobId={}",
                    task.id(), provider.getId(), jobRef.jobId());
            CompletableFuture<Boolean> ack;
            try {
                ack = adapter.cancel(jobRef);
            } catch (RuntimeException e) {
                log.warn("Provider cancel failed: taskId={}, providerId={}, error={}",
                        task.id(), provider.getId(), e.getMessage());
                report(AttemptOutcome.cancelled(elapsed()));
                return;
            }
            ack
                    .orTimeout(Math.max(1, remainingMillis()), TimeUnit.MILLISECONDS)
                    .whenComplete((acknowledged, throwable) -> {
                        if (throwable != null) {
                            log.warn("Provider cancel failed: taskId={}, providerId={}, error={}",
                                    task.id(), provider.getId(), throwable.getMessage());
                        } else {
                            log.info("Provider cancel answered: taskId={}, providerId={}, acknowledged={}",
                                    task.id(), provider.getId(), acknowledged);
                        }
                        report(AttemptOutcome.cancelled(elapsed()));
                    });
        }

        private void timedOut() {
            long timeoutMs = provider.getTimeout().toMillis();
            ProviderJobRef ref = jobRef;
            if (ref != null) {
                // Best effort: the attempt fails whatever the provider answers
                try {
                    adapter.cancel(ref).whenComplete((acknowledged, throwable) -> {
                        if (throwable != null) {
                            log.debug("Cancel after timeout failed: taskId={}, jobId={}, error={}",
                                    task.id(), ref.jobId(), throwable.getMessage());
                        }
                    });
                } catch (RuntimeException e) {
                    log.debug("Cancel after timeout failed: taskId={}, jobId={}, error={}",
                            task.id(), ref.jobId(), e.getMessage());
                }
            }
            report(AttemptOutcome.failed(
                    new TimeoutException("Attempt exceeded timeout of " + timeoutMs + "ms"), elapsed()));
        }

        void report(AttemptOutcome outcome) {
            if (!reported.compareAndSet(false, true)) {
                return;
            }
            log.debug("Attempt finished: taskId={}, attempt={}, outcome={}, elapsedMs={}",
                    task.id(), number, outcome.type(), outcome.elapsed().toMillis());
            try {
                publisher.publishCompletion(task.id(), number, outcome);
            } catch (RuntimeException e) {
                log.error("Failed to publish attempt outcome: taskId={}, attempt={}", task.id(), number, e);
            }
        }

        private long remainingMillis() {
            return TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime());
        }

        private Duration elapsed() {
            return Duration.ofNanos(System.nanoTime() - startNanos);
        }
    }
}
