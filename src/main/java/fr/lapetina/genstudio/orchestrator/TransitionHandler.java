package fr.lapetina.genstudio.orchestrator;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.genstudio.domain.event.AttemptOutcome;
import fr.lapetina.genstudio.domain.event.EventType;
import fr.lapetina.genstudio.domain.event.OrchestratorEvent;
import fr.lapetina.genstudio.domain.model.ErrorKind;
import fr.lapetina.genstudio.domain.model.TaskError;
import fr.lapetina.genstudio.domain.model.TaskStatus;
import fr.lapetina.genstudio.domain.policy.ErrorClassifier;
import fr.lapetina.genstudio.domain.policy.RetryDecision;
import fr.lapetina.genstudio.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.genstudio.infrastructure.provider.ProviderRegistry;
import fr.lapetina.genstudio.infrastructure.provider.RegisteredProvider;
import fr.lapetina.genstudio.infrastructure.resilience.CircuitBreaker;
import fr.lapetina.genstudio.infrastructure.resilience.CircuitBreakerRegistry;
import fr.lapetina.genstudio.infrastructure.resilience.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Set;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * The single writer. Every task transition and every breaker outcome happens here,
 * on the Disruptor consumer thread, one event at a time.
 *
 * After each event the admission queue is drained: tasks are admitted in submission
 * order while global and per-provider slots are free. A task whose provider is full is
 * skipped without blocking tasks of other providers.
 */
final class TransitionHandler implements EventHandler<OrchestratorEvent> {

    private static final Logger log = LoggerFactory.getLogger(TransitionHandler.class);

    private final TaskRegistry taskRegistry;
    private final ProviderRegistry providerRegistry;
    private final CircuitBreakerRegistry breakers;
    private final ConcurrencyBudget budget;
    private final ErrorClassifier classifier;
    private final AttemptRunner runner;
    private final ScheduledExecutorService timer;
    private final TransitionPublisher publisher;
    private final MetricsRegistry metrics;
    private final Duration cancelGracePeriod;

    // Tasks waiting for admission, in submission (or re-admission) order
    private final Deque<Task> admissionQueue = new ArrayDeque<>();

    // Providers with an ADMISSION_DUE timer already pending
    private final Set<String> rateLimitWakeups = new HashSet<>();

    TransitionHandler(
            TaskRegistry taskRegistry,
            ProviderRegistry providerRegistry,
            CircuitBreakerRegistry breakers,
            ConcurrencyBudget budget,
            ErrorClassifier classifier,
            AttemptRunner runner,
            ScheduledExecutorService timer,
            TransitionPublisher publisher,
            MetricsRegistry metrics,
            Duration cancelGracePeriod
    ) {
        this.taskRegistry = taskRegistry;
        this.providerRegistry = providerRegistry;
        this.breakers = breakers;
        this.budget = budget;
        this.classifier = classifier;
        this.runner = runner;
        this.timer = timer;
        this.publisher = publisher;
        this.metrics = metrics;
        this.cancelGracePeriod = cancelGracePeriod;
    }

    @Override
    public void onEvent(OrchestratorEvent event, long sequence, boolean endOfBatch) {
        try {
            Task task = taskRegistry.find(event.getTaskId()).orElse(null);
            if (task == null) {
                if (event.getType() == EventType.ADMISSION_DUE) {
                    // Its provider can no longer be told apart; the scan below re-arms what is still limited
                    rateLimitWakeups.clear();
                    drainAdmissionQueue();
                    return;
                }
                log.debug("Event for unknown or evicted task ignored: {}", event);
                return;
            }
            withTaskContext(task, () -> dispatch(event, task));
            drainAdmissionQueue();
        } finally {
            event.clear();
        }
    }

    private void dispatch(OrchestratorEvent event, Task task) {
        EventType type = event.getType();
        switch (type) {
            case SUBMITTED -> onSubmitted(task);
            case ATTEMPT_COMPLETED -> onAttemptCompleted(task, event.getAttempt(), event.getOutcome());
            case RETRY_DUE -> onRetryDue(task, event.getAttempt());
            case CANCEL_REQUESTED -> onCancelRequested(task);
            case CANCEL_GRACE_EXPIRED -> onCancelGraceExpired(task);
            case ADMISSION_DUE -> rateLimitWakeups.remove(task.providerId());
        }
    }

    // ==================== EVENT HANDLERS ====================

    private void onSubmitted(Task task) {
        if (task.isTerminal()) {
            // Cancelled before this event was processed
            return;
        }
        task.phase(Task.Phase.WAITING_ADMISSION);
        admissionQueue.addLast(task);
        metrics.incrementTransition(task.providerId(), task.status());
        log.info("Task queued: taskId={}, providerId={}, queueLength={}",
                task.id(), task.providerId(), admissionQueue.size());
    }

    private void onAttemptCompleted(Task task, int attempt, AttemptOutcome outcome) {
        if (task.phase() != Task.Phase.ATTEMPT_IN_FLIGHT || task.attempt() != attempt) {
            log.warn("Stale attempt outcome ignored: taskId={}, attempt={}, current={}, phase={}",
                    task.id(), attempt, task.attempt(), task.phase());
            return;
        }

        RegisteredProvider provider = requireProvider(task);
        CircuitBreaker breaker = breakers.forProvider(task.providerId());
        CircuitBreaker.Permit permit = task.takePermit();

        provider.releaseSlot();
        budget.releaseSlot();
        budget.release();
        task.phase(null);
        task.cancelGraceTimer();
        metrics.recordAttemptLatency(task.providerId(), outcome.type().name(), outcome.elapsed());

        if (task.isTerminal()) {
            // Force-cancelled after the grace period: the provider verdict still counts, the result does not
            recordBreakerOutcome(breaker, permit, outcome);
            log.info("Late attempt outcome discarded: taskId={}, attempt={}, outcome={}, status={}",
                    task.id(), attempt, outcome.type(), task.status());
            return;
        }

        switch (outcome.type()) {
            case SUCCEEDED -> {
                breaker.recordSuccess(permit);
                if (task.isCancelRequested()) {
                    task.cancel("Cancelled: result of attempt " + attempt + " discarded");
                    afterTransition(task);
                    log.info("Result discarded, cancellation was requested: taskId={}, attempt={}",
                            task.id(), attempt);
                    return;
                }
                task.succeed(outcome.result());
                afterTransition(task);
                log.info("Task succeeded: taskId={}, providerId={}, attempt={}, elapsedMs={}",
                        task.id(), task.providerId(), attempt, outcome.elapsed().toMillis());
            }
            case CANCELLED -> {
                breaker.release(permit);
                task.cancel("Cancelled: attempt " + attempt + " stopped");
                afterTransition(task);
                log.info("Task cancelled: taskId={}, attempt={}", task.id(), attempt);
            }
            case FAILED -> {
                TaskError error = classifier.classify(outcome.failure());
                if (error.kind().countsTowardBreaker()) {
                    breaker.recordFailure(permit);
                } else {
                    breaker.release(permit);
                }
                handleFailure(task, provider, breaker, error);
            }
        }
    }

    private void onRetryDue(Task task, int attempt) {
        if (task.isTerminal() || task.phase() != Task.Phase.BACKOFF || task.attempt() != attempt) {
            log.debug("Retry timer ignored: taskId={}, attempt={}, phase={}", task.id(), attempt, task.phase());
            return;
        }
        task.retryHandle(null);
        task.phase(Task.Phase.WAITING_ADMISSION);
        budget.reserve();
        admissionQueue.addLast(task);
        log.info("Task re-queued after backoff: taskId={}, providerId={}, attempt={}",
                task.id(), task.providerId(), attempt);
    }

    private void onCancelRequested(Task task) {
        if (task.isTerminal()) {
            log.debug("Cancellation ignored, task already finished: taskId={}, status={}", task.id(), task.status());
            return;
        }
        Task.Phase phase = task.phase();
        if (phase == Task.Phase.ATTEMPT_IN_FLIGHT) {
            // The runner observes the flag; bound how long we wait for it
            if (!task.hasGraceTimer()) {
                task.graceHandle(schedule(EventType.CANCEL_GRACE_EXPIRED, task, task.attempt(), cancelGracePeriod));
            }
            log.info("Cancellation requested for running attempt: taskId={}, attempt={}, graceMs={}",
                    task.id(), task.attempt(), cancelGracePeriod.toMillis());
            return;
        }

        if (phase == Task.Phase.BACKOFF) {
            task.cancelRetryTimer();
            task.cancel("Cancelled during retry backoff");
        } else {
            // Waiting for admission, or SUBMITTED not handled yet: both hold a reservation
            admissionQueue.remove(task);
            budget.release();
            task.cancel("Cancelled while queued");
        }
        task.phase(null);
        afterTransition(task);
        log.info("Task cancelled: taskId={}, providerId={}", task.id(), task.providerId());
    }

    private void onCancelGraceExpired(Task task) {
        if (task.isTerminal() || task.phase() != Task.Phase.ATTEMPT_IN_FLIGHT) {
            return;
        }
        task.cancel("Cancelled after " + cancelGracePeriod.toMillis() + "ms grace period; late result will be discarded");
        afterTransition(task);
        log.warn("Task force-cancelled, provider did not acknowledge in time: taskId={}, attempt={}",
                task.id(), task.attempt());
    }

    // ==================== ADMISSION ====================

    private void drainAdmissionQueue() {
        Iterator<Task> it = admissionQueue.iterator();
        while (it.hasNext()) {
            Task task = it.next();
            if (task.isCancelRequested()) {
                it.remove();
                budget.release();
                withTaskContext(task, () -> {
                    task.cancel("Cancelled while queued");
                    task.phase(null);
                    afterTransition(task);
                });
                continue;
            }
            if (!budget.hasFreeSlot()) {
                // Only cancellations can still make progress
                continue;
            }
            RegisteredProvider provider = requireProvider(task);
            if (!provider.tryAcquireSlot()) {
                continue;
            }
            if (!provider.tryAcquireRatePermit()) {
                provider.releaseSlot();
                scheduleRateLimitWakeup(task, provider);
                continue;
            }
            if (!budget.tryAcquireSlot()) {
                provider.releaseSlot();
                continue;
            }
            it.remove();
            withTaskContext(task, () -> admit(task, provider));
        }
    }

    private void scheduleRateLimitWakeup(Task task, RegisteredProvider provider) {
        if (!rateLimitWakeups.add(provider.getId())) {
            return;
        }
        Duration wait = provider.getRateLimiter()
                .map(RateLimiter::timeUntilNextPermit)
                .orElse(Duration.ZERO);
        // A zero wait still goes through the timer so the scan is not repeated in a tight loop
        Duration delay = wait.isZero() ? Duration.ofMillis(1) : wait;
        if (schedule(EventType.ADMISSION_DUE, task, task.attempt(), delay) == null) {
            rateLimitWakeups.remove(provider.getId());
        }
        log.debug("Admission deferred by rate limit: taskId={}, providerId={}, waitMs={}",
                task.id(), provider.getId(), delay.toMillis());
    }

    private void admit(Task task, RegisteredProvider provider) {
        if (task.status() == TaskStatus.QUEUED) {
            task.start();
            afterTransition(task);
        }

        CircuitBreaker breaker = breakers.forProvider(task.providerId());
        CircuitBreaker.Permit permit = breaker.tryAcquire();
        if (!permit.isGranted()) {
            provider.releaseSlot();
            budget.releaseSlot();
            budget.release();
            task.phase(null);
            TaskError error = TaskError.of(ErrorKind.PROVIDER_UNAVAILABLE,
                    "Circuit breaker " + breaker.getState() + " for provider " + task.providerId());
            log.warn("Attempt rejected by circuit breaker: taskId={}, providerId={}, state={}, remainingCooldownMs={}",
                    task.id(), task.providerId(), breaker.getState(), breaker.remainingCooldown().toMillis());
            handleFailure(task, provider, breaker, error);
            return;
        }

        int attempt = task.beginAttempt();
        task.permit(permit);
        task.phase(Task.Phase.ATTEMPT_IN_FLIGHT);
        log.info("Task admitted: taskId={}, providerId={}, attempt={}, permit={}, inFlight={}/{}",
                task.id(), task.providerId(), attempt, permit, budget.getInFlight(), budget.getMaxConcurrency());
        runner.start(task, attempt, provider);
    }

    // ==================== FAILURE HANDLING ====================

    private void handleFailure(Task task, RegisteredProvider provider, CircuitBreaker breaker, TaskError error) {
        metrics.incrementErrorCount(task.providerId(), error.kind());

        if (task.isCancelRequested()) {
            task.cancel("Cancelled after failed attempt: " + error);
            afterTransition(task);
            return;
        }

        RetryDecision decision = provider.getRetryPolicy().decide(error, task.attempt(), breaker.remainingCooldown());
        if (!decision.shouldRetry()) {
            task.fail(error);
            afterTransition(task);
            log.warn("Task failed: taskId={}, providerId={}, attempt={}, kind={}, error={}, reason={}",
                    task.id(), task.providerId(), task.attempt(), error.kind(), error.message(), decision.reason());
            return;
        }

        Duration delay = decision.delay();
        task.scheduleRetry(error, "Retry scheduled in " + delay.toMillis() + "ms after " + error);
        task.phase(Task.Phase.BACKOFF);
        task.retryHandle(schedule(EventType.RETRY_DUE, task, task.attempt(), delay));
        afterTransition(task);
        log.warn("Retry scheduled: taskId={}, providerId={}, attempt={}, kind={}, delayMs={}, error={}",
                task.id(), task.providerId(), task.attempt(), error.kind(), delay.toMillis(), error.message());
    }

    private void recordBreakerOutcome(CircuitBreaker breaker, CircuitBreaker.Permit permit, AttemptOutcome outcome) {
        if (outcome.isSucceeded()) {
            breaker.recordSuccess(permit);
        } else if (outcome.isFailed() && classifier.classify(outcome.failure()).kind().countsTowardBreaker()) {
            breaker.recordFailure(permit);
        } else {
            breaker.release(permit);
        }
    }

    // ==================== HELPERS ====================

    private ScheduledFuture<?> schedule(EventType type, Task task, int attempt, Duration delay) {
        try {
            return timer.schedule(() -> publisher.publish(type, task.id(), attempt),
                    Math.max(0, delay.toMillis()), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("Timer rejected {} for task {}: orchestrator shutting down", type, task.id());
            return null;
        }
    }

    private RegisteredProvider requireProvider(Task task) {
        return providerRegistry.find(task.providerId())
                .orElseThrow(() -> new IllegalStateException("Provider vanished: " + task.providerId()));
    }

    private void afterTransition(Task task) {
        metrics.incrementTransition(task.providerId(), task.status());
    }

    private static void withTaskContext(Task task, Runnable action) {
        MDC.put("taskId", task.id());
        MDC.put("providerId", task.providerId());
        try {
            action.run();
        } finally {
            MDC.remove("taskId");
            MDC.remove("providerId");
        }
    }
}
