package fr.lapetina.genstudio.orchestrator;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.genstudio.domain.event.AttemptOutcome;
import fr.lapetina.genstudio.domain.event.EventType;
import fr.lapetina.genstudio.domain.event.OrchestratorEvent;
import fr.lapetina.genstudio.domain.event.OrchestratorEventFactory;
import fr.lapetina.genstudio.domain.model.GenerationRequest;
import fr.lapetina.genstudio.domain.model.ProviderHealth;
import fr.lapetina.genstudio.domain.model.TaskSnapshot;
import fr.lapetina.genstudio.domain.model.TaskStatus;
import fr.lapetina.genstudio.domain.policy.ErrorClassifier;
import fr.lapetina.genstudio.infrastructure.config.OrchestratorConfig;
import fr.lapetina.genstudio.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.genstudio.infrastructure.provider.ProviderRegistry;
import fr.lapetina.genstudio.infrastructure.provider.RegisteredProvider;
import fr.lapetina.genstudio.infrastructure.resilience.CircuitBreakerRegistry;
import fr.lapetina.genstudio.orchestrator.exception.CapacityExceededException;
import fr.lapetina.genstudio.orchestrator.exception.InvalidStateTransitionException;
import fr.lapetina.genstudio.orchestrator.exception.TaskNotFoundException;
import fr.lapetina.genstudio.orchestrator.exception.UnknownProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point of the orchestration engine.
 *
 * Callers submit, inspect, cancel and subscribe to tasks. None of these calls block on
 * provider I/O: they read the task registry or publish an event to the ring buffer.
 * A single Disruptor consumer ({@link TransitionHandler}) applies every transition,
 * so task state and breaker state have exactly one writer.
 *
 * PRODUCER TYPE: MULTI. Caller threads, attempt callbacks and timers all publish.
 *
 * Caller-facing publishes use {@code tryNext()} and fail fast with
 * {@link CapacityExceededException} when the ring buffer is full. Internal publishes use
 * {@code next()} so an attempt outcome is never lost.
 */
public final class TaskOrchestrator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TaskOrchestrator.class);

    private final Disruptor<OrchestratorEvent> disruptor;
    private final RingBuffer<OrchestratorEvent> ringBuffer;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private final TaskRegistry taskRegistry;
    private final ProviderRegistry providerRegistry;
    private final CircuitBreakerRegistry breakers;
    private final ConcurrencyBudget budget;
    private final ExecutorService workerPool;
    private final ScheduledExecutorService timer;
    private final Clock clock;

    private final Duration completedTaskRetention;
    private final Duration retentionSweepInterval;

    private TaskOrchestrator(Builder builder) {
        this.providerRegistry = builder.providerRegistry;
        this.breakers = builder.breakers;
        this.clock = builder.clock;
        this.completedTaskRetention = builder.completedTaskRetention;
        this.retentionSweepInterval = builder.retentionSweepInterval;
        this.taskRegistry = new TaskRegistry();
        this.budget = new ConcurrencyBudget(builder.maxConcurrency);

        this.workerPool = Executors.newFixedThreadPool(builder.maxConcurrency, new NamedThreadFactory("attempt-worker", true));
        this.timer = Executors.newScheduledThreadPool(2, new NamedThreadFactory("orchestrator-timer", true));

        this.disruptor = new Disruptor<>(
                new OrchestratorEventFactory(),
                builder.ringBufferSize,
                new NamedThreadFactory("transition-handler", false),
                ProducerType.MULTI,
                createWaitStrategy(builder.waitStrategy)
        );

        TransitionPublisher publisher = new InternalPublisher();
        AttemptRunner runner = new AttemptRunner(workerPool, timer, publisher);
        TransitionHandler handler = new TransitionHandler(
                taskRegistry,
                providerRegistry,
                breakers,
                budget,
                builder.classifier,
                runner,
                timer,
                publisher,
                builder.metricsRegistry,
                builder.cancelGracePeriod
        );

        disruptor.handleEventsWith(handler);
        disruptor.setDefaultExceptionHandler(new DisruptorExceptionHandler());
        this.ringBuffer = disruptor.getRingBuffer();

        builder.metricsRegistry.registerOrchestratorGauges(
                budget::getInFlight,
                budget::getReserved,
                ringBuffer::remainingCapacity
        );

        log.info("TaskOrchestrator created: maxConcurrency={}, ringBufferSize={}, waitStrategy={}, providers={}",
                builder.maxConcurrency, builder.ringBufferSize, builder.waitStrategy, providerRegistry.size());
    }

    /**
     * Starts the transition thread and the retention sweep.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            disruptor.start();
            long sweepMs = retentionSweepInterval.toMillis();
            timer.scheduleWithFixedDelay(this::evictFinishedTasks, sweepMs, sweepMs, TimeUnit.MILLISECONDS);
            log.info("TaskOrchestrator started");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    // ==================== PUBLIC CONTRACT ====================

    /**
     * Submits a task, failing if every concurrency slot is already reserved.
     *
     * @return the new task ID
     * @throws UnknownProviderException  if no provider has this ID
     * @throws CapacityExceededException if the budget or the ring buffer is saturated
     */
    public String submit(String providerId, GenerationRequest request) {
        return submit(providerId, request, AdmissionMode.REJECT_WHEN_SATURATED);
    }

    /**
     * Submits a task. With {@link AdmissionMode#QUEUE} the task waits in Queued for a slot
     * instead of being rejected. Never blocks the caller.
     */
    public String submit(String providerId, GenerationRequest request, AdmissionMode mode) {
        Objects.requireNonNull(request, "Request is required");
        Objects.requireNonNull(mode, "Admission mode is required");
        if (!running.get()) {
            throw new CapacityExceededException(CapacityExceededException.Reason.NOT_RUNNING);
        }
        RegisteredProvider provider = providerRegistry.find(providerId)
                .orElseThrow(() -> new UnknownProviderException(providerId));

        if (mode == AdmissionMode.REJECT_WHEN_SATURATED) {
            budget.tryReserve();
        } else {
            budget.reserve();
        }

        Task task = new Task(UUID.randomUUID().toString(), provider.getId(), request, clock);
        taskRegistry.add(task);

        long sequence;
        try {
            sequence = ringBuffer.tryNext();
        } catch (InsufficientCapacityException e) {
            taskRegistry.remove(task.id());
            budget.release();
            throw new CapacityExceededException(
                    CapacityExceededException.Reason.RING_BUFFER_FULL,
                    "remaining capacity: " + ringBuffer.remainingCapacity()
            );
        }
        try {
            ringBuffer.get(sequence).initialize(EventType.SUBMITTED, task.id());
        } finally {
            ringBuffer.publish(sequence);
        }

        log.info("Task submitted: taskId={}, providerId={}, mode={}, reserved={}/{}",
                task.id(), provider.getId(), mode, budget.getReserved(), budget.getMaxConcurrency());
        return task.id();
    }

    /**
     * @throws TaskNotFoundException if the task is unknown
     */
    public TaskSnapshot getStatus(String taskId) {
        return taskRegistry.require(taskId).snapshot();
    }

    /**
     * Requests cancellation. A queued task is cancelled at once; a running attempt is asked
     * to stop and the task becomes Cancelled on acknowledgement or after the grace period.
     *
     * @throws TaskNotFoundException           if the task is unknown
     * @throws InvalidStateTransitionException if the task already finished
     */
    public void cancel(String taskId) {
        Task task = taskRegistry.require(taskId);
        TaskStatus status = task.status();
        if (status.isTerminal()) {
            throw new InvalidStateTransitionException(taskId, status, TaskStatus.CANCELLED);
        }
        if (!task.requestCancel()) {
            log.debug("Cancellation already requested: taskId={}", taskId);
            return;
        }
        // The flag alone is enough for queued tasks and in-flight attempts to notice
        if (!tryPublish(EventType.CANCEL_REQUESTED, taskId)) {
            log.debug("Ring buffer full, cancellation left to the flag: taskId={}", taskId);
        }
        log.info("Cancellation requested: taskId={}, status={}", taskId, status);
    }

    /**
     * Subscribes to every snapshot of a task, from creation to its terminal state.
     *
     * @throws TaskNotFoundException if the task is unknown
     */
    public TaskSubscription subscribe(String taskId) {
        return new TaskSubscription(taskRegistry.require(taskId));
    }

    /**
     * Blocks until the task reaches a terminal state or the timeout elapses.
     *
     * @return the terminal snapshot, or empty on timeout
     */
    public Optional<TaskSnapshot> awaitTerminal(String taskId, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        try (TaskSubscription subscription = subscribe(taskId)) {
            while (true) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return Optional.empty();
                }
                Optional<TaskSnapshot> next = subscription.next(Duration.ofNanos(remaining));
                if (next.isEmpty()) {
                    return Optional.empty();
                }
                if (next.get().isTerminal()) {
                    return next;
                }
            }
        }
    }

    /**
     * Returns every known task, oldest first.
     */
    public List<TaskSnapshot> listTasks() {
        return taskRegistry.snapshots();
    }

    /**
     * @throws UnknownProviderException if no provider has this ID
     */
    public ProviderHealth getProviderHealth(String providerId) {
        RegisteredProvider provider = providerRegistry.find(providerId)
                .orElseThrow(() -> new UnknownProviderException(providerId));
        return breakers.health(provider.getId());
    }

    /**
     * Returns the health of every registered provider, sorted by ID.
     */
    public List<ProviderHealth> getProviderHealth() {
        return providerRegistry.getAll().stream()
                .map(provider -> breakers.health(provider.getId()))
                .toList();
    }

    public TaskRegistry getTaskRegistry() {
        return taskRegistry;
    }

    public ConcurrencyBudget getBudget() {
        return budget;
    }

    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    // ==================== INTERNALS ====================

    private boolean tryPublish(EventType type, String taskId) {
        if (!running.get()) {
            return false;
        }
        long sequence;
        try {
            sequence = ringBuffer.tryNext();
        } catch (InsufficientCapacityException e) {
            return false;
        }
        try {
            ringBuffer.get(sequence).initialize(type, taskId);
        } finally {
            ringBuffer.publish(sequence);
        }
        return true;
    }

    private void evictFinishedTasks() {
        try {
            taskRegistry.evictTerminalBefore(clock.instant().minus(completedTaskRetention));
        } catch (RuntimeException e) {
            log.error("Retention sweep failed", e);
        }
    }

    /**
     * Gracefully shuts down: stops accepting work, drains pending transitions, then stops
     * workers and timers. Attempts still running are abandoned.
     */
    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down TaskOrchestrator...");
            try {
                disruptor.shutdown(30, TimeUnit.SECONDS);
                log.info("Transition handler drained");
            } catch (TimeoutException e) {
                log.warn("TaskOrchestrator shutdown timed out, halting...");
                disruptor.halt();
            }
            timer.shutdownNow();
            workerPool.shutdownNow();
            log.info("TaskOrchestrator shut down");
        }
    }

    private WaitStrategy createWaitStrategy(String name) {
        return switch (name.toLowerCase()) {
            case "blocking" -> new BlockingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            case "busy-spin" -> new BusySpinWaitStrategy();
            case "sleeping" -> new SleepingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using BlockingWaitStrategy", name);
                yield new BlockingWaitStrategy();
            }
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Publishes on behalf of attempts and timers. Blocks for a free slot rather than dropping.
     */
    private final class InternalPublisher implements TransitionPublisher {

        @Override
        public void publish(EventType type, String taskId, int attempt) {
            if (!running.get()) {
                log.debug("Orchestrator stopped, dropping {} for task {}", type, taskId);
                return;
            }
            long sequence = ringBuffer.next();
            try {
                ringBuffer.get(sequence).initialize(type, taskId, attempt);
            } finally {
                ringBuffer.publish(sequence);
            }
        }

        @Override
        public void publishCompletion(String taskId, int attempt, AttemptOutcome outcome) {
            if (!running.get()) {
                log.debug("Orchestrator stopped, dropping outcome {} for task {}", outcome.type(), taskId);
                return;
            }
            long sequence = ringBuffer.next();
            try {
                ringBuffer.get(sequence).initializeCompletion(taskId, attempt, outcome);
            } finally {
                ringBuffer.publish(sequence);
            }
        }
    }

    /**
     * Thread factory with numbered, named threads.
     */
    private static class NamedThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final boolean daemon;
        private final AtomicInteger counter = new AtomicInteger(0);

        NamedThreadFactory(String namePrefix, boolean daemon) {
            this.namePrefix = namePrefix;
            this.daemon = daemon;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(daemon);
            return t;
        }
    }

    /**
     * Logs handler exceptions; the transition thread keeps running.
     */
    private static class DisruptorExceptionHandler implements ExceptionHandler<OrchestratorEvent> {

        private static final Logger log = LoggerFactory.getLogger(DisruptorExceptionHandler.class);

        @Override
        public void handleEventException(Throwable ex, long sequence, OrchestratorEvent event) {
            log.error("Exception in transition handler: sequence={}, event={}", sequence, event, ex);
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during Disruptor start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during Disruptor shutdown", ex);
        }
    }

    /**
     * Builder for TaskOrchestrator.
     */
    public static final class Builder {
        private int maxConcurrency = 4;
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private Duration cancelGracePeriod = Duration.ofSeconds(10);
        private Duration completedTaskRetention = Duration.ofHours(48);
        private Duration retentionSweepInterval = Duration.ofMinutes(1);
        private ProviderRegistry providerRegistry;
        private CircuitBreakerRegistry breakers;
        private MetricsRegistry metricsRegistry;
        private ErrorClassifier classifier = new ErrorClassifier();
        private Clock clock = Clock.systemUTC();

        public Builder maxConcurrency(int maxConcurrency) {
            if (maxConcurrency < 1) {
                throw new IllegalArgumentException("maxConcurrency must be >= 1");
            }
            this.maxConcurrency = maxConcurrency;
            return this;
        }

        public Builder ringBufferSize(int size) {
            // Must be power of 2
            if (Integer.bitCount(size) != 1) {
                throw new IllegalArgumentException("Ring buffer size must be power of 2");
            }
            this.ringBufferSize = size;
            return this;
        }

        public Builder waitStrategy(String strategy) {
            this.waitStrategy = strategy;
            return this;
        }

        public Builder cancelGracePeriod(Duration gracePeriod) {
            this.cancelGracePeriod = gracePeriod;
            return this;
        }

        public Builder completedTaskRetention(Duration retention) {
            this.completedTaskRetention = retention;
            return this;
        }

        public Builder retentionSweepInterval(Duration interval) {
            this.retentionSweepInterval = interval;
            return this;
        }

        public Builder providerRegistry(ProviderRegistry registry) {
            this.providerRegistry = registry;
            return this;
        }

        public Builder circuitBreakers(CircuitBreakerRegistry registry) {
            this.breakers = registry;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry registry) {
            this.metricsRegistry = registry;
            return this;
        }

        public Builder classifier(ErrorClassifier classifier) {
            this.classifier = classifier;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder fromConfig(OrchestratorConfig config) {
            OrchestratorConfig.OrchestratorSettings settings = config.getOrchestrator();
            maxConcurrency(settings.getMaxConcurrency());
            ringBufferSize(settings.getRingBufferSize());
            this.waitStrategy = settings.getWaitStrategy();
            this.cancelGracePeriod = Duration.ofMillis(settings.getCancelGracePeriodMs());
            this.completedTaskRetention = Duration.ofMillis(settings.getCompletedTaskRetentionMs());
            this.retentionSweepInterval = Duration.ofMillis(settings.getRetentionSweepIntervalMs());
            return this;
        }

        public TaskOrchestrator build() {
            if (providerRegistry == null) {
                throw new IllegalStateException("ProviderRegistry is required");
            }
            if (breakers == null) {
                throw new IllegalStateException("CircuitBreakerRegistry is required");
            }
            if (metricsRegistry == null) {
                throw new IllegalStateException("MetricsRegistry is required");
            }
            if (retentionSweepInterval.isZero() || retentionSweepInterval.isNegative()) {
                throw new IllegalStateException("Retention sweep interval must be positive");
            }
            return new TaskOrchestrator(this);
        }
    }
}
