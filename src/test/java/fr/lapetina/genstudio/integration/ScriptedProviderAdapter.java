package fr.lapetina.genstudio.integration;

import fr.lapetina.genstudio.domain.model.GenerationRequest;
import fr.lapetina.genstudio.domain.model.GenerationResult;
import fr.lapetina.genstudio.domain.provider.PollResult;
import fr.lapetina.genstudio.domain.provider.ProviderAdapter;
import fr.lapetina.genstudio.domain.provider.ProviderException;
import fr.lapetina.genstudio.domain.provider.ProviderFailure;
import fr.lapetina.genstudio.domain.provider.ProviderJobRef;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory provider whose behaviour is scripted per submit call.
 * Calls beyond the script use the fallback behaviour.
 */
public final class ScriptedProviderAdapter implements ProviderAdapter {

    public enum Behaviour {
        /** Job completes on first poll */
        SUCCEED,
        /** Submit fails with HTTP 503 */
        FAIL_TRANSIENT,
        /** Submit fails with HTTP 422 */
        FAIL_INVALID,
        /** Job stays pending at half progress; cancel is acknowledged */
        HANG,
        /** Job stays pending and the cancel call never answers */
        HANG_IGNORING_CANCEL,
        /** First poll is left unanswered until the test completes it, see {@link #awaitPendingPoll} */
        DEFERRED_POLL,
        /** Submit answers with no job reference */
        NULL_JOB_REF
    }

    private final String providerId;
    private final Queue<Behaviour> script = new ConcurrentLinkedQueue<>();
    private volatile Behaviour fallback = Behaviour.SUCCEED;

    private final Map<String, Behaviour> jobs = new ConcurrentHashMap<>();
    private final List<String> submittedPrompts = new CopyOnWriteArrayList<>();
    private final AtomicInteger jobCounter = new AtomicInteger();
    private final AtomicInteger submitCalls = new AtomicInteger();
    private final AtomicInteger cancelCalls = new AtomicInteger();
    private final BlockingQueue<CompletableFuture<PollResult>> pendingPolls = new LinkedBlockingQueue<>();

    public ScriptedProviderAdapter(String providerId) {
        this.providerId = providerId;
    }

    /**
     * Queues behaviours for the next submit calls, in order.
     */
    public ScriptedProviderAdapter script(Behaviour... behaviours) {
        script.addAll(List.of(behaviours));
        return this;
    }

    public ScriptedProviderAdapter fallback(Behaviour behaviour) {
        this.fallback = behaviour;
        return this;
    }

    @Override
    public String getProviderId() {
        return providerId;
    }

    @Override
    public CompletableFuture<ProviderJobRef> submit(GenerationRequest request) {
        Behaviour behaviour = script.poll();
        if (behaviour == null) {
            behaviour = fallback;
        }
        submitCalls.incrementAndGet();
        submittedPrompts.add(request.prompt());

        switch (behaviour) {
            case FAIL_TRANSIENT -> {
                return CompletableFuture.failedFuture(new ProviderException(providerId,
                        ProviderFailure.httpStatus(503, "Service unavailable")));
            }
            case FAIL_INVALID -> {
                return CompletableFuture.failedFuture(new ProviderException(providerId,
                        ProviderFailure.httpStatus(422, "Unsupported parameter")));
            }
            case NULL_JOB_REF -> {
                return CompletableFuture.completedFuture(null);
            }
            default -> {
                String jobId = providerId + "-job-" + jobCounter.incrementAndGet();
                jobs.put(jobId, behaviour);
                return CompletableFuture.completedFuture(ProviderJobRef.of(providerId, jobId));
            }
        }
    }

    @Override
    public CompletableFuture<PollResult> poll(ProviderJobRef jobRef) {
        Behaviour behaviour = jobs.getOrDefault(jobRef.jobId(), Behaviour.SUCCEED);
        if (behaviour == Behaviour.SUCCEED) {
            return CompletableFuture.completedFuture(
                    PollResult.succeeded(GenerationResult.of("https://cdn.test/" + jobRef.jobId() + ".mp4")));
        }
        if (behaviour == Behaviour.DEFERRED_POLL && jobs.replace(jobRef.jobId(), Behaviour.DEFERRED_POLL, Behaviour.HANG)) {
            CompletableFuture<PollResult> deferred = new CompletableFuture<>();
            pendingPolls.add(deferred);
            return deferred;
        }
        return CompletableFuture.completedFuture(PollResult.pending(0.5));
    }

    @Override
    public CompletableFuture<Boolean> cancel(ProviderJobRef jobRef) {
        cancelCalls.incrementAndGet();
        if (jobs.get(jobRef.jobId()) == Behaviour.HANG_IGNORING_CANCEL) {
            return new CompletableFuture<>();
        }
        return CompletableFuture.completedFuture(Boolean.TRUE);
    }

    public int getSubmitCalls() {
        return submitCalls.get();
    }

    public int getCancelCalls() {
        return cancelCalls.get();
    }

    public List<String> getSubmittedPrompts() {
        return List.copyOf(submittedPrompts);
    }

    /**
     * Waits for a poll left unanswered by {@link Behaviour#DEFERRED_POLL}.
     *
     * @return the poll's future, or null if none was made in time
     */
    public CompletableFuture<PollResult> awaitPendingPoll(Duration timeout) throws InterruptedException {
        return pendingPolls.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Waits until at least {@code count} submit calls were made.
     */
    public boolean awaitSubmitCalls(int count, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (submitCalls.get() < count) {
            if (System.nanoTime() > deadline) {
                return false;
            }
            Thread.sleep(5);
        }
        return true;
    }
}
