package fr.lapetina.genstudio.domain.provider;

import fr.lapetina.genstudio.domain.model.GenerationRequest;

import java.util.concurrent.CompletableFuture;

/**
 * Capability interface every generation provider implements.
 *
 * <p>The orchestrator only calls these three operations and never inspects the
 * concrete adapter type. New providers are added as new implementations.
 *
 * <p>Failures are reported by completing the returned future exceptionally, preferably
 * with a {@link ProviderException} describing the raw failure shape. Implementations
 * must not block the calling thread.
 */
public interface ProviderAdapter extends AutoCloseable {

    /**
     * Provider identifier used for routing, metrics and logging.
     */
    String getProviderId();

    /**
     * Starts a generation job.
     *
     * @param request the opaque generation payload
     * @return future with the provider's job reference
     */
    CompletableFuture<ProviderJobRef> submit(GenerationRequest request);

    /**
     * Queries the state of a job previously started by {@link #submit}.
     */
    CompletableFuture<PollResult> poll(ProviderJobRef jobRef);

    /**
     * Requests cancellation of a running job.
     *
     * @return future completing with {@code true} when the provider acknowledged the cancellation
     */
    CompletableFuture<Boolean> cancel(ProviderJobRef jobRef);

    @Override
    default void close() {
        // Nothing to release by default
    }
}
