package fr.lapetina.genstudio.infrastructure.provider;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.genstudio.domain.model.GenerationRequest;
import fr.lapetina.genstudio.domain.model.GenerationResult;
import fr.lapetina.genstudio.domain.provider.PollResult;
import fr.lapetina.genstudio.domain.provider.ProviderFailure;
import fr.lapetina.genstudio.domain.provider.ProviderJobRef;

import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Image-to-video generation on the Luma generations API.
 *
 * <pre>
 * POST   /generations        {"prompt", "aspect_ratio", "loop", "keyframes": {"frame0": {...}}}
 * GET    /generations/{id}   state: pending | queued | dreaming | completed | failed
 * DELETE /generations/{id}
 * </pre>
 */
public final class LumaVideoAdapter extends HttpProviderAdapter {

    static final String DEFAULT_ASPECT_RATIO = "16:9";

    private final String model;

    public LumaVideoAdapter(
            String providerId,
            URI baseUrl,
            String apiKey,
            String model,
            Duration connectTimeout,
            Duration requestTimeout
    ) {
        super(providerId, baseUrl, apiKey, connectTimeout, requestTimeout);
        this.model = model;
    }

    @Override
    public CompletableFuture<ProviderJobRef> submit(GenerationRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        if (request.prompt() != null) {
            body.put("prompt", request.prompt());
        }
        if (model != null) {
            body.put("model", model);
        }
        body.put("aspect_ratio", request.stringParameter("aspect_ratio", DEFAULT_ASPECT_RATIO));
        body.put("loop", Boolean.parseBoolean(request.stringParameter("loop", "false")));

        request.primaryImage().ifPresent(image -> body.put("keyframes",
                Map.of("frame0", Map.of("type", "image", "url", image.uri()))));

        return post("/generations", body)
                .thenApply(node -> ProviderJobRef.of(getProviderId(), requireId(node)));
    }

    @Override
    public CompletableFuture<PollResult> poll(ProviderJobRef jobRef) {
        return get("/generations/" + jobRef.jobId()).thenApply(LumaVideoAdapter::toPollResult);
    }

    static PollResult toPollResult(JsonNode node) {
        String state = text(node, "state");
        if ("completed".equals(state)) {
            JsonNode assets = node.path("assets");
            String video = text(assets, "video");
            if (video == null) {
                return PollResult.failed(ProviderFailure.jobFailed("Generation completed without a video asset"));
            }
            return PollResult.succeeded(GenerationResult.of(video, text(assets, "thumbnail")));
        }
        if ("failed".equals(state)) {
            String reason = text(node, "failure_reason");
            return PollResult.failed(ProviderFailure.jobFailed(reason != null ? reason : "Generation failed"));
        }
        // pending, queued and dreaming are all in progress
        return PollResult.pending();
    }

    @Override
    public CompletableFuture<Boolean> cancel(ProviderJobRef jobRef) {
        return delete("/generations/" + jobRef.jobId()).thenApply(node -> Boolean.TRUE);
    }
}
