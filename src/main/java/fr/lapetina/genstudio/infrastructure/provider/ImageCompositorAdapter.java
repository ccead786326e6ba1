package fr.lapetina.genstudio.infrastructure.provider;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.genstudio.domain.model.AssetRef;
import fr.lapetina.genstudio.domain.model.GenerationRequest;
import fr.lapetina.genstudio.domain.model.GenerationResult;
import fr.lapetina.genstudio.domain.provider.PollResult;
import fr.lapetina.genstudio.domain.provider.ProviderFailure;
import fr.lapetina.genstudio.domain.provider.ProviderJobRef;

import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Static composite generation through a predictions API.
 *
 * <pre>
 * POST /predictions              {"version": ..., "input": {...}}
 * GET  /predictions/{id}         status: starting | processing | succeeded | failed | canceled
 * POST /predictions/{id}/cancel
 * </pre>
 */
public final class ImageCompositorAdapter extends HttpProviderAdapter {

    private final String modelVersion;

    public ImageCompositorAdapter(
            String providerId,
            URI baseUrl,
            String apiKey,
            String modelVersion,
            Duration connectTimeout,
            Duration requestTimeout
    ) {
        super(providerId, baseUrl, apiKey, connectTimeout, requestTimeout);
        this.modelVersion = Objects.requireNonNull(modelVersion, "Model version is required");
    }

    @Override
    public CompletableFuture<ProviderJobRef> submit(GenerationRequest request) {
        Map<String, Object> input = new LinkedHashMap<>(request.parameters());
        if (request.prompt() != null) {
            input.put("prompt", request.prompt());
        }
        request.primaryImage().map(AssetRef::uri).ifPresent(uri -> input.put("image", uri));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("version", modelVersion);
        body.put("input", input);

        return post("/predictions", body)
                .thenApply(node -> ProviderJobRef.of(getProviderId(), requireId(node)));
    }

    @Override
    public CompletableFuture<PollResult> poll(ProviderJobRef jobRef) {
        return get("/predictions/" + jobRef.jobId()).thenApply(this::toPollResult);
    }

    private PollResult toPollResult(JsonNode node) {
        String status = text(node, "status");
        if (status == null) {
            return PollResult.pending();
        }
        switch (status) {
            case "succeeded" -> {
                String output = firstOutput(node.path("output"));
                if (output == null) {
                    return PollResult.failed(ProviderFailure.jobFailed("Prediction succeeded without output"));
                }
                return PollResult.succeeded(GenerationResult.of(output));
            }
            case "failed" -> {
                String error = text(node, "error");
                return PollResult.failed(ProviderFailure.jobFailed(error != null ? error : "Prediction failed"));
            }
            case "canceled" -> {
                return PollResult.failed(ProviderFailure.jobFailed("Prediction was canceled by the provider"));
            }
            default -> {
                return PollResult.pending();
            }
        }
    }

    private static String firstOutput(JsonNode output) {
        if (output.isTextual()) {
            return output.asText();
        }
        if (output.isArray() && output.size() > 0 && output.get(0).isTextual()) {
            return output.get(0).asText();
        }
        return null;
    }

    @Override
    public CompletableFuture<Boolean> cancel(ProviderJobRef jobRef) {
        return post("/predictions/" + jobRef.jobId() + "/cancel", Map.of())
                .thenApply(node -> Boolean.TRUE);
    }
}
