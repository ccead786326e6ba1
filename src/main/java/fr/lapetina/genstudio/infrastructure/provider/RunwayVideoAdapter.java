package fr.lapetina.genstudio.infrastructure.provider;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.genstudio.domain.model.AssetRef;
import fr.lapetina.genstudio.domain.model.GenerationRequest;
import fr.lapetina.genstudio.domain.model.GenerationResult;
import fr.lapetina.genstudio.domain.provider.PollResult;
import fr.lapetina.genstudio.domain.provider.ProviderFailure;
import fr.lapetina.genstudio.domain.provider.ProviderJobRef;

import java.net.URI;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Image-to-video generation on the Runway API. A source image is mandatory.
 *
 * <pre>
 * POST   /image_to_video  {"model", "promptImage", "promptText", "ratio", "duration", "seed"}
 * GET    /tasks/{id}      status: PENDING | THROTTLED | RUNNING | SUCCEEDED | FAILED | CANCELLED
 * DELETE /tasks/{id}
 * </pre>
 */
public final class RunwayVideoAdapter extends HttpProviderAdapter {

    static final String DEFAULT_API_VERSION = "2024-09-13";
    static final String DEFAULT_MODEL = "gen3a_turbo";
    static final String DEFAULT_RATIO = "1280:768";
    static final int DEFAULT_DURATION_SECONDS = 5;

    private final String model;
    private final String apiVersion;

    public RunwayVideoAdapter(
            String providerId,
            URI baseUrl,
            String apiKey,
            String model,
            String apiVersion,
            Duration connectTimeout,
            Duration requestTimeout
    ) {
        super(providerId, baseUrl, apiKey, connectTimeout, requestTimeout);
        this.model = model != null ? model : DEFAULT_MODEL;
        this.apiVersion = apiVersion != null ? apiVersion : DEFAULT_API_VERSION;
    }

    @Override
    protected void customize(HttpRequest.Builder builder) {
        builder.header("X-Runway-Version", apiVersion);
    }

    @Override
    public CompletableFuture<ProviderJobRef> submit(GenerationRequest request) {
        Optional<AssetRef> image = request.primaryImage();
        if (image.isEmpty()) {
            return CompletableFuture.failedFuture(
                    new IllegalArgumentException("Image-to-video requires a source image"));
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("promptImage", image.get().uri());
        if (request.prompt() != null) {
            body.put("promptText", request.prompt());
        }
        body.put("ratio", request.stringParameter("ratio", DEFAULT_RATIO));
        body.put("duration", request.intParameter("duration", DEFAULT_DURATION_SECONDS));
        request.parameter("seed").ifPresent(seed -> body.put("seed", seed));

        return post("/image_to_video", body)
                .thenApply(node -> ProviderJobRef.of(getProviderId(), requireId(node)));
    }

    @Override
    public CompletableFuture<PollResult> poll(ProviderJobRef jobRef) {
        return get("/tasks/" + jobRef.jobId()).thenApply(RunwayVideoAdapter::toPollResult);
    }

    static PollResult toPollResult(JsonNode node) {
        String status = text(node, "status");
        if (status == null) {
            return PollResult.pending();
        }
        switch (status) {
            case "SUCCEEDED" -> {
                JsonNode output = node.path("output");
                if (!output.isArray() || output.size() == 0) {
                    return PollResult.failed(ProviderFailure.jobFailed("Task succeeded without output"));
                }
                return PollResult.succeeded(GenerationResult.of(output.get(0).asText()));
            }
            case "FAILED" -> {
                String failure = text(node, "failure");
                String code = text(node, "failureCode");
                String message = failure != null ? failure : "Task failed";
                return PollResult.failed(ProviderFailure.jobFailed(code != null ? message + " (" + code + ")" : message));
            }
            case "CANCELLED" -> {
                return PollResult.failed(ProviderFailure.jobFailed("Task was cancelled by the provider"));
            }
            default -> {
                return PollResult.pending(node.path("progress").asDouble(0.0));
            }
        }
    }

    @Override
    public CompletableFuture<Boolean> cancel(ProviderJobRef jobRef) {
        return delete("/tasks/" + jobRef.jobId()).thenApply(node -> Boolean.TRUE);
    }
}
