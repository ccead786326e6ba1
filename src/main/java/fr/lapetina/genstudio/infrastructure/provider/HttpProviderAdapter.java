package fr.lapetina.genstudio.infrastructure.provider;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.genstudio.domain.provider.ProviderAdapter;
import fr.lapetina.genstudio.domain.provider.ProviderException;
import fr.lapetina.genstudio.domain.provider.ProviderFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Base class for adapters talking JSON over HTTP to a generation provider.
 *
 * Uses java.net.http.HttpClient for non-blocking I/O. Every non-2xx response is turned
 * into a {@link ProviderException} carrying the status code, the provider's error message
 * and any {@code Retry-After} hint, so the orchestrator can classify it.
 */
public abstract class HttpProviderAdapter implements ProviderAdapter {

    private static final Logger log = LoggerFactory.getLogger(HttpProviderAdapter.class);

    private static final int MAX_RAW_MESSAGE_LENGTH = 200;

    protected final ObjectMapper objectMapper;

    private final String providerId;
    private final URI baseUrl;
    private final String apiKey;
    private final Duration requestTimeout;
    private final HttpClient httpClient;

    protected HttpProviderAdapter(
            String providerId,
            URI baseUrl,
            String apiKey,
            Duration connectTimeout,
            Duration requestTimeout
    ) {
        this.providerId = Objects.requireNonNull(providerId, "Provider ID is required");
        this.baseUrl = Objects.requireNonNull(baseUrl, "Base URL is required");
        this.apiKey = apiKey;
        this.requestTimeout = requestTimeout;

        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public String getProviderId() {
        return providerId;
    }

    public URI getBaseUrl() {
        return baseUrl;
    }

    /**
     * Hook for provider-specific headers (API version and the like).
     */
    protected void customize(HttpRequest.Builder builder) {
    }

    protected CompletableFuture<JsonNode> get(String path) {
        return send("GET", path, null);
    }

    protected CompletableFuture<JsonNode> post(String path, Object body) {
        return send("POST", path, body);
    }

    protected CompletableFuture<JsonNode> delete(String path) {
        return send("DELETE", path, null);
    }

    /**
     * Sends one JSON request and parses the JSON answer.
     * An empty 2xx body yields a {@link MissingNode}.
     */
    protected CompletableFuture<JsonNode> send(String method, String path, Object body) {
        HttpRequest request;
        try {
            request = buildRequest(method, path, body);
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(
                    new IllegalArgumentException("Failed to serialize request body: " + e.getOriginalMessage(), e));
        }

        Instant startTime = Instant.now();
        log.debug("Sending request: providerId={}, method={}, uri={}", providerId, method, request.uri());

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .thenApply(response -> handleResponse(method, response, startTime));
    }

    private HttpRequest buildRequest(String method, String path, Object body) throws JsonProcessingException {
        HttpRequest.BodyPublisher publisher = body != null
                ? HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body))
                : HttpRequest.BodyPublishers.noBody();

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(resolve(path))
                .header("Accept", "application/json")
                .method(method, publisher);
        if (body != null) {
            builder.header("Content-Type", "application/json");
        }
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
        if (requestTimeout != null) {
            builder.timeout(requestTimeout);
        }
        customize(builder);
        return builder.build();
    }

    URI resolve(String path) {
        String base = baseUrl.toString();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return URI.create(base + (path.startsWith("/") ? path : "/" + path));
    }

    private JsonNode handleResponse(String method, HttpResponse<String> response, Instant startTime) {
        int statusCode = response.statusCode();
        long latencyMs = Duration.between(startTime, Instant.now()).toMillis();

        if (statusCode >= 200 && statusCode < 300) {
            log.debug("Request successful: providerId={}, method={}, uri={}, status={}, latencyMs={}",
                    providerId, method, response.uri(), statusCode, latencyMs);
            return parseBody(response.body());
        }

        String message = extractErrorMessage(response.body(), statusCode);
        Duration retryAfter = response.headers().firstValue("Retry-After")
                .flatMap(HttpProviderAdapter::parseRetryAfter)
                .orElse(null);

        log.warn("Provider returned error: providerId={}, method={}, uri={}, status={}, error={}, latencyMs={}",
                providerId, method, response.uri(), statusCode, message, latencyMs);

        throw new ProviderException(providerId, ProviderFailure.httpStatus(statusCode, message, retryAfter));
    }

    private JsonNode parseBody(String body) {
        if (body == null || body.isBlank()) {
            return MissingNode.getInstance();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ProviderException(providerId,
                    ProviderFailure.jobFailed("Malformed provider response: " + e.getOriginalMessage()), e);
        }
    }

    /**
     * Pulls a human-readable message out of an error body, whatever its shape.
     */
    String extractErrorMessage(String body, int statusCode) {
        if (body == null || body.isBlank()) {
            return "HTTP " + statusCode;
        }
        try {
            JsonNode node = objectMapper.readTree(body);
            for (String field : new String[]{"error", "message", "detail", "failure_reason", "failure"}) {
                JsonNode value = node.path(field);
                if (value.isTextual() && !value.asText().isBlank()) {
                    return value.asText();
                }
                if (value.isObject() && value.path("message").isTextual()) {
                    return value.path("message").asText();
                }
            }
        } catch (JsonProcessingException e) {
            log.debug("Error body is not JSON: providerId={}, status={}", providerId, statusCode);
        }
        String raw = body.strip();
        return raw.length() > MAX_RAW_MESSAGE_LENGTH ? raw.substring(0, MAX_RAW_MESSAGE_LENGTH) : raw;
    }

    /**
     * Parses a {@code Retry-After} header given either in seconds or as an HTTP date.
     */
    static Optional<Duration> parseRetryAfter(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        try {
            long seconds = Long.parseLong(trimmed);
            return seconds >= 0 ? Optional.of(Duration.ofSeconds(seconds)) : Optional.empty();
        } catch (NumberFormatException notSeconds) {
            try {
                ZonedDateTime at = ZonedDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME);
                Duration wait = Duration.between(Instant.now(), at.toInstant());
                return Optional.of(wait.isNegative() ? Duration.ZERO : wait);
            } catch (DateTimeParseException notDate) {
                log.debug("Ignoring unparseable Retry-After header: {}", trimmed);
                return Optional.empty();
            }
        }
    }

    /**
     * Reads a text field, returning null when absent or blank.
     */
    protected static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    /**
     * Reads the job id every provider returns from its create call.
     */
    protected String requireId(JsonNode node) {
        String id = text(node, "id");
        if (id == null) {
            throw new ProviderException(providerId, ProviderFailure.jobFailed("Provider response has no job id"));
        }
        return id;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{providerId='" + providerId + "', baseUrl=" + baseUrl + '}';
    }
}
