package fr.lapetina.genstudio.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.genstudio.domain.model.GenerationRequest;
import fr.lapetina.genstudio.domain.model.TaskStatus;
import fr.lapetina.genstudio.integration.ScriptedProviderAdapter.Behaviour;
import fr.lapetina.genstudio.integration.TestOrchestratorFactory;
import org.junit.jupiter.api.*;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class HttpServerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient client = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(2))
            .build();

    private TestOrchestratorFactory factory;
    private HttpServer server;
    private String baseUrl;

    @BeforeEach
    void setUp() throws IOException {
        factory = TestOrchestratorFactory.create();
        server = new HttpServer("127.0.0.1", 0, 50, 8, factory.getOrchestrator(), factory.getMetricsRegistry());
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getPort();
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.close();
        }
        if (factory != null) {
            factory.close();
        }
    }

    @Test
    @DisplayName("should accept a task and expose its status")
    void shouldAcceptTaskAndExposeStatus() throws Exception {
        HttpResponse<String> submitted = post("/v1/tasks",
                "{\"providerId\":\"scripted-fast\",\"prompt\":\"a lighthouse at dusk\",\"parameters\":{\"duration\":5}}");

        assertThat(submitted.statusCode()).isEqualTo(202);
        String taskId = mapper.readTree(submitted.body()).get("taskId").asText();
        assertThat(factory.getOrchestrator().awaitTerminal(taskId, Duration.ofSeconds(5))).isPresent();

        HttpResponse<String> status = get("/v1/tasks/" + taskId);

        assertThat(status.statusCode()).isEqualTo(200);
        JsonNode snapshot = mapper.readTree(status.body());
        assertThat(snapshot.get("id").asText()).isEqualTo(taskId);
        assertThat(snapshot.get("status").asText()).isEqualTo("SUCCEEDED");
        assertThat(snapshot.get("attempt").asInt()).isEqualTo(1);
        assertThat(snapshot.get("history").size()).isGreaterThanOrEqualTo(3);

        HttpResponse<String> list = get("/v1/tasks");
        assertThat(list.statusCode()).isEqualTo(200);
        assertThat(mapper.readTree(list.body()).size()).isEqualTo(1);
    }

    @Test
    @DisplayName("should return 404 for an unknown task")
    void shouldReturn404ForUnknownTask() throws Exception {
        assertThat(get("/v1/tasks/does-not-exist").statusCode()).isEqualTo(404);
        assertThat(post("/v1/tasks/does-not-exist/cancel", "").statusCode()).isEqualTo(404);
    }

    @Test
    @DisplayName("should return 409 when cancelling a finished task")
    void shouldReturn409WhenCancellingFinishedTask() throws Exception {
        String taskId = factory.getOrchestrator().submit("scripted-fast",
                GenerationRequest.ofPrompt("quick"));
        assertThat(factory.getOrchestrator().awaitTerminal(taskId, Duration.ofSeconds(5))).isPresent();

        HttpResponse<String> response = post("/v1/tasks/" + taskId + "/cancel", "");

        assertThat(response.statusCode()).isEqualTo(409);
        assertThat(mapper.readTree(response.body()).get("error").asText()).contains("SUCCEEDED");
    }

    @Test
    @DisplayName("should accept cancellation of a running task")
    void shouldAcceptCancellationOfRunningTask() throws Exception {
        factory.adapter("scripted-fast").script(Behaviour.HANG);
        String taskId = mapper.readTree(post("/v1/tasks",
                "{\"providerId\":\"scripted-fast\",\"prompt\":\"long one\"}").body()).get("taskId").asText();
        assertThat(factory.adapter("scripted-fast").awaitSubmitCalls(1, Duration.ofSeconds(5))).isTrue();

        HttpResponse<String> response = post("/v1/tasks/" + taskId + "/cancel", "");

        assertThat(response.statusCode()).isEqualTo(202);
        assertThat(factory.getOrchestrator().awaitTerminal(taskId, Duration.ofSeconds(5)))
                .hasValueSatisfying(s -> assertThat(s.status()).isEqualTo(TaskStatus.CANCELLED));
    }

    @Test
    @DisplayName("should return 400 for invalid submissions")
    void shouldReturn400ForInvalidSubmissions() throws Exception {
        assertThat(post("/v1/tasks", "{not json").statusCode()).isEqualTo(400);
        assertThat(post("/v1/tasks", "{\"providerId\":\"nope\",\"prompt\":\"x\"}").statusCode()).isEqualTo(400);
        assertThat(post("/v1/tasks", "{\"providerId\":\"scripted-fast\"}").statusCode()).isEqualTo(400);
        assertThat(factory.getOrchestrator().listTasks()).isEmpty();
    }

    @Test
    @DisplayName("should return 429 when the concurrency budget is saturated")
    void shouldReturn429WhenSaturated() throws Exception {
        factory.adapter("scripted-fast").fallback(Behaviour.HANG);
        for (int i = 0; i < 4; i++) {
            assertThat(post("/v1/tasks", "{\"providerId\":\"scripted-fast\",\"prompt\":\"hang\"}").statusCode())
                    .isEqualTo(202);
        }

        HttpResponse<String> rejected = post("/v1/tasks", "{\"providerId\":\"scripted-fast\",\"prompt\":\"one more\"}");
        HttpResponse<String> queued = post("/v1/tasks",
                "{\"providerId\":\"scripted-fast\",\"prompt\":\"one more\",\"queue\":true}");

        assertThat(rejected.statusCode()).isEqualTo(429);
        assertThat(mapper.readTree(rejected.body()).get("reason").asText()).isEqualTo("CONCURRENCY_BUDGET_SATURATED");
        assertThat(queued.statusCode()).isEqualTo(202);
    }

    @Test
    @DisplayName("should stream snapshots until the task finishes")
    void shouldStreamSnapshotsUntilTaskFinishes() throws Exception {
        String taskId = mapper.readTree(post("/v1/tasks",
                "{\"providerId\":\"scripted-fast\",\"prompt\":\"streamed\"}").body()).get("taskId").asText();

        HttpResponse<String> events = client.send(
                HttpRequest.newBuilder(URI.create(baseUrl + "/v1/tasks/" + taskId + "/events"))
                        .timeout(Duration.ofSeconds(5))
                        .GET()
                        .build(),
                HttpResponse.BodyHandlers.ofString());

        assertThat(events.statusCode()).isEqualTo(200);
        assertThat(events.headers().firstValue("Content-Type")).hasValue("text/event-stream");
        assertThat(events.body()).startsWith("event: snapshot\ndata: ");
        assertThat(events.body()).contains("\"status\":\"QUEUED\"");
        assertThat(events.body().trim()).endsWith("}");
        String lastFrame = events.body().substring(events.body().lastIndexOf("data: "));
        assertThat(lastFrame).contains("\"status\":\"SUCCEEDED\"");
    }

    @Test
    @DisplayName("should keep serving requests while an event stream stays open")
    void shouldKeepServingRequestsWhileEventStreamStaysOpen() throws Exception {
        server.close();
        server = new HttpServer("127.0.0.1", 0, 50, 1, 1, Duration.ofMillis(50),
                factory.getOrchestrator(), factory.getMetricsRegistry());
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getPort();

        factory.adapter("scripted-fast").fallback(Behaviour.HANG);
        String taskId = factory.getOrchestrator().submit("scripted-fast", GenerationRequest.ofPrompt("held open"));
        String eventsPath = "/v1/tasks/" + taskId + "/events";

        HttpResponse<Stream<String>> events = client.send(
                HttpRequest.newBuilder(URI.create(baseUrl + eventsPath))
                        .timeout(Duration.ofSeconds(5))
                        .GET()
                        .build(),
                HttpResponse.BodyHandlers.ofLines());

        assertThat(events.statusCode()).isEqualTo(200);
        try (Stream<String> lines = events.body()) {
            // One exchange thread, and it is not held by the open stream
            assertThat(get("/v1/tasks/" + taskId).statusCode()).isEqualTo(200);

            HttpResponse<String> second = get(eventsPath);
            assertThat(second.statusCode()).isEqualTo(503);
            assertThat(mapper.readTree(second.body()).get("error").asText()).isEqualTo("Too many event streams");

            assertThat(lines.anyMatch(": keep-alive"::equals)).isTrue();
        } finally {
            factory.getOrchestrator().cancel(taskId);
        }
    }

    @Test
    @DisplayName("should list providers and their health")
    void shouldListProvidersAndHealth() throws Exception {
        HttpResponse<String> providers = get("/v1/providers");
        HttpResponse<String> single = get("/v1/providers/scripted-fast/health");
        HttpResponse<String> unknown = get("/v1/providers/nope/health");

        assertThat(providers.statusCode()).isEqualTo(200);
        assertThat(mapper.readTree(providers.body()).findValuesAsText("providerId"))
                .containsExactlyInAnyOrder("scripted-fast", "scripted-fragile", "scripted-single", "scripted-slow",
                        "scripted-limited");
        assertThat(single.statusCode()).isEqualTo(200);
        assertThat(mapper.readTree(single.body()).get("state").asText()).isEqualTo("CLOSED");
        assertThat(unknown.statusCode()).isEqualTo(404);
    }

    @Test
    @DisplayName("should report health and metrics")
    void shouldReportHealthAndMetrics() throws Exception {
        String taskId = factory.getOrchestrator().submit("scripted-fast",
                GenerationRequest.ofPrompt("counted"));
        assertThat(factory.getOrchestrator().awaitTerminal(taskId, Duration.ofSeconds(5))).isPresent();

        HttpResponse<String> health = get("/health");
        HttpResponse<String> metrics = get("/metrics");

        assertThat(health.statusCode()).isEqualTo(200);
        JsonNode body = mapper.readTree(health.body());
        assertThat(body.get("status").asText()).isEqualTo("UP");
        assertThat(body.get("orchestrator").get("maxConcurrency").asInt()).isEqualTo(4);

        assertThat(metrics.statusCode()).isEqualTo(200);
        assertThat(metrics.body()).contains("genstudio_task_transitions_total");
        assertThat(metrics.body()).contains("genstudio_breaker_state");
    }

    private HttpResponse<String> get(String path) throws IOException, InterruptedException {
        return client.send(HttpRequest.newBuilder(URI.create(baseUrl + path))
                        .timeout(Duration.ofSeconds(5))
                        .GET()
                        .build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String json) throws IOException, InterruptedException {
        return client.send(HttpRequest.newBuilder(URI.create(baseUrl + path))
                        .timeout(Duration.ofSeconds(5))
                        .header("Content-Type", "application/json")
                        .POST(HttpRequest.BodyPublishers.ofString(json))
                        .build(),
                HttpResponse.BodyHandlers.ofString());
    }
}
