package fr.lapetina.genstudio.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import fr.lapetina.genstudio.api.dto.SubmitTaskRequest;
import fr.lapetina.genstudio.domain.model.GenerationRequest;
import fr.lapetina.genstudio.domain.model.ProviderHealth;
import fr.lapetina.genstudio.domain.model.TaskSnapshot;
import fr.lapetina.genstudio.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.genstudio.orchestrator.TaskOrchestrator;
import fr.lapetina.genstudio.orchestrator.TaskSubscription;
import fr.lapetina.genstudio.orchestrator.exception.CapacityExceededException;
import fr.lapetina.genstudio.orchestrator.exception.InvalidStateTransitionException;
import fr.lapetina.genstudio.orchestrator.exception.TaskNotFoundException;
import fr.lapetina.genstudio.orchestrator.exception.UnknownProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thin UI-facing HTTP surface over the orchestrator, using JDK's built-in HttpServer.
 *
 * Endpoints:
 * - POST /v1/tasks - Submit a generation task
 * - GET /v1/tasks - List tasks
 * - GET /v1/tasks/{id} - Task snapshot
 * - POST /v1/tasks/{id}/cancel - Request cancellation
 * - GET /v1/tasks/{id}/events - Server-Sent Events stream of snapshots
 * - GET /v1/providers - Health of every provider
 * - GET /v1/providers/{id}/health - Health of one provider
 * - GET /health - Health check endpoint
 * - GET /metrics - Prometheus metrics endpoint
 */
public final class HttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    static final int DEFAULT_MAX_EVENT_STREAMS = 64;
    static final Duration DEFAULT_EVENT_HEARTBEAT = Duration.ofSeconds(15);

    private static final byte[] HEARTBEAT_FRAME = ": keep-alive\n\n".getBytes(StandardCharsets.UTF_8);

    private final com.sun.net.httpserver.HttpServer server;
    private final ExecutorService executor;
    private final ThreadPoolExecutor streamExecutor;
    private final Duration eventHeartbeat;
    private final ObjectMapper objectMapper;
    private final TaskOrchestrator orchestrator;
    private final MetricsRegistry metricsRegistry;

    public HttpServer(
            String host,
            int port,
            int backlog,
            int threads,
            TaskOrchestrator orchestrator,
            MetricsRegistry metricsRegistry
    ) throws IOException {
        this(host, port, backlog, threads, DEFAULT_MAX_EVENT_STREAMS, DEFAULT_EVENT_HEARTBEAT,
                orchestrator, metricsRegistry);
    }

    /**
     * @param threads         exchange threads serving regular requests
     * @param maxEventStreams event streams open at once; further ones get a 503
     * @param eventHeartbeat  idle time after which a keep-alive comment is written to an event stream
     */
    public HttpServer(
            String host,
            int port,
            int backlog,
            int threads,
            int maxEventStreams,
            Duration eventHeartbeat,
            TaskOrchestrator orchestrator,
            MetricsRegistry metricsRegistry
    ) throws IOException {
        if (eventHeartbeat == null || eventHeartbeat.isZero() || eventHeartbeat.isNegative()) {
            throw new IllegalArgumentException("Event heartbeat must be positive");
        }
        this.orchestrator = orchestrator;
        this.metricsRegistry = metricsRegistry;
        this.eventHeartbeat = eventHeartbeat;

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        InetSocketAddress address = host == null || host.isBlank()
                ? new InetSocketAddress(port)
                : new InetSocketAddress(host, port);
        this.server = com.sun.net.httpserver.HttpServer.create(address, backlog);

        this.executor = Executors.newFixedThreadPool(threads, new NamedThreadFactory("http-exchange-"));
        server.setExecutor(executor);

        // Event streams hold a thread each for their whole lifetime, so they get their own bounded pool
        this.streamExecutor = new ThreadPoolExecutor(0, maxEventStreams, 60, TimeUnit.SECONDS,
                new SynchronousQueue<>(), new NamedThreadFactory("event-stream-"));

        // Register handlers
        server.createContext("/v1/tasks", new TasksHandler());
        server.createContext("/v1/providers", new ProvidersHandler());
        server.createContext("/health", new HealthHandler());
        server.createContext("/metrics", new MetricsHandler());

        log.info("HTTP server configured on {}:{}", host, getPort());
    }

    public void start() {
        server.start();
        log.info("HTTP server started");
    }

    /**
     * Returns the bound port, useful when configured with port 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(1);
        streamExecutor.shutdownNow();
        executor.shutdownNow();
        log.info("HTTP server stopped");
    }

    // ==================== TASKS HANDLER ====================

    private class TasksHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            MDC.put("requestId", UUID.randomUUID().toString());
            String path = trimTrailingSlash(exchange.getRequestURI().getPath());
            String method = exchange.getRequestMethod();
            String[] parts = path.split("/");

            try {
                // parts: "", "v1", "tasks", id, action
                if (parts.length == 3) {
                    if ("POST".equalsIgnoreCase(method)) {
                        handleSubmit(exchange);
                    } else if ("GET".equalsIgnoreCase(method)) {
                        sendJson(exchange, 200, orchestrator.listTasks());
                    } else {
                        sendError(exchange, 405, "Method Not Allowed");
                    }
                } else if (parts.length == 4 && "GET".equalsIgnoreCase(method)) {
                    sendJson(exchange, 200, orchestrator.getStatus(parts[3]));
                } else if (parts.length == 5 && "cancel".equals(parts[4]) && "POST".equalsIgnoreCase(method)) {
                    orchestrator.cancel(parts[3]);
                    sendJson(exchange, 202, Map.of("taskId", parts[3], "message", "Cancellation requested"));
                } else if (parts.length == 5 && "events".equals(parts[4]) && "GET".equalsIgnoreCase(method)) {
                    handleEvents(exchange, parts[3]);
                } else {
                    sendError(exchange, 404, "Not Found");
                }
            } catch (TaskNotFoundException e) {
                sendError(exchange, 404, e.getMessage());
            } catch (InvalidStateTransitionException e) {
                sendError(exchange, 409, e.getMessage());
            } catch (IOException e) {
                log.warn("I/O error on {} {}: {}", method, path, e.getMessage());
            } catch (RuntimeException e) {
                log.error("Error handling {} {}", method, path, e);
                sendError(exchange, 500, "Internal server error: " + e.getMessage());
            } finally {
                MDC.remove("requestId");
            }
        }

        private void handleSubmit(HttpExchange exchange) throws IOException {
            SubmitTaskRequest body;
            GenerationRequest request;
            try (InputStream is = exchange.getRequestBody()) {
                body = objectMapper.readValue(is, SubmitTaskRequest.class);
                request = body.toGenerationRequest();
            } catch (JsonProcessingException e) {
                sendError(exchange, 400, "Malformed request body: " + e.getOriginalMessage());
                return;
            } catch (IllegalArgumentException | NullPointerException e) {
                sendError(exchange, 400, e.getMessage());
                return;
            }

            try {
                String taskId = orchestrator.submit(body.getProviderId(), request, body.admissionMode());
                sendJson(exchange, 202, Map.of("taskId", taskId));
            } catch (UnknownProviderException e) {
                sendError(exchange, 400, e.getMessage());
            } catch (CapacityExceededException e) {
                log.warn("Submission rejected: reason={}", e.getReason());
                Map<String, String> error = new LinkedHashMap<>();
                error.put("error", e.getMessage());
                error.put("reason", e.getReason().name());
                sendJson(exchange, 429, error);
            }
        }

        private void handleEvents(HttpExchange exchange, String taskId) throws IOException {
            // Resolve before committing headers so unknown IDs still get a 404
            TaskSubscription subscription = orchestrator.subscribe(taskId);
            try {
                streamExecutor.execute(() -> streamSnapshots(exchange, subscription));
            } catch (RejectedExecutionException e) {
                subscription.close();
                log.warn("Event stream rejected, {} streams already open: taskId={}",
                        streamExecutor.getActiveCount(), taskId);
                sendError(exchange, 503, "Too many event streams");
            }
        }
    }

    private void streamSnapshots(HttpExchange exchange, TaskSubscription subscription) {
        String taskId = subscription.getTaskId();
        try (subscription) {
            exchange.getResponseHeaders().set("Content-Type", "text/event-stream");
            exchange.getResponseHeaders().set("Cache-Control", "no-cache");
            exchange.sendResponseHeaders(200, 0);
            OutputStream os = exchange.getResponseBody();
            while (true) {
                Optional<TaskSnapshot> next = subscription.next(eventHeartbeat);
                if (next.isEmpty()) {
                    os.write(HEARTBEAT_FRAME);
                    os.flush();
                    continue;
                }
                TaskSnapshot snapshot = next.get();
                String frame = "event: snapshot\ndata: " + objectMapper.writeValueAsString(snapshot) + "\n\n";
                os.write(frame.getBytes(StandardCharsets.UTF_8));
                os.flush();
                if (snapshot.isTerminal()) {
                    break;
                }
            }
        } catch (IOException e) {
            log.debug("Event stream closed by client: taskId={}, reason={}", taskId, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Event stream interrupted: taskId={}", taskId);
        } finally {
            exchange.close();
        }
    }

    // ==================== PROVIDERS HANDLER ====================

    private class ProvidersHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            MDC.put("requestId", UUID.randomUUID().toString());
            String path = trimTrailingSlash(exchange.getRequestURI().getPath());
            String[] parts = path.split("/");

            try {
                if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                    sendError(exchange, 405, "Method Not Allowed");
                } else if (parts.length == 3) {
                    sendJson(exchange, 200, orchestrator.getProviderHealth());
                } else if (parts.length == 5 && "health".equals(parts[4])) {
                    sendJson(exchange, 200, orchestrator.getProviderHealth(parts[3]));
                } else {
                    sendError(exchange, 404, "Not Found");
                }
            } catch (UnknownProviderException e) {
                sendError(exchange, 404, e.getMessage());
            } finally {
                MDC.remove("requestId");
            }
        }
    }

    // ==================== HEALTH HANDLER ====================

    private class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            List<ProviderHealth> providers = orchestrator.getProviderHealth();

            Map<String, Object> health = new LinkedHashMap<>();
            health.put("status", determineOverallHealth(providers));
            health.put("timestamp", System.currentTimeMillis());
            health.put("providers", providers);

            Map<String, Object> orchestratorStats = new LinkedHashMap<>();
            orchestratorStats.put("maxConcurrency", orchestrator.getBudget().getMaxConcurrency());
            orchestratorStats.put("reserved", orchestrator.getBudget().getReserved());
            orchestratorStats.put("inFlight", orchestrator.getBudget().getInFlight());
            orchestratorStats.put("ringBufferRemaining", orchestrator.getRemainingCapacity());
            orchestratorStats.put("tasks", orchestrator.getTaskRegistry().size());
            health.put("orchestrator", orchestratorStats);

            int statusCode = "DOWN".equals(health.get("status")) ? 503 : 200;
            sendJson(exchange, statusCode, health);
        }

        private String determineOverallHealth(List<ProviderHealth> providers) {
            if (!orchestrator.isRunning() || providers.isEmpty()) {
                return "DOWN";
            }

            long available = providers.stream()
                    .filter(ProviderHealth::isAvailable)
                    .count();

            if (available == 0) {
                return "DOWN";
            } else if (available < providers.size()) {
                return "DEGRADED";
            }
            return "UP";
        }
    }

    // ==================== METRICS HANDLER ====================

    private class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            String metrics = metricsRegistry.scrape();
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
            byte[] bytes = metrics.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }
    }

    // ==================== HELPER METHODS ====================

    private static String trimTrailingSlash(String path) {
        return path.length() > 1 && path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
    }

    private void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        byte[] bytes = objectMapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
        Map<String, String> error = Map.of("error", message != null ? message : "Unknown error");
        sendJson(exchange, statusCode, error);
    }

    private static class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
