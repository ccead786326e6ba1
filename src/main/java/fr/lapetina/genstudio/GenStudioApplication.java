package fr.lapetina.genstudio;

import fr.lapetina.genstudio.api.HttpServer;
import fr.lapetina.genstudio.infrastructure.config.OrchestratorConfig.ServerConfig;
import fr.lapetina.genstudio.infrastructure.provider.RegisteredProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Runs a started orchestrator behind its HTTP surface until {@link #close()} is called,
 * either directly or from the JVM shutdown hook installed by {@link #main(String[])}.
 *
 * <p>The configuration file is the first argument, else {@value #CONFIG_ENV}, else {@code config.yaml}.
 */
public final class GenStudioApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(GenStudioApplication.class);

    static final String CONFIG_ENV = "GENSTUDIO_CONFIG";
    static final String DEFAULT_CONFIG = "config.yaml";

    private final OrchestratorFactory factory;
    private final HttpServer httpServer;
    private final CountDownLatch stopped = new CountDownLatch(1);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private GenStudioApplication(OrchestratorFactory factory, HttpServer httpServer) {
        this.factory = factory;
        this.httpServer = httpServer;
    }

    /**
     * Loads the configuration, starts the orchestrator and serves it.
     */
    public static GenStudioApplication launch(String configPath) throws IOException {
        log.info("Loading configuration from {}", configPath);
        return launch(OrchestratorFactory.create(configPath).start());
    }

    /**
     * Serves an already started orchestrator. The factory is closed if the server cannot bind.
     */
    public static GenStudioApplication launch(OrchestratorFactory factory) throws IOException {
        ServerConfig server = factory.getConfig().getServer();
        HttpServer httpServer;
        try {
            httpServer = new HttpServer(
                    server.getHost(),
                    server.getPort(),
                    server.getBacklog(),
                    server.getThreads(),
                    server.getMaxEventStreams(),
                    Duration.ofMillis(server.getEventHeartbeatMs()),
                    factory.getOrchestrator(),
                    factory.getMetricsRegistry()
            );
        } catch (IOException | RuntimeException e) {
            factory.close();
            throw e;
        }
        httpServer.start();

        String providers = factory.getProviderRegistry().getAll().stream()
                .map(RegisteredProvider::getId)
                .collect(Collectors.joining(", "));
        log.info("Serving on port {} with providers [{}]", httpServer.getPort(), providers);
        return new GenStudioApplication(factory, httpServer);
    }

    public int getPort() {
        return httpServer.getPort();
    }

    public OrchestratorFactory getFactory() {
        return factory;
    }

    /**
     * Blocks until the application has been closed.
     */
    public void awaitStop() throws InterruptedException {
        stopped.await();
    }

    /**
     * Stops accepting requests, then shuts the orchestrator down. Idempotent.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        httpServer.close();
        factory.close();
        stopped.countDown();
        log.info("Stopped");
    }

    static String resolveConfigPath(String[] args, Map<String, String> env) {
        if (args.length > 0 && !args[0].isBlank()) {
            return args[0];
        }
        String fromEnv = env.get(CONFIG_ENV);
        return fromEnv != null && !fromEnv.isBlank() ? fromEnv : DEFAULT_CONFIG;
    }

    public static void main(String[] args) {
        GenStudioApplication app;
        try {
            app = launch(resolveConfigPath(args, System.getenv()));
        } catch (IOException | RuntimeException e) {
            log.error("Startup failed", e);
            System.exit(1);
            return;
        }

        Runtime.getRuntime().addShutdownHook(new Thread(app::close, "genstudio-shutdown"));
        try {
            app.awaitStop();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            app.close();
        }
    }
}
