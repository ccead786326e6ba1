package fr.lapetina.genstudio.infrastructure.provider;

import fr.lapetina.genstudio.domain.provider.ProviderAdapter;
import fr.lapetina.genstudio.infrastructure.config.OrchestratorConfig.ProviderConfig;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Creates provider adapters from their configured {@code type}.
 *
 * New provider kinds are added by registering a creator; the orchestrator never
 * branches on the concrete adapter.
 */
public final class ProviderAdapterFactory {

    /**
     * Builds an adapter from its configuration and resolved API key.
     */
    @FunctionalInterface
    public interface AdapterCreator {
        ProviderAdapter create(ProviderConfig config, String apiKey);
    }

    private static final Map<String, AdapterCreator> REGISTRY = new ConcurrentHashMap<>();

    static {
        register("image-compositor", (config, apiKey) -> new ImageCompositorAdapter(
                config.getId(),
                URI.create(requireBaseUrl(config)),
                apiKey,
                config.getModel() != null ? config.getModel() : Objects.toString(config.getOptions().get("version"), null),
                Duration.ofMillis(config.getConnectTimeoutMs()),
                Duration.ofMillis(config.getTimeoutMs())
        ));
        register("luma", (config, apiKey) -> new LumaVideoAdapter(
                config.getId(),
                URI.create(requireBaseUrl(config)),
                apiKey,
                config.getModel(),
                Duration.ofMillis(config.getConnectTimeoutMs()),
                Duration.ofMillis(config.getTimeoutMs())
        ));
        register("runway", (config, apiKey) -> new RunwayVideoAdapter(
                config.getId(),
                URI.create(requireBaseUrl(config)),
                apiKey,
                config.getModel(),
                Objects.toString(config.getOptions().get("apiVersion"), null),
                Duration.ofMillis(config.getConnectTimeoutMs()),
                Duration.ofMillis(config.getTimeoutMs())
        ));
    }

    private ProviderAdapterFactory() {
        // Utility class
    }

    /**
     * Registers a custom adapter type.
     *
     * @param type    type name used in configuration
     * @param creator factory for adapter instances
     */
    public static void register(String type, AdapterCreator creator) {
        REGISTRY.put(type.toLowerCase(), creator);
    }

    public static boolean isSupported(String type) {
        return type != null && REGISTRY.containsKey(type.toLowerCase());
    }

    /**
     * Creates an adapter for the given provider configuration.
     *
     * @return the adapter, or empty if the type is unknown
     */
    public static Optional<ProviderAdapter> create(ProviderConfig config, String apiKey) {
        if (config.getType() == null) {
            return Optional.empty();
        }
        AdapterCreator creator = REGISTRY.get(config.getType().toLowerCase());
        if (creator == null) {
            return Optional.empty();
        }
        return Optional.of(creator.create(config, apiKey));
    }

    /**
     * Returns all registered type names.
     */
    public static Set<String> getRegisteredTypes() {
        return new TreeSet<>(REGISTRY.keySet());
    }

    private static String requireBaseUrl(ProviderConfig config) {
        if (config.getBaseUrl() == null || config.getBaseUrl().isBlank()) {
            throw new IllegalArgumentException("Provider " + config.getId() + " has no baseUrl");
        }
        return config.getBaseUrl();
    }
}
