package fr.lapetina.genstudio.infrastructure.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of the providers known at start-up.
 * Populated once by the factory; lookups are thread-safe.
 */
public final class ProviderRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    private final Map<String, RegisteredProvider> providers = new ConcurrentHashMap<>();

    /**
     * Registers a provider.
     *
     * @throws IllegalArgumentException if a provider with the same ID already exists
     */
    public void register(RegisteredProvider provider) {
        RegisteredProvider previous = providers.putIfAbsent(provider.getId(), provider);
        if (previous != null) {
            throw new IllegalArgumentException("Provider already registered: " + provider.getId());
        }
        log.info("Provider registered: {}", provider);
    }

    public Optional<RegisteredProvider> find(String providerId) {
        if (providerId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(providers.get(providerId));
    }

    /**
     * Returns every provider, sorted by ID.
     */
    public List<RegisteredProvider> getAll() {
        List<RegisteredProvider> all = new ArrayList<>(providers.values());
        all.sort(Comparator.comparing(RegisteredProvider::getId));
        return all;
    }

    public int size() {
        return providers.size();
    }

    /**
     * Closes every adapter.
     */
    @Override
    public void close() {
        for (RegisteredProvider provider : providers.values()) {
            try {
                provider.getAdapter().close();
            } catch (Exception e) {
                log.warn("Error closing adapter: providerId={}", provider.getId(), e);
            }
        }
    }
}
