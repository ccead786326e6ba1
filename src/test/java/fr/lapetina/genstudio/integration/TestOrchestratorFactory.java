package fr.lapetina.genstudio.integration;

import fr.lapetina.genstudio.OrchestratorFactory;
import fr.lapetina.genstudio.domain.provider.ProviderAdapter;
import fr.lapetina.genstudio.infrastructure.resilience.MutableClock;

import java.util.HashMap;
import java.util.Map;

/**
 * Test extension of OrchestratorFactory that replaces every provider with a scripted adapter.
 */
public final class TestOrchestratorFactory extends OrchestratorFactory {

    static final String[] PROVIDER_IDS = {"scripted-fast", "scripted-fragile", "scripted-single", "scripted-slow",
            "scripted-limited"};

    private final Map<String, ScriptedProviderAdapter> adapters;
    private final MutableClock clock;

    private TestOrchestratorFactory(String configPath, Map<String, ScriptedProviderAdapter> adapters, MutableClock clock) {
        super(configPath, new HashMap<String, ProviderAdapter>(adapters), clock);
        this.adapters = adapters;
        this.clock = clock;
    }

    /**
     * Creates and starts a test factory from the default test configuration.
     */
    public static TestOrchestratorFactory create() {
        return create("test-config.yaml");
    }

    /**
     * Creates and starts a test factory from a custom configuration path.
     */
    public static TestOrchestratorFactory create(String configPath) {
        Map<String, ScriptedProviderAdapter> adapters = new HashMap<>();
        for (String id : PROVIDER_IDS) {
            adapters.put(id, new ScriptedProviderAdapter(id));
        }
        TestOrchestratorFactory factory = new TestOrchestratorFactory(configPath, adapters, new MutableClock());
        factory.start();
        return factory;
    }

    public ScriptedProviderAdapter adapter(String providerId) {
        ScriptedProviderAdapter adapter = adapters.get(providerId);
        if (adapter == null) {
            throw new IllegalArgumentException("No scripted adapter for " + providerId);
        }
        return adapter;
    }

    /**
     * Clock driving breakers and task timestamps; only moves when advanced.
     */
    public MutableClock getClock() {
        return clock;
    }
}
