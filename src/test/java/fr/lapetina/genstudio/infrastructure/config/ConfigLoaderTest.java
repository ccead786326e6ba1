package fr.lapetina.genstudio.infrastructure.config;

import fr.lapetina.genstudio.infrastructure.config.ConfigLoader.ConfigurationException;
import org.junit.jupiter.api.*;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    private final ConfigLoader loader = new ConfigLoader("unused.yaml");

    private static InputStream yaml(String content) {
        return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("should load the test configuration from the classpath")
    void shouldLoadFromClasspath() {
        OrchestratorConfig config = new ConfigLoader("test-config.yaml").load();

        assertThat(config.getOrchestrator().getMaxConcurrency()).isEqualTo(4);
        assertThat(config.getOrchestrator().getCancelGracePeriodMs()).isEqualTo(300);
        assertThat(config.getRetry().getBaseDelayMs()).isEqualTo(20);
        assertThat(config.getCircuitBreaker().getFailureThreshold()).isEqualTo(5);
        assertThat(config.getProviders())
                .extracting(OrchestratorConfig.ProviderConfig::getId)
                .contains("scripted-fast", "disabled-video");
        assertThat(config.getProviders())
                .filteredOn(p -> p.getId().equals("scripted-fragile"))
                .singleElement()
                .extracting(OrchestratorConfig.ProviderConfig::getMaxAttempts)
                .isEqualTo(1);
    }

    @Test
    @DisplayName("should apply defaults for omitted sections")
    void shouldApplyDefaultsForOmittedSections() {
        OrchestratorConfig config = loader.loadFromStream(yaml("""
                providers:
                  - id: luma
                    type: luma
                    apiKey: secret
                """));

        assertThat(config.getOrchestrator().getMaxConcurrency()).isEqualTo(4);
        assertThat(config.getOrchestrator().getRingBufferSize()).isEqualTo(1024);
        assertThat(config.getRetry().getMaxAttempts()).isEqualTo(3);
        assertThat(config.getRetry().getUnknownMaxAttempts()).isEqualTo(2);
        assertThat(config.getRetry().isWaitForOpenBreaker()).isFalse();
        assertThat(config.getMetrics().getPrefix()).isEqualTo("genstudio");

        OrchestratorConfig.ProviderConfig provider = config.getProviders().get(0);
        assertThat(provider.isEnabled()).isTrue();
        assertThat(provider.getMaxAttempts()).isNull();
        assertThat(provider.resolveApiKey()).isEqualTo("secret");
        assertThat(provider.getOptions()).isEmpty();
    }

    @Test
    @DisplayName("should treat an empty document as the default configuration")
    void shouldTreatEmptyDocumentAsDefault() {
        OrchestratorConfig config = loader.loadFromStream(yaml(""));

        assertThat(config.getProviders()).isEmpty();
        assertThat(config.getServer().getPort()).isEqualTo(8080);
    }

    @Test
    @DisplayName("should report every validation problem at once")
    void shouldReportEveryValidationProblem() {
        assertThatThrownBy(() -> loader.loadFromStream(yaml("""
                orchestrator:
                  maxConcurrency: 0
                  ringBufferSize: 1000
                retry:
                  maxAttempts: 0
                providers:
                  - id: luma
                    type: luma
                  - id: luma
                    type: runway
                    maxConcurrency: 0
                """)))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("orchestrator.maxConcurrency must be >= 1")
                .hasMessageContaining("ringBufferSize must be a power of 2")
                .hasMessageContaining("retry.maxAttempts must be >= 1")
                .hasMessageContaining("duplicate provider id: luma")
                .hasMessageContaining("provider luma: maxConcurrency must be >= 1");
    }

    @Test
    @DisplayName("should read provider rate limits and event stream settings")
    void shouldReadRateLimitsAndEventStreamSettings() {
        OrchestratorConfig config = loader.loadFromStream(yaml("""
                server:
                  maxEventStreams: 8
                  eventHeartbeatMs: 5000
                providers:
                  - id: luma
                    type: luma
                    rateLimit:
                      maxRequests: 5
                      windowMs: 1000
                  - id: runway
                    type: runway
                """));

        assertThat(config.getServer().getMaxEventStreams()).isEqualTo(8);
        assertThat(config.getServer().getEventHeartbeatMs()).isEqualTo(5000);
        OrchestratorConfig.RateLimitConfig rateLimit = config.getProviders().get(0).getRateLimit();
        assertThat(rateLimit.getMaxRequests()).isEqualTo(5);
        assertThat(rateLimit.getWindowMs()).isEqualTo(1000);
        assertThat(config.getProviders().get(1).getRateLimit()).isNull();
    }

    @Test
    @DisplayName("should reject unusable rate limits and event stream settings")
    void shouldRejectUnusableRateLimitsAndEventStreamSettings() {
        assertThatThrownBy(() -> loader.loadFromStream(yaml("""
                server:
                  maxEventStreams: 0
                  eventHeartbeatMs: 0
                providers:
                  - id: luma
                    type: luma
                    rateLimit:
                      maxRequests: 0
                      windowMs: 1000
                """)))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("server.threads and server.maxEventStreams must be >= 1")
                .hasMessageContaining("server.eventHeartbeatMs must be > 0")
                .hasMessageContaining("provider luma: rateLimit needs maxRequests >= 1 and windowMs > 0");
    }

    @Test
    @DisplayName("should reject a provider without id or type")
    void shouldRejectProviderWithoutIdOrType() {
        assertThatThrownBy(() -> loader.loadFromStream(yaml("""
                providers:
                  - type: luma
                  - id: runway
                """)))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("providers[].id is required")
                .hasMessageContaining("provider runway: type is required");
    }

    @Test
    @DisplayName("should reject malformed YAML")
    void shouldRejectMalformedYaml() {
        assertThatThrownBy(() -> loader.loadFromStream(yaml("orchestrator: [unclosed")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageStartingWith("Invalid YAML");
    }

    @Test
    @DisplayName("should fail when the file cannot be found")
    void shouldFailWhenFileMissing() {
        assertThatThrownBy(() -> new ConfigLoader("does-not-exist.yaml").load())
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("not found");
    }
}
