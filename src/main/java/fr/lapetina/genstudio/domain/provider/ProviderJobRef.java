package fr.lapetina.genstudio.domain.provider;

import java.time.Instant;
import java.util.Objects;

/**
 * Opaque handle to a job running at a provider.
 */
public record ProviderJobRef(String providerId, String jobId, Instant submittedAt) {

    public ProviderJobRef {
        Objects.requireNonNull(providerId, "Provider ID is required");
        Objects.requireNonNull(jobId, "Job ID is required");
        if (submittedAt == null) {
            submittedAt = Instant.now();
        }
    }

    public static ProviderJobRef of(String providerId, String jobId) {
        return new ProviderJobRef(providerId, jobId, null);
    }
}
