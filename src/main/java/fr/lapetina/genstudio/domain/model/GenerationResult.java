package fr.lapetina.genstudio.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;
import java.util.Objects;

/**
 * Output reference produced by a provider on success.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GenerationResult(
        String outputUrl,
        String thumbnailUrl,
        Map<String, Object> metadata
) {
    public GenerationResult {
        Objects.requireNonNull(outputUrl, "Output URL is required");
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    public static GenerationResult of(String outputUrl) {
        return new GenerationResult(outputUrl, null, null);
    }

    public static GenerationResult of(String outputUrl, String thumbnailUrl) {
        return new GenerationResult(outputUrl, thumbnailUrl, null);
    }
}
