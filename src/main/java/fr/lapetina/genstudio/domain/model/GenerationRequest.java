package fr.lapetina.genstudio.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Opaque generation payload handed to a provider adapter.
 * Immutable and thread-safe; owned by exactly one task.
 *
 * @param templateId template the payload was resolved from, may be null
 * @param prompt     text prompt, may be null when assets are supplied
 * @param assets     references to input images (never raw bytes)
 * @param parameters provider parameters (aspect ratio, duration, seed...)
 */
public record GenerationRequest(
        String templateId,
        String prompt,
        List<AssetRef> assets,
        Map<String, Object> parameters
) {
    public GenerationRequest {
        assets = assets != null ? List.copyOf(assets) : List.of();
        if ((prompt == null || prompt.isBlank()) && assets.isEmpty()) {
            throw new IllegalArgumentException("Either prompt or assets must be provided");
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        if (parameters != null) {
            parameters.forEach((key, value) -> {
                if (key != null && value != null) {
                    copy.put(key, value);
                }
            });
        }
        parameters = Collections.unmodifiableMap(copy);
    }

    public static GenerationRequest ofPrompt(String prompt) {
        return new GenerationRequest(null, prompt, null, null);
    }

    /**
     * Image-to-X request: a prompt applied to a single source image.
     */
    public static GenerationRequest ofImage(String prompt, AssetRef image) {
        Objects.requireNonNull(image, "Image is required");
        return new GenerationRequest(null, prompt, List.of(image), null);
    }

    /**
     * Returns the first image asset, used as the reference frame by video models.
     */
    public Optional<AssetRef> primaryImage() {
        return assets.stream()
                .filter(a -> a.isImage() || a.mediaType() == null)
                .findFirst();
    }

    public Optional<Object> parameter(String name) {
        return Optional.ofNullable(parameters.get(name));
    }

    public String stringParameter(String name, String defaultValue) {
        Object value = parameters.get(name);
        return value != null ? value.toString() : defaultValue;
    }

    public int intParameter(String name, int defaultValue) {
        Object value = parameters.get(name);
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value != null) {
            try {
                return Integer.parseInt(value.toString().trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Parameter '" + name + "' is not an integer: " + value, e);
            }
        }
        return defaultValue;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String templateId;
        private String prompt;
        private final List<AssetRef> assets = new ArrayList<>();
        private final Map<String, Object> parameters = new LinkedHashMap<>();

        public Builder templateId(String templateId) {
            this.templateId = templateId;
            return this;
        }

        public Builder prompt(String prompt) {
            this.prompt = prompt;
            return this;
        }

        public Builder addAsset(AssetRef asset) {
            this.assets.add(asset);
            return this;
        }

        public Builder assets(List<AssetRef> assets) {
            this.assets.clear();
            if (assets != null) {
                this.assets.addAll(assets);
            }
            return this;
        }

        public Builder parameter(String name, Object value) {
            this.parameters.put(name, value);
            return this;
        }

        public Builder parameters(Map<String, Object> parameters) {
            if (parameters != null) {
                this.parameters.putAll(parameters);
            }
            return this;
        }

        public GenerationRequest build() {
            return new GenerationRequest(templateId, prompt, assets, parameters);
        }
    }
}
