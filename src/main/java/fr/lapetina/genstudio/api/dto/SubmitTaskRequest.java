package fr.lapetina.genstudio.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import fr.lapetina.genstudio.domain.model.AssetRef;
import fr.lapetina.genstudio.domain.model.GenerationRequest;
import fr.lapetina.genstudio.orchestrator.AdmissionMode;

import java.util.List;
import java.util.Map;

/**
 * Body of {@code POST /v1/tasks}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SubmitTaskRequest {

    private String providerId;
    private String templateId;
    private String prompt;
    private List<Asset> assets;
    private Map<String, Object> parameters;
    private boolean queue;

    // Getters and setters
    public String getProviderId() { return providerId; }
    public void setProviderId(String providerId) { this.providerId = providerId; }

    public String getTemplateId() { return templateId; }
    public void setTemplateId(String templateId) { this.templateId = templateId; }

    public String getPrompt() { return prompt; }
    public void setPrompt(String prompt) { this.prompt = prompt; }

    public List<Asset> getAssets() { return assets; }
    public void setAssets(List<Asset> assets) { this.assets = assets; }

    public Map<String, Object> getParameters() { return parameters; }
    public void setParameters(Map<String, Object> parameters) { this.parameters = parameters; }

    public boolean isQueue() { return queue; }
    public void setQueue(boolean queue) { this.queue = queue; }

    public AdmissionMode admissionMode() {
        return queue ? AdmissionMode.QUEUE : AdmissionMode.REJECT_WHEN_SATURATED;
    }

    /**
     * Converts to domain GenerationRequest.
     *
     * @throws IllegalArgumentException if neither a prompt nor an asset is present
     */
    public GenerationRequest toGenerationRequest() {
        List<AssetRef> domainAssets = null;
        if (assets != null) {
            domainAssets = assets.stream()
                    .map(a -> new AssetRef(a.getUri(), a.getMediaType(), a.getSizeBytes()))
                    .toList();
        }

        return GenerationRequest.builder()
                .templateId(templateId)
                .prompt(prompt)
                .assets(domainAssets)
                .parameters(parameters)
                .build();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Asset {
        private String uri;
        private String mediaType;
        private long sizeBytes;

        public String getUri() { return uri; }
        public void setUri(String uri) { this.uri = uri; }

        public String getMediaType() { return mediaType; }
        public void setMediaType(String mediaType) { this.mediaType = mediaType; }

        public long getSizeBytes() { return sizeBytes; }
        public void setSizeBytes(long sizeBytes) { this.sizeBytes = sizeBytes; }
    }
}
