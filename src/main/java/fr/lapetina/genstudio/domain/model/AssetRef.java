package fr.lapetina.genstudio.domain.model;

import java.util.Objects;

/**
 * Reference to a validated, size-bounded asset held by the asset service.
 * Only the reference is stored; never the bytes.
 */
public record AssetRef(String uri, String mediaType, long sizeBytes) {

    public AssetRef {
        Objects.requireNonNull(uri, "Asset URI is required");
        if (uri.isBlank()) {
            throw new IllegalArgumentException("Asset URI must not be blank");
        }
        if (sizeBytes < 0) {
            throw new IllegalArgumentException("Asset size must not be negative");
        }
    }

    public static AssetRef of(String uri, String mediaType) {
        return new AssetRef(uri, mediaType, 0);
    }

    public boolean isImage() {
        return mediaType != null && mediaType.startsWith("image/");
    }
}
