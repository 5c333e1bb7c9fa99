package fr.lapetina.hotswap.domain.model;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;

/**
 * An immutable, stored model artifact. Newer uploads supersede it, never mutate it.
 */
public record ArtifactVersion(
        String modelName,
        long version,
        String contentHash,
        Path storagePath,
        Instant createdAt
) {
    public ArtifactVersion {
        Objects.requireNonNull(modelName, "Model name is required");
        Objects.requireNonNull(contentHash, "Content hash is required");
        Objects.requireNonNull(storagePath, "Storage path is required");
        if (version < 1) {
            throw new IllegalArgumentException("Version must be positive: " + version);
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    /**
     * Returns true if both versions carry byte-identical content.
     */
    public boolean sameContentAs(ArtifactVersion other) {
        return other != null && contentHash.equals(other.contentHash);
    }

    /**
     * Short version identifier, e.g. {@code v3-1a2b3c4d5e6f}.
     */
    public String label() {
        return "v" + version + "-" + contentHash.substring(0, Math.min(12, contentHash.length()));
    }
}
