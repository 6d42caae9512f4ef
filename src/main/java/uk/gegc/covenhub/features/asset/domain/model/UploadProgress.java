package uk.gegc.covenhub.features.asset.domain.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Point-in-time view of a session, derived entirely from its admitted chunks.
 * {@code assetId} is set once the session completed.
 */
public record UploadProgress(
        String uploadId,
        String fileName,
        long totalSize,
        long uploadedSize,
        int chunksUploaded,
        int totalChunks,
        int progress,
        UploadStatus status,
        Instant createdAt,
        Instant lastUpdated,
        UUID assetId
) {
}
