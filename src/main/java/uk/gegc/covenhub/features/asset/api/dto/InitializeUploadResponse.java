package uk.gegc.covenhub.features.asset.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.covenhub.features.asset.domain.model.UploadStatus;

import java.time.Instant;

@Schema(description = "Chunk plan of a newly opened upload session")
public record InitializeUploadResponse(
        @Schema(description = "Opaque upload identifier (64 hex characters)")
        String uploadId,
        @Schema(description = "Original filename", example = "full-moon-ritual.mp4")
        String fileName,
        @Schema(description = "Total file size in bytes", example = "1048576")
        long totalSize,
        @Schema(description = "Bytes per chunk (last chunk carries the remainder)", example = "262144")
        long chunkSize,
        @Schema(description = "Number of chunks to send", example = "4")
        int totalChunks,
        @Schema(description = "Session status", example = "uploading")
        UploadStatus status,
        @Schema(description = "Session creation time", example = "2024-12-10T00:00:00Z")
        Instant createdAt
) {
}
