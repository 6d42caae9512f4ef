package uk.gegc.covenhub.features.asset.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.covenhub.features.asset.domain.model.UploadStatus;

import java.time.Instant;
import java.util.UUID;

@Schema(description = "Progress of a chunked upload session")
public record UploadProgressResponse(
        String uploadId,
        String fileName,
        @Schema(example = "1048576")
        long totalSize,
        @Schema(example = "786432")
        long uploadedSize,
        @Schema(example = "3")
        int chunksUploaded,
        @Schema(example = "4")
        int totalChunks,
        @Schema(description = "Whole percent uploaded, rounded down", example = "75")
        int progress,
        @Schema(example = "uploading")
        UploadStatus status,
        Instant createdAt,
        Instant lastUpdated,
        @Schema(description = "Asset created when the session completed")
        UUID assetId
) {
}
