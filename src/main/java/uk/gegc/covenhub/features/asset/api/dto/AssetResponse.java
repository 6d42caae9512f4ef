package uk.gegc.covenhub.features.asset.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.covenhub.features.asset.domain.model.AssetType;

import java.time.Instant;
import java.util.UUID;

@Schema(description = "Stored asset metadata")
public record AssetResponse(
        @Schema(description = "Asset identifier")
        UUID id,
        @Schema(description = "Original filename", example = "altar.png")
        String fileName,
        @Schema(description = "Unique stored filename", example = "9f2c...e1.png")
        String hashedFileName,
        @Schema(description = "Mime type", example = "image/png")
        String mimeType,
        @Schema(description = "Size in bytes", example = "834233")
        Long fileSize,
        @Schema(description = "Object key in storage", example = "prod/assets/images/9f2c...e1.png")
        String storageKey,
        @Schema(description = "Storage URL")
        String storageUrl,
        @Schema(description = "Time-limited download URL, when requested")
        String signedUrl,
        @Schema(description = "Asset type", example = "image")
        AssetType assetType,
        @Schema(description = "Owner that uploaded the asset")
        String uploadedBy,
        @Schema(description = "Created at timestamp", example = "2024-12-10T00:00:00Z")
        Instant createdAt,
        @Schema(description = "Updated at timestamp", example = "2024-12-11T00:00:00Z")
        Instant updatedAt
) {
}
