package uk.gegc.covenhub.features.asset.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

@Schema(description = "Request to open a chunked upload session")
public record InitializeUploadRequest(
        @NotBlank
        @Size(max = 512)
        @Schema(description = "Original filename", example = "full-moon-ritual.mp4")
        String fileName,

        @NotNull
        @Min(1)
        @Schema(description = "Total file size in bytes", example = "1048576")
        Long totalSize,

        @Min(1)
        @Schema(description = "Bytes per chunk; the server default applies when omitted", example = "262144")
        Long chunkSize,

        @Min(1)
        @Schema(description = "Declared chunk count; must equal ceil(totalSize / chunkSize) when given", example = "4")
        Integer totalChunks,

        @NotBlank
        @Schema(description = "Mime type of the file", example = "video/mp4")
        String mimeType
) {
}
