package uk.gegc.covenhub.features.asset.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import uk.gegc.covenhub.features.asset.api.dto.AssetResponse;
import uk.gegc.covenhub.features.asset.api.dto.InitializeUploadRequest;
import uk.gegc.covenhub.features.asset.api.dto.InitializeUploadResponse;
import uk.gegc.covenhub.features.asset.api.dto.UploadProgressResponse;
import uk.gegc.covenhub.features.asset.application.UploadService;
import uk.gegc.covenhub.shared.security.PermissionName;
import uk.gegc.covenhub.shared.security.annotation.RequirePermission;

@RestController
@RequestMapping("/api/v1/assets/uploads")
@Validated
@RequiredArgsConstructor
@SecurityRequirement(name = "Bearer Authentication")
@Tag(name = "Asset Uploads", description = "Direct and resumable chunked uploads of images and videos")
public class UploadController {

    public static final String CHUNK_HASH_HEADER = "X-Chunk-Hash";

    private final UploadService uploadService;

    @Operation(summary = "Open a chunked upload session")
    @ApiResponse(responseCode = "201", description = "Session created",
            content = @Content(schema = @Schema(implementation = InitializeUploadResponse.class)))
    @ApiResponse(responseCode = "400", description = "Inconsistent size/chunk arithmetic or unsupported type",
            content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    @RequirePermission(PermissionName.ASSET_CREATE)
    @PostMapping("/chunked")
    public ResponseEntity<InitializeUploadResponse> initializeUpload(
            Authentication authentication,
            @Valid @RequestBody InitializeUploadRequest request) {
        InitializeUploadResponse response = uploadService.initializeUpload(request, callerId(authentication));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @Operation(summary = "Send one chunk; safe to retry and to send in any order")
    @ApiResponse(responseCode = "200", description = "Chunk admitted",
            content = @Content(schema = @Schema(implementation = UploadProgressResponse.class)))
    @ApiResponse(responseCode = "409", description = "Session no longer accepts chunks",
            content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    @ApiResponse(responseCode = "410", description = "Session expired",
            content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    @ApiResponse(responseCode = "422", description = "Chunk hash mismatch",
            content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    @RequirePermission(PermissionName.ASSET_CREATE)
    @PutMapping(path = "/chunked/{uploadId}/chunks/{chunkIndex}", consumes = MediaType.APPLICATION_OCTET_STREAM_VALUE)
    public UploadProgressResponse uploadChunk(
            Authentication authentication,
            @PathVariable String uploadId,
            @PathVariable int chunkIndex,
            @Parameter(description = "Hex SHA-256 of the chunk body")
            @RequestHeader(CHUNK_HASH_HEADER) String chunkHash,
            @RequestBody byte[] chunk) {
        return uploadService.uploadChunk(uploadId, chunkIndex, chunk, chunkHash, callerId(authentication));
    }

    @Operation(summary = "Get upload progress")
    @ApiResponse(responseCode = "200", description = "Progress snapshot",
            content = @Content(schema = @Schema(implementation = UploadProgressResponse.class)))
    @ApiResponse(responseCode = "404", description = "Upload session not found",
            content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    @RequirePermission(PermissionName.ASSET_READ)
    @GetMapping("/chunked/{uploadId}")
    public UploadProgressResponse getUploadProgress(
            Authentication authentication,
            @PathVariable String uploadId) {
        return uploadService.getUploadProgress(uploadId, callerId(authentication));
    }

    @Operation(summary = "Cancel an upload and discard its stored chunks")
    @ApiResponse(responseCode = "204", description = "Upload cancelled")
    @RequirePermission(value = {PermissionName.ASSET_DELETE, PermissionName.ASSET_CREATE})
    @DeleteMapping("/chunked/{uploadId}")
    public ResponseEntity<Void> cancelUpload(
            Authentication authentication,
            @PathVariable String uploadId) {
        uploadService.cancelUpload(uploadId, callerId(authentication));
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Upload a whole file in one request")
    @ApiResponse(responseCode = "201", description = "Asset stored",
            content = @Content(schema = @Schema(implementation = AssetResponse.class)))
    @ApiResponse(responseCode = "400", description = "Missing file, unsupported type or over the size limit",
            content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    @RequirePermission(PermissionName.ASSET_CREATE)
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<AssetResponse> uploadDirect(
            Authentication authentication,
            @RequestPart("file") MultipartFile file) {
        AssetResponse response = uploadService.uploadDirect(file, callerId(authentication));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    private String callerId(Authentication authentication) {
        return authentication != null ? authentication.getName() : null;
    }
}
