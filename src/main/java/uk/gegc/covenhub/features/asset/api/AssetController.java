package uk.gegc.covenhub.features.asset.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.http.ProblemDetail;
import org.springframework.security.core.Authentication;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.covenhub.features.asset.api.dto.AssetResponse;
import uk.gegc.covenhub.features.asset.application.AssetService;
import uk.gegc.covenhub.features.asset.domain.model.AssetType;
import uk.gegc.covenhub.shared.security.PermissionName;
import uk.gegc.covenhub.shared.security.annotation.RequirePermission;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/assets")
@Validated
@RequiredArgsConstructor
@SecurityRequirement(name = "Bearer Authentication")
@Tag(name = "Assets", description = "Query stored images and videos")
public class AssetController {

    private final AssetService assetService;

    @Operation(summary = "List assets, newest first")
    @ApiResponse(responseCode = "200", description = "Assets retrieved")
    @RequirePermission(PermissionName.ASSET_READ)
    @GetMapping
    public Page<AssetResponse> listAssets(
            @RequestParam(required = false) AssetType type,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size,
            @RequestParam(defaultValue = "false") boolean signedUrl) {
        return assetService.listAssets(type, page, size, signedUrl);
    }

    @Operation(summary = "List the caller's own assets, newest first")
    @ApiResponse(responseCode = "200", description = "Assets retrieved")
    @RequirePermission(PermissionName.ASSET_READ)
    @GetMapping("/mine")
    public Page<AssetResponse> listMyAssets(
            Authentication authentication,
            @RequestParam(required = false) AssetType type,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size,
            @RequestParam(defaultValue = "false") boolean signedUrl) {
        String callerId = authentication != null ? authentication.getName() : null;
        return assetService.listMyAssets(callerId, type, page, size, signedUrl);
    }

    @Operation(summary = "Get one asset")
    @ApiResponse(responseCode = "200", description = "Asset found",
            content = @Content(schema = @Schema(implementation = AssetResponse.class)))
    @ApiResponse(responseCode = "404", description = "Asset not found",
            content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    @RequirePermission(PermissionName.ASSET_READ)
    @GetMapping("/{assetId}")
    public AssetResponse getAsset(
            @PathVariable UUID assetId,
            @RequestParam(defaultValue = "false") boolean signedUrl) {
        return assetService.getAsset(assetId, signedUrl);
    }
}
