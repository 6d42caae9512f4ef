package uk.gegc.covenhub.features.asset.application;

import org.springframework.data.domain.Page;
import uk.gegc.covenhub.features.asset.api.dto.AssetResponse;
import uk.gegc.covenhub.features.asset.domain.model.AssetType;

import java.util.UUID;

public interface AssetService {

    Page<AssetResponse> listAssets(AssetType type, int page, int size, boolean signedUrl);

    Page<AssetResponse> listMyAssets(String callerId, AssetType type, int page, int size, boolean signedUrl);

    AssetResponse getAsset(UUID assetId, boolean signedUrl);
}
