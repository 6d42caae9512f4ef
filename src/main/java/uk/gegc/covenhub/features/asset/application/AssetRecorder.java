package uk.gegc.covenhub.features.asset.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.covenhub.features.asset.domain.model.Asset;
import uk.gegc.covenhub.features.asset.domain.model.AssetType;
import uk.gegc.covenhub.features.asset.domain.repository.AssetRepository;

/**
 * Persists the asset record for a fully stored, size-verified object. Shared by the
 * chunked and direct upload paths.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AssetRecorder {

    private final AssetRepository assetRepository;
    private final StorageKeyFactory storageKeyFactory;

    @Transactional
    public Asset record(String fileName,
                        String hashedFileName,
                        String mimeType,
                        AssetType assetType,
                        long fileSize,
                        String storageKey,
                        String reportedLocation,
                        String ownerId,
                        String uploadId) {
        Asset asset = new Asset();
        asset.setFileName(fileName);
        asset.setHashedFileName(hashedFileName);
        asset.setMimeType(mimeType);
        asset.setAssetType(assetType);
        asset.setFileSize(fileSize);
        asset.setStorageKey(storageKey);
        asset.setStorageUrl(storageKeyFactory.storageUrl(storageKey, reportedLocation));
        asset.setUploadedBy(ownerId);
        asset.setUploadId(uploadId);

        Asset saved = assetRepository.saveAndFlush(asset);
        log.info("Recorded asset {} ({} bytes, {}) for owner {}", saved.getId(), fileSize, assetType, ownerId);
        return saved;
    }
}
