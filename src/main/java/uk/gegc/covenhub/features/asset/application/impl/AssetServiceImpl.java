package uk.gegc.covenhub.features.asset.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;
import uk.gegc.covenhub.features.asset.api.dto.AssetResponse;
import uk.gegc.covenhub.features.asset.application.AssetService;
import uk.gegc.covenhub.features.asset.config.AssetStorageProperties;
import uk.gegc.covenhub.features.asset.domain.exception.StorageException;
import uk.gegc.covenhub.features.asset.domain.model.Asset;
import uk.gegc.covenhub.features.asset.domain.model.AssetType;
import uk.gegc.covenhub.features.asset.domain.repository.AssetRepository;
import uk.gegc.covenhub.features.asset.infra.mapping.AssetMapper;
import uk.gegc.covenhub.features.asset.infra.storage.ObjectStorageClient;
import uk.gegc.covenhub.shared.exception.ResourceNotFoundException;
import uk.gegc.covenhub.shared.exception.UnauthorizedException;
import uk.gegc.covenhub.shared.exception.ValidationException;

import java.util.UUID;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
@Slf4j
public class AssetServiceImpl implements AssetService {

    private static final int MAX_PAGE_SIZE = 100;

    private final AssetRepository assetRepository;
    private final ObjectStorageClient storageClient;
    private final AssetStorageProperties properties;
    private final AssetMapper assetMapper;

    @Override
    public Page<AssetResponse> listAssets(AssetType type, int page, int size, boolean signedUrl) {
        return assetRepository.search(type, null, pageRequest(page, size))
                .map(asset -> toResponse(asset, signedUrl));
    }

    @Override
    public Page<AssetResponse> listMyAssets(String callerId, AssetType type, int page, int size, boolean signedUrl) {
        if (!StringUtils.hasText(callerId)) {
            throw new UnauthorizedException("Authentication is required to list your assets");
        }
        return assetRepository.search(type, callerId, pageRequest(page, size))
                .map(asset -> toResponse(asset, signedUrl));
    }

    @Override
    public AssetResponse getAsset(UUID assetId, boolean signedUrl) {
        Asset asset = assetRepository.findById(assetId)
                .orElseThrow(() -> new ResourceNotFoundException("Asset %s not found".formatted(assetId)));
        return toResponse(asset, signedUrl);
    }

    private PageRequest pageRequest(int page, int size) {
        if (page < 0) {
            throw new ValidationException("Page must not be negative");
        }
        if (size < 1 || size > MAX_PAGE_SIZE) {
            throw new ValidationException("Size must be between 1 and " + MAX_PAGE_SIZE);
        }
        return PageRequest.of(page, size);
    }

    private AssetResponse toResponse(Asset asset, boolean signedUrl) {
        if (!signedUrl) {
            return assetMapper.toResponse(asset, null);
        }
        try {
            String url = storageClient.presignGet(asset.getStorageKey(), properties.getSignedUrlTtl());
            return assetMapper.toResponse(asset, url);
        } catch (StorageException ex) {
            log.warn("Failed to sign URL for asset {}: {}", asset.getId(), ex.getMessage());
            return assetMapper.toResponse(asset, null);
        }
    }
}
