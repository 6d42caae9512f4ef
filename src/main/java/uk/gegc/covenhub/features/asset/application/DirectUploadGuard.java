package uk.gegc.covenhub.features.asset.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import uk.gegc.covenhub.features.asset.domain.exception.StorageException;
import uk.gegc.covenhub.features.asset.domain.model.Asset;
import uk.gegc.covenhub.features.asset.domain.model.AssetType;
import uk.gegc.covenhub.features.asset.domain.model.UploadPayload;
import uk.gegc.covenhub.features.asset.infra.storage.ObjectStorageClient;
import uk.gegc.covenhub.shared.exception.UnauthorizedException;
import uk.gegc.covenhub.shared.exception.ValidationException;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Single-request upload path. The size limit is enforced against the size storage
 * reports after the write, so an oversize or unrecordable object is deleted before the
 * error propagates.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DirectUploadGuard {

    private final ObjectStorageClient storageClient;
    private final AssetClassifier assetClassifier;
    private final StorageKeyFactory storageKeyFactory;
    private final AssetRecorder assetRecorder;

    public Asset store(UploadPayload.Direct payload) {
        if (!StringUtils.hasText(payload.callerId())) {
            throw new UnauthorizedException("Authentication is required to upload");
        }
        if (!StringUtils.hasText(payload.fileName())) {
            throw new ValidationException("File name is required");
        }
        if (payload.content() == null || payload.declaredSize() <= 0) {
            throw new ValidationException("No file provided");
        }
        AssetType assetType = assetClassifier.classify(payload.mimeType());
        String hashedFileName = storageKeyFactory.hashedFileName(payload.fileName(), payload.callerId());
        String key = storageKeyFactory.storageKey(assetType, hashedFileName);

        InputStream content;
        try {
            content = payload.content().getInputStream();
        } catch (IOException ex) {
            throw new ValidationException("Unable to read uploaded file", ex);
        }
        String location;
        try {
            location = storageClient.putObject(key, payload.mimeType(), content, payload.declaredSize(),
                    Map.of("uploaded-by", payload.callerId()));
        } finally {
            closeContent(content, key);
        }

        long storedSize;
        try {
            storedSize = storageClient.objectSize(key);
        } catch (RuntimeException ex) {
            deleteQuietly(key);
            throw ex;
        }

        long maxSize = assetClassifier.maxSizeFor(assetType);
        if (storedSize > maxSize) {
            log.warn("Direct upload {} by {} is {} bytes, over the {} limit of {}; deleting stored object",
                    payload.fileName(), payload.callerId(), storedSize, assetType.getValue(), maxSize);
            deleteQuietly(key);
            assetClassifier.enforceSizeLimit(assetType, storedSize);
        }

        try {
            Asset asset = assetRecorder.record(
                    payload.fileName(),
                    hashedFileName,
                    payload.mimeType(),
                    assetType,
                    storedSize,
                    key,
                    location,
                    payload.callerId(),
                    null
            );
            log.info("Stored direct upload {} as asset {}", payload.fileName(), asset.getId());
            return asset;
        } catch (RuntimeException ex) {
            log.error("Failed to record asset for direct upload {}; deleting stored object", key, ex);
            deleteQuietly(key);
            throw ex;
        }
    }

    /**
     * A close failure after the put is only logged: the object is already stored and
     * goes through the size check and recording like any other.
     */
    private void closeContent(InputStream content, String key) {
        try {
            content.close();
        } catch (IOException ex) {
            log.warn("Failed to close upload stream for {}: {}", key, ex.getMessage());
        }
    }

    private void deleteQuietly(String key) {
        try {
            storageClient.deleteObject(key);
        } catch (StorageException ex) {
            log.warn("Failed to delete stored object {}: {}", key, ex.getMessage());
        }
    }
}
