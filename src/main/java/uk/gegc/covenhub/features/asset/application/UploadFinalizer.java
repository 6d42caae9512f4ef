package uk.gegc.covenhub.features.asset.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.covenhub.features.asset.domain.exception.ChunkIntegrityException;
import uk.gegc.covenhub.features.asset.domain.exception.StorageException;
import uk.gegc.covenhub.features.asset.domain.model.Asset;
import uk.gegc.covenhub.features.asset.domain.model.UploadSession;
import uk.gegc.covenhub.features.asset.domain.model.UploadStatus;
import uk.gegc.covenhub.features.asset.infra.storage.ObjectStorageClient;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns a session whose chunks are all admitted into a stored object and an asset record.
 * Only the caller that moved the session to {@code finalizing} may invoke it; any failure
 * leaves the session {@code failed} with no asset recorded.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class UploadFinalizer {

    private final ObjectStorageClient storageClient;
    private final AssetRecorder assetRecorder;
    private final Clock clock;

    public Asset finalizeSession(UploadSession session) {
        if (session.getStatus() != UploadStatus.FINALIZING) {
            throw new IllegalStateException("Upload " + session.getUploadId() + " is not finalizing but " + session.getStatus().getValue());
        }
        String uploadId = session.getUploadId();
        String key = session.getStorageKey();

        String location;
        try {
            location = storageClient.completeMultipartUpload(key, session.getStorageHandle(), partETags(session));
        } catch (RuntimeException ex) {
            fail(session, "Failed to assemble stored object", ex);
            abortQuietly(session);
            throw ex;
        }

        long actualSize;
        try {
            actualSize = storageClient.objectSize(key);
        } catch (RuntimeException ex) {
            fail(session, "Failed to verify stored object size", ex);
            deleteQuietly(session);
            throw ex;
        }
        if (actualSize != session.getTotalSize()) {
            log.error("Upload {} assembled to {} bytes but {} were declared", uploadId, actualSize, session.getTotalSize());
            session.markFailed("Assembled size mismatch", clock.instant());
            deleteQuietly(session);
            throw new ChunkIntegrityException(uploadId, session.getTotalSize(), actualSize);
        }

        Asset asset;
        try {
            asset = assetRecorder.record(
                    session.getFileName(),
                    session.getHashedFileName(),
                    session.getMimeType(),
                    session.getAssetType(),
                    actualSize,
                    key,
                    location,
                    session.getOwnerId(),
                    uploadId
            );
        } catch (RuntimeException ex) {
            fail(session, "Failed to record asset", ex);
            deleteQuietly(session);
            throw ex;
        }

        session.markCompleted(asset.getId(), clock.instant());
        log.info("Upload {} completed as asset {}", uploadId, asset.getId());
        return asset;
    }

    private Map<Integer, String> partETags(UploadSession session) {
        Map<Integer, String> parts = new LinkedHashMap<>();
        session.orderedChunkETags().forEach((index, eTag) -> parts.put(index + 1, eTag));
        return parts;
    }

    private void fail(UploadSession session, String reason, RuntimeException cause) {
        log.error("Finalization of upload {} failed: {}", session.getUploadId(), reason, cause);
        session.markFailed(reason + ": " + cause.getMessage(), clock.instant());
    }

    private void abortQuietly(UploadSession session) {
        try {
            storageClient.abortMultipartUpload(session.getStorageKey(), session.getStorageHandle());
        } catch (StorageException ex) {
            log.warn("Failed to abort multipart upload for {}: {}", session.getUploadId(), ex.getMessage());
        }
    }

    private void deleteQuietly(UploadSession session) {
        try {
            storageClient.deleteObject(session.getStorageKey());
        } catch (StorageException ex) {
            log.warn("Failed to delete assembled object {} for upload {}: {}",
                    session.getStorageKey(), session.getUploadId(), ex.getMessage());
        }
    }
}
