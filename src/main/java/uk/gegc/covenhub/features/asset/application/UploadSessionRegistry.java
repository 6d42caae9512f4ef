package uk.gegc.covenhub.features.asset.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import uk.gegc.covenhub.features.asset.config.AssetStorageProperties;
import uk.gegc.covenhub.features.asset.domain.exception.StorageException;
import uk.gegc.covenhub.features.asset.domain.exception.UploadSessionNotFoundException;
import uk.gegc.covenhub.features.asset.domain.model.AssetType;
import uk.gegc.covenhub.features.asset.domain.model.UploadSession;
import uk.gegc.covenhub.features.asset.domain.model.UploadStatus;
import uk.gegc.covenhub.features.asset.infra.storage.ObjectStorageClient;
import uk.gegc.covenhub.shared.exception.UnauthorizedException;
import uk.gegc.covenhub.shared.exception.ValidationException;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.regex.Pattern;

/**
 * In-memory table of chunked upload sessions keyed by upload id. All session mutation
 * happens under the session's own lock; the table itself is only read and written
 * through concurrent map operations.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class UploadSessionRegistry {

    private static final Pattern UPLOAD_ID_PATTERN = Pattern.compile("^[0-9a-f]{64}$");
    private static final int UPLOAD_ID_BYTES = 32;
    /**
     * S3 accepts at most 10,000 parts per multipart upload.
     */
    private static final int MAX_PARTS = 10_000;

    private final SecureRandom random = new SecureRandom();
    private final ConcurrentMap<String, UploadSession> sessions = new ConcurrentHashMap<>();

    private final ObjectStorageClient storageClient;
    private final AssetClassifier assetClassifier;
    private final StorageKeyFactory storageKeyFactory;
    private final AssetStorageProperties properties;
    private final Clock clock;

    /**
     * Validates the chunk plan, opens the storage-side multipart upload and registers a
     * session in {@code uploading} status.
     *
     * @param chunkSize          null to use the configured default
     * @param declaredTotalChunks null to accept the computed count
     */
    public UploadSession initialize(String fileName,
                                    long totalSize,
                                    Long chunkSize,
                                    Integer declaredTotalChunks,
                                    String mimeType,
                                    String ownerId) {
        if (!StringUtils.hasText(ownerId)) {
            throw new UnauthorizedException("Authentication is required to start an upload");
        }
        if (!StringUtils.hasText(fileName)) {
            throw new ValidationException("File name is required");
        }
        if (totalSize <= 0) {
            throw new ValidationException("Total size must be positive");
        }
        long effectiveChunkSize = chunkSize != null ? chunkSize : properties.getChunked().getDefaultChunkSizeBytes();
        if (effectiveChunkSize <= 0) {
            throw new ValidationException("Chunk size must be positive");
        }

        AssetType assetType = assetClassifier.classify(mimeType);
        assetClassifier.enforceSizeLimit(assetType, totalSize);

        int totalChunks = UploadSession.computeTotalChunks(totalSize, effectiveChunkSize);
        if (declaredTotalChunks != null && declaredTotalChunks != totalChunks) {
            throw new ValidationException("Total chunks mismatch: expected %d for total size %d and chunk size %d, got %d"
                    .formatted(totalChunks, totalSize, effectiveChunkSize, declaredTotalChunks));
        }
        validateChunkBounds(effectiveChunkSize, totalChunks);

        String uploadId = newUploadId();
        String hashedFileName = storageKeyFactory.hashedFileName(fileName, ownerId);
        String storageKey = storageKeyFactory.storageKey(assetType, hashedFileName);
        String storageHandle = storageClient.createMultipartUpload(storageKey, mimeType);

        UploadSession session = new UploadSession(
                uploadId,
                fileName,
                mimeType,
                assetType,
                totalSize,
                effectiveChunkSize,
                totalChunks,
                ownerId,
                hashedFileName,
                storageKey,
                storageHandle,
                clock.instant()
        );
        sessions.put(uploadId, session);
        session.transition(UploadStatus.INITIALIZING, UploadStatus.UPLOADING);

        log.info("Initialized upload {} for owner {}: {} bytes in {} chunks of {}",
                uploadId, ownerId, totalSize, totalChunks, effectiveChunkSize);
        return session;
    }

    /**
     * Looks up a session, expiring it first if it sat idle past the TTL.
     *
     * @throws ValidationException            when the id is not 64 lowercase hex characters
     * @throws UploadSessionNotFoundException when no such session is registered
     */
    public UploadSession get(String uploadId) {
        if (uploadId == null || !UPLOAD_ID_PATTERN.matcher(uploadId).matches()) {
            throw new ValidationException("Invalid upload ID format");
        }
        UploadSession session = sessions.get(uploadId);
        if (session == null) {
            throw new UploadSessionNotFoundException(uploadId);
        }
        expireIfIdle(session);
        return session;
    }

    /**
     * Marks an idle uploading session as expired and aborts its multipart upload.
     *
     * @return true when this call expired the session
     */
    public boolean expireIfIdle(UploadSession session) {
        Instant now = clock.instant();
        boolean expired;
        session.lock();
        try {
            expired = session.getStatus() == UploadStatus.UPLOADING
                    && session.isIdleSince(now, properties.getChunked().getSessionTtl())
                    && session.markExpired(now);
        } finally {
            session.unlock();
        }
        if (expired) {
            log.warn("Upload {} expired after inactivity since {}", session.getUploadId(), session.getLastUpdated());
            releaseStorage(session);
        }
        return expired;
    }

    /**
     * Best-effort abort of the session's multipart upload. Failures are logged; storage
     * lifecycle rules clean up anything left behind.
     */
    public void releaseStorage(UploadSession session) {
        try {
            storageClient.abortMultipartUpload(session.getStorageKey(), session.getStorageHandle());
        } catch (StorageException ex) {
            log.warn("Failed to abort multipart upload for {}: {}", session.getUploadId(), ex.getMessage());
        }
    }

    public void remove(String uploadId) {
        sessions.remove(uploadId);
    }

    public List<UploadSession> sessions() {
        return List.copyOf(sessions.values());
    }

    public int size() {
        return sessions.size();
    }

    private void validateChunkBounds(long chunkSize, int totalChunks) {
        AssetStorageProperties.Chunked limits = properties.getChunked();
        if (chunkSize > limits.getMaxChunkSizeBytes()) {
            throw new ValidationException("Chunk size %d exceeds maximum of %d bytes"
                    .formatted(chunkSize, limits.getMaxChunkSizeBytes()));
        }
        if (totalChunks > 1 && chunkSize < limits.getMinChunkSizeBytes()) {
            throw new ValidationException("Chunk size %d is below minimum of %d bytes"
                    .formatted(chunkSize, limits.getMinChunkSizeBytes()));
        }
        if (totalChunks > MAX_PARTS) {
            throw new ValidationException("Upload would need %d chunks; at most %d are allowed"
                    .formatted(totalChunks, MAX_PARTS));
        }
    }

    private String newUploadId() {
        byte[] bytes = new byte[UPLOAD_ID_BYTES];
        random.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }
}
