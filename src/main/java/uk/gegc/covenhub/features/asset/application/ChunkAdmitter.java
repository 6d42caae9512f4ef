package uk.gegc.covenhub.features.asset.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import uk.gegc.covenhub.features.asset.domain.exception.ChunkIntegrityException;
import uk.gegc.covenhub.features.asset.domain.exception.StorageException;
import uk.gegc.covenhub.features.asset.domain.exception.UploadConflictException;
import uk.gegc.covenhub.features.asset.domain.exception.UploadExpiredException;
import uk.gegc.covenhub.features.asset.domain.model.Asset;
import uk.gegc.covenhub.features.asset.domain.model.UploadOutcome;
import uk.gegc.covenhub.features.asset.domain.model.UploadSession;
import uk.gegc.covenhub.features.asset.domain.model.UploadStatus;
import uk.gegc.covenhub.features.asset.infra.storage.ObjectStorageClient;
import uk.gegc.covenhub.shared.exception.ValidationException;

import java.time.Clock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Validates and records one chunk of a session.
 * <p>
 * Hashing runs outside any lock. The storage write and the bookkeeping update for one
 * index run under that index's lock, so writes to different indices proceed in parallel
 * while re-sends of the same index are applied in order. The completion check runs under
 * the session lock once no write is in flight; the admission that wins the
 * {@code uploading -> finalizing} transition runs the finalizer.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ChunkAdmitter {

    private final UploadSessionRegistry registry;
    private final UploadProgressAccountant progressAccountant;
    private final UploadFinalizer finalizer;
    private final ObjectStorageClient storageClient;
    private final Clock clock;

    public UploadOutcome admit(String uploadId, int chunkIndex, byte[] chunkBytes, String claimedHash) {
        UploadSession session = registry.get(uploadId);
        requireAccepting(session);

        if (!session.isIndexInRange(chunkIndex)) {
            throw new ValidationException("Chunk index %d out of range: expected 0 to %d"
                    .formatted(chunkIndex, session.getTotalChunks() - 1));
        }
        if (!StringUtils.hasText(claimedHash)) {
            throw new ValidationException("Chunk hash is required");
        }
        byte[] bytes = chunkBytes != null ? chunkBytes : new byte[0];
        long expectedLength = session.expectedChunkLength(chunkIndex);
        if (bytes.length != expectedLength) {
            throw new ValidationException("Chunk %d must be %d bytes but was %d"
                    .formatted(chunkIndex, expectedLength, bytes.length));
        }
        if (!ContentHashing.matches(bytes, claimedHash)) {
            log.warn("Chunk {} of upload {} failed hash verification", chunkIndex, uploadId);
            throw new ChunkIntegrityException(uploadId, chunkIndex);
        }

        boolean finalize;
        ReentrantLock chunkLock = session.chunkLock(chunkIndex);
        chunkLock.lock();
        try {
            beginWrite(session);
            String eTag;
            try {
                eTag = writeChunk(session, chunkIndex, bytes);
            } catch (RuntimeException ex) {
                if (finishWrite(session, chunkIndex, bytes.length, null)) {
                    log.info("Upload {} became complete while chunk {} failed to re-send", uploadId, chunkIndex);
                    finalizer.finalizeSession(session);
                }
                throw ex;
            }
            finalize = finishWrite(session, chunkIndex, bytes.length, eTag);
        } finally {
            chunkLock.unlock();
        }

        Asset asset = finalize ? finalizer.finalizeSession(session) : null;
        return UploadOutcome.admitted(progressAccountant.snapshot(session), asset);
    }

    private void beginWrite(UploadSession session) {
        session.lock();
        try {
            requireAccepting(session);
            session.beginWrite();
        } finally {
            session.unlock();
        }
    }

    /**
     * Ends one storage write and records its chunk when {@code eTag} is present.
     *
     * @return true when this caller won the {@code uploading -> finalizing} transition
     */
    private boolean finishWrite(UploadSession session, int chunkIndex, long length, String eTag) {
        session.lock();
        try {
            session.endWrite();
            if (eTag != null) {
                requireAccepting(session);
                boolean resend = session.hasChunk(chunkIndex);
                session.recordChunk(chunkIndex, length, eTag, clock.instant());
                log.debug("Admitted chunk {}/{} of upload {}{}", chunkIndex + 1, session.getTotalChunks(),
                        session.getUploadId(), resend ? " (re-sent)" : "");
            }
            return session.isComplete() && session.transition(UploadStatus.UPLOADING, UploadStatus.FINALIZING);
        } finally {
            session.unlock();
        }
    }

    private String writeChunk(UploadSession session, int chunkIndex, byte[] bytes) {
        try {
            return storageClient.uploadPart(session.getStorageKey(), session.getStorageHandle(), chunkIndex + 1, bytes);
        } catch (StorageException ex) {
            if (ex.isRetryable()) {
                log.warn("Transient storage failure writing chunk {} of upload {}; chunk may be retried",
                        chunkIndex, session.getUploadId());
                throw ex;
            }
            boolean failed;
            session.lock();
            try {
                failed = session.getStatus() == UploadStatus.UPLOADING;
                if (failed) {
                    session.markFailed("Storage rejected chunk " + chunkIndex + ": " + ex.getMessage(), clock.instant());
                }
            } finally {
                session.unlock();
            }
            if (failed) {
                log.error("Upload {} failed: storage rejected chunk {}", session.getUploadId(), chunkIndex, ex);
                registry.releaseStorage(session);
            }
            throw ex;
        }
    }

    private void requireAccepting(UploadSession session) {
        UploadStatus status = session.getStatus();
        if (status == UploadStatus.EXPIRED) {
            log.warn("Rejected chunk for expired upload {}", session.getUploadId());
            throw new UploadExpiredException(session.getUploadId());
        }
        if (status != UploadStatus.UPLOADING) {
            throw new UploadConflictException(session.getUploadId(), status);
        }
    }
}
