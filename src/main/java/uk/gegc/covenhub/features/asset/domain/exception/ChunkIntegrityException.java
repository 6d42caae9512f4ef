package uk.gegc.covenhub.features.asset.domain.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Payload bytes do not match what the caller (or the session plan) claimed.
 * Raised for chunk hash mismatches and for an assembled object whose size differs
 * from the declared total.
 */
@ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
public class ChunkIntegrityException extends RuntimeException {

    private final String uploadId;
    private final Integer chunkIndex;
    private final Long expectedSize;
    private final Long actualSize;

    public ChunkIntegrityException(String uploadId, int chunkIndex) {
        super("Chunk " + chunkIndex + " failed integrity check: hash does not match payload");
        this.uploadId = uploadId;
        this.chunkIndex = chunkIndex;
        this.expectedSize = null;
        this.actualSize = null;
    }

    public ChunkIntegrityException(String uploadId, long expectedSize, long actualSize) {
        super("Assembled object size %d does not match declared size %d".formatted(actualSize, expectedSize));
        this.uploadId = uploadId;
        this.chunkIndex = null;
        this.expectedSize = expectedSize;
        this.actualSize = actualSize;
    }

    public String getUploadId() {
        return uploadId;
    }

    public Integer getChunkIndex() {
        return chunkIndex;
    }

    public Long getExpectedSize() {
        return expectedSize;
    }

    public Long getActualSize() {
        return actualSize;
    }
}
