package uk.gegc.covenhub.features.asset.domain.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * The session exists but sat idle past its TTL. Distinct from "not found" so clients
 * know to start over with a new initialize call rather than retrying the chunk.
 */
@ResponseStatus(HttpStatus.GONE)
public class UploadExpiredException extends RuntimeException {

    private final String uploadId;

    public UploadExpiredException(String uploadId) {
        super("Upload session " + uploadId + " has expired; start a new upload");
        this.uploadId = uploadId;
    }

    public String getUploadId() {
        return uploadId;
    }
}
