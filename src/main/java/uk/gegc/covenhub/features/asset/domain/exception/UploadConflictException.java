package uk.gegc.covenhub.features.asset.domain.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;
import uk.gegc.covenhub.features.asset.domain.model.UploadStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class UploadConflictException extends RuntimeException {

    private final String uploadId;
    private final UploadStatus currentStatus;

    public UploadConflictException(String uploadId, UploadStatus currentStatus, String message) {
        super(message);
        this.uploadId = uploadId;
        this.currentStatus = currentStatus;
    }

    public UploadConflictException(String uploadId, UploadStatus currentStatus) {
        this(uploadId, currentStatus,
                "Upload session " + uploadId + " is " + currentStatus.getValue() + " and no longer accepts changes");
    }

    public String getUploadId() {
        return uploadId;
    }

    public UploadStatus getCurrentStatus() {
        return currentStatus;
    }
}
