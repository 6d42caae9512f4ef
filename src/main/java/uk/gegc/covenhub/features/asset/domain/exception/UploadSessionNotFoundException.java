package uk.gegc.covenhub.features.asset.domain.exception;

import uk.gegc.covenhub.shared.exception.ResourceNotFoundException;

public class UploadSessionNotFoundException extends ResourceNotFoundException {

    private final String uploadId;

    public UploadSessionNotFoundException(String uploadId) {
        super("Upload session not found");
        this.uploadId = uploadId;
    }

    public String getUploadId() {
        return uploadId;
    }
}
