package uk.gegc.covenhub.features.asset.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of a chunked upload session.
 */
public enum UploadStatus {
    INITIALIZING("initializing"),
    UPLOADING("uploading"),
    FINALIZING("finalizing"),
    COMPLETED("completed"),
    FAILED("failed"),
    EXPIRED("expired");

    private final String value;

    UploadStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Terminal sessions accept no further chunks and are evicted after the retention window
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == EXPIRED;
    }
}
