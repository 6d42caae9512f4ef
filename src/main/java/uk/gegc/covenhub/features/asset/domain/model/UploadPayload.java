package uk.gegc.covenhub.features.asset.domain.model;

import org.springframework.core.io.InputStreamSource;

/**
 * Bytes arriving at the upload coordinator: either a whole file in one request or one
 * chunk of a session.
 */
public interface UploadPayload {

    String callerId();

    record Direct(
            String fileName,
            String mimeType,
            long declaredSize,
            InputStreamSource content,
            String callerId
    ) implements UploadPayload {
    }

    record Chunked(
            String uploadId,
            int chunkIndex,
            byte[] bytes,
            String claimedHash,
            String callerId
    ) implements UploadPayload {
    }
}
