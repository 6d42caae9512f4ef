package uk.gegc.covenhub.features.asset.application;

import org.springframework.stereotype.Component;
import uk.gegc.covenhub.features.asset.domain.model.UploadProgress;
import uk.gegc.covenhub.features.asset.domain.model.UploadSession;

@Component
public class UploadProgressAccountant {

    /**
     * Derives a consistent progress view from the session's admitted chunks.
     * {@code progress} is {@code floor(uploadedSize * 100 / totalSize)}.
     */
    public UploadProgress snapshot(UploadSession session) {
        session.lock();
        try {
            long uploadedSize = session.getUploadedSize();
            return new UploadProgress(
                    session.getUploadId(),
                    session.getFileName(),
                    session.getTotalSize(),
                    uploadedSize,
                    session.getChunksUploaded(),
                    session.getTotalChunks(),
                    percent(uploadedSize, session.getTotalSize()),
                    session.getStatus(),
                    session.getCreatedAt(),
                    session.getLastUpdated(),
                    session.getAssetId()
            );
        } finally {
            session.unlock();
        }
    }

    static int percent(long uploadedSize, long totalSize) {
        if (totalSize <= 0) {
            return 0;
        }
        return (int) Math.floorDiv(Math.multiplyExact(uploadedSize, 100L), totalSize);
    }
}
