package uk.gegc.covenhub.features.asset.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.covenhub.features.asset.domain.model.UploadOutcome;
import uk.gegc.covenhub.features.asset.domain.model.UploadPayload;

/**
 * Routes an {@link UploadPayload} to the path that handles its shape.
 */
@Component
@RequiredArgsConstructor
public class UploadDispatcher {

    private final DirectUploadGuard directUploadGuard;
    private final ChunkAdmitter chunkAdmitter;

    public UploadOutcome dispatch(UploadPayload payload) {
        if (payload instanceof UploadPayload.Direct direct) {
            return UploadOutcome.stored(directUploadGuard.store(direct));
        }
        if (payload instanceof UploadPayload.Chunked chunked) {
            return chunkAdmitter.admit(chunked.uploadId(), chunked.chunkIndex(), chunked.bytes(), chunked.claimedHash());
        }
        throw new IllegalArgumentException("Unsupported upload payload: "
                + (payload == null ? "null" : payload.getClass().getSimpleName()));
    }
}
