package uk.gegc.covenhub.features.asset.infra.mapping;

import org.springframework.stereotype.Component;
import uk.gegc.covenhub.features.asset.api.dto.AssetResponse;
import uk.gegc.covenhub.features.asset.api.dto.InitializeUploadResponse;
import uk.gegc.covenhub.features.asset.api.dto.UploadProgressResponse;
import uk.gegc.covenhub.features.asset.domain.model.Asset;
import uk.gegc.covenhub.features.asset.domain.model.UploadProgress;
import uk.gegc.covenhub.features.asset.domain.model.UploadSession;

@Component
public class AssetMapper {

    public AssetResponse toResponse(Asset asset, String signedUrl) {
        if (asset == null) {
            return null;
        }
        return new AssetResponse(
                asset.getId(),
                asset.getFileName(),
                asset.getHashedFileName(),
                asset.getMimeType(),
                asset.getFileSize(),
                asset.getStorageKey(),
                asset.getStorageUrl(),
                signedUrl,
                asset.getAssetType(),
                asset.getUploadedBy(),
                asset.getCreatedAt(),
                asset.getUpdatedAt()
        );
    }

    public InitializeUploadResponse toInitializeResponse(UploadSession session) {
        return new InitializeUploadResponse(
                session.getUploadId(),
                session.getFileName(),
                session.getTotalSize(),
                session.getChunkSize(),
                session.getTotalChunks(),
                session.getStatus(),
                session.getCreatedAt()
        );
    }

    public UploadProgressResponse toProgressResponse(UploadProgress progress) {
        return new UploadProgressResponse(
                progress.uploadId(),
                progress.fileName(),
                progress.totalSize(),
                progress.uploadedSize(),
                progress.chunksUploaded(),
                progress.totalChunks(),
                progress.progress(),
                progress.status(),
                progress.createdAt(),
                progress.lastUpdated(),
                progress.assetId()
        );
    }
}
