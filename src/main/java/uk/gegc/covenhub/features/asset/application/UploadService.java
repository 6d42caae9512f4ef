package uk.gegc.covenhub.features.asset.application;

import org.springframework.web.multipart.MultipartFile;
import uk.gegc.covenhub.features.asset.api.dto.AssetResponse;
import uk.gegc.covenhub.features.asset.api.dto.InitializeUploadRequest;
import uk.gegc.covenhub.features.asset.api.dto.InitializeUploadResponse;
import uk.gegc.covenhub.features.asset.api.dto.UploadProgressResponse;

public interface UploadService {

    InitializeUploadResponse initializeUpload(InitializeUploadRequest request, String callerId);

    UploadProgressResponse uploadChunk(String uploadId, int chunkIndex, byte[] chunkBytes, String chunkHash, String callerId);

    UploadProgressResponse getUploadProgress(String uploadId, String callerId);

    void cancelUpload(String uploadId, String callerId);

    AssetResponse uploadDirect(MultipartFile file, String callerId);
}
