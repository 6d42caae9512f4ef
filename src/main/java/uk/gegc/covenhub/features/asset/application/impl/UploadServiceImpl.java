package uk.gegc.covenhub.features.asset.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;
import uk.gegc.covenhub.features.asset.api.dto.AssetResponse;
import uk.gegc.covenhub.features.asset.api.dto.InitializeUploadRequest;
import uk.gegc.covenhub.features.asset.api.dto.InitializeUploadResponse;
import uk.gegc.covenhub.features.asset.api.dto.UploadProgressResponse;
import uk.gegc.covenhub.features.asset.application.UploadDispatcher;
import uk.gegc.covenhub.features.asset.application.UploadProgressAccountant;
import uk.gegc.covenhub.features.asset.application.UploadService;
import uk.gegc.covenhub.features.asset.application.UploadSessionRegistry;
import uk.gegc.covenhub.features.asset.domain.exception.UploadConflictException;
import uk.gegc.covenhub.features.asset.domain.model.UploadOutcome;
import uk.gegc.covenhub.features.asset.domain.model.UploadPayload;
import uk.gegc.covenhub.features.asset.domain.model.UploadSession;
import uk.gegc.covenhub.features.asset.domain.model.UploadStatus;
import uk.gegc.covenhub.features.asset.infra.mapping.AssetMapper;
import uk.gegc.covenhub.shared.exception.ForbiddenException;
import uk.gegc.covenhub.shared.exception.UnauthorizedException;
import uk.gegc.covenhub.shared.exception.ValidationException;
import uk.gegc.covenhub.shared.security.AppPermissionEvaluator;
import uk.gegc.covenhub.shared.security.PermissionName;

import java.time.Clock;

@Service
@RequiredArgsConstructor
@Slf4j
public class UploadServiceImpl implements UploadService {

    private final UploadSessionRegistry registry;
    private final UploadDispatcher dispatcher;
    private final UploadProgressAccountant progressAccountant;
    private final AssetMapper assetMapper;
    private final AppPermissionEvaluator permissionEvaluator;
    private final Clock clock;

    @Override
    public InitializeUploadResponse initializeUpload(InitializeUploadRequest request, String callerId) {
        if (request == null) {
            throw new ValidationException("Request body is required");
        }
        requireCaller(callerId);
        if (request.totalSize() == null) {
            throw new ValidationException("Total size is required");
        }
        UploadSession session = registry.initialize(
                request.fileName(),
                request.totalSize(),
                request.chunkSize(),
                request.totalChunks(),
                request.mimeType(),
                callerId
        );
        return assetMapper.toInitializeResponse(session);
    }

    @Override
    public UploadProgressResponse uploadChunk(String uploadId, int chunkIndex, byte[] chunkBytes, String chunkHash, String callerId) {
        requireCaller(callerId);
        assertCanAccess(registry.get(uploadId), callerId);
        UploadOutcome outcome = dispatcher.dispatch(
                new UploadPayload.Chunked(uploadId, chunkIndex, chunkBytes, chunkHash, callerId));
        return assetMapper.toProgressResponse(outcome.progress());
    }

    @Override
    public UploadProgressResponse getUploadProgress(String uploadId, String callerId) {
        requireCaller(callerId);
        UploadSession session = registry.get(uploadId);
        assertCanAccess(session, callerId);
        return assetMapper.toProgressResponse(progressAccountant.snapshot(session));
    }

    @Override
    public void cancelUpload(String uploadId, String callerId) {
        requireCaller(callerId);
        UploadSession session = registry.get(uploadId);
        assertCanAccess(session, callerId);

        boolean wasUploading;
        session.lock();
        try {
            UploadStatus status = session.getStatus();
            if (status == UploadStatus.FINALIZING || status == UploadStatus.COMPLETED) {
                throw new UploadConflictException(uploadId, status,
                        "Upload session " + uploadId + " is " + status.getValue() + " and cannot be cancelled");
            }
            wasUploading = status == UploadStatus.UPLOADING;
            if (wasUploading) {
                session.markFailed("Cancelled by " + callerId, clock.instant());
            }
        } finally {
            session.unlock();
        }
        if (wasUploading) {
            registry.releaseStorage(session);
        }
        registry.remove(uploadId);
        log.info("Upload {} cancelled by {}", uploadId, callerId);
    }

    @Override
    public AssetResponse uploadDirect(MultipartFile file, String callerId) {
        requireCaller(callerId);
        if (file == null || file.isEmpty()) {
            throw new ValidationException("No file provided");
        }
        UploadOutcome outcome = dispatcher.dispatch(new UploadPayload.Direct(
                file.getOriginalFilename(),
                file.getContentType(),
                file.getSize(),
                file,
                callerId
        ));
        return assetMapper.toResponse(outcome.asset(), null);
    }

    private void requireCaller(String callerId) {
        if (!StringUtils.hasText(callerId)) {
            throw new UnauthorizedException("Authentication is required for uploads");
        }
    }

    private void assertCanAccess(UploadSession session, String callerId) {
        if (session.getOwnerId().equals(callerId)) {
            return;
        }
        if (!permissionEvaluator.hasPermission(PermissionName.ASSET_ADMIN)) {
            log.warn("Caller {} denied access to upload {} owned by {}", callerId, session.getUploadId(), session.getOwnerId());
            throw new ForbiddenException("You cannot access this upload session");
        }
    }
}
