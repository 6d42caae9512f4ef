package uk.gegc.covenhub.features.asset.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import uk.gegc.covenhub.features.asset.config.AssetStorageProperties;
import uk.gegc.covenhub.features.asset.domain.model.AssetType;
import uk.gegc.covenhub.shared.exception.ValidationException;

import java.util.Locale;

/**
 * Maps MIME types onto {@link AssetType}s and enforces the per-type size limits.
 */
@Component
@RequiredArgsConstructor
public class AssetClassifier {

    private static final long MEGABYTE = 1024L * 1024;

    private final AssetStorageProperties properties;

    public AssetType classify(String mimeType) {
        if (!StringUtils.hasText(mimeType)) {
            throw new ValidationException("Mime type is required");
        }
        String normalized = mimeType.trim().toLowerCase(Locale.ROOT);
        if (properties.getLimits().getAllowedImageMimeTypes().contains(normalized)) {
            return AssetType.IMAGE;
        }
        if (properties.getLimits().getAllowedVideoMimeTypes().contains(normalized)) {
            return AssetType.VIDEO;
        }
        throw new ValidationException("Invalid file type: " + mimeType + ". Only images and videos are allowed");
    }

    public long maxSizeFor(AssetType type) {
        return switch (type) {
            case IMAGE -> properties.getLimits().getMaxImageSizeBytes();
            case VIDEO -> properties.getLimits().getMaxVideoSizeBytes();
        };
    }

    public void enforceSizeLimit(AssetType type, long sizeBytes) {
        long max = maxSizeFor(type);
        if (sizeBytes > max) {
            throw new ValidationException("File too large. Maximum size for %s is %d MB"
                    .formatted(type.getValue(), max / MEGABYTE));
        }
    }
}
