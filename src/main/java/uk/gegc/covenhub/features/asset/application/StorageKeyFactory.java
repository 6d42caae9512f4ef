package uk.gegc.covenhub.features.asset.application;

import lombok.RequiredArgsConstructor;
import org.apache.commons.io.FilenameUtils;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import uk.gegc.covenhub.features.asset.config.AssetStorageProperties;
import uk.gegc.covenhub.features.asset.domain.model.AssetType;

import java.util.Locale;

@Component
@RequiredArgsConstructor
public class StorageKeyFactory {

    private final AssetStorageProperties properties;

    /**
     * Unique stored name: sha256 of base name, owner and a nano timestamp, keeping the
     * original extension in lower case.
     */
    public String hashedFileName(String fileName, String ownerId) {
        String baseName = FilenameUtils.getBaseName(fileName);
        String extension = FilenameUtils.getExtension(fileName);
        String digest = ContentHashing.sha256Hex(baseName + "-" + ownerId + "-" + System.nanoTime());
        return StringUtils.hasText(extension)
                ? digest + "." + extension.toLowerCase(Locale.ROOT)
                : digest;
    }

    public String storageKey(AssetType type, String hashedFileName) {
        String key = "assets/" + type.getFolder() + "/" + hashedFileName;
        String prefix = properties.getDirectoryPrefix();
        if (!StringUtils.hasText(prefix)) {
            return key;
        }
        return trimSlashes(prefix) + "/" + key;
    }

    /**
     * URL recorded on the asset: the location storage reported, otherwise the public base URL joined with the key.
     */
    public String storageUrl(String key, String reportedLocation) {
        if (StringUtils.hasText(reportedLocation)) {
            return reportedLocation;
        }
        String base = properties.getPublicBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + "/" + key;
    }

    private String trimSlashes(String value) {
        String trimmed = value.trim();
        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
