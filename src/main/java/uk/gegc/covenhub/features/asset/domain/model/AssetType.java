package uk.gegc.covenhub.features.asset.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

public enum AssetType {
    IMAGE("image", "images"),
    VIDEO("video", "videos");

    private final String value;
    private final String folder;

    AssetType(String value, String folder) {
        this.value = value;
        this.folder = folder;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Storage folder under {@code assets/} holding objects of this type.
     */
    public String getFolder() {
        return folder;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static AssetType fromValue(String rawValue) {
        if (rawValue == null || rawValue.isBlank()) {
            return null;
        }
        String normalized = rawValue.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(type -> type.value.equals(normalized) || type.name().toLowerCase(Locale.ROOT).equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown asset type: " + rawValue));
    }
}
