package uk.gegc.covenhub.features.asset.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.net.URI;
import java.time.Duration;
import java.util.List;

@Data
@Validated
@Component
@ConfigurationProperties(prefix = "app.assets")
public class AssetStorageProperties {

    @NotBlank
    private String bucket = "covenhub-assets";

    @NotBlank
    private String region = "us-east-1";

    /**
     * Optional S3-compatible endpoint override (MinIO, Spaces). Empty means the AWS default for the region.
     */
    private URI endpoint;

    @NotBlank
    private String accessKey = "dev-access-key";

    @NotBlank
    private String secretKey = "dev-secret-key";

    /**
     * Base URL used to build asset URLs when storage does not report a location.
     * Example: https://covenhub-assets.s3.amazonaws.com
     */
    @NotBlank
    private String publicBaseUrl = "https://covenhub-assets.s3.amazonaws.com";

    /**
     * Environment folder prepended to every key, e.g. "dev" or "prod". Blank for none.
     */
    private String directoryPrefix = "";

    /**
     * Lifetime of presigned download URLs.
     */
    @NotNull
    private Duration signedUrlTtl = Duration.ofHours(1);

    @Valid
    @NotNull
    private Limits limits = new Limits();

    @Valid
    @NotNull
    private Chunked chunked = new Chunked();

    @Data
    public static class Limits {
        private List<String> allowedImageMimeTypes = List.of(
                "image/jpeg",
                "image/jpg",
                "image/png",
                "image/gif",
                "image/webp"
        );

        private List<String> allowedVideoMimeTypes = List.of(
                "video/mp4",
                "video/mpeg",
                "video/quicktime",
                "video/x-msvideo",
                "video/webm"
        );

        /**
         * Max size in bytes for images (default 50MB).
         */
        @Positive
        private long maxImageSizeBytes = 50L * 1024 * 1024;

        /**
         * Max size in bytes for videos (default 500MB).
         */
        @Positive
        private long maxVideoSizeBytes = 500L * 1024 * 1024;
    }

    @Data
    public static class Chunked {
        @Positive
        private long defaultChunkSizeBytes = 5L * 1024 * 1024;

        /**
         * Lower bound for every chunk but the last. S3 rejects smaller multipart parts.
         */
        @Positive
        private long minChunkSizeBytes = 5L * 1024 * 1024;

        @Positive
        private long maxChunkSizeBytes = 100L * 1024 * 1024;

        /**
         * Idle time after which an uploading session expires.
         */
        @NotNull
        private Duration sessionTtl = Duration.ofHours(24);

        /**
         * How long terminal sessions stay queryable before eviction.
         */
        @NotNull
        private Duration retention = Duration.ofHours(1);

        @Positive
        private long sweepIntervalMs = 60_000L;
    }
}
