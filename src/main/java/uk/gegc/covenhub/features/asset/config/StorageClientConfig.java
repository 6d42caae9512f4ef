package uk.gegc.covenhub.features.asset.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

@Configuration
public class StorageClientConfig {

    @Bean
    public S3Configuration assetS3Configuration(AssetStorageProperties properties) {
        return S3Configuration.builder()
                // Path-style for S3-compatible endpoints such as MinIO
                .pathStyleAccessEnabled(properties.getEndpoint() != null)
                .build();
    }

    @Bean
    public S3Client assetS3Client(AssetStorageProperties properties, S3Configuration assetS3Configuration) {
        S3ClientBuilder builder = S3Client.builder()
                .region(Region.of(properties.getRegion()))
                .credentialsProvider(credentials(properties))
                .serviceConfiguration(assetS3Configuration);
        if (properties.getEndpoint() != null) {
            builder.endpointOverride(properties.getEndpoint());
        }
        return builder.build();
    }

    @Bean
    public S3Presigner assetPresigner(AssetStorageProperties properties, S3Configuration assetS3Configuration) {
        S3Presigner.Builder builder = S3Presigner.builder()
                .region(Region.of(properties.getRegion()))
                .credentialsProvider(credentials(properties))
                .serviceConfiguration(assetS3Configuration);
        if (properties.getEndpoint() != null) {
            builder.endpointOverride(properties.getEndpoint());
        }
        return builder.build();
    }

    private AwsCredentialsProvider credentials(AssetStorageProperties properties) {
        AwsBasicCredentials creds = AwsBasicCredentials.create(
                properties.getAccessKey(),
                properties.getSecretKey()
        );
        return StaticCredentialsProvider.create(creds);
    }
}
