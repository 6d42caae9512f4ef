package uk.gegc.covenhub.features.asset.infra.storage;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.AbortMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CompleteMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CompleteMultipartUploadResponse;
import software.amazon.awssdk.services.s3.model.CompletedMultipartUpload;
import software.amazon.awssdk.services.s3.model.CompletedPart;
import software.amazon.awssdk.services.s3.model.CreateMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.UploadPartRequest;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;
import uk.gegc.covenhub.features.asset.config.AssetStorageProperties;
import uk.gegc.covenhub.features.asset.domain.exception.StorageException;

import java.io.InputStream;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Component
@RequiredArgsConstructor
@Slf4j
public class S3ObjectStorageClient implements ObjectStorageClient {

    private final S3Client s3Client;
    private final S3Presigner presigner;
    private final AssetStorageProperties properties;

    @Override
    public String createMultipartUpload(String key, String contentType) {
        try {
            return s3Client.createMultipartUpload(CreateMultipartUploadRequest.builder()
                    .bucket(properties.getBucket())
                    .key(key)
                    .contentType(contentType)
                    .build()).uploadId();
        } catch (SdkException ex) {
            throw translate("create multipart upload", key, ex);
        }
    }

    @Override
    public String uploadPart(String key, String storageHandle, int partNumber, byte[] bytes) {
        try {
            return s3Client.uploadPart(UploadPartRequest.builder()
                            .bucket(properties.getBucket())
                            .key(key)
                            .uploadId(storageHandle)
                            .partNumber(partNumber)
                            .contentLength((long) bytes.length)
                            .build(),
                    RequestBody.fromBytes(bytes)).eTag();
        } catch (SdkException ex) {
            throw translate("upload part " + partNumber, key, ex);
        }
    }

    @Override
    public String completeMultipartUpload(String key, String storageHandle, Map<Integer, String> partETags) {
        List<CompletedPart> parts = new TreeMap<>(partETags).entrySet().stream()
                .map(entry -> CompletedPart.builder()
                        .partNumber(entry.getKey())
                        .eTag(entry.getValue())
                        .build())
                .toList();
        try {
            CompleteMultipartUploadResponse response = s3Client.completeMultipartUpload(CompleteMultipartUploadRequest.builder()
                    .bucket(properties.getBucket())
                    .key(key)
                    .uploadId(storageHandle)
                    .multipartUpload(CompletedMultipartUpload.builder().parts(parts).build())
                    .build());
            return response.location();
        } catch (SdkException ex) {
            throw translate("complete multipart upload", key, ex);
        }
    }

    @Override
    public void abortMultipartUpload(String key, String storageHandle) {
        try {
            s3Client.abortMultipartUpload(AbortMultipartUploadRequest.builder()
                    .bucket(properties.getBucket())
                    .key(key)
                    .uploadId(storageHandle)
                    .build());
        } catch (SdkException ex) {
            throw translate("abort multipart upload", key, ex);
        }
    }

    @Override
    public String putObject(String key, String contentType, InputStream content, long contentLength, Map<String, String> metadata) {
        try {
            s3Client.putObject(PutObjectRequest.builder()
                            .bucket(properties.getBucket())
                            .key(key)
                            .contentType(contentType)
                            .contentLength(contentLength)
                            .metadata(metadata)
                            .build(),
                    RequestBody.fromInputStream(content, contentLength));
            // PutObject reports no location
            return null;
        } catch (SdkException ex) {
            throw translate("put object", key, ex);
        }
    }

    @Override
    public long objectSize(String key) {
        try {
            return s3Client.headObject(HeadObjectRequest.builder()
                    .bucket(properties.getBucket())
                    .key(key)
                    .build()).contentLength();
        } catch (NoSuchKeyException ex) {
            throw new StorageException("Stored object not found: " + key, false, ex);
        } catch (S3Exception ex) {
            // HEAD carries no error body, so a missing key surfaces as a bare 404
            if (ex.statusCode() == 404) {
                throw new StorageException("Stored object not found: " + key, false, ex);
            }
            throw translate("head object", key, ex);
        } catch (SdkException ex) {
            throw translate("head object", key, ex);
        }
    }

    @Override
    public void deleteObject(String key) {
        try {
            s3Client.deleteObject(DeleteObjectRequest.builder()
                    .bucket(properties.getBucket())
                    .key(key)
                    .build());
        } catch (SdkException ex) {
            throw translate("delete object", key, ex);
        }
    }

    @Override
    public String presignGet(String key, Duration ttl) {
        try {
            GetObjectPresignRequest presignRequest = GetObjectPresignRequest.builder()
                    .signatureDuration(ttl)
                    .getObjectRequest(GetObjectRequest.builder()
                            .bucket(properties.getBucket())
                            .key(key)
                            .build())
                    .build();
            return presigner.presignGetObject(presignRequest).url().toString();
        } catch (SdkException ex) {
            throw translate("presign get", key, ex);
        }
    }

    private StorageException translate(String operation, String key, SdkException ex) {
        boolean retryable = ex.retryable();
        if (ex instanceof S3Exception s3Exception) {
            int status = s3Exception.statusCode();
            retryable = retryable || status >= 500 || status == 429;
        }
        log.error("Storage failure during {} for key {} (retryable={}): {}", operation, key, retryable, ex.getMessage(), ex);
        return new StorageException("Storage failed to " + operation, retryable, ex);
    }
}
