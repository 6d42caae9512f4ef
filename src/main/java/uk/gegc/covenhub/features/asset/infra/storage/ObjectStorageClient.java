package uk.gegc.covenhub.features.asset.infra.storage;

import uk.gegc.covenhub.features.asset.domain.exception.StorageException;

import java.io.InputStream;
import java.time.Duration;
import java.util.Map;

/**
 * Object-storage operations the upload coordinator relies on. Every method reports
 * failures as {@link StorageException}, flagged retryable when repeating the same call
 * is safe.
 */
public interface ObjectStorageClient {

    /**
     * Opens a multipart upload and returns its storage handle.
     */
    String createMultipartUpload(String key, String contentType);

    /**
     * Writes one part. Re-sending a part number replaces the earlier payload.
     *
     * @return the part's ETag, needed to complete the upload
     */
    String uploadPart(String key, String storageHandle, int partNumber, byte[] bytes);

    /**
     * Assembles the parts in ascending part-number order.
     *
     * @param partETags ETag per part number
     * @return the location reported by storage, or null when it reports none
     */
    String completeMultipartUpload(String key, String storageHandle, Map<Integer, String> partETags);

    void abortMultipartUpload(String key, String storageHandle);

    /**
     * @return the location reported by storage, or null when it reports none
     */
    String putObject(String key, String contentType, InputStream content, long contentLength, Map<String, String> metadata);

    /**
     * Byte size of a stored object as storage reports it.
     */
    long objectSize(String key);

    void deleteObject(String key);

    String presignGet(String key, Duration ttl);
}
