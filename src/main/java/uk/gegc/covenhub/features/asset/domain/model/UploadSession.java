package uk.gegc.covenhub.features.asset.domain.model;

import lombok.AccessLevel;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Server-side state of one chunked transfer.
 * <p>
 * Chunk bookkeeping ({@code chunkSizes}, {@code chunkETags}, {@code uploadedSize},
 * {@code lastUpdated}) is guarded by the session's own lock. Status changes go through
 * {@link #transition(UploadStatus, UploadStatus)} so that exactly one caller wins each
 * transition, regardless of which lock it holds.
 * <p>
 * Each chunk index also has its own lock, held across the storage write and the
 * bookkeeping update, so the recorded ETag is always the one storage kept last.
 * {@code writesInFlight} counts storage writes between {@link #beginWrite()} and
 * {@link #endWrite()}; the session only completes once it is zero.
 */
@Getter
public class UploadSession {

    private final String uploadId;
    private final String fileName;
    private final String mimeType;
    private final AssetType assetType;
    private final long totalSize;
    private final long chunkSize;
    private final int totalChunks;
    private final String ownerId;
    private final String hashedFileName;
    private final String storageKey;
    private final String storageHandle;
    private final Instant createdAt;

    @Getter(AccessLevel.NONE)
    private final ReentrantLock lock = new ReentrantLock();
    @Getter(AccessLevel.NONE)
    private final AtomicReference<UploadStatus> status = new AtomicReference<>(UploadStatus.INITIALIZING);
    @Getter(AccessLevel.NONE)
    private final Map<Integer, ReentrantLock> chunkLocks = new ConcurrentHashMap<>();

    @Getter(AccessLevel.NONE)
    private final Map<Integer, Long> chunkSizes = new HashMap<>();
    @Getter(AccessLevel.NONE)
    private final Map<Integer, String> chunkETags = new HashMap<>();
    @Getter(AccessLevel.NONE)
    private long uploadedSize;
    @Getter(AccessLevel.NONE)
    private int writesInFlight;
    private volatile Instant lastUpdated;
    private volatile Instant terminalAt;
    private volatile String failureReason;
    private volatile UUID assetId;

    public UploadSession(String uploadId,
                         String fileName,
                         String mimeType,
                         AssetType assetType,
                         long totalSize,
                         long chunkSize,
                         int totalChunks,
                         String ownerId,
                         String hashedFileName,
                         String storageKey,
                         String storageHandle,
                         Instant createdAt) {
        this.uploadId = uploadId;
        this.fileName = fileName;
        this.mimeType = mimeType;
        this.assetType = assetType;
        this.totalSize = totalSize;
        this.chunkSize = chunkSize;
        this.totalChunks = totalChunks;
        this.ownerId = ownerId;
        this.hashedFileName = hashedFileName;
        this.storageKey = storageKey;
        this.storageHandle = storageHandle;
        this.createdAt = createdAt;
        this.lastUpdated = createdAt;
    }

    public static int computeTotalChunks(long totalSize, long chunkSize) {
        if (totalSize <= 0 || chunkSize <= 0) {
            throw new IllegalArgumentException("totalSize and chunkSize must be positive");
        }
        return Math.toIntExact((totalSize + chunkSize - 1) / chunkSize);
    }

    /**
     * Byte length every admission of {@code chunkIndex} must carry: {@code chunkSize}
     * for all but the last index, the remainder for the last.
     */
    public long expectedChunkLength(int chunkIndex) {
        if (chunkIndex < totalChunks - 1) {
            return chunkSize;
        }
        return totalSize - chunkSize * (totalChunks - 1L);
    }

    public boolean isIndexInRange(int chunkIndex) {
        return chunkIndex >= 0 && chunkIndex < totalChunks;
    }

    public void lock() {
        lock.lock();
    }

    public void unlock() {
        lock.unlock();
    }

    /**
     * Lock serializing the storage write and the record of one chunk index.
     */
    public ReentrantLock chunkLock(int chunkIndex) {
        return chunkLocks.computeIfAbsent(chunkIndex, index -> new ReentrantLock());
    }

    /**
     * Caller must hold the lock.
     */
    public void beginWrite() {
        requireLocked();
        writesInFlight++;
    }

    /**
     * Caller must hold the lock.
     */
    public void endWrite() {
        requireLocked();
        if (writesInFlight == 0) {
            throw new IllegalStateException("No chunk write in flight for " + uploadId);
        }
        writesInFlight--;
    }

    /**
     * Atomically moves the session from {@code expected} to {@code target}.
     *
     * @return true when this caller performed the transition
     */
    public boolean transition(UploadStatus expected, UploadStatus target) {
        return status.compareAndSet(expected, target);
    }

    /**
     * Records (or refreshes) one chunk and recomputes {@code uploadedSize} over the
     * distinct indices. Caller must hold the lock.
     */
    public void recordChunk(int chunkIndex, long length, String eTag, Instant now) {
        requireLocked();
        chunkSizes.put(chunkIndex, length);
        chunkETags.put(chunkIndex, eTag);
        uploadedSize = chunkSizes.values().stream().mapToLong(Long::longValue).sum();
        lastUpdated = now;
    }

    /**
     * True when every index is recorded, the sizes add up and no write is still in
     * flight. Caller must hold the lock.
     */
    public boolean isComplete() {
        requireLocked();
        return writesInFlight == 0 && chunkSizes.size() == totalChunks && uploadedSize == totalSize;
    }

    public boolean isIdleSince(Instant now, Duration ttl) {
        return lastUpdated.plus(ttl).isBefore(now);
    }

    /**
     * @return true when this call moved the session from uploading to expired
     */
    public boolean markExpired(Instant now) {
        if (transition(UploadStatus.UPLOADING, UploadStatus.EXPIRED)) {
            terminalAt = now;
            return true;
        }
        return false;
    }

    public void markFailed(String reason, Instant now) {
        failureReason = reason;
        UploadStatus current = status.get();
        while (!current.isTerminal()) {
            if (status.compareAndSet(current, UploadStatus.FAILED)) {
                terminalAt = now;
                return;
            }
            current = status.get();
        }
    }

    public void markCompleted(UUID assetId, Instant now) {
        this.assetId = assetId;
        if (transition(UploadStatus.FINALIZING, UploadStatus.COMPLETED)) {
            terminalAt = now;
        }
    }

    /**
     * ETags of the admitted chunks keyed by index, in ascending index order.
     */
    public Map<Integer, String> orderedChunkETags() {
        lock();
        try {
            return Collections.unmodifiableMap(new TreeMap<>(chunkETags));
        } finally {
            unlock();
        }
    }

    public int getChunksUploaded() {
        lock();
        try {
            return chunkSizes.size();
        } finally {
            unlock();
        }
    }

    public long getUploadedSize() {
        lock();
        try {
            return uploadedSize;
        } finally {
            unlock();
        }
    }

    public boolean hasChunk(int chunkIndex) {
        lock();
        try {
            return chunkSizes.containsKey(chunkIndex);
        } finally {
            unlock();
        }
    }

    private void requireLocked() {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("Session lock not held for " + uploadId);
        }
    }

    public UploadStatus getStatus() {
        return status.get();
    }
}
