package uk.gegc.covenhub.features.asset.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "assets")
@Getter
@Setter
@NoArgsConstructor
public class Asset {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "asset_id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "file_name", nullable = false, length = 512)
    private String fileName;

    @Column(name = "hashed_file_name", nullable = false, unique = true, length = 128)
    private String hashedFileName;

    @Column(name = "mime_type", nullable = false, length = 255)
    private String mimeType;

    @Column(name = "file_size", nullable = false)
    private Long fileSize;

    @Column(name = "storage_key", nullable = false, unique = true, length = 1024)
    private String storageKey;

    @Column(name = "storage_url", nullable = false, length = 2048)
    private String storageUrl;

    @Enumerated(EnumType.STRING)
    @Column(name = "asset_type", nullable = false, length = 32)
    private AssetType assetType;

    @Column(name = "uploaded_by", nullable = false, length = 255)
    private String uploadedBy;

    /**
     * Chunked session that produced this asset; null for direct uploads. Unique so a
     * session can never be recorded twice.
     */
    @Column(name = "upload_id", unique = true, length = 64)
    private String uploadId;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    public boolean isImage() {
        return AssetType.IMAGE.equals(assetType);
    }
}
