package uk.gegc.covenhub.features.asset.domain.repository;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.covenhub.features.asset.domain.model.Asset;
import uk.gegc.covenhub.features.asset.domain.model.AssetType;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface AssetRepository extends JpaRepository<Asset, UUID> {

    @Query("""
        SELECT a FROM Asset a
        WHERE (:type IS NULL OR a.assetType = :type)
          AND (:owner IS NULL OR a.uploadedBy = :owner)
        ORDER BY a.createdAt DESC
    """)
    Page<Asset> search(
            @Param("type") AssetType type,
            @Param("owner") String owner,
            Pageable pageable
    );

    Optional<Asset> findByUploadId(String uploadId);

    long countByUploadId(String uploadId);
}
