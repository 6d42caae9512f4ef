package uk.gegc.covenhub.features.asset.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import uk.gegc.covenhub.features.asset.api.dto.AssetResponse;
import uk.gegc.covenhub.features.asset.config.AssetStorageProperties;
import uk.gegc.covenhub.features.asset.domain.exception.StorageException;
import uk.gegc.covenhub.features.asset.domain.model.Asset;
import uk.gegc.covenhub.features.asset.domain.model.AssetType;
import uk.gegc.covenhub.features.asset.domain.repository.AssetRepository;
import uk.gegc.covenhub.features.asset.infra.mapping.AssetMapper;
import uk.gegc.covenhub.features.asset.infra.storage.ObjectStorageClient;
import uk.gegc.covenhub.shared.exception.ResourceNotFoundException;
import uk.gegc.covenhub.shared.exception.UnauthorizedException;
import uk.gegc.covenhub.shared.exception.ValidationException;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AssetServiceImplTest {

    @Mock
    private AssetRepository assetRepository;
    @Mock
    private ObjectStorageClient storageClient;

    private AssetStorageProperties properties;
    private AssetServiceImpl service;

    @BeforeEach
    void setup() {
        properties = new AssetStorageProperties();
        properties.setSignedUrlTtl(Duration.ofMinutes(15));
        service = new AssetServiceImpl(assetRepository, storageClient, properties, new AssetMapper());
    }

    private Asset asset(String owner) {
        Asset asset = new Asset();
        asset.setId(UUID.randomUUID());
        asset.setFileName("sigil.png");
        asset.setHashedFileName("abc.png");
        asset.setMimeType("image/png");
        asset.setFileSize(2048L);
        asset.setStorageKey("assets/images/abc.png");
        asset.setStorageUrl("https://covenhub-assets.s3.amazonaws.com/assets/images/abc.png");
        asset.setAssetType(AssetType.IMAGE);
        asset.setUploadedBy(owner);
        return asset;
    }

    @Test
    @DisplayName("listAssets filters by type and returns unsigned responses by default")
    void listAssets_unsigned() {
        Asset asset = asset("user-1");
        Pageable pageable = PageRequest.of(1, 10);
        when(assetRepository.search(AssetType.IMAGE, null, pageable)).thenReturn(new PageImpl<>(List.of(asset), pageable, 11));

        Page<AssetResponse> page = service.listAssets(AssetType.IMAGE, 1, 10, false);

        assertThat(page.getTotalElements()).isEqualTo(11);
        assertThat(page.getContent()).singleElement()
                .extracting(AssetResponse::id, AssetResponse::signedUrl)
                .containsExactly(asset.getId(), null);
        verifyNoInteractions(storageClient);
    }

    @Test
    @DisplayName("listMyAssets scopes the search to the caller and signs URLs on request")
    void listMyAssets_signed() {
        Asset asset = asset("user-1");
        when(assetRepository.search(null, "user-1", PageRequest.of(0, 20)))
                .thenReturn(new PageImpl<>(List.of(asset)));
        when(storageClient.presignGet("assets/images/abc.png", Duration.ofMinutes(15))).thenReturn("https://signed/abc");

        Page<AssetResponse> page = service.listMyAssets("user-1", null, 0, 20, true);

        assertThat(page.getContent()).singleElement()
                .extracting(AssetResponse::signedUrl)
                .isEqualTo("https://signed/abc");
    }

    @Test
    @DisplayName("listMyAssets requires a caller")
    void listMyAssets_requiresCaller() {
        assertThatThrownBy(() -> service.listMyAssets(" ", null, 0, 20, false))
                .isInstanceOf(UnauthorizedException.class);
        verifyNoInteractions(assetRepository);
    }

    @Test
    @DisplayName("paging arguments are validated")
    void paging_validated() {
        assertThatThrownBy(() -> service.listAssets(null, -1, 20, false))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Page must not be negative");
        assertThatThrownBy(() -> service.listAssets(null, 0, 0, false))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.listAssets(null, 0, 101, false))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Size must be between 1 and 100");
        verifyNoInteractions(assetRepository);
    }

    @Test
    @DisplayName("getAsset degrades to an unsigned response when signing fails")
    void getAsset_signingFailure() {
        Asset asset = asset("user-1");
        when(assetRepository.findById(asset.getId())).thenReturn(Optional.of(asset));
        when(storageClient.presignGet(eq("assets/images/abc.png"), any(Duration.class)))
                .thenThrow(new StorageException("credentials expired", false));

        AssetResponse response = service.getAsset(asset.getId(), true);

        assertThat(response.id()).isEqualTo(asset.getId());
        assertThat(response.signedUrl()).isNull();
        assertThat(response.storageUrl()).isEqualTo(asset.getStorageUrl());
        verify(storageClient).presignGet(eq("assets/images/abc.png"), any(Duration.class));
    }

    @Test
    @DisplayName("getAsset reports a missing asset")
    void getAsset_notFound() {
        UUID id = UUID.randomUUID();
        when(assetRepository.findById(id)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.getAsset(id, false))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessage("Asset " + id + " not found");
    }
}
