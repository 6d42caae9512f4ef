package uk.gegc.covenhub.features.asset.application;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.mock.web.MockMultipartFile;
import uk.gegc.covenhub.features.asset.config.AssetStorageProperties;
import uk.gegc.covenhub.features.asset.domain.model.Asset;
import uk.gegc.covenhub.features.asset.domain.model.AssetType;
import uk.gegc.covenhub.features.asset.domain.model.UploadPayload;
import uk.gegc.covenhub.features.asset.infra.storage.ObjectStorageClient;
import uk.gegc.covenhub.shared.exception.UnauthorizedException;
import uk.gegc.covenhub.shared.exception.ValidationException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DirectUploadGuardTest {

    @Mock
    private ObjectStorageClient storageClient;
    @Mock
    private AssetRecorder assetRecorder;

    private AssetStorageProperties properties;
    private DirectUploadGuard guard;

    @BeforeEach
    void setup() {
        properties = new AssetStorageProperties();
        properties.getLimits().setMaxImageSizeBytes(1024L * 1024);
        guard = new DirectUploadGuard(
                storageClient,
                new AssetClassifier(properties),
                new StorageKeyFactory(properties),
                assetRecorder
        );
    }

    private UploadPayload.Direct payload(String fileName, String mimeType, byte[] bytes, String callerId) {
        MockMultipartFile file = new MockMultipartFile("file", fileName, mimeType, bytes);
        return new UploadPayload.Direct(fileName, mimeType, bytes.length, file, callerId);
    }

    @Test
    @DisplayName("store writes the object, checks its stored size and records an asset without an upload id")
    void store_success() {
        byte[] bytes = new byte[2048];
        Asset saved = new Asset();
        saved.setId(UUID.randomUUID());
        when(storageClient.putObject(anyString(), eq("image/png"), any(InputStream.class), eq(2048L), anyMap())).thenReturn(null);
        when(storageClient.objectSize(anyString())).thenReturn(2048L);
        when(assetRecorder.record(eq("sigil.png"), anyString(), eq("image/png"), eq(AssetType.IMAGE), eq(2048L),
                anyString(), isNull(), eq("user-1"), isNull())).thenReturn(saved);

        Asset asset = guard.store(payload("sigil.png", "image/png", bytes, "user-1"));

        assertThat(asset).isSameAs(saved);
        ArgumentCaptor<String> key = ArgumentCaptor.forClass(String.class);
        verify(storageClient).putObject(key.capture(), eq("image/png"), any(InputStream.class), eq(2048L),
                eq(Map.of("uploaded-by", "user-1")));
        assertThat(key.getValue()).startsWith("assets/images/").endsWith(".png");
        verify(storageClient, never()).deleteObject(anyString());
    }

    @Test
    @DisplayName("A stream that fails to close after a successful put still yields a recorded asset")
    void store_closeFailureAfterPut() {
        byte[] bytes = new byte[256];
        Asset saved = new Asset();
        saved.setId(UUID.randomUUID());
        InputStream failingClose = new ByteArrayInputStream(bytes) {
            @Override
            public void close() throws IOException {
                throw new IOException("connection reset");
            }
        };
        UploadPayload.Direct payload = new UploadPayload.Direct("sigil.png", "image/png", bytes.length,
                () -> failingClose, "user-1");
        when(storageClient.objectSize(anyString())).thenReturn(256L);
        when(assetRecorder.record(anyString(), anyString(), anyString(), any(), anyLong(), anyString(), any(), anyString(), any()))
                .thenReturn(saved);

        Asset asset = guard.store(payload);

        assertThat(asset).isSameAs(saved);
        verify(storageClient).putObject(anyString(), eq("image/png"), any(InputStream.class), eq(256L), anyMap());
        verify(storageClient, never()).deleteObject(anyString());
    }

    @Test
    @DisplayName("An object larger than the type limit is deleted and rejected")
    void store_oversizeDeleted() {
        byte[] bytes = new byte[4096];
        when(storageClient.objectSize(anyString())).thenReturn(2L * 1024 * 1024);

        assertThatThrownBy(() -> guard.store(payload("sigil.png", "image/png", bytes, "user-1")))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("File too large. Maximum size for image is 1 MB");

        verify(storageClient).deleteObject(anyString());
        verifyNoInteractions(assetRecorder);
    }

    @Test
    @DisplayName("A persistence failure deletes the stored object and propagates")
    void store_recordFailureDeletesObject() {
        byte[] bytes = new byte[512];
        when(storageClient.objectSize(anyString())).thenReturn(512L);
        when(assetRecorder.record(anyString(), anyString(), anyString(), any(), anyLong(), anyString(), any(), anyString(), any()))
                .thenThrow(new DataIntegrityViolationException("duplicate key"));

        assertThatThrownBy(() -> guard.store(payload("sigil.png", "image/png", bytes, "user-1")))
                .isInstanceOf(DataIntegrityViolationException.class);

        verify(storageClient).deleteObject(anyString());
    }

    @Test
    @DisplayName("Unsupported types are rejected before anything is written")
    void store_rejectsUnsupportedType() {
        assertThatThrownBy(() -> guard.store(payload("grimoire.pdf", "application/pdf", new byte[10], "user-1")))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Invalid file type");

        verifyNoInteractions(storageClient);
    }

    @Test
    @DisplayName("An anonymous caller is rejected")
    void store_requiresCaller() {
        assertThatThrownBy(() -> guard.store(payload("sigil.png", "image/png", new byte[10], null)))
                .isInstanceOf(UnauthorizedException.class);

        verifyNoInteractions(storageClient);
    }
}
