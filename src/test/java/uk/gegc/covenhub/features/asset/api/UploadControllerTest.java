package uk.gegc.covenhub.features.asset.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import uk.gegc.covenhub.features.asset.api.dto.AssetResponse;
import uk.gegc.covenhub.features.asset.api.dto.InitializeUploadRequest;
import uk.gegc.covenhub.features.asset.api.dto.InitializeUploadResponse;
import uk.gegc.covenhub.features.asset.api.dto.UploadProgressResponse;
import uk.gegc.covenhub.features.asset.application.UploadService;
import uk.gegc.covenhub.features.asset.domain.exception.ChunkIntegrityException;
import uk.gegc.covenhub.features.asset.domain.exception.StorageException;
import uk.gegc.covenhub.features.asset.domain.exception.UploadConflictException;
import uk.gegc.covenhub.features.asset.domain.exception.UploadExpiredException;
import uk.gegc.covenhub.features.asset.domain.exception.UploadSessionNotFoundException;
import uk.gegc.covenhub.features.asset.domain.model.AssetType;
import uk.gegc.covenhub.features.asset.domain.model.UploadStatus;
import uk.gegc.covenhub.shared.exception.ForbiddenException;
import uk.gegc.covenhub.shared.exception.ValidationException;
import uk.gegc.covenhub.shared.security.AppPermissionEvaluator;

import java.time.Instant;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.csrf;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(UploadController.class)
class UploadControllerTest {

    private static final String UPLOAD_ID = "e".repeat(64);
    private static final String CHUNK_URL = "/api/v1/assets/uploads/chunked/{uploadId}/chunks/{chunkIndex}";

    @Autowired
    MockMvc mockMvc;

    @Autowired
    ObjectMapper objectMapper;

    @MockitoBean
    UploadService uploadService;

    @MockitoBean
    AppPermissionEvaluator permissionEvaluator;

    private UploadProgressResponse progress(int chunksUploaded, int percent, UploadStatus status, UUID assetId) {
        return new UploadProgressResponse(UPLOAD_ID, "ritual.mp4", 1048576L, 262144L * chunksUploaded,
                chunksUploaded, 4, percent, status,
                Instant.parse("2024-06-01T00:00:00Z"), Instant.parse("2024-06-01T00:01:00Z"), assetId);
    }

    @Test
    @WithMockUser(username = "user-1", authorities = "ASSET_CREATE")
    @DisplayName("POST /chunked opens a session and returns 201")
    void initializeUpload() throws Exception {
        InitializeUploadResponse response = new InitializeUploadResponse(UPLOAD_ID, "ritual.mp4", 1048576L, 262144L, 4,
                UploadStatus.UPLOADING, Instant.parse("2024-06-01T00:00:00Z"));
        when(uploadService.initializeUpload(any(InitializeUploadRequest.class), eq("user-1"))).thenReturn(response);

        mockMvc.perform(post("/api/v1/assets/uploads/chunked")
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                new InitializeUploadRequest("ritual.mp4", 1048576L, 262144L, 4, "video/mp4"))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.uploadId").value(UPLOAD_ID))
                .andExpect(jsonPath("$.totalChunks").value(4))
                .andExpect(jsonPath("$.status").value("uploading"));
    }

    @Test
    @WithMockUser(username = "user-1", authorities = "ASSET_CREATE")
    @DisplayName("POST /chunked with a missing total size is a 400 with field errors")
    void initializeUpload_invalidBody() throws Exception {
        mockMvc.perform(post("/api/v1/assets/uploads/chunked")
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fileName\":\"ritual.mp4\",\"mimeType\":\"video/mp4\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fieldErrors[0].field").value("totalSize"));

        verifyNoInteractions(uploadService);
    }

    @Test
    @WithMockUser(username = "user-1", authorities = "ASSET_CREATE")
    @DisplayName("POST /chunked with an inconsistent chunk count is a 400")
    void initializeUpload_mismatch() throws Exception {
        when(uploadService.initializeUpload(any(InitializeUploadRequest.class), anyString()))
                .thenThrow(new ValidationException("Total chunks mismatch: expected 4 but got 3"));

        mockMvc.perform(post("/api/v1/assets/uploads/chunked")
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                new InitializeUploadRequest("ritual.mp4", 1048576L, 262144L, 3, "video/mp4"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("Validation Failed"))
                .andExpect(jsonPath("$.detail").value("Total chunks mismatch: expected 4 but got 3"));
    }

    @Test
    @WithMockUser(username = "user-1", authorities = "ASSET_CREATE")
    @DisplayName("PUT chunk passes raw bytes and the hash header to the service")
    void uploadChunk() throws Exception {
        byte[] body = new byte[]{1, 2, 3, 4};
        when(uploadService.uploadChunk(eq(UPLOAD_ID), eq(2), any(byte[].class), eq("abc123"), eq("user-1")))
                .thenReturn(progress(3, 75, UploadStatus.UPLOADING, null));

        mockMvc.perform(put(CHUNK_URL, UPLOAD_ID, 2)
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_OCTET_STREAM)
                        .header(UploadController.CHUNK_HASH_HEADER, "abc123")
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.progress").value(75))
                .andExpect(jsonPath("$.chunksUploaded").value(3))
                .andExpect(jsonPath("$.status").value("uploading"));

        verify(uploadService).uploadChunk(eq(UPLOAD_ID), eq(2), eq(body), eq("abc123"), eq("user-1"));
    }

    @Test
    @WithMockUser(username = "user-1", authorities = "ASSET_CREATE")
    @DisplayName("PUT chunk with an empty body is reported as unreadable, not as malformed JSON")
    void uploadChunk_emptyBody() throws Exception {
        mockMvc.perform(put(CHUNK_URL, UPLOAD_ID, 0)
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_OCTET_STREAM)
                        .header(UploadController.CHUNK_HASH_HEADER, "abc123")
                        .content(new byte[0]))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("Unreadable Request Body"))
                .andExpect(jsonPath("$.detail").value("Request body is missing or unreadable"));

        verifyNoInteractions(uploadService);
    }

    @Test
    @WithMockUser(username = "user-1", authorities = "ASSET_CREATE")
    @DisplayName("POST /chunked with broken JSON is a malformed JSON problem")
    void initializeUpload_malformedJson() throws Exception {
        mockMvc.perform(post("/api/v1/assets/uploads/chunked")
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fileName\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("Malformed JSON"));

        verifyNoInteractions(uploadService);
    }

    @Test
    @WithMockUser(username = "user-1", authorities = "ASSET_CREATE")
    @DisplayName("PUT chunk without the hash header is a 400")
    void uploadChunk_missingHash() throws Exception {
        mockMvc.perform(put(CHUNK_URL, UPLOAD_ID, 0)
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_OCTET_STREAM)
                        .content(new byte[8]))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("Missing Request Value"));

        verifyNoInteractions(uploadService);
    }

    @Test
    @WithMockUser(username = "user-1", authorities = "ASSET_CREATE")
    @DisplayName("Chunk failures map onto their problem statuses")
    void uploadChunk_errorMapping() throws Exception {
        when(uploadService.uploadChunk(anyString(), anyInt(), any(byte[].class), anyString(), anyString()))
                .thenThrow(new ChunkIntegrityException(UPLOAD_ID, 1))
                .thenThrow(new UploadConflictException(UPLOAD_ID, UploadStatus.COMPLETED))
                .thenThrow(new UploadExpiredException(UPLOAD_ID))
                .thenThrow(new StorageException("Storage failed to upload part 2", true))
                .thenThrow(new StorageException("Storage failed to upload part 2", false))
                .thenThrow(new ForbiddenException("You cannot access this upload session"));

        mockMvc.perform(put(CHUNK_URL, UPLOAD_ID, 1).with(csrf())
                        .contentType(MediaType.APPLICATION_OCTET_STREAM)
                        .header(UploadController.CHUNK_HASH_HEADER, "abc").content(new byte[4]))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.chunkIndex").value(1));
        mockMvc.perform(put(CHUNK_URL, UPLOAD_ID, 1).with(csrf())
                        .contentType(MediaType.APPLICATION_OCTET_STREAM)
                        .header(UploadController.CHUNK_HASH_HEADER, "abc").content(new byte[4]))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.currentStatus").value("completed"));
        mockMvc.perform(put(CHUNK_URL, UPLOAD_ID, 1).with(csrf())
                        .contentType(MediaType.APPLICATION_OCTET_STREAM)
                        .header(UploadController.CHUNK_HASH_HEADER, "abc").content(new byte[4]))
                .andExpect(status().isGone());
        mockMvc.perform(put(CHUNK_URL, UPLOAD_ID, 1).with(csrf())
                        .contentType(MediaType.APPLICATION_OCTET_STREAM)
                        .header(UploadController.CHUNK_HASH_HEADER, "abc").content(new byte[4]))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.retryable").value(true));
        mockMvc.perform(put(CHUNK_URL, UPLOAD_ID, 1).with(csrf())
                        .contentType(MediaType.APPLICATION_OCTET_STREAM)
                        .header(UploadController.CHUNK_HASH_HEADER, "abc").content(new byte[4]))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.retryable").value(false));
        mockMvc.perform(put(CHUNK_URL, UPLOAD_ID, 1).with(csrf())
                        .contentType(MediaType.APPLICATION_OCTET_STREAM)
                        .header(UploadController.CHUNK_HASH_HEADER, "abc").content(new byte[4]))
                .andExpect(status().isForbidden());
    }

    @Test
    @WithMockUser(username = "user-1", authorities = "ASSET_READ")
    @DisplayName("GET /chunked/{id} returns progress, 404 for unknown and 400 for malformed ids")
    void getUploadProgress() throws Exception {
        UUID assetId = UUID.randomUUID();
        when(uploadService.getUploadProgress(UPLOAD_ID, "user-1"))
                .thenReturn(progress(4, 100, UploadStatus.COMPLETED, assetId));
        when(uploadService.getUploadProgress("f".repeat(64), "user-1"))
                .thenThrow(new UploadSessionNotFoundException("f".repeat(64)));
        when(uploadService.getUploadProgress("bogus", "user-1"))
                .thenThrow(new ValidationException("Invalid upload ID format"));

        mockMvc.perform(get("/api/v1/assets/uploads/chunked/{uploadId}", UPLOAD_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.progress").value(100))
                .andExpect(jsonPath("$.status").value("completed"))
                .andExpect(jsonPath("$.assetId").value(assetId.toString()));
        mockMvc.perform(get("/api/v1/assets/uploads/chunked/{uploadId}", "f".repeat(64)))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.detail").value("Upload session not found"));
        mockMvc.perform(get("/api/v1/assets/uploads/chunked/{uploadId}", "bogus"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Invalid upload ID format"));
    }

    @Test
    @WithMockUser(username = "user-1", authorities = "ASSET_DELETE")
    @DisplayName("DELETE /chunked/{id} cancels and returns 204")
    void cancelUpload() throws Exception {
        mockMvc.perform(delete("/api/v1/assets/uploads/chunked/{uploadId}", UPLOAD_ID).with(csrf()))
                .andExpect(status().isNoContent());

        verify(uploadService).cancelUpload(UPLOAD_ID, "user-1");
    }

    @Test
    @WithMockUser(username = "user-1", authorities = "ASSET_CREATE")
    @DisplayName("POST multipart stores the file directly and returns 201")
    void uploadDirect() throws Exception {
        UUID assetId = UUID.randomUUID();
        AssetResponse response = new AssetResponse(assetId, "sigil.png", "abc.png", "image/png", 64L,
                "assets/images/abc.png", "https://covenhub-assets.s3.amazonaws.com/assets/images/abc.png", null,
                AssetType.IMAGE, "user-1", Instant.parse("2024-06-01T00:00:00Z"), Instant.parse("2024-06-01T00:00:00Z"));
        when(uploadService.uploadDirect(any(), eq("user-1"))).thenReturn(response);

        mockMvc.perform(multipart("/api/v1/assets/uploads")
                        .file(new MockMultipartFile("file", "sigil.png", "image/png", new byte[64]))
                        .with(csrf()))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(assetId.toString()))
                .andExpect(jsonPath("$.assetType").value("image"));
    }
}
