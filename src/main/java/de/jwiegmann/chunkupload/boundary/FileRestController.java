package de.jwiegmann.chunkupload.boundary;

import de.jwiegmann.chunkupload.boundary.dto.ApiResponse;
import de.jwiegmann.chunkupload.boundary.dto.UploadCompleteResponse;
import de.jwiegmann.chunkupload.boundary.dto.UploadStatsResponse;
import de.jwiegmann.chunkupload.boundary.dto.UploadStatusListResponse;
import de.jwiegmann.chunkupload.control.UploadFileService;
import de.jwiegmann.chunkupload.control.UploadSessionManager;
import de.jwiegmann.chunkupload.entity.UploadSession;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;

@RestController
@RequestMapping("/api/files")
public class FileRestController {

    private final UploadFileService fileService;
    private final UploadSessionManager manager;

    public FileRestController(UploadFileService fileService, UploadSessionManager manager) {
        this.fileService = fileService;
        this.manager = manager;
    }

    /**
     * GET /api/files?status=&page=&limit=&sortBy=&sortOrder=
     */
    @GetMapping
    public ResponseEntity<ApiResponse<UploadStatusListResponse>> list(
            @RequestParam(required = false) String status,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) String sortBy,
            @RequestParam(required = false) String sortOrder
    ) {
        return ResponseEntity.ok(ApiResponse.ok(fileService.list(status, page, limit, sortBy, sortOrder)));
    }

    /**
     * GET /api/files/stats
     */
    @GetMapping("/stats")
    public ResponseEntity<ApiResponse<UploadStatsResponse>> stats() {
        return ResponseEntity.ok(ApiResponse.ok(fileService.stats()));
    }

    /**
     * DELETE /api/files/{sessionId}
     */
    @DeleteMapping("/{sessionId}")
    public ResponseEntity<ApiResponse<UploadCompleteResponse>> delete(@PathVariable String sessionId) {
        manager.delete(sessionId);
        return ResponseEntity.ok(ApiResponse.ok(UploadCompleteResponse.builder()
                .sessionId(sessionId)
                .message("File deleted")
                .build()));
    }

    /**
     * GET /api/files/{sessionId}/download. Range-Header wertet Spring anhand der Resource aus (206).
     */
    @GetMapping("/{sessionId}/download")
    public ResponseEntity<Resource> download(@PathVariable String sessionId) {
        UploadFileService.Download download = fileService.download(sessionId);
        UploadSession session = download.session();

        return ResponseEntity.ok()
                .contentType(mediaTypeOf(session.getMimeType()))
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                        .filename(session.getOriginalName(), StandardCharsets.UTF_8)
                        .build()
                        .toString())
                .body(download.resource());
    }

    private static MediaType mediaTypeOf(String mimeType) {
        try {
            return MediaType.parseMediaType(mimeType);
        } catch (IllegalArgumentException e) {
            return MediaType.APPLICATION_OCTET_STREAM;
        }
    }
}
