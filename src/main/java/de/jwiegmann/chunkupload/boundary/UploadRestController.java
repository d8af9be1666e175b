package de.jwiegmann.chunkupload.boundary;

import de.jwiegmann.chunkupload.boundary.dto.ApiResponse;
import de.jwiegmann.chunkupload.boundary.dto.ChunkUploadResponse;
import de.jwiegmann.chunkupload.boundary.dto.UploadCompleteResponse;
import de.jwiegmann.chunkupload.boundary.dto.UploadInitRequest;
import de.jwiegmann.chunkupload.boundary.dto.UploadInitResponse;
import de.jwiegmann.chunkupload.boundary.dto.UploadStatusResponse;
import de.jwiegmann.chunkupload.control.UploadSessionManager;
import de.jwiegmann.chunkupload.control.exception.UploadValidationException;
import de.jwiegmann.chunkupload.entity.UploadSession;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;
import java.time.Clock;
import java.time.LocalDateTime;

@RestController
@RequestMapping("/api/uploads")
public class UploadRestController {

    static final String TOTAL_CHUNKS_HEADER = "X-Total-Chunks";

    private final UploadSessionManager manager;
    private final Clock clock;

    public UploadRestController(UploadSessionManager manager, Clock clock) {
        this.manager = manager;
        this.clock = clock;
    }

    /**
     * POST /api/uploads
     */
    @PostMapping
    public ResponseEntity<ApiResponse<UploadInitResponse>> init(@RequestBody(required = false) UploadInitRequest req) {
        if (req == null) {
            throw new UploadValidationException("Missing request body");
        }

        UploadSession s = manager.open(req.getFileName(), req.getFileSize(), req.getMimeType(),
                req.getTotalChunks(), req.getUploadedBy());

        UploadInitResponse body = UploadInitResponse.builder()
                .sessionId(s.getSessionId())
                .status(s.getStatus().value())
                .fileName(s.getOriginalName())
                .totalChunks(s.getTotalChunks())
                .expiresAt(s.getExpiresAt())
                .build();

        return ResponseEntity
                .created(URI.create("/api/uploads/" + s.getSessionId()))
                .body(ApiResponse.ok(body));
    }

    /**
     * PUT /api/uploads/{sessionId}/chunks/{chunkIndex}, Body sind die rohen Bytes des Chunks.
     */
    @PutMapping("/{sessionId}/chunks/{chunkIndex}")
    public ResponseEntity<ApiResponse<ChunkUploadResponse>> uploadChunk(
            @PathVariable String sessionId,
            @PathVariable int chunkIndex,
            @RequestHeader(TOTAL_CHUNKS_HEADER) int totalChunks,
            @RequestBody(required = false) byte[] chunk
    ) {
        return ResponseEntity.ok(ApiResponse.ok(manager.submitChunk(sessionId, chunkIndex, totalChunks, chunk)));
    }

    /**
     * POST /api/uploads/{sessionId}/complete, antwortet sofort; der Merge läuft im Hintergrund.
     */
    @PostMapping("/{sessionId}/complete")
    public ResponseEntity<ApiResponse<UploadCompleteResponse>> complete(@PathVariable String sessionId) {
        return ResponseEntity.ok(ApiResponse.ok(manager.complete(sessionId)));
    }

    /**
     * POST /api/uploads/{sessionId}/cancel
     */
    @PostMapping("/{sessionId}/cancel")
    public ResponseEntity<ApiResponse<UploadCompleteResponse>> cancel(@PathVariable String sessionId) {
        return ResponseEntity.ok(ApiResponse.ok(manager.cancel(sessionId)));
    }

    /**
     * GET /api/uploads/{sessionId}
     */
    @GetMapping("/{sessionId}")
    public ResponseEntity<ApiResponse<UploadStatusResponse>> getStatus(@PathVariable String sessionId) {
        UploadSession s = manager.getStatus(sessionId);
        return ResponseEntity.ok(ApiResponse.ok(UploadStatusResponse.of(s, LocalDateTime.now(clock))));
    }
}
