package de.jwiegmann.chunkupload.boundary.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import de.jwiegmann.chunkupload.entity.UploadSession;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Sicht auf eine Session nach außen. Interne Felder wie blobRef bleiben draußen,
 * progress und expired werden beim Lesen berechnet.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UploadStatusResponse {

    private String sessionId;
    private String fileName;
    private String mimeType;
    private long fileSize;
    private String uploadedBy;
    private String status;      // pending | uploading | processing | completed | failed | cancelled
    private int totalChunks;
    private int uploadedChunks;
    private int progress;
    private boolean expired;
    private String errorMessage;
    private int retryCount;
    private int downloadCount;
    private LocalDateTime lastDownloadedAt;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private LocalDateTime expiresAt;
    private LocalDateTime processingStartedAt;
    private LocalDateTime processingCompletedAt;

    public static UploadStatusResponse of(UploadSession s, LocalDateTime now) {
        return UploadStatusResponse.builder()
                .sessionId(s.getSessionId())
                .fileName(s.getOriginalName())
                .mimeType(s.getMimeType())
                .fileSize(s.getDeclaredSize())
                .uploadedBy(s.getUploadedBy())
                .status(s.getStatus().value())
                .totalChunks(s.getTotalChunks())
                .uploadedChunks(s.getUploadedChunks())
                .progress(s.getProgress())
                .expired(s.isExpired(now))
                .errorMessage(s.getErrorMessage())
                .retryCount(s.getRetryCount())
                .downloadCount(s.getDownloadCount())
                .lastDownloadedAt(s.getLastDownloadedAt())
                .createdAt(s.getCreatedAt())
                .updatedAt(s.getUpdatedAt())
                .expiresAt(s.getExpiresAt())
                .processingStartedAt(s.getProcessingStartedAt())
                .processingCompletedAt(s.getProcessingCompletedAt())
                .build();
    }
}
