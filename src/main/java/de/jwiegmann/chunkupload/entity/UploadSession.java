package de.jwiegmann.chunkupload.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Metadaten einer Upload-Session (eine Datei pro Session).
 * Fortschritt wird nur als zusammenhängendes Präfix gezählt: uploadedChunks = n heißt,
 * dass die Chunks 0..n-1 bestätigt sind.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class UploadSession {

    private String sessionId;             // 32 Zeichen hex
    private String originalName;
    private String mimeType;
    private long declaredSize;
    private String uploadedBy;

    private int totalChunks;
    private int uploadedChunks;

    private UploadSessionStatus status;
    private String blobRef;               // nur bei COMPLETED gesetzt
    private String errorMessage;
    private int retryCount;

    private int downloadCount;
    private LocalDateTime lastDownloadedAt;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private LocalDateTime expiresAt;
    private LocalDateTime processingStartedAt;
    private LocalDateTime processingCompletedAt;

    /**
     * Fortschritt in Prozent (gerundet), wird nie gespeichert.
     */
    public int getProgress() {
        if (totalChunks <= 0) {
            return 0;
        }
        return (int) Math.round(uploadedChunks * 100.0 / totalChunks);
    }

    public boolean isExpired(LocalDateTime now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }

    public boolean isFullyUploaded() {
        return uploadedChunks == totalChunks;
    }

    public UploadSession copy() {
        return toBuilder().build();
    }
}
