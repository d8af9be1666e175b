package de.jwiegmann.chunkupload.boundary.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UploadInitResponse {
    private String sessionId;
    private String status;
    private String fileName;          // bereinigter Name
    private int totalChunks;
    private LocalDateTime expiresAt;
}
