package de.jwiegmann.chunkupload.boundary.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Antwort auf complete und cancel.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UploadCompleteResponse {
    private String sessionId;
    private String status;
    private String message;
}
