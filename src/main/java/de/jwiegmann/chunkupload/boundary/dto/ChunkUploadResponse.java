package de.jwiegmann.chunkupload.boundary.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Antwort auf einen Chunk-Upload. {@code uploadedChunks} ist der bestätigte Präfix,
 * nicht die Zahl der abgelegten Chunks.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChunkUploadResponse {
    private String sessionId;
    private int chunkIndex;
    private int uploadedChunks;
    private int totalChunks;
    private int progress;
    private String status;
}
