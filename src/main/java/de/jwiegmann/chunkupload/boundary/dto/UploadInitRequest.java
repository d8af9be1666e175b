package de.jwiegmann.chunkupload.boundary.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UploadInitRequest {
    private String fileName;
    private long fileSize;
    private String mimeType;
    private int totalChunks;
    private String uploadedBy;
}
