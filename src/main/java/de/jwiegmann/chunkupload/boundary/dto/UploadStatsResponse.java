package de.jwiegmann.chunkupload.boundary.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UploadStatsResponse {
    private long totalFiles;
    private long totalSize;
    private Map<String, StatusStats> byStatus;   // nur Status mit mindestens einer Session

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class StatusStats {
        private long count;
        private long totalSize;
        private long avgSize;
    }
}
