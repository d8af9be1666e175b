package de.jwiegmann.chunkupload.control.blob;

import java.time.Instant;
import java.util.Map;

public record BlobInfo(String id,
                       String fileName,
                       long length,
                       Instant uploadDate,
                       Map<String, String> metadata) {
}
