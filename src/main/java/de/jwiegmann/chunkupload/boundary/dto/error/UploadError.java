package de.jwiegmann.chunkupload.boundary.dto.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UploadError {
    private String code;          // stabiler Fehlercode, z.B. VALIDATION_FAILED
    private String message;
    private Object details;       // optional, z.B. sessionId

    private LocalDateTime timestamp;

    public static UploadError of(String code, String message, Object details, LocalDateTime timestamp) {
        return new UploadError(code, message, details, timestamp);
    }
}
