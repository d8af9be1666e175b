package de.jwiegmann.chunkupload.control.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class UploadSessionNotFoundException extends UploadException {

    private final String sessionId;

    public UploadSessionNotFoundException(String sessionId) {
        this(sessionId, "Upload session not found");
    }

    public UploadSessionNotFoundException(String sessionId, String message) {
        super("NOT_FOUND", message, HttpStatus.NOT_FOUND);
        this.sessionId = sessionId;
    }
}
