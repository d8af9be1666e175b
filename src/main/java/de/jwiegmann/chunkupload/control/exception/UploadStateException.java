package de.jwiegmann.chunkupload.control.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Verletzung einer Fachregel: falscher Status, unvollständiger Upload, fehlende Chunks.
 */
@Getter
public class UploadStateException extends UploadException {

    private final String sessionId;

    public UploadStateException(String errorCode, String message, String sessionId) {
        super(errorCode, message, HttpStatus.BAD_REQUEST);
        this.sessionId = sessionId;
    }
}
