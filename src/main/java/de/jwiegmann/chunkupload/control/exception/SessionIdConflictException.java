package de.jwiegmann.chunkupload.control.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Eine Session mit dieser Id existiert bereits.
 */
@Getter
public class SessionIdConflictException extends UploadException {

    private final String sessionId;

    public SessionIdConflictException(String sessionId) {
        super("SESSION_ID_CONFLICT", "Session id already exists", HttpStatus.CONFLICT);
        this.sessionId = sessionId;
    }
}
