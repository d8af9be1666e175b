package de.jwiegmann.chunkupload.control.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Basis aller fachlichen Fehler rund um Upload-Sessions.
 * Trägt einen stabilen Fehlercode und den HTTP-Status, den die Boundary daraus macht.
 */
@Getter
public abstract class UploadException extends RuntimeException {

    private final String errorCode;
    private final HttpStatus httpStatus;

    protected UploadException(String errorCode, String message, HttpStatus httpStatus) {
        super(message);
        this.errorCode = errorCode;
        this.httpStatus = httpStatus;
    }

    protected UploadException(String errorCode, String message, HttpStatus httpStatus, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.httpStatus = httpStatus;
    }
}
