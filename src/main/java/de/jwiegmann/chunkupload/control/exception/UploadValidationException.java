package de.jwiegmann.chunkupload.control.exception;

import org.springframework.http.HttpStatus;

/**
 * Ungültige oder außerhalb des erlaubten Bereichs liegende Eingaben (vom Client korrigierbar).
 */
public class UploadValidationException extends UploadException {

    public UploadValidationException(String message) {
        super("VALIDATION_FAILED", message, HttpStatus.BAD_REQUEST);
    }
}
