package de.jwiegmann.chunkupload.control.exception;

import org.springframework.http.HttpStatus;

/**
 * Fehler im Dateisystem oder im BlobStore. Die Nachricht kann interne Pfade enthalten
 * und wird deshalb nie an den Client durchgereicht.
 */
public class UploadStorageException extends UploadException {

    public UploadStorageException(String message, Throwable cause) {
        super("STORAGE_ERROR", message, HttpStatus.INTERNAL_SERVER_ERROR, cause);
    }
}
