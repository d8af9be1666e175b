package de.jwiegmann.chunkupload.boundary;

import de.jwiegmann.chunkupload.boundary.dto.ApiResponse;
import de.jwiegmann.chunkupload.boundary.dto.error.UploadError;
import de.jwiegmann.chunkupload.control.exception.UploadException;
import de.jwiegmann.chunkupload.control.exception.UploadSessionNotFoundException;
import de.jwiegmann.chunkupload.control.exception.UploadStateException;
import de.jwiegmann.chunkupload.control.exception.UploadStorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Übersetzt Exceptions in den Antwort-Umschlag {@code {success:false, error:{...}}}.
 * Storage- und unerwartete Fehler gehen nur mit einer allgemeinen Meldung raus.
 */
@Slf4j
@RestControllerAdvice(basePackages = "de.jwiegmann.chunkupload")
public class GlobalExceptionHandler {

    private static final String INTERNAL_MESSAGE = "An internal error occurred";

    private final Clock clock;

    public GlobalExceptionHandler(Clock clock) {
        this.clock = clock;
    }

    @ExceptionHandler(UploadStorageException.class)
    public ResponseEntity<ApiResponse<Void>> handleStorageException(UploadStorageException ex) {
        log.error("Storage error: {}", ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ex.getErrorCode(), INTERNAL_MESSAGE, null);
    }

    @ExceptionHandler(UploadException.class)
    public ResponseEntity<ApiResponse<Void>> handleUploadException(UploadException ex) {
        log.warn("Upload error: {} - {}", ex.getErrorCode(), ex.getMessage());
        return respond(ex.getHttpStatus(), ex.getErrorCode(), ex.getMessage(), detailsOf(ex));
    }

    @ExceptionHandler({
            MissingRequestHeaderException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class
    })
    public ResponseEntity<ApiResponse<Void>> handleBadRequest(Exception ex) {
        log.warn("Invalid request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", "Invalid request: " + reasonOf(ex), null);
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<ApiResponse<Void>> handleMediaType(HttpMediaTypeNotSupportedException ex) {
        log.warn("Unsupported media type: {}", ex.getContentType());
        return respond(HttpStatus.UNSUPPORTED_MEDIA_TYPE, "UNSUPPORTED_MEDIA_TYPE", "Unsupported content type", null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleUnexpected(Exception ex) {
        // 404/405 usw. aus Spring MVC selbst
        if (ex instanceof ErrorResponse response && response.getStatusCode().is4xxClientError()) {
            log.warn("Request rejected: {}", ex.getMessage());
            HttpStatus status = HttpStatus.valueOf(response.getStatusCode().value());
            return respond(status, status.name(), status.getReasonPhrase(), null);
        }
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", INTERNAL_MESSAGE, null);
    }

    private ResponseEntity<ApiResponse<Void>> respond(HttpStatus status, String code, String message, Object details) {
        UploadError error = UploadError.of(code, message, details, LocalDateTime.now(clock));
        return ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(ApiResponse.failed(error));
    }

    private static Object detailsOf(UploadException ex) {
        if (ex instanceof UploadStateException state) {
            return state.getSessionId();
        }
        if (ex instanceof UploadSessionNotFoundException notFound) {
            return notFound.getSessionId();
        }
        return null;
    }

    private static String reasonOf(Exception ex) {
        if (ex instanceof MissingRequestHeaderException header) {
            return "missing header " + header.getHeaderName();
        }
        if (ex instanceof MissingServletRequestParameterException param) {
            return "missing parameter " + param.getParameterName();
        }
        if (ex instanceof MethodArgumentTypeMismatchException mismatch) {
            return "invalid value for " + mismatch.getName();
        }
        return "malformed body";
    }
}
