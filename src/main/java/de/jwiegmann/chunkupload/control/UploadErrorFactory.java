package de.jwiegmann.chunkupload.control;

import de.jwiegmann.chunkupload.control.exception.UploadSessionNotFoundException;
import de.jwiegmann.chunkupload.control.exception.UploadStateException;
import de.jwiegmann.chunkupload.control.exception.UploadValidationException;

/**
 * Zentrale Stelle für Fehlercodes und -texte rund um Upload-Sessions.
 */
public final class UploadErrorFactory {

    private UploadErrorFactory() {
    }

    public static UploadValidationException invalidSessionId() {
        return new UploadValidationException("Invalid file ID format");
    }

    public static UploadValidationException invalidChunkIndex(int chunkIndex, int totalChunks) {
        return new UploadValidationException("Invalid chunk index " + chunkIndex + " (0.." + (totalChunks - 1) + ")");
    }

    public static UploadValidationException totalChunksMismatch(int header, int stored) {
        return new UploadValidationException("Total chunks mismatch: got " + header + ", session expects " + stored);
    }

    public static UploadValidationException noChunkData() {
        return new UploadValidationException("No chunk data received");
    }

    public static UploadValidationException chunkTooLarge(long maxBytes) {
        return new UploadValidationException("Chunk size exceeds limit of " + maxBytes + " bytes");
    }

    public static UploadSessionNotFoundException sessionNotFound(String sessionId) {
        return new UploadSessionNotFoundException(sessionId);
    }

    public static UploadSessionNotFoundException fileNotReady(String sessionId) {
        return new UploadSessionNotFoundException(sessionId, "File not found or not ready for download");
    }

    public static UploadStateException alreadyCompleted(String sessionId) {
        return new UploadStateException("UPLOAD_ALREADY_COMPLETED", "Upload already completed", sessionId);
    }

    public static UploadStateException cancelled(String sessionId) {
        return new UploadStateException("UPLOAD_CANCELLED", "Upload has been cancelled", sessionId);
    }

    public static UploadStateException cannotCancelCompleted(String sessionId) {
        return new UploadStateException("UPLOAD_ALREADY_COMPLETED", "Cannot cancel completed upload", sessionId);
    }

    public static UploadStateException incomplete(String sessionId, int uploaded, int total) {
        return new UploadStateException("UPLOAD_INCOMPLETE",
                "Incomplete upload: " + uploaded + "/" + total + " chunks received", sessionId);
    }

    public static UploadStateException missingChunks(String sessionId) {
        return new UploadStateException("MISSING_CHUNKS", "Some chunks are missing. Please re-upload.", sessionId);
    }

    public static UploadStateException failedNeedsResubmit(String sessionId) {
        return new UploadStateException("UPLOAD_FAILED",
                "Upload failed during processing; resubmit a chunk to retry", sessionId);
    }

    public static UploadStateException retryLimitReached(String sessionId, int maxRetries) {
        return new UploadStateException("RETRY_LIMIT_REACHED",
                "Upload failed " + maxRetries + " times and cannot be retried", sessionId);
    }

    public static UploadStateException concurrentStateChange(String sessionId) {
        return new UploadStateException("STATE_CHANGED", "Upload session changed concurrently, try again", sessionId);
    }
}
