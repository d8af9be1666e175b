package de.jwiegmann.chunkupload.control;

import de.jwiegmann.chunkupload.boundary.dto.ChunkUploadResponse;
import de.jwiegmann.chunkupload.boundary.dto.UploadCompleteResponse;
import de.jwiegmann.chunkupload.config.UploadConfiguration;
import de.jwiegmann.chunkupload.config.UploadProperties;
import de.jwiegmann.chunkupload.control.blob.BlobStore;
import de.jwiegmann.chunkupload.control.exception.SessionIdConflictException;
import de.jwiegmann.chunkupload.control.exception.UploadSessionNotFoundException;
import de.jwiegmann.chunkupload.control.exception.UploadStorageException;
import de.jwiegmann.chunkupload.control.exception.UploadValidationException;
import de.jwiegmann.chunkupload.control.repository.UploadSessionRepository;
import de.jwiegmann.chunkupload.control.staging.ChunkStaging;
import de.jwiegmann.chunkupload.entity.UploadSession;
import de.jwiegmann.chunkupload.entity.UploadSessionStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Lebenszyklus einer Upload-Session: anlegen, Chunks annehmen, abschließen, abbrechen, löschen.
 *
 * <p>Jede Zustandsänderung ist ein bedingtes Update auf dem Session-Datensatz. Der Fortschritt
 * ({@code uploadedChunks}) wächst nur als lückenloser Präfix: nach dem Ablegen eines Chunks wird
 * ab dem gespeicherten Zähler gescannt, wie weit die Chunks lückenlos vorliegen, und der neue
 * Wert nur geschrieben, wenn der Zähler noch auf dem gelesenen Stand ist. Verliert ein Request
 * dieses Rennen, liest er neu und versucht es noch einmal.</p>
 */
@Slf4j
@Service
public class UploadSessionManager {

    static final String DEFAULT_MIME_TYPE = "application/octet-stream";
    static final String ANONYMOUS = "anonymous";

    private static final int MAX_FILE_NAME_LENGTH = 255;
    private static final int MAX_UPLOADED_BY_LENGTH = 100;
    private static final int MAX_ID_ATTEMPTS = 3;

    private final UploadSessionRepository repository;
    private final ChunkStaging staging;
    private final BlobStore blobStore;
    private final MergeEngine mergeEngine;
    private final SessionIdGenerator idGenerator;
    private final UploadProperties properties;
    private final TaskExecutor mergeExecutor;
    private final Clock clock;

    public UploadSessionManager(UploadSessionRepository repository,
                                ChunkStaging staging,
                                BlobStore blobStore,
                                MergeEngine mergeEngine,
                                SessionIdGenerator idGenerator,
                                UploadProperties properties,
                                @Qualifier(UploadConfiguration.MERGE_EXECUTOR) TaskExecutor mergeExecutor,
                                Clock clock) {
        this.repository = repository;
        this.staging = staging;
        this.blobStore = blobStore;
        this.mergeEngine = mergeEngine;
        this.idGenerator = idGenerator;
        this.properties = properties;
        this.mergeExecutor = mergeExecutor;
        this.clock = clock;
    }

    /**
     * Legt eine neue Session in PENDING an.
     *
     * @throws UploadValidationException bei ungültigen Metadaten
     * @throws SessionIdConflictException wenn auch nach mehreren Versuchen keine freie Id gefunden wurde
     */
    public UploadSession open(String fileName, long declaredSize, String mimeType, int totalChunks, String uploadedBy) {

        // 1. Metadaten prüfen und normalisieren
        String name = validateFileName(fileName);
        validateSize(declaredSize);
        if (totalChunks < 1) {
            throw new UploadValidationException("Invalid total chunks");
        }
        String type = normalizeMimeType(mimeType);
        String uploader = normalizeUploader(uploadedBy);

        // 2. Anlegen, bei Id-Kollision mit neuer Id wiederholen
        LocalDateTime now = LocalDateTime.now(clock);
        SessionIdConflictException lastConflict = null;
        for (int attempt = 1; attempt <= MAX_ID_ATTEMPTS; attempt++) {
            UploadSession session = UploadSession.builder()
                    .sessionId(idGenerator.generate())
                    .originalName(name)
                    .mimeType(type)
                    .declaredSize(declaredSize)
                    .uploadedBy(uploader)
                    .totalChunks(totalChunks)
                    .uploadedChunks(0)
                    .status(UploadSessionStatus.PENDING)
                    .createdAt(now)
                    .updatedAt(now)
                    .expiresAt(now.plus(properties.getSessionTtl()))
                    .build();
            try {
                UploadSession created = repository.insert(session);
                log.info("Upload session created: id={}, file={}, size={}, chunks={}",
                        created.getSessionId(), name, declaredSize, totalChunks);
                return created;
            } catch (SessionIdConflictException e) {
                log.warn("Session id collision on attempt {}: {}", attempt, e.getSessionId());
                lastConflict = e;
            }
        }
        throw lastConflict;
    }

    /**
     * Nimmt einen Chunk an. Wiederholte Indizes unterhalb des bestätigten Präfixes werden
     * nicht neu geschrieben, außer die Datei fehlt in der Ablage. Chunks außerhalb der Reihe
     * werden abgelegt, zählen aber erst, wenn die Lücke davor geschlossen ist.
     */
    public ChunkUploadResponse submitChunk(String sessionId, int chunkIndex, int totalChunksHeader, byte[] bytes) {

        // 1. Request prüfen, bevor irgendetwas geschrieben wird
        validateSessionId(sessionId);
        if (totalChunksHeader < 1 || chunkIndex < 0 || chunkIndex >= totalChunksHeader) {
            throw UploadErrorFactory.invalidChunkIndex(chunkIndex, totalChunksHeader);
        }
        if (bytes == null || bytes.length == 0) {
            throw UploadErrorFactory.noChunkData();
        }
        long maxChunkSize = properties.getMaxChunkSize().toBytes();
        if (bytes.length > maxChunkSize) {
            throw UploadErrorFactory.chunkTooLarge(maxChunkSize);
        }

        // 2. Session-Zustand prüfen
        UploadSession session = find(sessionId);
        if (session.getTotalChunks() != totalChunksHeader) {
            throw UploadErrorFactory.totalChunksMismatch(totalChunksHeader, session.getTotalChunks());
        }
        checkAcceptsChunks(session);

        // 3. Bereits bestätigter Index: idempotent, nur eine verlorene Datei wird neu abgelegt
        if (chunkIndex < session.getUploadedChunks()) {
            if (staging.exists(sessionId, chunkIndex)) {
                log.debug("Chunk {} of session {} already confirmed", chunkIndex, sessionId);
            } else {
                restoreChunk(sessionId, chunkIndex, bytes);
            }
            return chunkResponse(chunkIndex, reopenIfFailed(session));
        }

        // 4. Ablegen
        try {
            staging.write(sessionId, chunkIndex, bytes);
        } catch (IOException e) {
            discardChunk(sessionId, chunkIndex);
            throw new UploadStorageException("Failed to save chunk " + chunkIndex, e);
        }

        // 5. Präfix nachziehen
        UploadSession updated;
        try {
            updated = advanceProgress(sessionId, chunkIndex);
        } catch (UploadSessionNotFoundException e) {
            // Session ist weg: nichts liegen lassen
            discardSession(sessionId);
            throw e;
        } catch (RuntimeException e) {
            discardUnconfirmedChunk(sessionId, chunkIndex);
            throw e;
        }

        log.info("Chunk {} uploaded for session {}, progress {}/{}",
                chunkIndex, sessionId, updated.getUploadedChunks(), updated.getTotalChunks());
        return chunkResponse(chunkIndex, updated);
    }

    /**
     * Schließt den Upload ab und stößt den Merge im Hintergrund an. Kehrt zurück, sobald die
     * Session auf PROCESSING steht.
     */
    public UploadCompleteResponse complete(String sessionId) {
        validateSessionId(sessionId);
        UploadSession session = find(sessionId);

        switch (session.getStatus()) {
            case COMPLETED:
                return completeResponse(sessionId, UploadSessionStatus.COMPLETED, "File already processed");
            case PROCESSING:
                return completeResponse(sessionId, UploadSessionStatus.PROCESSING, "File is already being processed");
            case CANCELLED:
                throw UploadErrorFactory.cancelled(sessionId);
            case FAILED:
                throw UploadErrorFactory.failedNeedsResubmit(sessionId);
            default:
                break;
        }

        if (!session.isFullyUploaded()) {
            throw UploadErrorFactory.incomplete(sessionId, session.getUploadedChunks(), session.getTotalChunks());
        }
        for (int i = 0; i < session.getTotalChunks(); i++) {
            if (!staging.exists(sessionId, i)) {
                log.warn("Session {} claims all chunks but chunk {} is missing", sessionId, i);
                throw UploadErrorFactory.missingChunks(sessionId);
            }
        }

        LocalDateTime now = LocalDateTime.now(clock);
        Optional<UploadSession> marked = repository.updateIf(sessionId,
                s -> s.getStatus().canTransitionTo(UploadSessionStatus.PROCESSING) && s.isFullyUploaded(),
                s -> {
                    s.setStatus(UploadSessionStatus.PROCESSING);
                    s.setProcessingStartedAt(now);
                    s.setUpdatedAt(now);
                    return s;
                });

        if (marked.isEmpty()) {
            // jemand war schneller: erneut lesen und wie oben antworten
            UploadSession current = find(sessionId);
            if (current.getStatus() == UploadSessionStatus.PROCESSING
                    || current.getStatus() == UploadSessionStatus.COMPLETED) {
                return completeResponse(sessionId, current.getStatus(), "File is already being processed");
            }
            throw UploadErrorFactory.concurrentStateChange(sessionId);
        }

        dispatchMerge(sessionId);
        log.info("Upload session {} complete, merge scheduled", sessionId);
        return completeResponse(sessionId, UploadSessionStatus.PROCESSING, "File is being processed");
    }

    /**
     * Bricht eine Session ab. Chunks werden asynchron entfernt; ein erneuter Abbruch ist ein No-op.
     */
    public UploadCompleteResponse cancel(String sessionId) {
        validateSessionId(sessionId);
        UploadSession session = find(sessionId);

        if (session.getStatus() == UploadSessionStatus.CANCELLED) {
            return completeResponse(sessionId, UploadSessionStatus.CANCELLED, "Upload already cancelled");
        }
        if (session.getStatus().isTerminal()) {
            throw UploadErrorFactory.cannotCancelCompleted(sessionId);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        Optional<UploadSession> cancelled = repository.updateIf(sessionId,
                s -> s.getStatus().canTransitionTo(UploadSessionStatus.CANCELLED),
                s -> {
                    s.setStatus(UploadSessionStatus.CANCELLED);
                    s.setUpdatedAt(now);
                    return s;
                });

        if (cancelled.isEmpty()) {
            UploadSession current = find(sessionId);
            if (current.getStatus() == UploadSessionStatus.COMPLETED) {
                throw UploadErrorFactory.cannotCancelCompleted(sessionId);
            }
            return completeResponse(sessionId, current.getStatus(), "Upload already cancelled");
        }

        scheduleCleanup(sessionId);
        log.info("Upload session {} cancelled", sessionId);
        return completeResponse(sessionId, UploadSessionStatus.CANCELLED, "Upload cancelled");
    }

    public UploadSession getStatus(String sessionId) {
        validateSessionId(sessionId);
        return find(sessionId);
    }

    /**
     * Entfernt Session, Blob und Chunks. Der Blob wird nach bestem Bemühen gelöscht,
     * der Datensatz verschwindet zuletzt.
     */
    public void delete(String sessionId) {
        validateSessionId(sessionId);
        UploadSession session = find(sessionId);

        if (session.getBlobRef() != null) {
            try {
                blobStore.delete(session.getBlobRef());
            } catch (IOException e) {
                log.error("Could not delete blob {} of session {}", session.getBlobRef(), sessionId, e);
            }
        }
        try {
            staging.deleteAll(sessionId);
        } catch (IOException e) {
            throw new UploadStorageException("Failed to delete chunks", e);
        }
        repository.delete(sessionId);
        log.info("Upload session {} deleted", sessionId);
    }

    static void validateSessionId(String sessionId) {
        if (!SessionIdGenerator.isWellFormed(sessionId)) {
            throw UploadErrorFactory.invalidSessionId();
        }
    }

    private UploadSession find(String sessionId) {
        return repository.find(sessionId).orElseThrow(() -> UploadErrorFactory.sessionNotFound(sessionId));
    }

    private void checkAcceptsChunks(UploadSession session) {
        switch (session.getStatus()) {
            case COMPLETED:
                throw UploadErrorFactory.alreadyCompleted(session.getSessionId());
            case CANCELLED:
                throw UploadErrorFactory.cancelled(session.getSessionId());
            case FAILED:
                if (session.getRetryCount() >= properties.getMaxRetries()) {
                    throw UploadErrorFactory.retryLimitReached(session.getSessionId(), properties.getMaxRetries());
                }
                break;
            default:
                break;
        }
    }

    private UploadSession advanceProgress(String sessionId, int chunkIndex) {
        while (true) {
            UploadSession current = find(sessionId);
            checkAcceptsChunks(current);
            if (current.getStatus() == UploadSessionStatus.PROCESSING) {
                // alle Chunks bestätigt, der Merge liest gerade
                return current;
            }

            int from = current.getUploadedChunks();
            int frontier = from;
            while (frontier < current.getTotalChunks() && staging.exists(sessionId, frontier)) {
                frontier++;
            }

            UploadSessionStatus expectedStatus = current.getStatus();
            int newValue = frontier;
            LocalDateTime now = LocalDateTime.now(clock);
            Optional<UploadSession> updated = repository.updateIf(sessionId,
                    s -> s.getUploadedChunks() == from && s.getStatus() == expectedStatus,
                    s -> {
                        s.setUploadedChunks(newValue);
                        if (s.getStatus() == UploadSessionStatus.PENDING || s.getStatus() == UploadSessionStatus.FAILED) {
                            s.setStatus(UploadSessionStatus.UPLOADING);
                            s.setErrorMessage(null);
                        }
                        s.setUpdatedAt(now);
                        return s;
                    });
            if (updated.isPresent()) {
                return updated.get();
            }
            log.debug("Progress update for session {} (chunk {}) lost a race, retrying", sessionId, chunkIndex);
        }
    }

    private void restoreChunk(String sessionId, int chunkIndex, byte[] bytes) {
        try {
            staging.write(sessionId, chunkIndex, bytes);
        } catch (IOException e) {
            throw new UploadStorageException("Failed to save chunk " + chunkIndex, e);
        }
        log.info("Missing chunk {} of session {} restored", chunkIndex, sessionId);
    }

    private UploadSession reopenIfFailed(UploadSession session) {
        if (session.getStatus() != UploadSessionStatus.FAILED) {
            return session;
        }
        LocalDateTime now = LocalDateTime.now(clock);
        return repository.updateIf(session.getSessionId(),
                        s -> s.getStatus() == UploadSessionStatus.FAILED,
                        s -> {
                            s.setStatus(UploadSessionStatus.UPLOADING);
                            s.setErrorMessage(null);
                            s.setUpdatedAt(now);
                            return s;
                        })
                .map(s -> {
                    log.info("Upload session {} reopened for retry {}", s.getSessionId(), s.getRetryCount());
                    return s;
                })
                .orElseGet(() -> find(session.getSessionId()));
    }

    private void dispatchMerge(String sessionId) {
        try {
            mergeExecutor.execute(() -> {
                try {
                    mergeEngine.merge(sessionId);
                } catch (RuntimeException e) {
                    // Session steht bereits auf FAILED, MergeEngine hat geloggt
                    log.debug("Background merge for session {} ended with error: {}", sessionId, e.getMessage());
                }
            });
        } catch (TaskRejectedException e) {
            LocalDateTime now = LocalDateTime.now(clock);
            repository.updateIf(sessionId,
                    s -> s.getStatus() == UploadSessionStatus.PROCESSING,
                    s -> {
                        s.setStatus(UploadSessionStatus.FAILED);
                        s.setErrorMessage("Merge could not be scheduled");
                        s.setRetryCount(s.getRetryCount() + 1);
                        s.setUpdatedAt(now);
                        return s;
                    });
            throw new UploadStorageException("Merge could not be scheduled", e);
        }
    }

    private void scheduleCleanup(String sessionId) {
        try {
            mergeExecutor.execute(() -> discardSession(sessionId));
        } catch (TaskRejectedException e) {
            // Orphan-Sweep holt das später nach
            log.warn("Cleanup for cancelled session {} rejected: {}", sessionId, e.getMessage());
        }
    }

    private void discardChunk(String sessionId, int chunkIndex) {
        try {
            staging.delete(sessionId, chunkIndex);
        } catch (IOException e) {
            log.error("Could not remove chunk {} of session {}", chunkIndex, sessionId, e);
        }
    }

    /**
     * Ein inzwischen von anderen Requests bestätigter Chunk bleibt liegen, ein Merge liest ihn womöglich gerade.
     */
    private void discardUnconfirmedChunk(String sessionId, int chunkIndex) {
        boolean confirmed = repository.find(sessionId)
                .map(s -> chunkIndex < s.getUploadedChunks())
                .orElse(false);
        if (!confirmed) {
            discardChunk(sessionId, chunkIndex);
        }
    }

    private void discardSession(String sessionId) {
        try {
            staging.deleteAll(sessionId);
        } catch (IOException e) {
            log.error("Could not remove chunks of session {}", sessionId, e);
        }
    }

    private String validateFileName(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            throw new UploadValidationException("Invalid filename");
        }
        String sanitized = FileNameSanitizer.sanitize(fileName);
        if (sanitized.isEmpty()) {
            throw new UploadValidationException("Invalid filename");
        }
        if (sanitized.length() > MAX_FILE_NAME_LENGTH) {
            throw new UploadValidationException("Filename too long (max " + MAX_FILE_NAME_LENGTH + " characters)");
        }
        return sanitized;
    }

    private void validateSize(long declaredSize) {
        if (declaredSize <= 0) {
            throw new UploadValidationException("Invalid file size");
        }
        long max = properties.getMaxFileSize().toBytes();
        if (declaredSize > max) {
            throw new UploadValidationException("File size exceeds maximum limit of " + max + " bytes");
        }
    }

    private String normalizeMimeType(String mimeType) {
        String type = mimeType == null || mimeType.isBlank() ? DEFAULT_MIME_TYPE : mimeType.trim();
        if (!properties.getAllowedMimeTypes().isEmpty() && !properties.getAllowedMimeTypes().contains(type)) {
            throw new UploadValidationException("File type not allowed: " + type);
        }
        return type;
    }

    private static String normalizeUploader(String uploadedBy) {
        String uploader = uploadedBy == null || uploadedBy.isBlank() ? ANONYMOUS : uploadedBy.trim();
        if (uploader.length() > MAX_UPLOADED_BY_LENGTH) {
            throw new UploadValidationException("uploadedBy too long (max " + MAX_UPLOADED_BY_LENGTH + " characters)");
        }
        return uploader;
    }

    private static ChunkUploadResponse chunkResponse(int chunkIndex, UploadSession session) {
        return ChunkUploadResponse.builder()
                .sessionId(session.getSessionId())
                .chunkIndex(chunkIndex)
                .uploadedChunks(session.getUploadedChunks())
                .totalChunks(session.getTotalChunks())
                .progress(session.getProgress())
                .status(session.getStatus().value())
                .build();
    }

    private static UploadCompleteResponse completeResponse(String sessionId, UploadSessionStatus status, String message) {
        return UploadCompleteResponse.builder()
                .sessionId(sessionId)
                .status(status.value())
                .message(message)
                .build();
    }
}
