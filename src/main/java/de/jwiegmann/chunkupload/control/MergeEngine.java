package de.jwiegmann.chunkupload.control;

import de.jwiegmann.chunkupload.config.UploadProperties;
import de.jwiegmann.chunkupload.control.blob.BlobInfo;
import de.jwiegmann.chunkupload.control.blob.BlobStore;
import de.jwiegmann.chunkupload.control.blob.BlobUpload;
import de.jwiegmann.chunkupload.control.exception.UploadStorageException;
import de.jwiegmann.chunkupload.control.repository.UploadSessionRepository;
import de.jwiegmann.chunkupload.control.staging.ChunkStaging;
import de.jwiegmann.chunkupload.entity.UploadSession;
import de.jwiegmann.chunkupload.entity.UploadSessionStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Setzt die Chunks einer Session in Index-Reihenfolge zu einem Blob zusammen.
 * Läuft im Merge-Pool; der Request, der den Merge auslöst, wartet nicht darauf.
 *
 * <p>Es wird nie die ganze Datei im Speicher gehalten: jeder Chunk wird gestreamt und
 * der Blob-Stream blockiert, bis das Ziel die Bytes abgenommen hat.</p>
 *
 * <p>Ausgang eines Merges ist entweder ein committeter Blob plus Session in COMPLETED,
 * oder kein Blob plus Session in FAILED. Wurde die Session währenddessen abgebrochen oder
 * gelöscht, wird der fertige Blob wieder entfernt; hat der Stale-Sweep sie auf FAILED gesetzt,
 * gilt der fertige Blob trotzdem.</p>
 */
@Slf4j
@Component
public class MergeEngine {

    private static final int BUFFER_SIZE = 64 * 1024;
    private static final int MAX_ERROR_MESSAGE_LENGTH = 500;

    private final UploadSessionRepository repository;
    private final ChunkStaging staging;
    private final BlobStore blobStore;
    private final UploadProperties properties;
    private final Clock clock;

    public MergeEngine(UploadSessionRepository repository,
                       ChunkStaging staging,
                       BlobStore blobStore,
                       UploadProperties properties,
                       Clock clock) {
        this.repository = repository;
        this.staging = staging;
        this.blobStore = blobStore;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Führt den Merge für eine Session in PROCESSING aus.
     *
     * @param sessionId Id der Session
     * @return Stand der Session nach dem Merge
     * @throws UploadStorageException wenn Lesen oder Schreiben scheitert; die Session steht dann auf FAILED
     */
    public UploadSession merge(String sessionId) {
        UploadSession session = repository.find(sessionId)
                .orElseThrow(() -> UploadErrorFactory.sessionNotFound(sessionId));

        if (session.getStatus() == UploadSessionStatus.COMPLETED) {
            log.info("Session {} already merged, nothing to do", sessionId);
            return session;
        }
        if (session.getStatus() != UploadSessionStatus.PROCESSING) {
            log.warn("Merge for session {} skipped, status is {}", sessionId, session.getStatus().value());
            return session;
        }

        log.info("Merge started: session={}, chunks={}, declaredSize={}",
                sessionId, session.getTotalChunks(), session.getDeclaredSize());

        BlobUpload upload = null;
        try {
            upload = blobStore.openUploadStream(session.getOriginalName(), metadataOf(session));

            OutputStream out = upload.getOutputStream();
            byte[] buffer = new byte[BUFFER_SIZE];
            for (int i = 0; i < session.getTotalChunks(); i++) {
                copyChunk(sessionId, i, out, buffer);
                log.debug("Chunk {}/{} merged for session {}", i + 1, session.getTotalChunks(), sessionId);
            }
            out.flush();

            long merged = upload.getBytesWritten();
            if (Math.abs(merged - session.getDeclaredSize()) > properties.getSizeTolerance()) {
                log.warn("Size mismatch for session {}: declared {}, merged {}",
                        sessionId, session.getDeclaredSize(), merged);
            }

            BlobInfo blob = upload.commit();
            return finish(session, blob);

        } catch (IOException e) {
            UploadStorageException failure = new UploadStorageException("Failed to write merged file", e);
            fail(sessionId, upload, failure);
            throw failure;
        } catch (RuntimeException e) {
            fail(sessionId, upload, e);
            throw e;
        }
    }

    /**
     * Markiert eine hängende Session (PROCESSING, updatedAt vor {@code cutoff}) als FAILED.
     *
     * @return true wenn die Session tatsächlich umgestellt wurde
     */
    public boolean failIfStuck(String sessionId, LocalDateTime cutoff) {
        LocalDateTime now = LocalDateTime.now(clock);
        return repository.updateIf(sessionId,
                s -> s.getStatus() == UploadSessionStatus.PROCESSING && s.getUpdatedAt().isBefore(cutoff),
                s -> markFailed(s, "Processing did not finish in time", now)).isPresent();
    }

    private void copyChunk(String sessionId, int chunkIndex, OutputStream out, byte[] buffer) throws IOException {
        InputStream in;
        try {
            in = staging.open(sessionId, chunkIndex);
        } catch (IOException e) {
            throw new UploadStorageException("Failed to read chunk " + chunkIndex, e);
        }
        try (in) {
            while (true) {
                int n;
                try {
                    n = in.read(buffer);
                } catch (IOException e) {
                    throw new UploadStorageException("Failed to read chunk " + chunkIndex, e);
                }
                if (n == -1) {
                    return;
                }
                out.write(buffer, 0, n);
            }
        }
    }

    private UploadSession finish(UploadSession session, BlobInfo blob) {
        String sessionId = session.getSessionId();
        LocalDateTime now = LocalDateTime.now(clock);

        // FAILED heißt hier: der Stale-Sweep hat den langsamen Merge überholt, der Blob ist trotzdem vollständig
        Optional<UploadSession> completed = repository.updateIf(sessionId,
                s -> s.getStatus().canTransitionTo(UploadSessionStatus.COMPLETED),
                s -> {
                    s.setStatus(UploadSessionStatus.COMPLETED);
                    s.setBlobRef(blob.id());
                    s.setErrorMessage(null);
                    s.setProcessingCompletedAt(now);
                    s.setUpdatedAt(now);
                    return s;
                });

        if (completed.isEmpty()) {
            Optional<UploadSession> current = repository.find(sessionId);
            log.warn("Session {} left PROCESSING during merge, discarding blob {}", sessionId, blob.id());
            deleteBlobQuietly(blob.id());
            // Chunks nur bei abgebrochener oder gelöschter Session entfernen, sonst wird neu hochgeladen
            if (current.map(s -> s.getStatus() == UploadSessionStatus.CANCELLED).orElse(true)) {
                cleanupChunks(sessionId);
            }
            return current.orElse(session);
        }

        cleanupChunks(sessionId);
        log.info("Merge completed: session={}, blob={}, bytes={}", sessionId, blob.id(), blob.length());
        return completed.get();
    }

    private void fail(String sessionId, BlobUpload upload, Exception cause) {
        log.error("Merge failed for session {}", sessionId, cause);
        if (upload != null) {
            try {
                upload.abort();
            } catch (IOException e) {
                log.error("Could not abort blob upload {} for session {}", upload.getId(), sessionId, e);
            }
        }
        String message = truncate(cause.getMessage());
        LocalDateTime now = LocalDateTime.now(clock);
        boolean marked = repository.updateIf(sessionId,
                s -> s.getStatus() == UploadSessionStatus.PROCESSING,
                s -> markFailed(s, message, now)).isPresent();
        if (!marked) {
            log.warn("Session {} not marked failed, it is no longer processing", sessionId);
        }
    }

    private static UploadSession markFailed(UploadSession s, String message, LocalDateTime now) {
        s.setStatus(UploadSessionStatus.FAILED);
        s.setErrorMessage(message);
        s.setRetryCount(s.getRetryCount() + 1);
        s.setUpdatedAt(now);
        return s;
    }

    private void cleanupChunks(String sessionId) {
        try {
            staging.deleteAll(sessionId);
        } catch (IOException e) {
            // Blob ist fertig, Reste räumt der Orphan-Sweep
            log.warn("Could not clean up chunks of session {}", sessionId, e);
        }
    }

    private void deleteBlobQuietly(String blobId) {
        try {
            blobStore.delete(blobId);
        } catch (IOException e) {
            log.error("Could not delete blob {}", blobId, e);
        }
    }

    private static Map<String, String> metadataOf(UploadSession session) {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("originalName", session.getOriginalName());
        metadata.put("mimeType", session.getMimeType());
        metadata.put("uploadedBy", session.getUploadedBy());
        metadata.put("sessionId", session.getSessionId());
        return metadata;
    }

    private static String truncate(String message) {
        if (message == null) {
            return "Merge failed";
        }
        return message.length() > MAX_ERROR_MESSAGE_LENGTH ? message.substring(0, MAX_ERROR_MESSAGE_LENGTH) : message;
    }
}
