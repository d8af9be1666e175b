package de.jwiegmann.chunkupload.control;

import de.jwiegmann.chunkupload.config.UploadProperties;
import de.jwiegmann.chunkupload.control.blob.BlobStore;
import de.jwiegmann.chunkupload.control.repository.UploadSessionRepository;
import de.jwiegmann.chunkupload.control.staging.ChunkStaging;
import de.jwiegmann.chunkupload.entity.UploadSession;
import de.jwiegmann.chunkupload.entity.UploadSessionStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.IntSupplier;

/**
 * Periodisches Aufräumen.
 *
 * Räumt ab:
 * - abgelaufene Sessions (expiresAt überschritten) samt Chunks und Blob
 * - liegengebliebene Sessions in PENDING/UPLOADING
 * - hängende Merges (PROCESSING zu lange ohne Update), diese gehen auf FAILED
 * - Chunk-Verzeichnisse ohne Session
 *
 * Ein Fehler bei einem Eintrag bricht den Lauf nicht ab.
 */
@Slf4j
@Service
public class JanitorService {

    private static final Set<UploadSessionStatus> OPEN_STATES =
            EnumSet.of(UploadSessionStatus.PENDING, UploadSessionStatus.UPLOADING);

    private final UploadSessionRepository repository;
    private final ChunkStaging staging;
    private final BlobStore blobStore;
    private final MergeEngine mergeEngine;
    private final UploadProperties properties;
    private final Clock clock;

    @Value("${upload.janitor.enabled:true}")
    private boolean janitorEnabled;

    private final AtomicBoolean expireRunning = new AtomicBoolean(false);
    private final AtomicBoolean staleRunning = new AtomicBoolean(false);
    private final AtomicBoolean orphanRunning = new AtomicBoolean(false);

    public JanitorService(UploadSessionRepository repository,
                          ChunkStaging staging,
                          BlobStore blobStore,
                          MergeEngine mergeEngine,
                          UploadProperties properties,
                          Clock clock) {
        this.repository = repository;
        this.staging = staging;
        this.blobStore = blobStore;
        this.mergeEngine = mergeEngine;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${upload.janitor.expire-interval-ms:3600000}",
            initialDelayString = "${upload.janitor.expire-interval-ms:3600000}")
    public void scheduledExpireSweep() {
        runGuarded(expireRunning, "expired sessions", this::sweepExpired);
    }

    @Scheduled(fixedDelayString = "${upload.janitor.stale-interval-ms:7200000}",
            initialDelayString = "${upload.janitor.stale-interval-ms:7200000}")
    public void scheduledStaleSweep() {
        runGuarded(staleRunning, "stale sessions", () -> sweepStale() + sweepStuckMerges());
    }

    @Scheduled(fixedDelayString = "${upload.janitor.orphan-interval-ms:21600000}",
            initialDelayString = "${upload.janitor.orphan-interval-ms:21600000}")
    public void scheduledOrphanSweep() {
        runGuarded(orphanRunning, "orphaned chunk directories", this::sweepOrphans);
    }

    /**
     * Nach einem Neustart liegen oft Reste abgebrochener Uploads herum.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void sweepOrphansOnStartup() {
        runGuarded(orphanRunning, "orphaned chunk directories (startup)", this::sweepOrphans);
    }

    /**
     * @return Anzahl entfernter Sessions
     */
    public int sweepExpired() {
        List<UploadSession> expired = repository.findExpired(LocalDateTime.now(clock));
        int removed = 0;
        for (UploadSession session : expired) {
            if (removeSession(session, "expired")) {
                removed++;
            }
        }
        return removed;
    }

    /**
     * @return Anzahl entfernter Sessions
     */
    public int sweepStale() {
        LocalDateTime cutoff = LocalDateTime.now(clock).minus(properties.getStaleAfter());
        int removed = 0;
        for (UploadSession session : repository.findStale(OPEN_STATES, cutoff)) {
            if (removeSession(session, "stale")) {
                removed++;
            }
        }
        return removed;
    }

    /**
     * Merges, die seit {@code processingTimeout} nichts mehr getan haben, gelten als gescheitert.
     * Die Chunks bleiben liegen, damit der Client erneut abschließen kann.
     *
     * @return Anzahl auf FAILED gesetzter Sessions
     */
    public int sweepStuckMerges() {
        LocalDateTime cutoff = LocalDateTime.now(clock).minus(properties.getProcessingTimeout());
        int failed = 0;
        for (UploadSession session : repository.findStale(EnumSet.of(UploadSessionStatus.PROCESSING), cutoff)) {
            try {
                if (mergeEngine.failIfStuck(session.getSessionId(), cutoff)) {
                    log.warn("Session {} stuck in processing since {}, marked failed",
                            session.getSessionId(), session.getUpdatedAt());
                    failed++;
                }
            } catch (RuntimeException e) {
                log.error("Could not mark stuck session {} as failed", session.getSessionId(), e);
            }
        }
        return failed;
    }

    /**
     * @return Anzahl entfernter Chunk-Verzeichnisse
     */
    public int sweepOrphans() {
        List<String> directories;
        try {
            // Verzeichnisse vor den Ids lesen: eine neue Session hat immer zuerst ihren Datensatz
            directories = staging.listSessionIds();
        } catch (IOException e) {
            log.error("Could not list staging directory", e);
            return 0;
        }
        Set<String> known = repository.findAllIds();

        int removed = 0;
        for (String sessionId : directories) {
            if (known.contains(sessionId)) {
                continue;
            }
            try {
                staging.deleteAll(sessionId);
                log.debug("Orphaned chunk directory {} removed", sessionId);
                removed++;
            } catch (IOException | RuntimeException e) {
                log.error("Could not remove orphaned chunk directory {}", sessionId, e);
            }
        }
        return removed;
    }

    private boolean removeSession(UploadSession session, String reason) {
        String sessionId = session.getSessionId();
        try {
            staging.deleteAll(sessionId);
            if (session.getBlobRef() != null) {
                blobStore.delete(session.getBlobRef());
            }
            repository.delete(sessionId);
            log.debug("Removed {} session {} (status {})", reason, sessionId, session.getStatus().value());
            return true;
        } catch (IOException | RuntimeException e) {
            log.error("Could not remove {} session {}", reason, sessionId, e);
            return false;
        }
    }

    private void runGuarded(AtomicBoolean running, String what, IntSupplier sweep) {
        if (!janitorEnabled) {
            log.debug("Janitor is disabled, skipping cleanup of {}", what);
            return;
        }
        if (!running.compareAndSet(false, true)) {
            log.warn("Previous cleanup of {} is still running, skipping this run", what);
            return;
        }
        try {
            int count = sweep.getAsInt();
            if (count > 0) {
                log.info("Cleanup of {}: {} handled", what, count);
            } else {
                log.debug("Cleanup of {}: nothing to do", what);
            }
        } catch (RuntimeException e) {
            log.error("Cleanup of {} failed: {}", what, e.getMessage(), e);
        } finally {
            running.set(false);
        }
    }
}
