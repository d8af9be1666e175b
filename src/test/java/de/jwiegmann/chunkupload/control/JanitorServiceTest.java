package de.jwiegmann.chunkupload.control;

import com.fasterxml.jackson.databind.json.JsonMapper;
import de.jwiegmann.chunkupload.config.UploadProperties;
import de.jwiegmann.chunkupload.control.blob.BlobInfo;
import de.jwiegmann.chunkupload.control.blob.BlobUpload;
import de.jwiegmann.chunkupload.control.blob.FileSystemBlobStore;
import de.jwiegmann.chunkupload.control.repository.InMemoryUploadSessionRepository;
import de.jwiegmann.chunkupload.control.staging.ChunkStaging;
import de.jwiegmann.chunkupload.control.staging.FileSystemChunkStaging;
import de.jwiegmann.chunkupload.entity.UploadSession;
import de.jwiegmann.chunkupload.entity.UploadSessionStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class JanitorServiceTest {

    private static final String EXPIRED = "1".repeat(32);
    private static final String STALE = "2".repeat(32);
    private static final String ACTIVE = "3".repeat(32);
    private static final String STUCK = "4".repeat(32);

    @TempDir
    Path tmp;

    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-01T10:00:00Z"));

    private InMemoryUploadSessionRepository repository;
    private FileSystemChunkStaging staging;
    private FileSystemBlobStore blobStore;
    private UploadProperties properties;
    private MergeEngine mergeEngine;

    @BeforeEach
    void setUp() {
        repository = new InMemoryUploadSessionRepository();
        staging = new FileSystemChunkStaging(tmp.resolve("staging"));
        blobStore = new FileSystemBlobStore(tmp.resolve("blobs"), JsonMapper.builder().findAndAddModules().build(), clock);
        properties = new UploadProperties();
        mergeEngine = new MergeEngine(repository, staging, blobStore, properties, clock);
    }

    private JanitorService janitor(ChunkStaging chunkStaging) {
        return new JanitorService(repository, chunkStaging, blobStore, mergeEngine, properties, clock);
    }

    @Test
    void sweepExpired_removesRecordChunksAndBlob() throws Exception {
        LocalDateTime now = LocalDateTime.now(clock);
        BlobInfo blob = storeBlob();
        UploadSession expired = session(EXPIRED, UploadSessionStatus.COMPLETED, now.minusHours(30));
        expired.setBlobRef(blob.id());
        repository.insert(expired);
        repository.insert(session(ACTIVE, UploadSessionStatus.UPLOADING, now.minusMinutes(1)));
        staging.write(EXPIRED, 0, new byte[]{1});

        int removed = janitor(staging).sweepExpired();

        assertThat(removed).isEqualTo(1);
        assertThat(repository.findAllIds()).containsExactly(ACTIVE);
        assertThat(staging.listSessionIds()).isEmpty();
        assertThat(blobStore.find(blob.id())).isEmpty();
    }

    @Test
    void sweepStale_onlyOpenSessionsWithoutRecentActivity() throws Exception {
        LocalDateTime now = LocalDateTime.now(clock);
        repository.insert(session(STALE, UploadSessionStatus.UPLOADING, now.minusHours(3)));
        repository.insert(session(ACTIVE, UploadSessionStatus.UPLOADING, now.minusMinutes(10)));
        repository.insert(session(EXPIRED, UploadSessionStatus.COMPLETED, now.minusHours(3)));
        staging.write(STALE, 0, new byte[]{1});

        int removed = janitor(staging).sweepStale();

        assertThat(removed).isEqualTo(1);
        assertThat(repository.findAllIds()).containsExactlyInAnyOrder(ACTIVE, EXPIRED);
        assertThat(staging.exists(STALE, 0)).isFalse();
    }

    @Test
    void sweepStuckMerges_marksFailedAndKeepsChunks() throws Exception {
        LocalDateTime now = LocalDateTime.now(clock);
        repository.insert(session(STUCK, UploadSessionStatus.PROCESSING, now.minusHours(3)));
        repository.insert(session(ACTIVE, UploadSessionStatus.PROCESSING, now.minusMinutes(5)));
        staging.write(STUCK, 0, new byte[]{1});

        int failed = janitor(staging).sweepStuckMerges();

        assertThat(failed).isEqualTo(1);
        UploadSession stuck = repository.find(STUCK).orElseThrow();
        assertThat(stuck.getStatus()).isEqualTo(UploadSessionStatus.FAILED);
        assertThat(stuck.getRetryCount()).isEqualTo(1);
        assertThat(staging.exists(STUCK, 0)).isTrue();
        assertThat(repository.find(ACTIVE).orElseThrow().getStatus()).isEqualTo(UploadSessionStatus.PROCESSING);
    }

    @Test
    void sweepOrphans_removesOnlyUnknownDirectories() throws Exception {
        repository.insert(session(ACTIVE, UploadSessionStatus.UPLOADING, LocalDateTime.now(clock)));
        staging.write(ACTIVE, 0, new byte[]{1});
        staging.write(STALE, 0, new byte[]{1});
        staging.write(EXPIRED, 3, new byte[]{1});

        int removed = janitor(staging).sweepOrphans();

        assertThat(removed).isEqualTo(2);
        assertThat(staging.listSessionIds()).containsExactly(ACTIVE);
    }

    @Test
    void sweepExpired_oneFailure_doesNotAbortSweep() throws Exception {
        LocalDateTime past = LocalDateTime.now(clock).minusHours(30);
        repository.insert(session(EXPIRED, UploadSessionStatus.UPLOADING, past));
        repository.insert(session(STALE, UploadSessionStatus.UPLOADING, past));

        ChunkStaging broken = mock(ChunkStaging.class);
        doThrow(new IOException("permission denied")).when(broken).deleteAll(EXPIRED);

        int removed = janitor(broken).sweepExpired();

        assertThat(removed).isEqualTo(1);
        assertThat(repository.findAllIds()).containsExactly(EXPIRED);
    }

    @Test
    void sweepOrphans_listingFails_returnsZero() throws Exception {
        ChunkStaging broken = mock(ChunkStaging.class);
        when(broken.listSessionIds()).thenThrow(new IOException("gone"));

        assertThat(janitor(broken).sweepOrphans()).isZero();
    }

    @Test
    void sweepOrphans_deleteFailure_continuesWithNext() throws Exception {
        ChunkStaging broken = mock(ChunkStaging.class);
        when(broken.listSessionIds()).thenReturn(List.of(STALE, EXPIRED));
        doThrow(new IOException("busy")).when(broken).deleteAll(STALE);

        assertThat(janitor(broken).sweepOrphans()).isEqualTo(1);
    }

    private BlobInfo storeBlob() throws IOException {
        try (BlobUpload upload = blobStore.openUploadStream("old.bin", Map.of())) {
            upload.getOutputStream().write(new byte[]{1, 2, 3});
            return upload.commit();
        }
    }

    private static UploadSession session(String id, UploadSessionStatus status, LocalDateTime createdAt) {
        return UploadSession.builder()
                .sessionId(id)
                .originalName("file.bin")
                .mimeType("application/octet-stream")
                .declaredSize(10)
                .uploadedBy("anonymous")
                .totalChunks(1)
                .status(status)
                .createdAt(createdAt)
                .updatedAt(createdAt)
                .expiresAt(createdAt.plus(Duration.ofHours(24)))
                .build();
    }
}
