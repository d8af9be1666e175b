package de.jwiegmann.chunkupload.control;

import com.fasterxml.jackson.databind.json.JsonMapper;
import de.jwiegmann.chunkupload.config.UploadProperties;
import de.jwiegmann.chunkupload.control.blob.BlobInfo;
import de.jwiegmann.chunkupload.control.blob.BlobStore;
import de.jwiegmann.chunkupload.control.blob.BlobUpload;
import de.jwiegmann.chunkupload.control.blob.FileSystemBlobStore;
import de.jwiegmann.chunkupload.control.exception.UploadStorageException;
import de.jwiegmann.chunkupload.control.repository.InMemoryUploadSessionRepository;
import de.jwiegmann.chunkupload.control.staging.FileSystemChunkStaging;
import de.jwiegmann.chunkupload.entity.UploadSession;
import de.jwiegmann.chunkupload.entity.UploadSessionStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MergeEngineTest {

    private static final String ID = "0123456789abcdef0123456789abcdef";

    @TempDir
    Path tmp;

    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-01T10:00:00Z"));

    private InMemoryUploadSessionRepository repository;
    private FileSystemChunkStaging staging;
    private FileSystemBlobStore blobStore;
    private UploadProperties properties;

    @BeforeEach
    void setUp() throws IOException {
        repository = new InMemoryUploadSessionRepository();
        staging = new FileSystemChunkStaging(tmp.resolve("staging"));
        blobStore = new FileSystemBlobStore(tmp.resolve("blobs"), JsonMapper.builder().findAndAddModules().build(), clock);
        properties = new UploadProperties();

        LocalDateTime now = LocalDateTime.now(clock);
        repository.insert(UploadSession.builder()
                .sessionId(ID)
                .originalName("data.bin")
                .mimeType("application/octet-stream")
                .declaredSize(300)
                .uploadedBy("tester")
                .totalChunks(3)
                .uploadedChunks(3)
                .status(UploadSessionStatus.PROCESSING)
                .createdAt(now)
                .updatedAt(now)
                .processingStartedAt(now)
                .expiresAt(now.plusDays(1))
                .build());
        staging.write(ID, 0, fill(100, 0xAA));
        staging.write(ID, 1, fill(100, 0xBB));
        staging.write(ID, 2, fill(100, 0xCC));
    }

    @Test
    void merge_concatenatesInIndexOrder() throws Exception {
        UploadSession result = engine(blobStore).merge(ID);

        assertThat(result.getStatus()).isEqualTo(UploadSessionStatus.COMPLETED);
        assertThat(result.getProcessingCompletedAt()).isNotNull();

        BlobInfo info = blobStore.find(result.getBlobRef()).orElseThrow();
        assertThat(info.length()).isEqualTo(300);
        assertThat(info.metadata()).containsEntry("sessionId", ID).containsEntry("uploadedBy", "tester");
        try (InputStream in = blobStore.openDownloadStream(result.getBlobRef())) {
            byte[] content = in.readAllBytes();
            assertThat(Arrays.copyOfRange(content, 0, 100)).containsOnly((byte) 0xAA);
            assertThat(Arrays.copyOfRange(content, 100, 200)).containsOnly((byte) 0xBB);
            assertThat(Arrays.copyOfRange(content, 200, 300)).containsOnly((byte) 0xCC);
        }
        assertThat(Files.exists(tmp.resolve("staging").resolve(ID))).isFalse();
    }

    @Test
    void merge_alreadyCompleted_isNoop() {
        MergeEngine engine = engine(blobStore);
        String blobRef = engine.merge(ID).getBlobRef();

        UploadSession again = engine.merge(ID);

        assertThat(again.getBlobRef()).isEqualTo(blobRef);
    }

    @Test
    void merge_missingChunk_failsWithoutLeavingBlob() throws Exception {
        staging.delete(ID, 1);

        assertThatThrownBy(() -> engine(blobStore).merge(ID))
                .isInstanceOf(UploadStorageException.class);

        UploadSession failed = repository.find(ID).orElseThrow();
        assertThat(failed.getStatus()).isEqualTo(UploadSessionStatus.FAILED);
        assertThat(failed.getRetryCount()).isEqualTo(1);
        assertThat(failed.getErrorMessage()).isEqualTo("Failed to read chunk 1");
        assertThat(failed.getBlobRef()).isNull();
        assertNoBlobFiles();
    }

    @Test
    void merge_writeFailsMidStream_abortsBlob() throws Exception {
        BlobStore failing = new FailingBlobStore(blobStore, 150, null);

        assertThatThrownBy(() -> engine(failing).merge(ID))
                .isInstanceOf(UploadStorageException.class);

        UploadSession failed = repository.find(ID).orElseThrow();
        assertThat(failed.getStatus()).isEqualTo(UploadSessionStatus.FAILED);
        assertThat(failed.getRetryCount()).isEqualTo(1);
        assertNoBlobFiles();
        // Chunks bleiben für einen neuen Versuch liegen
        assertThat(staging.exists(ID, 0)).isTrue();
    }

    @Test
    void merge_sessionCancelledWhileMerging_blobDiscarded() throws Exception {
        Runnable cancelBeforeCommit = () -> repository.updateIf(ID, s -> true, s -> {
            s.setStatus(UploadSessionStatus.CANCELLED);
            return s;
        });
        BlobStore cancelling = new FailingBlobStore(blobStore, Long.MAX_VALUE, cancelBeforeCommit);

        UploadSession result = engine(cancelling).merge(ID);

        assertThat(result.getStatus()).isEqualTo(UploadSessionStatus.CANCELLED);
        assertThat(result.getBlobRef()).isNull();
        assertNoBlobFiles();
        assertThat(staging.exists(ID, 0)).isFalse();
    }

    @Test
    void merge_outlivesProcessingTimeout_stillCompletes() throws Exception {
        MergeEngine sweeper = engine(blobStore);
        Runnable sweepBeforeCommit = () -> {
            clock.advance(Duration.ofHours(3));
            assertThat(sweeper.failIfStuck(ID, LocalDateTime.now(clock).minus(properties.getProcessingTimeout()))).isTrue();
        };
        BlobStore slow = new FailingBlobStore(blobStore, Long.MAX_VALUE, sweepBeforeCommit);

        UploadSession result = engine(slow).merge(ID);

        assertThat(result.getStatus()).isEqualTo(UploadSessionStatus.COMPLETED);
        assertThat(result.getErrorMessage()).isNull();
        assertThat(blobStore.find(result.getBlobRef()).orElseThrow().length()).isEqualTo(300);
        assertThat(repository.find(ID).orElseThrow().getBlobRef()).isEqualTo(result.getBlobRef());
    }

    @Test
    void merge_sessionReopenedWhileMerging_keepsChunks() throws Exception {
        Runnable reopenBeforeCommit = () -> repository.updateIf(ID, s -> true, s -> {
            s.setStatus(UploadSessionStatus.UPLOADING);
            return s;
        });
        BlobStore reopening = new FailingBlobStore(blobStore, Long.MAX_VALUE, reopenBeforeCommit);

        UploadSession result = engine(reopening).merge(ID);

        assertThat(result.getStatus()).isEqualTo(UploadSessionStatus.UPLOADING);
        assertThat(result.getBlobRef()).isNull();
        assertNoBlobFiles();
        assertThat(staging.exists(ID, 0)).isTrue();
        assertThat(staging.exists(ID, 2)).isTrue();
    }

    @Test
    void failIfStuck_onlyOldProcessingSessions() {
        MergeEngine engine = engine(blobStore);
        LocalDateTime cutoff = LocalDateTime.now(clock).minus(properties.getProcessingTimeout());

        assertThat(engine.failIfStuck(ID, cutoff)).isFalse();

        clock.advance(Duration.ofHours(3));
        assertThat(engine.failIfStuck(ID, LocalDateTime.now(clock).minus(properties.getProcessingTimeout()))).isTrue();

        UploadSession failed = repository.find(ID).orElseThrow();
        assertThat(failed.getStatus()).isEqualTo(UploadSessionStatus.FAILED);
        assertThat(failed.getRetryCount()).isEqualTo(1);
        assertThat(staging.exists(ID, 2)).isTrue();
    }

    private MergeEngine engine(BlobStore store) {
        return new MergeEngine(repository, staging, store, properties, clock);
    }

    private void assertNoBlobFiles() throws IOException {
        try (Stream<Path> files = Files.walk(tmp.resolve("blobs"))) {
            assertThat(files.filter(Files::isRegularFile)).isEmpty();
        }
    }

    private static byte[] fill(int length, int value) {
        byte[] b = new byte[length];
        Arrays.fill(b, (byte) value);
        return b;
    }

    /**
     * Reicht an einen echten Store durch, bricht aber nach {@code failAfter} Bytes ab
     * und führt optional vor dem Commit eine Aktion aus.
     */
    private static final class FailingBlobStore implements BlobStore {

        private final BlobStore delegate;
        private final long failAfter;
        private final Runnable beforeCommit;

        private FailingBlobStore(BlobStore delegate, long failAfter, Runnable beforeCommit) {
            this.delegate = delegate;
            this.failAfter = failAfter;
            this.beforeCommit = beforeCommit;
        }

        @Override
        public BlobUpload openUploadStream(String fileName, Map<String, String> metadata) throws IOException {
            BlobUpload upload = delegate.openUploadStream(fileName, metadata);
            OutputStream limited = new FilterOutputStream(upload.getOutputStream()) {
                private long written;

                @Override
                public void write(int b) throws IOException {
                    write(new byte[]{(byte) b}, 0, 1);
                }

                @Override
                public void write(byte[] b, int off, int len) throws IOException {
                    if (written + len > failAfter) {
                        throw new IOException("disk full");
                    }
                    out.write(b, off, len);
                    written += len;
                }
            };
            return new BlobUpload() {
                @Override
                public String getId() {
                    return upload.getId();
                }

                @Override
                public OutputStream getOutputStream() {
                    return limited;
                }

                @Override
                public long getBytesWritten() {
                    return upload.getBytesWritten();
                }

                @Override
                public BlobInfo commit() throws IOException {
                    if (beforeCommit != null) {
                        beforeCommit.run();
                    }
                    return upload.commit();
                }

                @Override
                public void abort() throws IOException {
                    upload.abort();
                }

                @Override
                public void close() throws IOException {
                    upload.close();
                }
            };
        }

        @Override
        public InputStream openDownloadStream(String blobId) throws IOException {
            return delegate.openDownloadStream(blobId);
        }

        @Override
        public Optional<BlobInfo> find(String blobId) throws IOException {
            return delegate.find(blobId);
        }

        @Override
        public void delete(String blobId) throws IOException {
            delegate.delete(blobId);
        }
    }
}
