package de.jwiegmann.chunkupload.control.blob;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileSystemBlobStoreTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-01-01T12:00:00Z"), ZoneOffset.UTC);

    private final ObjectMapper objectMapper = JsonMapper.builder().findAndAddModules().build();

    @TempDir
    Path root;

    @Test
    void commit_makesBlobReadable_withMetadata() throws Exception {
        FileSystemBlobStore store = new FileSystemBlobStore(root, objectMapper, CLOCK);

        String id;
        try (BlobUpload upload = store.openUploadStream("report.pdf", Map.of("sessionId", "abc"))) {
            upload.getOutputStream().write("hello ".getBytes(StandardCharsets.UTF_8));
            upload.getOutputStream().write("world".getBytes(StandardCharsets.UTF_8));
            assertThat(upload.getBytesWritten()).isEqualTo(11);
            BlobInfo info = upload.commit();
            id = info.id();
            assertThat(info.length()).isEqualTo(11);
        }

        BlobInfo found = store.find(id).orElseThrow();
        assertThat(found.fileName()).isEqualTo("report.pdf");
        assertThat(found.metadata()).containsEntry("sessionId", "abc");
        assertThat(found.uploadDate()).isEqualTo(CLOCK.instant());
        try (InputStream in = store.openDownloadStream(id)) {
            assertThat(new String(in.readAllBytes(), StandardCharsets.UTF_8)).isEqualTo("hello world");
        }
    }

    @Test
    void abort_leavesNothingBehind() throws Exception {
        FileSystemBlobStore store = new FileSystemBlobStore(root, objectMapper, CLOCK);

        BlobUpload upload = store.openUploadStream("x.bin", Map.of());
        upload.getOutputStream().write(new byte[]{1, 2, 3});
        upload.abort();

        assertThat(store.find(upload.getId())).isEmpty();
        assertThatThrownBy(() -> store.openDownloadStream(upload.getId())).isInstanceOf(NoSuchFileException.class);
        try (Stream<Path> files = Files.walk(root)) {
            assertThat(files.filter(Files::isRegularFile)).isEmpty();
        }
    }

    @Test
    void close_withoutCommit_discards() throws Exception {
        FileSystemBlobStore store = new FileSystemBlobStore(root, objectMapper, CLOCK);

        String id;
        try (BlobUpload upload = store.openUploadStream("x.bin", Map.of())) {
            upload.getOutputStream().write(42);
            id = upload.getId();
        }

        assertThat(store.find(id)).isEmpty();
    }

    @Test
    void delete_unknownId_isNoError() throws Exception {
        FileSystemBlobStore store = new FileSystemBlobStore(root, objectMapper, CLOCK);

        store.delete("0123456789abcdef01234567");

        assertThat(store.find("0123456789abcdef01234567")).isEmpty();
    }
}
