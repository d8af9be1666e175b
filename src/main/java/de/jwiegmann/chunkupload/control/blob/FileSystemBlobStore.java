package de.jwiegmann.chunkupload.control.blob;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.jwiegmann.chunkupload.config.UploadProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.BufferedOutputStream;
import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.HexFormat;
import java.util.Map;
import java.util.Optional;

/**
 * Blob-Ablage im lokalen Dateisystem nach Art eines GridFS-Buckets.
 * Layout: {@code <blobDir>/<id>} für die Daten, {@code <blobDir>/<id>.meta.json} für die Metadaten,
 * laufende Schreibvorgänge unter {@code <blobDir>/.incoming/<id>.part}.
 */
@Slf4j
@Component
public class FileSystemBlobStore implements BlobStore {

    private static final String INCOMING_DIR = ".incoming";
    private static final String META_SUFFIX = ".meta.json";
    private static final SecureRandom RANDOM = new SecureRandom();

    private final Path root;
    private final Path incoming;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Autowired
    public FileSystemBlobStore(UploadProperties properties, ObjectMapper objectMapper, Clock clock) {
        this(properties.getBlobDir(), objectMapper, clock);
    }

    public FileSystemBlobStore(Path root, ObjectMapper objectMapper, Clock clock) {
        this.root = root.toAbsolutePath().normalize();
        this.incoming = this.root.resolve(INCOMING_DIR);
        this.objectMapper = objectMapper;
        this.clock = clock;
        try {
            Files.createDirectories(this.incoming);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create blob directory " + this.root, e);
        }
    }

    @Override
    public BlobUpload openUploadStream(String fileName, Map<String, String> metadata) throws IOException {
        String id = newBlobId();
        Path part = incoming.resolve(id + ".part");
        OutputStream out = new BufferedOutputStream(Files.newOutputStream(part));
        log.debug("Blob upload opened: id={}, fileName={}", id, fileName);
        return new FileBlobUpload(id, fileName, Map.copyOf(metadata), part, out);
    }

    @Override
    public InputStream openDownloadStream(String blobId) throws IOException {
        Path data = dataPath(blobId);
        if (!Files.isRegularFile(data)) {
            throw new NoSuchFileException(blobId);
        }
        return Files.newInputStream(data);
    }

    @Override
    public Optional<BlobInfo> find(String blobId) throws IOException {
        Path data = dataPath(blobId);
        Path meta = metaPath(blobId);
        if (!Files.isRegularFile(data) || !Files.isRegularFile(meta)) {
            return Optional.empty();
        }
        return Optional.of(objectMapper.readValue(meta.toFile(), BlobInfo.class));
    }

    @Override
    public void delete(String blobId) throws IOException {
        Files.deleteIfExists(dataPath(blobId));
        Files.deleteIfExists(metaPath(blobId));
    }

    private Path dataPath(String blobId) {
        return checked(root.resolve(blobId));
    }

    private Path metaPath(String blobId) {
        return checked(root.resolve(blobId + META_SUFFIX));
    }

    private Path checked(Path path) {
        Path normalized = path.normalize();
        if (!root.equals(normalized.getParent())) {
            throw new IllegalArgumentException("invalid blob id");
        }
        return normalized;
    }

    /**
     * 12 Zufallsbytes, hex-kodiert (Länge wie eine ObjectId).
     */
    private static String newBlobId() {
        byte[] bytes = new byte[12];
        RANDOM.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    private final class FileBlobUpload implements BlobUpload {

        private final String id;
        private final String fileName;
        private final Map<String, String> metadata;
        private final Path part;
        private final CountingOutputStream out;
        private boolean finished;

        private FileBlobUpload(String id, String fileName, Map<String, String> metadata, Path part, OutputStream out) {
            this.id = id;
            this.fileName = fileName;
            this.metadata = metadata;
            this.part = part;
            this.out = new CountingOutputStream(out);
        }

        @Override
        public String getId() {
            return id;
        }

        @Override
        public OutputStream getOutputStream() {
            return out;
        }

        @Override
        public long getBytesWritten() {
            return out.count;
        }

        @Override
        public synchronized BlobInfo commit() throws IOException {
            if (finished) {
                throw new IllegalStateException("blob upload " + id + " already finished");
            }
            out.close();
            BlobInfo info = new BlobInfo(id, fileName, Files.size(part), clock.instant(), metadata);
            Path meta = metaPath(id);
            try {
                objectMapper.writeValue(meta.toFile(), info);
                Files.move(part, dataPath(id), StandardCopyOption.ATOMIC_MOVE);
            } catch (IOException e) {
                Files.deleteIfExists(meta);
                Files.deleteIfExists(part);
                finished = true;
                throw e;
            }
            finished = true;
            log.debug("Blob committed: id={}, length={}", id, info.length());
            return info;
        }

        @Override
        public synchronized void abort() throws IOException {
            if (finished) {
                return;
            }
            finished = true;
            try {
                out.close();
            } finally {
                Files.deleteIfExists(part);
            }
            log.debug("Blob upload aborted: id={}", id);
        }

        @Override
        public void close() throws IOException {
            abort();
        }
    }

    private static final class CountingOutputStream extends FilterOutputStream {

        private long count;

        private CountingOutputStream(OutputStream out) {
            super(out);
        }

        @Override
        public void write(int b) throws IOException {
            out.write(b);
            count++;
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            out.write(b, off, len);
            count += len;
        }
    }
}
