package de.jwiegmann.chunkupload.control.staging;

import de.jwiegmann.chunkupload.config.UploadProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Chunk-Ablage im lokalen Dateisystem.
 * Layout: {@code <stagingDir>/<sessionId>/chunk-<index>}. Geschrieben wird zuerst in eine
 * {@code .part}-Datei, die danach atomar umbenannt wird.
 */
@Slf4j
@Component
public class FileSystemChunkStaging implements ChunkStaging {

    private static final String CHUNK_PREFIX = "chunk-";
    private static final String PART_SUFFIX = ".part";

    private final Path root;

    @Autowired
    public FileSystemChunkStaging(UploadProperties properties) {
        this(properties.getStagingDir());
    }

    public FileSystemChunkStaging(Path root) {
        this.root = root.toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.root);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create staging directory " + this.root, e);
        }
    }

    @Override
    public void write(String sessionId, int chunkIndex, byte[] bytes) throws IOException {
        Path dir = sessionDir(sessionId);
        Files.createDirectories(dir);
        Path target = chunkPath(sessionId, chunkIndex);
        Path part = dir.resolve(CHUNK_PREFIX + chunkIndex + "-" + UUID.randomUUID() + PART_SUFFIX);
        try {
            Files.write(part, bytes);
            Files.move(part, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(part);
        }
    }

    @Override
    public boolean exists(String sessionId, int chunkIndex) {
        return Files.isRegularFile(chunkPath(sessionId, chunkIndex));
    }

    @Override
    public InputStream open(String sessionId, int chunkIndex) throws IOException {
        return Files.newInputStream(chunkPath(sessionId, chunkIndex));
    }

    @Override
    public void delete(String sessionId, int chunkIndex) throws IOException {
        Files.deleteIfExists(chunkPath(sessionId, chunkIndex));
    }

    @Override
    public void deleteAll(String sessionId) throws IOException {
        Path dir = sessionDir(sessionId);
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(dir)) {
            for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(path);
            }
        }
        log.debug("Staging directory removed for session {}", sessionId);
    }

    @Override
    public List<String> listSessionIds() throws IOException {
        try (Stream<Path> dirs = Files.list(root)) {
            return dirs.filter(Files::isDirectory)
                    .map(p -> p.getFileName().toString())
                    .toList();
        }
    }

    private Path sessionDir(String sessionId) {
        Path dir = root.resolve(sessionId).normalize();
        if (!dir.getParent().equals(root)) {
            throw new IllegalArgumentException("invalid session id for staging: " + sessionId);
        }
        return dir;
    }

    private Path chunkPath(String sessionId, int chunkIndex) {
        return sessionDir(sessionId).resolve(CHUNK_PREFIX + chunkIndex);
    }
}
