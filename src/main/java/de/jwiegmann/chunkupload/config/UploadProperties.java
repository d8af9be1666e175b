package de.jwiegmann.chunkupload.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Konfiguration des Chunk-Uploads (Prefix "upload").
 */
@Data
@ConfigurationProperties(prefix = "upload")
public class UploadProperties {

    /**
     * Arbeitsverzeichnis für Chunks, ein Unterverzeichnis pro Session.
     */
    private Path stagingDir = Path.of("./uploads/staging");

    /**
     * Ablage der fertig zusammengesetzten Dateien.
     */
    private Path blobDir = Path.of("./uploads/blobs");

    /**
     * Größte erlaubte Datei (declaredSize).
     */
    private DataSize maxFileSize = DataSize.ofGigabytes(5);

    private DataSize maxChunkSize = DataSize.ofMegabytes(50);

    /**
     * Lebensdauer einer Session ab Erstellung, danach räumt der Janitor sie ab.
     */
    private Duration sessionTtl = Duration.ofHours(24);

    /**
     * Sessions in PENDING/UPLOADING ohne Update seit dieser Zeit gelten als verwaist.
     */
    private Duration staleAfter = Duration.ofHours(2);

    /**
     * Sessions in PROCESSING ohne Update seit dieser Zeit werden als FAILED markiert.
     */
    private Duration processingTimeout = Duration.ofHours(2);

    private int maxRetries = 5;

    /**
     * Erlaubte Abweichung zwischen declaredSize und tatsächlich gemergten Bytes (nur Warnung).
     */
    private long sizeTolerance = 1024;

    /**
     * Leer = alle Typen erlaubt.
     */
    private List<String> allowedMimeTypes = new ArrayList<>();

    private Merge merge = new Merge();

    private Listing list = new Listing();

    private Admission admission = new Admission();

    @Data
    public static class Merge {
        private int corePoolSize = 2;
        private int maxPoolSize = 4;
        private int queueCapacity = 100;
    }

    @Data
    public static class Listing {
        private int defaultLimit = 50;
        private int maxLimit = 100;
    }

    @Data
    public static class Admission {
        private boolean enabled = false;
        private int maxRequests = 100;
        private Duration window = Duration.ofMinutes(15);
    }
}
