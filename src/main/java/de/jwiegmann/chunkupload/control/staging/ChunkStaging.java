package de.jwiegmann.chunkupload.control.staging;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Zwischenablage für Chunks: ein Verzeichnis pro Session, eine Datei pro Chunk-Index.
 * Keine Fachlogik, nur Schreiben, Lesen und Löschen.
 */
public interface ChunkStaging {

    /**
     * Schreibt den Chunk vollständig und dauerhaft. Erst danach ist er über {@link #exists} sichtbar.
     */
    void write(String sessionId, int chunkIndex, byte[] bytes) throws IOException;

    boolean exists(String sessionId, int chunkIndex);

    InputStream open(String sessionId, int chunkIndex) throws IOException;

    /**
     * Löscht einen einzelnen Chunk; fehlende Datei ist kein Fehler.
     */
    void delete(String sessionId, int chunkIndex) throws IOException;

    /**
     * Löscht das Verzeichnis der Session samt Inhalt; fehlendes Verzeichnis ist kein Fehler.
     */
    void deleteAll(String sessionId) throws IOException;

    /**
     * Namen aller Session-Verzeichnisse, die physisch vorhanden sind.
     */
    List<String> listSessionIds() throws IOException;
}
