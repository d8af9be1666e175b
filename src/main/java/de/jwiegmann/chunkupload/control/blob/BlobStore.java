package de.jwiegmann.chunkupload.control.blob;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.Optional;

/**
 * Ablage der fertigen Dateien (Bucket-Modell: schreiben per Stream, lesen per Stream, löschen per Id).
 */
public interface BlobStore {

    /**
     * Öffnet einen Schreibvorgang. Das Objekt wird erst mit {@link BlobUpload#commit()} sichtbar.
     */
    BlobUpload openUploadStream(String fileName, Map<String, String> metadata) throws IOException;

    /**
     * @throws java.nio.file.NoSuchFileException wenn kein Objekt mit dieser Id existiert
     */
    InputStream openDownloadStream(String blobId) throws IOException;

    Optional<BlobInfo> find(String blobId) throws IOException;

    /**
     * Löscht das Objekt; eine unbekannte Id ist kein Fehler.
     */
    void delete(String blobId) throws IOException;
}
