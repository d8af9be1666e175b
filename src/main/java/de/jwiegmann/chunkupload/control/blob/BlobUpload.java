package de.jwiegmann.chunkupload.control.blob;

import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;

/**
 * Laufender Schreibvorgang in den {@link BlobStore}.
 * Entweder {@link #commit()} oder {@link #abort()}; {@link #close()} ohne Commit verwirft.
 */
public interface BlobUpload extends Closeable {

    String getId();

    /**
     * Blockierender Stream; ein langsames Ziel bremst damit auch den Leser.
     */
    OutputStream getOutputStream();

    long getBytesWritten();

    BlobInfo commit() throws IOException;

    /**
     * Verwirft alle bisher geschriebenen Bytes. Nach abort ist unter {@link #getId()} nichts lesbar.
     */
    void abort() throws IOException;
}
