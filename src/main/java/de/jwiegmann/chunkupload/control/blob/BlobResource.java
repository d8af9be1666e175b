package de.jwiegmann.chunkupload.control.blob;

import org.springframework.core.io.AbstractResource;

import java.io.IOException;
import java.io.InputStream;

/**
 * Stellt einen Blob als Spring-{@link org.springframework.core.io.Resource} bereit.
 * Jeder Aufruf von {@link #getInputStream()} öffnet einen neuen Stream; damit kann Spring
 * Range-Anfragen selbst bedienen.
 */
public class BlobResource extends AbstractResource {

    private final BlobStore blobStore;
    private final BlobInfo info;

    public BlobResource(BlobStore blobStore, BlobInfo info) {
        this.blobStore = blobStore;
        this.info = info;
    }

    @Override
    public InputStream getInputStream() throws IOException {
        return blobStore.openDownloadStream(info.id());
    }

    @Override
    public long contentLength() {
        return info.length();
    }

    @Override
    public String getFilename() {
        return info.fileName();
    }

    @Override
    public boolean exists() {
        return true;
    }

    @Override
    public String getDescription() {
        return "Blob [" + info.id() + "]";
    }

    public BlobInfo getInfo() {
        return info;
    }
}
