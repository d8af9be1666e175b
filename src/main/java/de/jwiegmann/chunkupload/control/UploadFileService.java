package de.jwiegmann.chunkupload.control;

import de.jwiegmann.chunkupload.boundary.dto.UploadStatsResponse;
import de.jwiegmann.chunkupload.boundary.dto.UploadStatusListResponse;
import de.jwiegmann.chunkupload.boundary.dto.UploadStatusResponse;
import de.jwiegmann.chunkupload.config.UploadProperties;
import de.jwiegmann.chunkupload.control.blob.BlobInfo;
import de.jwiegmann.chunkupload.control.blob.BlobResource;
import de.jwiegmann.chunkupload.control.blob.BlobStore;
import de.jwiegmann.chunkupload.control.exception.UploadStorageException;
import de.jwiegmann.chunkupload.control.exception.UploadValidationException;
import de.jwiegmann.chunkupload.control.repository.SessionPage;
import de.jwiegmann.chunkupload.control.repository.SessionQuery;
import de.jwiegmann.chunkupload.control.repository.UploadSessionRepository;
import de.jwiegmann.chunkupload.entity.UploadSession;
import de.jwiegmann.chunkupload.entity.UploadSessionStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lesende Sicht auf die Uploads: Liste, Statistik und Download fertiger Dateien.
 */
@Slf4j
@Service
public class UploadFileService {

    private final UploadSessionRepository repository;
    private final BlobStore blobStore;
    private final UploadProperties properties;
    private final Clock clock;

    public UploadFileService(UploadSessionRepository repository,
                             BlobStore blobStore,
                             UploadProperties properties,
                             Clock clock) {
        this.repository = repository;
        this.blobStore = blobStore;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Seitenweise Liste aller Sessions.
     *
     * @param status    Filter, null = alle
     * @param page      1-basiert, null = 1
     * @param limit     null = Default, größer als das Maximum wird gekappt
     * @param sortBy    createdAt | updatedAt | declaredSize | originalName | status
     * @param sortOrder asc | desc
     * @throws UploadValidationException bei unbekanntem Status, Sortierfeld oder Seitenangabe
     */
    public UploadStatusListResponse list(String status, Integer page, Integer limit, String sortBy, String sortOrder) {
        UploadProperties.Listing listing = properties.getList();

        int pageNo = page == null ? 1 : page;
        if (pageNo < 1) {
            throw new UploadValidationException("Invalid page");
        }
        int pageSize = limit == null ? listing.getDefaultLimit() : limit;
        if (pageSize < 1) {
            throw new UploadValidationException("Invalid limit");
        }
        pageSize = Math.min(pageSize, listing.getMaxLimit());

        SessionQuery query = SessionQuery.builder()
                .status(parseStatus(status))
                .page(pageNo)
                .limit(pageSize)
                .sortBy(parseSortField(sortBy))
                .ascending(parseAscending(sortOrder))
                .build();

        SessionPage result = repository.findPage(query);
        LocalDateTime now = LocalDateTime.now(clock);
        List<UploadStatusResponse> items = result.items().stream()
                .map(s -> UploadStatusResponse.of(s, now))
                .toList();

        return UploadStatusListResponse.builder()
                .items(items)
                .pagination(UploadStatusListResponse.Pagination.builder()
                        .page(pageNo)
                        .limit(pageSize)
                        .total(result.total())
                        .pages((int) ((result.total() + pageSize - 1) / pageSize))
                        .build())
                .build();
    }

    public UploadStatsResponse stats() {
        Map<String, UploadStatsResponse.StatusStats> byStatus = new LinkedHashMap<>();
        long totalFiles = 0;
        long totalSize = 0;

        List<UploadSession> sessions = repository.findAll();
        for (UploadSessionStatus status : UploadSessionStatus.values()) {
            long count = 0;
            long size = 0;
            for (UploadSession s : sessions) {
                if (s.getStatus() == status) {
                    count++;
                    size += s.getDeclaredSize();
                }
            }
            if (count > 0) {
                byStatus.put(status.value(), UploadStatsResponse.StatusStats.builder()
                        .count(count)
                        .totalSize(size)
                        .avgSize(size / count)
                        .build());
            }
            totalFiles += count;
            totalSize += size;
        }

        return UploadStatsResponse.builder()
                .totalFiles(totalFiles)
                .totalSize(totalSize)
                .byStatus(byStatus)
                .build();
    }

    /**
     * Liefert die fertige Datei einer Session und zählt den Download.
     *
     * @throws de.jwiegmann.chunkupload.control.exception.UploadSessionNotFoundException wenn die Session
     *                                                                                  nicht existiert oder noch nicht fertig ist
     */
    public Download download(String sessionId) {
        UploadSessionManager.validateSessionId(sessionId);
        UploadSession session = repository.find(sessionId)
                .filter(s -> s.getStatus() == UploadSessionStatus.COMPLETED && s.getBlobRef() != null)
                .orElseThrow(() -> UploadErrorFactory.fileNotReady(sessionId));

        BlobInfo info;
        try {
            info = blobStore.find(session.getBlobRef())
                    .orElseThrow(() -> UploadErrorFactory.fileNotReady(sessionId));
        } catch (IOException e) {
            throw new UploadStorageException("Failed to read file metadata", e);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        repository.updateIf(sessionId, s -> true, s -> {
            s.setDownloadCount(s.getDownloadCount() + 1);
            s.setLastDownloadedAt(now);
            return s;
        });
        log.debug("Download of session {} (blob {})", sessionId, info.id());

        return new Download(session, new BlobResource(blobStore, info));
    }

    private static UploadSessionStatus parseStatus(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        try {
            return UploadSessionStatus.fromValue(status);
        } catch (IllegalArgumentException e) {
            throw new UploadValidationException("Invalid status: " + status);
        }
    }

    private static SessionQuery.SortField parseSortField(String sortBy) {
        if (sortBy == null || sortBy.isBlank()) {
            return SessionQuery.SortField.CREATED_AT;
        }
        try {
            return SessionQuery.SortField.fromProperty(sortBy);
        } catch (IllegalArgumentException e) {
            throw new UploadValidationException("Invalid sort field: " + sortBy);
        }
    }

    private static boolean parseAscending(String sortOrder) {
        if (sortOrder == null || sortOrder.isBlank() || sortOrder.equalsIgnoreCase("desc")) {
            return false;
        }
        if (sortOrder.equalsIgnoreCase("asc")) {
            return true;
        }
        throw new UploadValidationException("Invalid sort order: " + sortOrder);
    }

    /**
     * Session-Stand vor dem Download plus Zugriff auf den Inhalt.
     */
    public record Download(UploadSession session, BlobResource resource) {
    }
}
