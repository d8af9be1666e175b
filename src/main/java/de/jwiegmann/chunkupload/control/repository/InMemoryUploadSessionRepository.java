package de.jwiegmann.chunkupload.control.repository;

import de.jwiegmann.chunkupload.control.exception.SessionIdConflictException;
import de.jwiegmann.chunkupload.entity.UploadSession;
import de.jwiegmann.chunkupload.entity.UploadSessionStatus;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * In-Memory Store für Session-Metadaten.
 * Bedingte Updates laufen über {@link ConcurrentHashMap#computeIfPresent}, das pro Schlüssel atomar ist.
 * Gespeichert werden nur Kopien, damit niemand am Store vorbei mutieren kann.
 */
@Repository
public class InMemoryUploadSessionRepository implements UploadSessionRepository {

    private final Map<String, UploadSession> store = new ConcurrentHashMap<>();

    @Override
    public UploadSession insert(UploadSession session) {
        UploadSession stored = session.copy();
        if (store.putIfAbsent(stored.getSessionId(), stored) != null) {
            throw new SessionIdConflictException(stored.getSessionId());
        }
        return stored.copy();
    }

    @Override
    public Optional<UploadSession> find(String sessionId) {
        return Optional.ofNullable(store.get(sessionId)).map(UploadSession::copy);
    }

    @Override
    public Optional<UploadSession> updateIf(String sessionId,
                                            Predicate<UploadSession> condition,
                                            UnaryOperator<UploadSession> mutation) {
        UploadSession[] updated = new UploadSession[1];
        store.computeIfPresent(sessionId, (id, current) -> {
            if (!condition.test(current.copy())) {
                return current;
            }
            UploadSession next = mutation.apply(current.copy());
            updated[0] = next;
            return next;
        });
        return Optional.ofNullable(updated[0]).map(UploadSession::copy);
    }

    @Override
    public boolean delete(String sessionId) {
        return store.remove(sessionId) != null;
    }

    @Override
    public List<UploadSession> findAll() {
        return store.values().stream().map(UploadSession::copy).toList();
    }

    @Override
    public Set<String> findAllIds() {
        return new HashSet<>(store.keySet());
    }

    @Override
    public List<UploadSession> findExpired(LocalDateTime now) {
        return store.values().stream()
                .filter(s -> s.isExpired(now))
                .map(UploadSession::copy)
                .toList();
    }

    @Override
    public List<UploadSession> findStale(Collection<UploadSessionStatus> statuses, LocalDateTime cutoff) {
        return store.values().stream()
                .filter(s -> statuses.contains(s.getStatus()))
                .filter(s -> s.getUpdatedAt() != null && s.getUpdatedAt().isBefore(cutoff))
                .map(UploadSession::copy)
                .toList();
    }

    @Override
    public SessionPage findPage(SessionQuery query) {
        List<UploadSession> matching = store.values().stream()
                .filter(s -> query.getStatus() == null || s.getStatus() == query.getStatus())
                .toList();

        Comparator<UploadSession> comparator = comparatorFor(query.getSortBy());
        if (!query.isAscending()) {
            comparator = comparator.reversed();
        }

        long skip = Math.max(0L, (long) (query.getPage() - 1) * query.getLimit());
        List<UploadSession> items = matching.stream()
                .sorted(comparator)
                .skip(skip)
                .limit(query.getLimit())
                .map(UploadSession::copy)
                .toList();

        return new SessionPage(items, matching.size());
    }

    private static Comparator<UploadSession> comparatorFor(SessionQuery.SortField field) {
        Comparator<UploadSession> primary = switch (field) {
            case CREATED_AT -> Comparator.comparing(UploadSession::getCreatedAt,
                    Comparator.nullsFirst(Comparator.naturalOrder()));
            case UPDATED_AT -> Comparator.comparing(UploadSession::getUpdatedAt,
                    Comparator.nullsFirst(Comparator.naturalOrder()));
            case DECLARED_SIZE -> Comparator.comparingLong(UploadSession::getDeclaredSize);
            case ORIGINAL_NAME -> Comparator.comparing(UploadSession::getOriginalName,
                    Comparator.nullsFirst(Comparator.naturalOrder()));
            case STATUS -> Comparator.comparing(UploadSession::getStatus,
                    Comparator.nullsFirst(Comparator.naturalOrder()));
        };
        // stabile Reihenfolge bei Gleichstand
        return primary.thenComparing(UploadSession::getSessionId);
    }
}
