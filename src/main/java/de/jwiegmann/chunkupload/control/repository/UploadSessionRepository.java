package de.jwiegmann.chunkupload.control.repository;

import de.jwiegmann.chunkupload.entity.UploadSession;
import de.jwiegmann.chunkupload.entity.UploadSessionStatus;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Persistenz der Session-Metadaten, ein Datensatz pro Session.
 * Alle Änderungen laufen über atomare, bedingte Updates auf genau einem Datensatz.
 * Zurückgegebene Objekte sind Kopien; Änderungen daran wirken nicht auf den Store.
 */
public interface UploadSessionRepository {

    /**
     * Legt einen neuen Datensatz an.
     *
     * @throws de.jwiegmann.chunkupload.control.exception.SessionIdConflictException wenn die Id schon vergeben ist
     */
    UploadSession insert(UploadSession session);

    Optional<UploadSession> find(String sessionId);

    /**
     * Wendet {@code mutation} atomar an, falls der Datensatz existiert und {@code condition} in diesem
     * Moment erfüllt ist.
     *
     * @return der neue Stand, leer wenn der Datensatz fehlt oder die Bedingung nicht erfüllt war
     */
    Optional<UploadSession> updateIf(String sessionId,
                                     Predicate<UploadSession> condition,
                                     UnaryOperator<UploadSession> mutation);

    boolean delete(String sessionId);

    List<UploadSession> findAll();

    Set<String> findAllIds();

    /**
     * Sessions mit expiresAt vor {@code now}, unabhängig vom Status.
     */
    List<UploadSession> findExpired(LocalDateTime now);

    /**
     * Sessions in einem der Status, deren updatedAt vor {@code cutoff} liegt.
     */
    List<UploadSession> findStale(Collection<UploadSessionStatus> statuses, LocalDateTime cutoff);

    SessionPage findPage(SessionQuery query);
}
