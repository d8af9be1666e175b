package de.jwiegmann.chunkupload.boundary.admission;

import java.time.Duration;
import java.util.Optional;

/**
 * Entscheidet, ob ein Request angenommen wird. Der Schlüssel ist typischerweise die Client-Adresse.
 * Abgelehnte Requests beantwortet die Boundary mit 429.
 */
public interface AdmissionControl {

    boolean allow(String key);

    /**
     * Wartezeit, die dem Client nach einer Ablehnung mitgegeben wird.
     */
    default Optional<Duration> retryAfter(String key) {
        return Optional.empty();
    }

    static AdmissionControl permitAll() {
        return key -> true;
    }
}
