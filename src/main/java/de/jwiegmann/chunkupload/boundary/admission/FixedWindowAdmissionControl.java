package de.jwiegmann.chunkupload.boundary.admission;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Zählt Requests pro Schlüssel in festen Zeitfenstern.
 * Nur für eine Instanz gedacht, der Zustand liegt im Speicher.
 */
public final class FixedWindowAdmissionControl implements AdmissionControl {

    private final int maxRequests;
    private final Duration window;
    private final Clock clock;
    private final Map<String, Window> windows = new ConcurrentHashMap<>();

    private static final int EVICTION_THRESHOLD = 10_000;

    public FixedWindowAdmissionControl(int maxRequests, Duration window, Clock clock) {
        if (maxRequests <= 0) throw new IllegalArgumentException("maxRequests must be positive");
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive");
        }
        this.maxRequests = maxRequests;
        this.window = window;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public boolean allow(String key) {
        Instant now = clock.instant();
        if (windows.size() > EVICTION_THRESHOLD) {
            evictExpired();
        }
        Window w = windows.computeIfAbsent(normalize(key), k -> new Window(now));
        return w.tryCount(now, window, maxRequests);
    }

    @Override
    public Optional<Duration> retryAfter(String key) {
        Window w = windows.get(normalize(key));
        if (w == null) {
            return Optional.empty();
        }
        Duration remaining = w.remaining(clock.instant(), window);
        return remaining.isNegative() || remaining.isZero() ? Optional.empty() : Optional.of(remaining);
    }

    /**
     * Entfernt abgelaufene Fenster, damit die Map nicht unbegrenzt wächst.
     */
    public void evictExpired() {
        Instant now = clock.instant();
        windows.values().removeIf(w -> w.isExpired(now, window));
    }

    private static String normalize(String key) {
        return key != null ? key : "unknown";
    }

    private static final class Window {
        private Instant start;
        private int count;

        Window(Instant start) {
            this.start = start;
        }

        synchronized boolean tryCount(Instant now, Duration window, int max) {
            if (isExpired(now, window)) {
                start = now;
                count = 0;
            }
            if (count >= max) {
                return false;
            }
            count++;
            return true;
        }

        synchronized Duration remaining(Instant now, Duration window) {
            return Duration.between(now, start.plus(window));
        }

        synchronized boolean isExpired(Instant now, Duration window) {
            return !now.isBefore(start.plus(window));
        }
    }
}
