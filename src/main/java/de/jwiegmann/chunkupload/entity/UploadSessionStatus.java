package de.jwiegmann.chunkupload.entity;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Lebenszyklus einer Upload-Session.
 * Die erlaubten Übergänge stehen explizit in {@link #TRANSITIONS}; der Manager prüft sie,
 * bevor er ein Update gegen den Store absetzt.
 */
public enum UploadSessionStatus {
    PENDING,
    UPLOADING,
    PROCESSING,
    COMPLETED,
    FAILED,
    CANCELLED;

    private static final Map<UploadSessionStatus, Set<UploadSessionStatus>> TRANSITIONS = Map.of(
            PENDING, EnumSet.of(UPLOADING, CANCELLED),
            UPLOADING, EnumSet.of(PROCESSING, FAILED, CANCELLED),
            PROCESSING, EnumSet.of(COMPLETED, FAILED, CANCELLED),
            FAILED, EnumSet.of(UPLOADING, COMPLETED, CANCELLED),
            COMPLETED, EnumSet.noneOf(UploadSessionStatus.class),
            CANCELLED, EnumSet.noneOf(UploadSessionStatus.class)
    );

    public boolean canTransitionTo(UploadSessionStatus target) {
        return TRANSITIONS.get(this).contains(target);
    }

    public boolean isTerminal() {
        return TRANSITIONS.get(this).isEmpty();
    }

    /**
     * Name wie er nach außen geht (klein geschrieben, z.B. "processing").
     */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @throws IllegalArgumentException bei unbekanntem Status
     */
    public static UploadSessionStatus fromValue(String value) {
        return UploadSessionStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
