package de.jwiegmann.chunkupload.control.repository;

import de.jwiegmann.chunkupload.entity.UploadSessionStatus;
import lombok.Builder;
import lombok.Value;

/**
 * Filter, Sortierung und Seite für die Session-Liste. page ist 1-basiert.
 */
@Value
@Builder
public class SessionQuery {

    UploadSessionStatus status;   // null = alle
    int page;
    int limit;
    SortField sortBy;
    boolean ascending;

    public enum SortField {
        CREATED_AT("createdAt"),
        UPDATED_AT("updatedAt"),
        DECLARED_SIZE("declaredSize"),
        ORIGINAL_NAME("originalName"),
        STATUS("status");

        private final String property;

        SortField(String property) {
            this.property = property;
        }

        public String property() {
            return property;
        }

        public static SortField fromProperty(String property) {
            for (SortField field : values()) {
                if (field.property.equals(property)) {
                    return field;
                }
            }
            throw new IllegalArgumentException("unknown sort field: " + property);
        }
    }
}
