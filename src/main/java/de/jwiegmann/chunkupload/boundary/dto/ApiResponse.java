package de.jwiegmann.chunkupload.boundary.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import de.jwiegmann.chunkupload.boundary.dto.error.UploadError;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Einheitlicher Umschlag aller JSON-Antworten: entweder {@code data} oder {@code error}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    private boolean success;
    private T data;
    private UploadError error;

    public static <T> ApiResponse<T> ok(T data) {
        return ApiResponse.<T>builder().success(true).data(data).build();
    }

    public static <T> ApiResponse<T> failed(UploadError error) {
        return ApiResponse.<T>builder().success(false).error(error).build();
    }
}
