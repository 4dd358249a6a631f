package com.support.triage.spring_server.dto;

import com.support.triage.spring_server.exception.TriageException;
import lombok.Data;

/**
 * Envelope used by every REST endpoint: either a complete payload or a single typed failure.
 */
@Data
public class ApiResponse<T> {
    private final String status;
    private final String message;
    private final String errorKind;
    private final T data;

    public ApiResponse(String status, String message, String errorKind, T data) {
        this.status = status;
        this.message = message;
        this.errorKind = errorKind;
        this.data = data;
    }

    public static <T> ApiResponse<T> success(String message, T data) {
        return new ApiResponse<>("success", message, null, data);
    }

    public static <T> ApiResponse<T> error(TriageException e) {
        return new ApiResponse<>("error", e.getMessage(), e.getErrorKind().name(), null);
    }

    public static <T> ApiResponse<T> error(String message) {
        return new ApiResponse<>("error", message, "INTERNAL", null);
    }
}
