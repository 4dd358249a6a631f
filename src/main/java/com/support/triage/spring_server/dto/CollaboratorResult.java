package com.support.triage.spring_server.dto;

import com.support.triage.spring_server.exception.ErrorKind;
import lombok.Data;

/**
 * Outcome of a call to an external collaborator (store, model, cache). Callers branch on
 * {@link #isSuccess()} and {@link #getErrorKind()} instead of catching exceptions.
 */
@Data
public class CollaboratorResult<T> {
    private final T value;
    private final boolean success;
    private final ErrorKind errorKind;
    private final String errorMessage;

    public CollaboratorResult(T value, boolean success, ErrorKind errorKind, String errorMessage) {
        this.value = value;
        this.success = success;
        this.errorKind = errorKind;
        this.errorMessage = errorMessage;
    }

    public static <T> CollaboratorResult<T> success(T value) {
        return new CollaboratorResult<>(value, true, null, null);
    }

    public static <T> CollaboratorResult<T> failure(ErrorKind errorKind, String errorMessage) {
        return new CollaboratorResult<>(null, false, errorKind, errorMessage);
    }

    public static <T> CollaboratorResult<T> unavailable(String errorMessage) {
        return failure(ErrorKind.COLLABORATOR_UNAVAILABLE, errorMessage);
    }

    public static <T> CollaboratorResult<T> cancelled(String errorMessage) {
        return failure(ErrorKind.CANCELLED, errorMessage);
    }

    public boolean isCancelled() {
        return errorKind == ErrorKind.CANCELLED;
    }

    public T orElse(T fallback) {
        return success ? value : fallback;
    }
}
