package com.support.triage.spring_server.exception;

/**
 * Failure taxonomy shared by collaborator results and pipeline exceptions.
 */
public enum ErrorKind {
    INVALID_INPUT(400),
    NOT_FOUND(404),
    COLLABORATOR_UNAVAILABLE(503),
    CANCELLED(503),
    INTERNAL(500);

    private final int httpStatus;

    ErrorKind(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int getHttpStatus() {
        return httpStatus;
    }
}
