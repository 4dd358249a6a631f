package com.support.triage.spring_server.exception;

public class TriageException extends RuntimeException {
    private final ErrorKind errorKind;

    public TriageException(ErrorKind errorKind, String message) {
        super(message);
        this.errorKind = errorKind;
    }

    public TriageException(ErrorKind errorKind, String message, Throwable cause) {
        super(message, cause);
        this.errorKind = errorKind;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }
}
