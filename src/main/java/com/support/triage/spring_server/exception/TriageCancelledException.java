package com.support.triage.spring_server.exception;

public class TriageCancelledException extends TriageException {
    public TriageCancelledException(String message) {
        super(ErrorKind.CANCELLED, message);
    }
}
