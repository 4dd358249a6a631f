package com.support.triage.spring_server.exception;

public class TriagePipelineException extends TriageException {
    public TriagePipelineException(String message, Throwable cause) {
        super(ErrorKind.INTERNAL, message, cause);
    }
}
