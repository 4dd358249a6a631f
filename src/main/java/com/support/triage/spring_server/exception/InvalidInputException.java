package com.support.triage.spring_server.exception;

public class InvalidInputException extends TriageException {
    public InvalidInputException(String message) {
        super(ErrorKind.INVALID_INPUT, message);
    }
}
