package com.support.triage.spring_server.exception;

public class ResourceNotFoundException extends TriageException {
    public ResourceNotFoundException(String resource, String id) {
        super(ErrorKind.NOT_FOUND, resource + " not found: " + id);
    }
}
