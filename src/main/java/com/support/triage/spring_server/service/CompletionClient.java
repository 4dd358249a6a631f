package com.support.triage.spring_server.service;

import com.support.triage.spring_server.dto.CollaboratorResult;
import com.support.triage.spring_server.dto.CompletionRequest;

/**
 * Single request/response text completion from a language model.
 */
public interface CompletionClient {

    /**
     * Returns the raw completion text, or a failure carrying
     * {@link com.support.triage.spring_server.exception.ErrorKind#COLLABORATOR_UNAVAILABLE}
     * (unreachable, timed out, malformed envelope) or
     * {@link com.support.triage.spring_server.exception.ErrorKind#CANCELLED} (caller interrupted).
     */
    CollaboratorResult<String> complete(CompletionRequest request);
}
