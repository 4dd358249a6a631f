package com.support.triage.spring_server.dto;

import lombok.Data;

@Data
public class CompletionRequest {
    private final String prompt;
    private final int maxTokens;
    private final double temperature;

    public CompletionRequest(String prompt, int maxTokens, double temperature) {
        this.prompt = prompt;
        this.maxTokens = maxTokens;
        this.temperature = temperature;
    }
}
