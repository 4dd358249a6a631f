package com.support.triage.spring_server.controller;

import com.support.triage.spring_server.dto.CollaboratorResult;
import com.support.triage.spring_server.dto.CompletionRequest;
import com.support.triage.spring_server.service.CacheFacade;
import com.support.triage.spring_server.service.OpenAIService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthCheck {

    @Autowired
    private OpenAIService openAiService;

    @Autowired
    private CacheFacade cacheFacade;

    @GetMapping("/health-check")
    public String healthCheck() {
        return "OK";
    }

    @GetMapping("/cache-health-check")
    public Map<String, Object> cacheHealthCheck() {
        Map<String, Object> health = new LinkedHashMap<>(cacheFacade.healthCheck());
        health.put("stats", cacheFacade.stats());
        return health;
    }

    @PostMapping("/openAi-health-check")
    public String openAiHealthCheck() {
        CollaboratorResult<String> result = openAiService.complete(
                new CompletionRequest("Reply with the single word: pong", 5, 0.0));
        if (result.isSuccess()) {
            return result.getValue() + " (permits available: " + openAiService.getAvailablePermits()
                    + ", queued: " + openAiService.getQueueLength() + ")";
        }
        return "OpenAI unreachable: " + result.getErrorMessage();
    }
}
