package com.support.triage.spring_server.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.support.triage.spring_server.dto.CollaboratorResult;
import com.support.triage.spring_server.dto.CompletionRequest;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

@Service
public class OpenAIService implements CompletionClient {
    private static final Logger log = LoggerFactory.getLogger(OpenAIService.class);

    @Value("${openai.api.uri}")
    private String openAiUri;

    @Value("${openai.api.key:}")
    private String apiKey;

    @Value("${openai.model:gpt-3.5-turbo}")
    private String model;

    @Value("${openai.concurrent.requests.limit}")
    private int maxConcurrentRequests;

    @Value("${openai.request.timeout.seconds}")
    private int requestTimeoutSeconds;

    private final ObjectMapper objectMapper;
    private WebClient openAiClient;
    private Semaphore requestSemaphore;

    @Autowired
    public OpenAIService(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void initClient() {
        WebClient.Builder builder = WebClient.builder()
                .baseUrl(openAiUri)
                .defaultHeader("Content-Type", "application/json");
        if (apiKey != null && !apiKey.isBlank()) {
            builder.defaultHeader("Authorization", "Bearer " + apiKey);
        }
        this.openAiClient = builder.build();

        this.requestSemaphore = new Semaphore(maxConcurrentRequests, true);
        log.info("Initialized OpenAI service with max {} concurrent requests, {}s timeout",
                maxConcurrentRequests, requestTimeoutSeconds);
    }

    @PreDestroy
    public void cleanup() {
        if (requestSemaphore != null) {
            log.info("Shutting down OpenAI service, {} requests still in flight",
                    maxConcurrentRequests - requestSemaphore.availablePermits());
        }
    }

    @Override
    public CollaboratorResult<String> complete(CompletionRequest request) {
        try {
            if (!requestSemaphore.tryAcquire(requestTimeoutSeconds, TimeUnit.SECONDS)) {
                log.warn("Failed to acquire OpenAI request permit within {} seconds. Request dropped.", requestTimeoutSeconds);
                return CollaboratorResult.unavailable("No completion permit within " + requestTimeoutSeconds + "s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Interrupted while waiting for OpenAI request permit");
            return CollaboratorResult.cancelled("Interrupted while waiting for completion permit");
        }

        try {
            log.debug("Acquired OpenAI request permit. Available permits: {}", requestSemaphore.availablePermits());
            return generateResponse(request);
        } finally {
            requestSemaphore.release();
        }
    }

    private CollaboratorResult<String> generateResponse(CompletionRequest request) {
        String requestBody;
        try {
            requestBody = objectMapper.writeValueAsString(Map.of(
                    "model", model,
                    "max_tokens", request.getMaxTokens(),
                    "temperature", request.getTemperature(),
                    "messages", List.of(Map.of(
                            "role", "user",
                            "content", request.getPrompt()
                    ))
            ));
        } catch (Exception e) {
            log.error("Failed to serialise completion request", e);
            return CollaboratorResult.unavailable("Failed to serialise completion request");
        }

        try {
            String response = openAiClient.post()
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(requestBody)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofSeconds(requestTimeoutSeconds))
                    .retryWhen(Retry.backoff(2, Duration.ofMillis(500))
                            .filter(OpenAIService::isRetryable)
                            .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                    .doOnError(error -> log.warn("Completion request failed: {}", error.getMessage()))
                    .block();
            return extractContent(response);
        } catch (Exception e) {
            if (Thread.currentThread().isInterrupted() || Exceptions.unwrap(e) instanceof InterruptedException) {
                log.info("Completion request cancelled by caller");
                return CollaboratorResult.cancelled("Completion request cancelled");
            }
            if (e instanceof WebClientResponseException wcre) {
                log.error("Completion failed. Status: {}, Response: {}", wcre.getStatusCode(), wcre.getResponseBodyAsString());
            } else {
                log.error("Completion failed: {}", e.toString());
            }
            return CollaboratorResult.unavailable("Completion failed: " + e.getMessage());
        }
    }

    private static boolean isRetryable(Throwable throwable) {
        if (throwable instanceof WebClientResponseException wcre) {
            int status = wcre.getStatusCode().value();
            return status == 429 || status >= 500;
        }
        return throwable instanceof WebClientRequestException
                && throwable.getCause() instanceof java.net.SocketException;
    }

    private CollaboratorResult<String> extractContent(String response) {
        if (response == null || response.isBlank()) {
            return CollaboratorResult.unavailable("Empty completion response");
        }
        try {
            JsonNode root = objectMapper.readTree(response);
            JsonNode content = root.path("choices").path(0).path("message").path("content");
            if (!content.isTextual()) {
                log.warn("Completion response has no message content");
                return CollaboratorResult.unavailable("Completion response has no message content");
            }
            return CollaboratorResult.success(content.asText());
        } catch (Exception e) {
            log.error("Failed to parse completion response: {}", e.getMessage());
            return CollaboratorResult.unavailable("Malformed completion response");
        }
    }

    // Monitoring methods
    public int getAvailablePermits() {
        return requestSemaphore.availablePermits();
    }

    public int getQueueLength() {
        return requestSemaphore.getQueueLength();
    }
}
