package com.support.triage.spring_server.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.support.triage.spring_server.dto.CollaboratorResult;
import com.support.triage.spring_server.dto.CompletionRequest;
import com.support.triage.spring_server.dto.IssueInsights;
import com.support.triage.spring_server.dto.SimilarIssue;
import com.support.triage.spring_server.exception.TriageCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Asks the language model for root cause, approach and escalation hints on a new issue.
 * Falls back to a fixed playbook whenever the model is unavailable or answers off-schema.
 */
@Service
public class IssueInsightService {
    private static final Logger log = LoggerFactory.getLogger(IssueInsightService.class);

    private static final int MAX_TOKENS = 500;
    private static final double TEMPERATURE = 0.3;
    private static final int SIMILAR_CONTEXT_SIZE = 3;
    static final double DEFAULT_ESTIMATE_HOURS = 24.0;
    private static final Pattern NUMBER = Pattern.compile("\\d+(\\.\\d+)?");

    private static final String PROMPT_TEMPLATE = """
            Analyze this support issue and provide insights:

            Title: %s
            Description: %s

            Similar resolved issues:
            %s

            Please provide:
            1. Root cause analysis (2-3 sentences)
            2. Recommended resolution approach
            3. Estimated resolution time
            4. Potential escalation triggers
            5. Customer communication strategy

            Format as JSON with keys: root_cause, resolution_approach, estimated_time_hours, escalation_triggers, communication_strategy
            """;

    private final CompletionClient completionClient;
    private final ObjectMapper objectMapper;

    @Autowired
    public IssueInsightService(CompletionClient completionClient, ObjectMapper objectMapper) {
        this.completionClient = completionClient;
        this.objectMapper = objectMapper;
    }

    /**
     * @throws TriageCancelledException when the calling thread was interrupted during the model call
     */
    public IssueInsights generateInsights(String title, String description, List<SimilarIssue> similarIssues) {
        String similarContext = similarIssues == null ? "" : similarIssues.stream()
                .limit(SIMILAR_CONTEXT_SIZE)
                .map(s -> "- " + s.getTitle() + " (resolved in "
                        + (s.getResolutionTimeHours() == null ? "N/A" : s.getResolutionTimeHours()) + " hours)")
                .collect(Collectors.joining("\n"));

        String prompt = String.format(PROMPT_TEMPLATE, title, description, similarContext);
        CollaboratorResult<String> result = completionClient.complete(new CompletionRequest(prompt, MAX_TOKENS, TEMPERATURE));

        if (result.isCancelled()) {
            throw new TriageCancelledException("Insight generation cancelled");
        }
        if (!result.isSuccess()) {
            log.warn("Insight generation unavailable ({}): {}", result.getErrorKind(), result.getErrorMessage());
            return defaultInsights();
        }
        return parseInsights(result.getValue());
    }

    IssueInsights parseInsights(String answer) {
        String json = stripCodeFence(answer);
        try {
            JsonNode root = objectMapper.readTree(json);
            if (root == null || !root.isObject()
                    || !root.path("root_cause").isTextual()
                    || !root.path("resolution_approach").isTextual()) {
                log.warn("Model insights missing required fields, using partial fallback");
                return partialInsights(answer);
            }
            JsonNode estimate = root.path("estimated_time_hours");
            double hours = estimate.isNumber() ? estimate.asDouble() : parseHours(estimate.asText(null));

            List<String> triggers = new ArrayList<>();
            JsonNode triggerNode = root.path("escalation_triggers");
            if (triggerNode.isArray()) {
                triggerNode.forEach(t -> triggers.add(t.asText()));
            } else if (triggerNode.isTextual()) {
                triggers.add(triggerNode.asText());
            }
            if (triggers.isEmpty()) {
                triggers.add("No response in 4 hours");
            }

            String communication = root.path("communication_strategy").isTextual()
                    ? root.path("communication_strategy").asText()
                    : "Regular updates every 2 hours";
            return new IssueInsights(root.path("root_cause").asText(), root.path("resolution_approach").asText(),
                    hours, triggers, communication, true);
        } catch (Exception e) {
            log.warn("Model insights are not valid JSON: {}", e.getMessage());
            return partialInsights(answer);
        }
    }

    static String stripCodeFence(String answer) {
        if (answer == null) {
            return "";
        }
        String trimmed = answer.trim();
        if (trimmed.startsWith("```")) {
            int firstNewline = trimmed.indexOf('\n');
            int closing = trimmed.lastIndexOf("```");
            if (firstNewline > 0 && closing > firstNewline) {
                return trimmed.substring(firstNewline + 1, closing).trim();
            }
        }
        return trimmed;
    }

    private static double parseHours(String text) {
        if (text == null) {
            return DEFAULT_ESTIMATE_HOURS;
        }
        // "4-8 hours" and similar: take the first number
        Matcher matcher = NUMBER.matcher(text);
        return matcher.find() ? Double.parseDouble(matcher.group()) : DEFAULT_ESTIMATE_HOURS;
    }

    private static IssueInsights partialInsights(String answer) {
        String approach = answer == null ? "" : answer.trim();
        if (approach.length() > 200) {
            approach = approach.substring(0, 200);
        }
        return new IssueInsights("AI analysis pending", approach, DEFAULT_ESTIMATE_HOURS,
                List.of("No response in 4 hours", "Customer escalation"), "Regular updates every 2 hours", true);
    }

    static IssueInsights defaultInsights() {
        return new IssueInsights("Analysis pending", "Standard troubleshooting process", DEFAULT_ESTIMATE_HOURS,
                List.of("No response in 4 hours"), "Regular updates", false);
    }
}
