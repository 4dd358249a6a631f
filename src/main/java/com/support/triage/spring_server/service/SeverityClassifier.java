package com.support.triage.spring_server.service;

import com.support.triage.spring_server.dto.CollaboratorResult;
import com.support.triage.spring_server.dto.CompletionRequest;
import com.support.triage.spring_server.dto.SeverityClassification;
import com.support.triage.spring_server.entity.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Keyword based severity classification with a model fallback for low-confidence text.
 */
@Service
public class SeverityClassifier {
    private static final Logger log = LoggerFactory.getLogger(SeverityClassifier.class);

    static final double CONFIDENCE_THRESHOLD = 2.0;
    private static final int MODEL_MAX_TOKENS = 10;
    private static final double MODEL_TEMPERATURE = 0.1;

    private static final Map<Severity, List<String>> KEYWORDS = new EnumMap<>(Severity.class);
    private static final Map<Severity, Double> WEIGHTS = new EnumMap<>(Severity.class);

    static {
        KEYWORDS.put(Severity.CRITICAL, List.of(
                "system down", "outage", "cannot access", "complete failure", "data loss",
                "security breach", "urgent", "emergency", "production down", "service unavailable"));
        KEYWORDS.put(Severity.HIGH, List.of(
                "major issue", "significant problem", "blocking", "broken", "not working",
                "error", "failure", "important", "affecting multiple users", "performance issue"));
        KEYWORDS.put(Severity.NORMAL, List.of(
                "question", "help", "how to", "clarification", "minor issue", "improvement", "suggestion"));
        KEYWORDS.put(Severity.LOW, List.of(
                "feature request", "enhancement", "nice to have", "cosmetic", "documentation", "typo"));

        WEIGHTS.put(Severity.CRITICAL, 3.0);
        WEIGHTS.put(Severity.HIGH, 2.0);
        WEIGHTS.put(Severity.NORMAL, 1.0);
        WEIGHTS.put(Severity.LOW, 0.5);
    }

    private static final String PROMPT_TEMPLATE = """
            Analyze the following support issue and classify its severity as Critical, High, Normal, or Low.

            Title: %s
            Description: %s

            Severity Guidelines:
            - Critical: System outages, data loss, security breaches, complete service unavailability
            - High: Major functionality broken, significant user impact, blocking issues
            - Normal: Standard issues, questions, minor bugs with workarounds
            - Low: Feature requests, cosmetic issues, documentation updates

            Respond with only the severity level: Critical, High, Normal, or Low
            """;

    private final CompletionClient completionClient;

    @Autowired
    public SeverityClassifier(CompletionClient completionClient) {
        this.completionClient = completionClient;
    }

    public SeverityClassification classify(String title, String description) {
        String content = ((title == null ? "" : title) + " " + (description == null ? "" : description))
                .toLowerCase(Locale.ROOT);

        Map<Severity, Double> scores = keywordScores(content);
        Severity best = argmax(scores);
        double bestScore = scores.get(best);

        if (bestScore >= CONFIDENCE_THRESHOLD) {
            log.debug("Keyword classification {} with score {}", best, bestScore);
            return new SeverityClassification(best, SeverityClassification.Source.KEYWORD, scores);
        }

        Optional<Severity> modelSeverity = askModel(title, description);
        if (modelSeverity.isPresent()) {
            log.debug("Model classification {} (keyword max {})", modelSeverity.get(), bestScore);
            return new SeverityClassification(modelSeverity.get(), SeverityClassification.Source.MODEL, scores);
        }

        if (bestScore > 0) {
            return new SeverityClassification(best, SeverityClassification.Source.KEYWORD, scores);
        }
        return new SeverityClassification(Severity.NORMAL, SeverityClassification.Source.DEFAULT, scores);
    }

    Map<Severity, Double> keywordScores(String content) {
        Map<Severity, Double> scores = new EnumMap<>(Severity.class);
        for (Map.Entry<Severity, List<String>> entry : KEYWORDS.entrySet()) {
            double score = 0;
            for (String keyword : entry.getValue()) {
                if (content.contains(keyword)) {
                    score += WEIGHTS.get(entry.getKey());
                }
            }
            scores.put(entry.getKey(), score);
        }
        return scores;
    }

    // ties go to the more severe level
    private static Severity argmax(Map<Severity, Double> scores) {
        Severity best = Severity.LOW;
        for (Severity severity : Severity.values()) {
            if (scores.get(severity) >= scores.get(best)) {
                best = severity;
            }
        }
        return best;
    }

    private Optional<Severity> askModel(String title, String description) {
        String prompt = String.format(PROMPT_TEMPLATE, title, description);
        CollaboratorResult<String> result =
                completionClient.complete(new CompletionRequest(prompt, MODEL_MAX_TOKENS, MODEL_TEMPERATURE));
        if (!result.isSuccess()) {
            log.warn("Model severity classification unavailable ({}): {}", result.getErrorKind(), result.getErrorMessage());
            return Optional.empty();
        }
        Optional<Severity> parsed = parseAnswer(result.getValue());
        if (parsed.isEmpty()) {
            log.warn("Discarding unusable model severity answer: '{}'", result.getValue());
        }
        return parsed;
    }

    static Optional<Severity> parseAnswer(String answer) {
        if (answer == null) {
            return Optional.empty();
        }
        String cleaned = answer.trim()
                .replaceAll("[\\p{Punct}\\s]+$", "")
                .replaceAll("^[\"'`]+", "")
                .trim();
        for (Severity severity : Severity.values()) {
            if (severity.getLabel().equalsIgnoreCase(cleaned)) {
                return Optional.of(severity);
            }
        }
        return Optional.empty();
    }
}
