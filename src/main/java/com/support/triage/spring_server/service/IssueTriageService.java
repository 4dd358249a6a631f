package com.support.triage.spring_server.service;

import com.support.triage.spring_server.dto.CriticalCondition;
import com.support.triage.spring_server.dto.CustomerHistory;
import com.support.triage.spring_server.dto.IssueAnalysisResult;
import com.support.triage.spring_server.dto.IssueInsights;
import com.support.triage.spring_server.dto.IssueIntakeRequest;
import com.support.triage.spring_server.dto.SeverityClassification;
import com.support.triage.spring_server.dto.SimilarIssue;
import com.support.triage.spring_server.entity.CustomerTier;
import com.support.triage.spring_server.entity.Issue;
import com.support.triage.spring_server.entity.IssueCategory;
import com.support.triage.spring_server.entity.IssueStatus;
import com.support.triage.spring_server.entity.RiskLevel;
import com.support.triage.spring_server.entity.Severity;
import com.support.triage.spring_server.entity.TagValue;
import com.support.triage.spring_server.exception.InvalidInputException;
import com.support.triage.spring_server.exception.ResourceNotFoundException;
import com.support.triage.spring_server.exception.TriageCancelledException;
import com.support.triage.spring_server.exception.TriageException;
import com.support.triage.spring_server.exception.TriagePipelineException;
import com.support.triage.spring_server.util.PerfStats;
import com.support.triage.spring_server.util.PerfTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Intake pipeline for new issues: classify, rank similar issues, detect critical conditions,
 * generate insights and priority, then persist the analysis in one update.
 */
@Service
public class IssueTriageService {
    private static final Logger log = LoggerFactory.getLogger(IssueTriageService.class);
    private static final Logger perfLog = LoggerFactory.getLogger("PERF_SUMMARY");

    static final int MAX_TITLE_LENGTH = 500;
    static final int SIMILAR_ISSUES_LIMIT = SimilarityRanker.DEFAULT_LIMIT;

    private final IssueStore issueStore;
    private final CustomerHistoryService customerHistoryService;
    private final SeverityClassifier severityClassifier;
    private final SimilarityRanker similarityRanker;
    private final CriticalConditionDetector criticalConditionDetector;
    private final IssueInsightService issueInsightService;
    private final PriorityScorer priorityScorer;
    private final CacheFacade cacheFacade;
    private final Clock clock;

    @Autowired
    public IssueTriageService(IssueStore issueStore,
                              CustomerHistoryService customerHistoryService,
                              SeverityClassifier severityClassifier,
                              SimilarityRanker similarityRanker,
                              CriticalConditionDetector criticalConditionDetector,
                              IssueInsightService issueInsightService,
                              PriorityScorer priorityScorer,
                              CacheFacade cacheFacade,
                              Clock clock) {
        this.issueStore = issueStore;
        this.customerHistoryService = customerHistoryService;
        this.severityClassifier = severityClassifier;
        this.similarityRanker = similarityRanker;
        this.criticalConditionDetector = criticalConditionDetector;
        this.issueInsightService = issueInsightService;
        this.priorityScorer = priorityScorer;
        this.cacheFacade = cacheFacade;
        this.clock = clock;
    }

    public IssueAnalysisResult analyzeNewIssue(IssueIntakeRequest request) {
        IssueCategory category = validate(request);
        String customerId = request.getCustomerId().trim();

        PerfStats perfStats = PerfTracker.start();
        String issueId = null;
        try {
            log.info("Starting triage for new issue of customer {}", customerId);

            // Step 1: customer history, risk on the history policy
            PerfTracker.in("customerHistory");
            CustomerHistory customerHistory = customerHistoryService.getCustomerHistory(customerId);
            PerfTracker.out("customerHistory");

            // Step 2: severity
            PerfTracker.in("classifySeverity");
            SeverityClassification classification = severityClassifier.classify(request.getTitle(), request.getDescription());
            PerfTracker.out("classifySeverity");
            checkCancelled("severity classification");
            log.info("Classified issue for customer {} as {} ({})", customerId,
                    classification.getSeverity(), classification.getSource());

            // Step 3: issue record
            PerfTracker.in("insertIssue");
            LocalDateTime now = LocalDateTime.now(clock);
            Issue issue = new Issue();
            issue.setCustomerId(customerId);
            issue.setTitle(request.getTitle().trim());
            issue.setDescription(request.getDescription().trim());
            issue.setCategory(category);
            issue.setProductArea(request.getProductArea());
            issue.setSeverity(classification.getSeverity());
            issue.setStatus(IssueStatus.OPEN);
            issue.setCreatedAt(now);
            issue.setUpdatedAt(now);
            issueId = issueStore.insertIssue(issue).getIssueId();
            PerfTracker.out("insertIssue");

            // Step 4: similar resolved issues
            PerfTracker.in("rankSimilar");
            List<SimilarIssue> similarIssues = similarityRanker.rankSimilar(
                    request.getTitle(), request.getDescription(), SIMILAR_ISSUES_LIMIT);
            saveSimilarLinks(issueId, similarIssues, now);
            PerfTracker.out("rankSimilar");

            // Step 5: critical conditions
            PerfTracker.in("detectCritical");
            List<CriticalCondition> criticalConditions = criticalConditionDetector.detect(customerId, issueId);
            PerfTracker.out("detectCritical");

            // Step 6: model insights
            PerfTracker.in("generateInsights");
            IssueInsights insights = issueInsightService.generateInsights(
                    request.getTitle(), request.getDescription(), similarIssues);
            PerfTracker.out("generateInsights");
            checkCancelled("insight generation");

            // Step 7: priority and the single analysis write
            PerfTracker.in("applyAnalysis");
            CustomerTier tier = customerHistory.getCustomerInfo() == null ? null : customerHistory.getCustomerInfo().getTier();
            int priority = priorityScorer.score(classification.getSeverity(), tier,
                    customerHistory.getRiskLevel(), similarIssues.size());

            Map<String, TagValue> tags = new LinkedHashMap<>();
            tags.put("ai_analyzed", TagValue.of(insights.isAiGenerated()));
            tags.put("estimated_resolution_hours", TagValue.of(insights.getEstimatedTimeHours()));
            tags.put("priority_score", TagValue.of((double) priority));
            tags.put("severity_source", TagValue.of(classification.getSource().name()));
            tags.put("similar_issue_count", TagValue.of((double) similarIssues.size()));
            issueStore.applyAnalysis(issueId, classification.getSeverity(), priority, tags, LocalDateTime.now(clock));
            PerfTracker.out("applyAnalysis");

            cacheFacade.invalidateCustomer(customerId);
            cacheFacade.invalidateIssue(issueId);

            List<String> recommendations = buildRecommendations(
                    classification.getSeverity(), similarIssues, customerHistory.getRiskLevel());

            PerfTracker.stopAndClean();
            IssueAnalysisResult result = new IssueAnalysisResult(
                    issueId,
                    customerId,
                    classification.getSeverity(),
                    classification.getSource(),
                    priority,
                    customerHistory,
                    similarIssues,
                    criticalConditions,
                    insights,
                    recommendations,
                    perfStats.elapsedSeconds(),
                    perfStats.getStageTimes());
            cacheFacade.set(CacheKind.ISSUE_ANALYSIS, issueId, result);

            log.info("Triage of issue {} finished: severity {}, priority {}, {} similar, {} alert(s)",
                    issueId, classification.getSeverity(), priority, similarIssues.size(), criticalConditions.size());
            return result;
        } catch (TriageException e) {
            log.warn("Triage of issue {} for customer {} stopped: {}", issueId, customerId, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("Triage pipeline failed for customer {} (issue {})", customerId, issueId, e);
            throw new TriagePipelineException("Issue analysis failed for customer " + customerId, e);
        } finally {
            PerfStats finished = PerfTracker.stopAndClean();
            perfLog.info("Triage perf for customer {} issue {}\n{}", customerId, issueId,
                    (finished != null ? finished : perfStats).toFormattedString());
        }
    }

    /**
     * Analysis produced by the last intake of this issue, while it is still cached.
     */
    public IssueAnalysisResult getIssueAnalysis(String issueId) {
        if (issueStore.findIssue(issueId).isEmpty()) {
            throw new ResourceNotFoundException("Issue", issueId);
        }
        return cacheFacade.get(CacheKind.ISSUE_ANALYSIS, issueId, IssueAnalysisResult.class)
                .orElseThrow(() -> new ResourceNotFoundException("Issue analysis", issueId));
    }

    List<String> buildRecommendations(Severity severity, List<SimilarIssue> similarIssues, RiskLevel riskLevel) {
        List<String> recommendations = new ArrayList<>();
        if (severity == Severity.CRITICAL) {
            recommendations.add("Immediately assign to senior technical team");
            recommendations.add("Notify customer within 15 minutes");
            recommendations.add("Set up war room if needed");
            recommendations.add("Prepare executive escalation path");
        } else if (severity == Severity.HIGH) {
            recommendations.add("Assign to experienced support engineer");
            recommendations.add("Respond to customer within 1 hour");
            recommendations.add("Monitor progress every 2 hours");
        }

        if (!similarIssues.isEmpty()) {
            double avgHours = similarIssues.stream()
                    .mapToDouble(s -> s.getResolutionTimeHours() == null ? 24.0 : s.getResolutionTimeHours())
                    .average()
                    .orElse(24.0);
            recommendations.add(String.format(Locale.ROOT, "Based on similar issues, expected resolution time: %.1f hours", avgHours));
            if (similarIssues.size() >= 3) {
                recommendations.add("Review knowledge base articles from similar resolved issues");
            }
        }

        if (riskLevel == RiskLevel.HIGH) {
            recommendations.add("Consider proactive communication");
            recommendations.add("Involve account manager if available");
            recommendations.add("Document all interactions thoroughly");
        }
        return recommendations;
    }

    private void saveSimilarLinks(String issueId, List<SimilarIssue> similarIssues, LocalDateTime now) {
        if (similarIssues.isEmpty()) {
            return;
        }
        try {
            issueStore.saveSimilarLinks(issueId, similarIssues, now);
        } catch (RuntimeException e) {
            log.warn("Could not store similar-issue links for {}: {}", issueId, e.getMessage());
        }
    }

    private static void checkCancelled(String stage) {
        if (Thread.currentThread().isInterrupted()) {
            throw new TriageCancelledException("Triage cancelled during " + stage);
        }
    }

    private static IssueCategory validate(IssueIntakeRequest request) {
        if (request == null) {
            throw new InvalidInputException("Request body is required");
        }
        if (isBlank(request.getCustomerId())) {
            throw new InvalidInputException("customerId is required");
        }
        if (isBlank(request.getTitle())) {
            throw new InvalidInputException("title is required");
        }
        if (isBlank(request.getDescription())) {
            throw new InvalidInputException("description is required");
        }
        if (request.getTitle().length() > MAX_TITLE_LENGTH) {
            throw new InvalidInputException("title must be at most " + MAX_TITLE_LENGTH + " characters");
        }
        if (request.getCategory() == null) {
            return IssueCategory.GENERAL;
        }
        return IssueCategory.parse(request.getCategory())
                .orElseThrow(() -> new InvalidInputException("Unknown category: " + request.getCategory()));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
