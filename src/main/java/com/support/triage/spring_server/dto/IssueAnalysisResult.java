package com.support.triage.spring_server.dto;

import com.support.triage.spring_server.entity.Severity;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class IssueAnalysisResult {
    private String issueId;
    private String customerId;
    private Severity severity;
    private SeverityClassification.Source severitySource;
    private int priorityScore;
    private CustomerHistory customerHistory;
    private List<SimilarIssue> similarIssues;
    private List<CriticalCondition> criticalAlerts;
    private IssueInsights aiInsights;
    private List<String> recommendations;
    private double analysisTimeSeconds;
    private Map<String, Long> stageTimingsMs;
}
