package com.support.triage.spring_server.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Derived view over one customer's issues. Never persisted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CustomerHistoryAggregate {
    private int totalIssues;
    private int resolvedIssues;
    // Open + In Progress
    private int openIssues;
    private int criticalIssues;
    private int highIssues;
    // created within the last 30 days
    private int recentIssues;
    private Double avgResolutionTimeHours;
    private Double avgSatisfaction;
    private LocalDateTime lastIssueDate;
}
