package com.support.triage.spring_server.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

/**
 * Support dashboard snapshot: issue and customer statistics over the last 30 days,
 * open alert count and the daily trend of the last 7 days.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DashboardAnalytics {
    private IssueStatistics issueStatistics;
    private CustomerStatistics customerStatistics;
    private long activeAlerts;
    private List<DailyTrend> issueTrends;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class IssueStatistics {
        private int totalIssues;
        private int openIssues;
        private int inProgressIssues;
        private int resolvedIssues;
        private int criticalIssues;
        private int highIssues;
        private Double avgResolutionTimeHours;
        private int issuesLast24h;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CustomerStatistics {
        private long totalCustomers;
        // customers with an issue created in the last 7 days
        private int activeCustomersWeek;
        private Double avgIssuesPerCustomer;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DailyTrend {
        private LocalDate date;
        private int issuesCreated;
        private int issuesResolved;
    }
}
