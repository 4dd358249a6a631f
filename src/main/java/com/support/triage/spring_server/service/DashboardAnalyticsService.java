package com.support.triage.spring_server.service;

import com.support.triage.spring_server.dto.DashboardAnalytics;
import com.support.triage.spring_server.entity.Issue;
import com.support.triage.spring_server.entity.IssueStatus;
import com.support.triage.spring_server.entity.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

@Service
public class DashboardAnalyticsService {
    private static final Logger log = LoggerFactory.getLogger(DashboardAnalyticsService.class);

    static final Duration STATISTICS_WINDOW = Duration.ofDays(30);
    static final Duration TREND_WINDOW = Duration.ofDays(7);
    static final Duration LAST_DAY = Duration.ofHours(24);

    private final IssueStore issueStore;
    private final Clock clock;

    @Autowired
    public DashboardAnalyticsService(IssueStore issueStore, Clock clock) {
        this.issueStore = issueStore;
        this.clock = clock;
    }

    public DashboardAnalytics getDashboardAnalytics() {
        LocalDateTime now = LocalDateTime.now(clock);
        List<Issue> issues = issueStore.findIssuesCreatedSince(now.minus(STATISTICS_WINDOW));

        DashboardAnalytics analytics = new DashboardAnalytics(
                issueStatistics(issues, now),
                customerStatistics(issues, now),
                issueStore.countActiveAlerts(),
                trends(issues, now));
        log.info("Dashboard analytics computed over {} issues, {} active alerts",
                issues.size(), analytics.getActiveAlerts());
        return analytics;
    }

    private static DashboardAnalytics.IssueStatistics issueStatistics(List<Issue> issues, LocalDateTime now) {
        LocalDateTime dayAgo = now.minus(LAST_DAY);
        DashboardAnalytics.IssueStatistics stats = new DashboardAnalytics.IssueStatistics();
        double resolutionHoursSum = 0;
        int resolutionHoursCount = 0;

        for (Issue issue : issues) {
            stats.setTotalIssues(stats.getTotalIssues() + 1);
            if (issue.getStatus() == IssueStatus.OPEN) {
                stats.setOpenIssues(stats.getOpenIssues() + 1);
            } else if (issue.getStatus() == IssueStatus.IN_PROGRESS) {
                stats.setInProgressIssues(stats.getInProgressIssues() + 1);
            } else if (issue.getStatus() == IssueStatus.RESOLVED) {
                stats.setResolvedIssues(stats.getResolvedIssues() + 1);
            }
            if (issue.getSeverity() == Severity.CRITICAL) {
                stats.setCriticalIssues(stats.getCriticalIssues() + 1);
            } else if (issue.getSeverity() == Severity.HIGH) {
                stats.setHighIssues(stats.getHighIssues() + 1);
            }
            if (issue.getResolutionTimeHours() != null) {
                resolutionHoursSum += issue.getResolutionTimeHours();
                resolutionHoursCount++;
            }
            if (issue.getCreatedAt() != null && !issue.getCreatedAt().isBefore(dayAgo)) {
                stats.setIssuesLast24h(stats.getIssuesLast24h() + 1);
            }
        }
        stats.setAvgResolutionTimeHours(resolutionHoursCount == 0 ? null : resolutionHoursSum / resolutionHoursCount);
        return stats;
    }

    private DashboardAnalytics.CustomerStatistics customerStatistics(List<Issue> issues, LocalDateTime now) {
        LocalDateTime weekAgo = now.minus(TREND_WINDOW);
        Map<String, Integer> issuesPerCustomer = new HashMap<>();
        Set<String> activeThisWeek = new HashSet<>();
        for (Issue issue : issues) {
            if (issue.getCustomerId() == null) {
                continue;
            }
            issuesPerCustomer.merge(issue.getCustomerId(), 1, Integer::sum);
            if (issue.getCreatedAt() != null && !issue.getCreatedAt().isBefore(weekAgo)) {
                activeThisWeek.add(issue.getCustomerId());
            }
        }
        // averaged over customers who opened at least one issue in the window
        Double avgIssues = issuesPerCustomer.isEmpty() ? null
                : issuesPerCustomer.values().stream().mapToInt(Integer::intValue).average().getAsDouble();
        return new DashboardAnalytics.CustomerStatistics(issueStore.countCustomers(), activeThisWeek.size(), avgIssues);
    }

    private static List<DashboardAnalytics.DailyTrend> trends(List<Issue> issues, LocalDateTime now) {
        LocalDateTime weekAgo = now.minus(TREND_WINDOW);
        Map<LocalDate, DashboardAnalytics.DailyTrend> byDay = new TreeMap<>();
        for (Issue issue : issues) {
            if (issue.getCreatedAt() == null || issue.getCreatedAt().isBefore(weekAgo)) {
                continue;
            }
            LocalDate day = issue.getCreatedAt().toLocalDate();
            DashboardAnalytics.DailyTrend trend = byDay.computeIfAbsent(day, d -> new DashboardAnalytics.DailyTrend(d, 0, 0));
            trend.setIssuesCreated(trend.getIssuesCreated() + 1);
            if (issue.getStatus() == IssueStatus.RESOLVED) {
                trend.setIssuesResolved(trend.getIssuesResolved() + 1);
            }
        }
        return new ArrayList<>(byDay.values());
    }
}
