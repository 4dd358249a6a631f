package com.support.triage.spring_server.dto;

import com.support.triage.spring_server.entity.Customer;
import com.support.triage.spring_server.entity.IssueStatus;
import com.support.triage.spring_server.entity.RiskLevel;
import com.support.triage.spring_server.entity.Severity;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CustomerHistory {
    private Customer customerInfo;
    private CustomerHistoryAggregate statistics;
    private List<RecentIssue> recentIssues;
    private RiskLevel riskLevel;
    private double riskScore;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RecentIssue {
        private String issueId;
        private String title;
        private Severity severity;
        private IssueStatus status;
        private LocalDateTime createdAt;
    }
}
