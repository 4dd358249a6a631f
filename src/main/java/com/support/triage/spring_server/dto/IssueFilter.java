package com.support.triage.spring_server.dto;

import com.support.triage.spring_server.entity.IssueStatus;
import com.support.triage.spring_server.entity.Severity;
import lombok.Data;

import java.time.LocalDateTime;

@Data
public class IssueFilter {
    private final IssueStatus status;
    private final Severity severity;
    private final String customerId;
    private final LocalDateTime createdAfter;
    private final LocalDateTime createdBefore;

    public IssueFilter(IssueStatus status, Severity severity, String customerId,
                       LocalDateTime createdAfter, LocalDateTime createdBefore) {
        this.status = status;
        this.severity = severity;
        this.customerId = customerId;
        this.createdAfter = createdAfter;
        this.createdBefore = createdBefore;
    }
}
