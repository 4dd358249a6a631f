package com.support.triage.spring_server.service;

import com.support.triage.spring_server.dto.IssueFilter;
import com.support.triage.spring_server.dto.IssuePage;
import com.support.triage.spring_server.dto.ResolutionRequest;
import com.support.triage.spring_server.dto.StatusUpdateRequest;
import com.support.triage.spring_server.entity.Issue;
import com.support.triage.spring_server.entity.IssueResolution;
import com.support.triage.spring_server.entity.IssueStatus;
import com.support.triage.spring_server.entity.Severity;
import com.support.triage.spring_server.exception.InvalidInputException;
import com.support.triage.spring_server.exception.ResourceNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Issue lookups and lifecycle changes outside the intake pipeline. Every mutation drops the
 * cached history of the owning customer and the cached analysis of the issue.
 */
@Service
public class IssueService {
    private static final Logger log = LoggerFactory.getLogger(IssueService.class);

    public static final int DEFAULT_PER_PAGE = 20;
    static final int MAX_PER_PAGE = 100;

    private final IssueStore issueStore;
    private final CacheFacade cacheFacade;
    private final Clock clock;

    @Autowired
    public IssueService(IssueStore issueStore, CacheFacade cacheFacade, Clock clock) {
        this.issueStore = issueStore;
        this.cacheFacade = cacheFacade;
        this.clock = clock;
    }

    public Issue getIssue(String issueId) {
        return issueStore.findIssue(issueId)
                .orElseThrow(() -> new ResourceNotFoundException("Issue", issueId));
    }

    public IssuePage listIssues(String status, String severity, String customerId, int page, int perPage) {
        if (page < 1) {
            throw new InvalidInputException("page must be at least 1");
        }
        if (perPage < 1 || perPage > MAX_PER_PAGE) {
            throw new InvalidInputException("perPage must be between 1 and " + MAX_PER_PAGE);
        }
        IssueStatus statusFilter = status == null ? null : IssueStatus.parse(status)
                .orElseThrow(() -> new InvalidInputException("Unknown status: " + status));
        Severity severityFilter = severity == null ? null : Severity.parse(severity)
                .orElseThrow(() -> new InvalidInputException("Unknown severity: " + severity));
        IssueFilter filter = new IssueFilter(statusFilter, severityFilter, customerId, null, null);
        return issueStore.findIssues(filter, page, perPage);
    }

    /**
     * Moves the issue to a new status. Moving to Resolved records the resolution time,
     * any other status clears it.
     */
    public Issue updateStatus(String issueId, StatusUpdateRequest request) {
        if (request == null || request.getStatus() == null || request.getStatus().isBlank()) {
            throw new InvalidInputException("status is required");
        }
        IssueStatus status = IssueStatus.parse(request.getStatus())
                .orElseThrow(() -> new InvalidInputException("Unknown status: " + request.getStatus()));

        Issue updated = issueStore.updateIssueStatus(issueId, status, LocalDateTime.now(clock))
                .orElseThrow(() -> new ResourceNotFoundException("Issue", issueId));
        log.info("Issue {} moved to {} by {}", issueId, status, request.getUpdatedBy());

        cacheFacade.invalidateCustomer(updated.getCustomerId());
        cacheFacade.invalidateIssue(issueId);
        return updated;
    }

    /**
     * Stores the resolution summary and customer rating, resolving the issue if it is not yet resolved.
     */
    public IssueResolution recordResolution(String issueId, ResolutionRequest request) {
        if (request == null || request.getResolutionSummary() == null || request.getResolutionSummary().isBlank()) {
            throw new InvalidInputException("resolutionSummary is required");
        }
        Integer satisfaction = request.getCustomerSatisfaction();
        if (satisfaction != null && (satisfaction < 1 || satisfaction > 5)) {
            throw new InvalidInputException("customerSatisfaction must be between 1 and 5");
        }

        Issue issue = getIssue(issueId);
        LocalDateTime now = LocalDateTime.now(clock);
        if (issue.getStatus() != IssueStatus.RESOLVED) {
            issueStore.updateIssueStatus(issueId, IssueStatus.RESOLVED, now);
        }

        IssueResolution resolution = new IssueResolution();
        resolution.setIssueId(issueId);
        resolution.setCustomerId(issue.getCustomerId());
        resolution.setResolutionSummary(request.getResolutionSummary().trim());
        resolution.setCustomerSatisfaction(satisfaction);
        resolution.setCreatedAt(now);
        IssueResolution saved = issueStore.insertResolution(resolution);
        log.info("Recorded resolution for issue {} (satisfaction {})", issueId, satisfaction);

        cacheFacade.invalidateCustomer(issue.getCustomerId());
        cacheFacade.invalidateIssue(issueId);
        return saved;
    }
}
