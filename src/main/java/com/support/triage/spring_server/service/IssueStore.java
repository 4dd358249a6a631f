package com.support.triage.spring_server.service;

import com.support.triage.spring_server.dto.CollaboratorResult;
import com.support.triage.spring_server.dto.IssueFilter;
import com.support.triage.spring_server.dto.IssuePage;
import com.support.triage.spring_server.dto.SimilarIssue;
import com.support.triage.spring_server.entity.CriticalAlert;
import com.support.triage.spring_server.entity.Customer;
import com.support.triage.spring_server.entity.Issue;
import com.support.triage.spring_server.entity.IssueResolution;
import com.support.triage.spring_server.entity.IssueStatus;
import com.support.triage.spring_server.entity.Severity;
import com.support.triage.spring_server.entity.TagValue;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistent issue/customer store used by the triage components. Every write is a single
 * atomic operation on one record.
 */
public interface IssueStore {

    Optional<Issue> findIssue(String issueId);

    Issue insertIssue(Issue issue);

    /**
     * Sets severity, priority and tags together in one write.
     */
    void applyAnalysis(String issueId, Severity severity, int priority, Map<String, TagValue> tags, LocalDateTime updatedAt);

    /**
     * Changes the status; resolution time is set when moving to RESOLVED and cleared otherwise.
     */
    Optional<Issue> updateIssueStatus(String issueId, IssueStatus status, LocalDateTime updatedAt);

    List<Issue> findIssuesByCustomer(String customerId);

    List<Issue> findIssuesByCustomerAndStatus(String customerId, Collection<IssueStatus> statuses);

    IssuePage findIssues(IssueFilter filter, int page, int perPage);

    List<Issue> findIssuesCreatedSince(LocalDateTime since);

    /**
     * Most recent resolved issues that carry a resolution time, newest first.
     */
    CollaboratorResult<List<Issue>> findRecentResolvedIssues(int limit, Duration timeout);

    Optional<Customer> findCustomer(String customerId);

    List<Customer> findAllCustomers();

    long countCustomers();

    boolean customerEmailExists(String email);

    Customer insertCustomer(Customer customer);

    IssueResolution insertResolution(IssueResolution resolution);

    List<IssueResolution> findResolutionsByCustomer(String customerId);

    /**
     * Inserts the alert unless an open alert with the same dedup key exists.
     */
    AlertWrite insertAlertIfAbsent(CriticalAlert alert);

    Optional<CriticalAlert> findAlert(String alertId);

    List<CriticalAlert> findActiveAlerts();

    long countActiveAlerts();

    /** Active to Acknowledged. False when the alert is not active. */
    boolean acknowledgeAlert(String alertId, String actor, LocalDateTime at);

    /** Acknowledged to Resolved. False when the alert is not acknowledged. */
    boolean resolveAlert(String alertId, LocalDateTime at);

    void saveSimilarLinks(String sourceIssueId, List<SimilarIssue> similarIssues, LocalDateTime at);

    record AlertWrite(CriticalAlert alert, boolean created) {
    }
}
