package com.support.triage.spring_server.service;

import com.support.triage.spring_server.dto.CriticalCondition;
import com.support.triage.spring_server.entity.AlertStatus;
import com.support.triage.spring_server.entity.AlertType;
import com.support.triage.spring_server.entity.CriticalAlert;
import com.support.triage.spring_server.entity.Issue;
import com.support.triage.spring_server.entity.IssueStatus;
import com.support.triage.spring_server.entity.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Time-based alerting over a customer's active issues.
 * <p>
 * Raises an Unattended alert for every critical issue open longer than 24 hours, and one
 * Customer_Escalation alert when the customer opened three or more high or critical issues in
 * the last seven days. Alerts are deduplicated per condition while open; conditions are still
 * reported on every run.
 */
@Service
public class CriticalConditionDetector {
    private static final Logger log = LoggerFactory.getLogger(CriticalConditionDetector.class);

    static final Duration UNATTENDED_AFTER = Duration.ofHours(24);
    static final Duration HIGH_SEVERITY_WINDOW = Duration.ofDays(7);
    static final int HIGH_SEVERITY_THRESHOLD = 3;

    private final IssueStore issueStore;
    private final Clock clock;

    @Autowired
    public CriticalConditionDetector(IssueStore issueStore, Clock clock) {
        this.issueStore = issueStore;
        this.clock = clock;
    }

    public List<CriticalCondition> detect(String customerId, String triggeringIssueId) {
        List<Issue> activeIssues;
        try {
            activeIssues = issueStore.findIssuesByCustomerAndStatus(customerId, IssueStatus.ACTIVE).stream()
                    .filter(issue -> IssueStatus.ACTIVE.contains(issue.getStatus()))
                    .toList();
        } catch (DataAccessException e) {
            log.error("Critical condition check failed for customer {}: {}", customerId, e.getMessage());
            return List.of();
        }

        LocalDateTime now = LocalDateTime.now(clock);
        List<CriticalCondition> conditions = new ArrayList<>();

        for (Issue issue : activeIssues) {
            if (issue.getSeverity() != Severity.CRITICAL || issue.getCreatedAt() == null) {
                continue;
            }
            Duration age = Duration.between(issue.getCreatedAt(), now);
            if (age.compareTo(UNATTENDED_AFTER) > 0) {
                long hours = age.toHours();
                CriticalCondition condition = new CriticalCondition();
                condition.setType(CriticalCondition.ConditionType.UNATTENDED_CRITICAL);
                condition.setAlertType(AlertType.UNATTENDED);
                condition.setIssueId(issue.getIssueId());
                condition.setCustomerId(customerId);
                condition.setTitle(issue.getTitle());
                condition.setHoursOpen(hours);
                condition.setSeverity(Severity.HIGH);
                condition.setMessage("Critical issue #" + issue.getIssueId() + " has been unattended for " + hours + " hours");
                raise(condition, CriticalAlert.issueKey(issue.getIssueId(), AlertType.UNATTENDED), now);
                conditions.add(condition);
            }
        }

        LocalDateTime windowStart = now.minus(HIGH_SEVERITY_WINDOW);
        int recentHighSeverity = 0;
        for (Issue issue : activeIssues) {
            if (issue.getSeverity() != null && issue.getSeverity().isAtLeast(Severity.HIGH)
                    && issue.getCreatedAt() != null && !issue.getCreatedAt().isBefore(windowStart)) {
                recentHighSeverity++;
            }
        }
        if (recentHighSeverity >= HIGH_SEVERITY_THRESHOLD) {
            CriticalCondition condition = new CriticalCondition();
            condition.setType(CriticalCondition.ConditionType.MULTIPLE_HIGH_SEVERITY);
            condition.setAlertType(AlertType.CUSTOMER_ESCALATION);
            condition.setIssueId(triggeringIssueId);
            condition.setCustomerId(customerId);
            condition.setCount(recentHighSeverity);
            condition.setSeverity(Severity.HIGH);
            condition.setMessage("Customer has " + recentHighSeverity + " high-severity issues in the last 7 days");
            raise(condition, CriticalAlert.customerKey(customerId, AlertType.CUSTOMER_ESCALATION), now);
            conditions.add(condition);
        }

        if (!conditions.isEmpty()) {
            log.info("Detected {} critical condition(s) for customer {}", conditions.size(), customerId);
        }
        return conditions;
    }

    private void raise(CriticalCondition condition, String dedupKey, LocalDateTime now) {
        CriticalAlert alert = new CriticalAlert();
        alert.setIssueId(condition.getIssueId());
        alert.setCustomerId(condition.getCustomerId());
        alert.setAlertType(condition.getAlertType());
        alert.setSeverity(condition.getSeverity());
        alert.setAlertMessage(condition.getMessage());
        alert.setStatus(AlertStatus.ACTIVE);
        alert.setCreatedAt(now);
        alert.setDedupKey(dedupKey);
        alert.setOpen(true);

        try {
            IssueStore.AlertWrite write = issueStore.insertAlertIfAbsent(alert);
            if (write.alert() != null) {
                condition.setAlertId(write.alert().getAlertId());
            }
            condition.setNewAlert(write.created());
        } catch (DataAccessException e) {
            log.error("Failed to persist {} alert for {}: {}", condition.getAlertType(), dedupKey, e.getMessage());
        }
    }
}
