package com.support.triage.spring_server.service;

import com.support.triage.spring_server.dto.ActiveAlertView;
import com.support.triage.spring_server.dto.AlertActionResult;
import com.support.triage.spring_server.entity.CriticalAlert;
import com.support.triage.spring_server.entity.Customer;
import com.support.triage.spring_server.entity.Issue;
import com.support.triage.spring_server.exception.InvalidInputException;
import com.support.triage.spring_server.exception.ResourceNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
public class CriticalAlertService {
    private static final Logger log = LoggerFactory.getLogger(CriticalAlertService.class);

    private final IssueStore issueStore;
    private final Clock clock;

    @Autowired
    public CriticalAlertService(IssueStore issueStore, Clock clock) {
        this.issueStore = issueStore;
        this.clock = clock;
    }

    /**
     * Active alerts, newest first, with the issue and customer they point at.
     */
    public List<ActiveAlertView> getActiveAlerts() {
        List<CriticalAlert> alerts = issueStore.findActiveAlerts();
        Map<String, Optional<Issue>> issues = new HashMap<>();
        Map<String, Optional<Customer>> customers = new HashMap<>();

        List<ActiveAlertView> views = new ArrayList<>(alerts.size());
        for (CriticalAlert alert : alerts) {
            Issue issue = alert.getIssueId() == null ? null
                    : issues.computeIfAbsent(alert.getIssueId(), issueStore::findIssue).orElse(null);
            String customerId = alert.getCustomerId() != null ? alert.getCustomerId()
                    : issue != null ? issue.getCustomerId() : null;
            Customer customer = customerId == null ? null
                    : customers.computeIfAbsent(customerId, issueStore::findCustomer).orElse(null);

            views.add(new ActiveAlertView(
                    alert,
                    issue != null ? issue.getTitle() : null,
                    issue != null ? issue.getSeverity() : null,
                    customer != null ? customer.getCustomerName() : null,
                    customer != null ? customer.getCompany() : null));
        }
        return views;
    }

    public AlertActionResult acknowledge(String alertId, String actor) {
        if (actor == null || actor.isBlank()) {
            throw new InvalidInputException("acknowledgedBy is required");
        }
        requireAlert(alertId);
        if (issueStore.acknowledgeAlert(alertId, actor, LocalDateTime.now(clock))) {
            log.info("Alert {} acknowledged by {}", alertId, actor);
            return new AlertActionResult(alertId, true, "Alert acknowledged successfully");
        }
        return new AlertActionResult(alertId, false, "Alert is not active");
    }

    public AlertActionResult resolve(String alertId) {
        requireAlert(alertId);
        if (issueStore.resolveAlert(alertId, LocalDateTime.now(clock))) {
            log.info("Alert {} resolved", alertId);
            return new AlertActionResult(alertId, true, "Alert resolved successfully");
        }
        return new AlertActionResult(alertId, false, "Alert must be acknowledged before it is resolved");
    }

    private void requireAlert(String alertId) {
        if (issueStore.findAlert(alertId).isEmpty()) {
            throw new ResourceNotFoundException("Alert", alertId);
        }
    }
}
