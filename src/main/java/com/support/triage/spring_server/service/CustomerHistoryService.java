package com.support.triage.spring_server.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.support.triage.spring_server.dto.CustomerHistory;
import com.support.triage.spring_server.dto.CustomerHistoryAggregate;
import com.support.triage.spring_server.dto.CustomerRiskProfile;
import com.support.triage.spring_server.dto.RiskAssessment;
import com.support.triage.spring_server.entity.Customer;
import com.support.triage.spring_server.entity.Issue;
import com.support.triage.spring_server.entity.IssueResolution;
import com.support.triage.spring_server.entity.IssueStatus;
import com.support.triage.spring_server.entity.Severity;
import com.support.triage.spring_server.exception.ResourceNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

@Service
public class CustomerHistoryService {
    private static final Logger log = LoggerFactory.getLogger(CustomerHistoryService.class);

    public static final String RISK_ANALYSIS_KEY = "all";
    static final Duration RECENT_WINDOW = Duration.ofDays(30);
    static final int RECENT_ISSUES_SHOWN = 10;
    static final int RISK_ANALYSIS_SIZE = 50;

    private static final TypeReference<List<CustomerRiskProfile>> RISK_PROFILE_LIST = new TypeReference<>() {
    };

    private final IssueStore issueStore;
    private final CacheFacade cacheFacade;
    private final RiskScorer riskScorer;
    private final Clock clock;

    @Autowired
    public CustomerHistoryService(IssueStore issueStore, CacheFacade cacheFacade, RiskScorer riskScorer, Clock clock) {
        this.issueStore = issueStore;
        this.cacheFacade = cacheFacade;
        this.riskScorer = riskScorer;
        this.clock = clock;
    }

    /**
     * Customer info, statistics, latest issues and history-policy risk. Cached for five minutes.
     */
    public CustomerHistory getCustomerHistory(String customerId) {
        return cacheFacade.getOrCompute(CacheKind.CUSTOMER_HISTORY, customerId, CustomerHistory.class,
                () -> buildHistory(customerId));
    }

    /**
     * Customers ranked by critical, high and recent issue load, scored with the dashboard policy.
     */
    public List<CustomerRiskProfile> getRiskAnalysis() {
        return cacheFacade.getOrCompute(CacheKind.CUSTOMER_RISK_ANALYSIS, RISK_ANALYSIS_KEY, RISK_PROFILE_LIST,
                this::buildRiskAnalysis);
    }

    public CustomerHistoryAggregate aggregate(String customerId) {
        return aggregate(issueStore.findIssuesByCustomer(customerId), issueStore.findResolutionsByCustomer(customerId));
    }

    CustomerHistoryAggregate aggregate(List<Issue> issues, List<IssueResolution> resolutions) {
        LocalDateTime recentSince = LocalDateTime.now(clock).minus(RECENT_WINDOW);

        int resolved = 0;
        int open = 0;
        int critical = 0;
        int high = 0;
        int recent = 0;
        double resolutionHoursSum = 0;
        int resolutionHoursCount = 0;
        LocalDateTime lastIssueDate = null;

        for (Issue issue : issues) {
            if (issue.getStatus() == IssueStatus.RESOLVED) {
                resolved++;
            }
            if (IssueStatus.ACTIVE.contains(issue.getStatus())) {
                open++;
            }
            if (issue.getSeverity() == Severity.CRITICAL) {
                critical++;
            } else if (issue.getSeverity() == Severity.HIGH) {
                high++;
            }
            if (issue.getResolutionTimeHours() != null) {
                resolutionHoursSum += issue.getResolutionTimeHours();
                resolutionHoursCount++;
            }
            LocalDateTime createdAt = issue.getCreatedAt();
            if (createdAt != null) {
                if (!createdAt.isBefore(recentSince)) {
                    recent++;
                }
                if (lastIssueDate == null || createdAt.isAfter(lastIssueDate)) {
                    lastIssueDate = createdAt;
                }
            }
        }

        OptionalDouble satisfaction = resolutions.stream()
                .map(IssueResolution::getCustomerSatisfaction)
                .filter(Objects::nonNull)
                .mapToInt(Integer::intValue)
                .average();

        return CustomerHistoryAggregate.builder()
                .totalIssues(issues.size())
                .resolvedIssues(resolved)
                .openIssues(open)
                .criticalIssues(critical)
                .highIssues(high)
                .recentIssues(recent)
                .avgResolutionTimeHours(resolutionHoursCount == 0 ? null : resolutionHoursSum / resolutionHoursCount)
                .avgSatisfaction(satisfaction.isPresent() ? satisfaction.getAsDouble() : null)
                .lastIssueDate(lastIssueDate)
                .build();
    }

    private CustomerHistory buildHistory(String customerId) {
        Customer customer = issueStore.findCustomer(customerId)
                .orElseThrow(() -> new ResourceNotFoundException("Customer", customerId));

        // newest first
        List<Issue> issues = issueStore.findIssuesByCustomer(customerId);
        CustomerHistoryAggregate statistics = aggregate(issues, issueStore.findResolutionsByCustomer(customerId));
        RiskAssessment risk = riskScorer.assess(statistics, RiskPolicy.HISTORY);

        List<CustomerHistory.RecentIssue> recentIssues = issues.stream()
                .limit(RECENT_ISSUES_SHOWN)
                .map(i -> new CustomerHistory.RecentIssue(i.getIssueId(), i.getTitle(), i.getSeverity(), i.getStatus(), i.getCreatedAt()))
                .toList();

        log.debug("Built history for customer {}: {} issues, risk {}", customerId, statistics.getTotalIssues(), risk.getLevel());
        return new CustomerHistory(customer, statistics, new ArrayList<>(recentIssues), risk.getLevel(), risk.getScore());
    }

    private List<CustomerRiskProfile> buildRiskAnalysis() {
        List<CustomerRiskProfile> profiles = new ArrayList<>();
        for (Customer customer : issueStore.findAllCustomers()) {
            CustomerHistoryAggregate statistics = aggregate(customer.getCustomerId());
            if (statistics.getTotalIssues() == 0) {
                continue;
            }
            RiskAssessment risk = riskScorer.assess(statistics, RiskPolicy.DASHBOARD);
            profiles.add(new CustomerRiskProfile(customer.getCustomerId(), customer.getCustomerName(),
                    customer.getCompany(), customer.getTier(), statistics, risk.getScore(), risk.getLevel()));
        }
        profiles.sort(Comparator.comparingInt(CustomerHistoryService::issueLoad).reversed());
        List<CustomerRiskProfile> top = new ArrayList<>(profiles.subList(0, Math.min(RISK_ANALYSIS_SIZE, profiles.size())));
        log.info("Risk analysis computed for {} customers ({} with issues)", top.size(), profiles.size());
        return top;
    }

    private static int issueLoad(CustomerRiskProfile profile) {
        CustomerHistoryAggregate s = profile.getStatistics();
        return s.getCriticalIssues() * 3 + s.getHighIssues() * 2 + s.getRecentIssues();
    }
}
