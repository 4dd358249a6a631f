package com.support.triage.spring_server.service;

import com.support.triage.spring_server.dto.CollaboratorResult;
import com.support.triage.spring_server.dto.IssueFilter;
import com.support.triage.spring_server.dto.IssuePage;
import com.support.triage.spring_server.dto.SimilarIssue;
import com.support.triage.spring_server.entity.AlertStatus;
import com.support.triage.spring_server.entity.CriticalAlert;
import com.support.triage.spring_server.entity.Customer;
import com.support.triage.spring_server.entity.Issue;
import com.support.triage.spring_server.entity.IssueResolution;
import com.support.triage.spring_server.entity.IssueStatus;
import com.support.triage.spring_server.entity.Severity;
import com.support.triage.spring_server.entity.SimilarIssueLink;
import com.support.triage.spring_server.entity.TagValue;
import com.support.triage.spring_server.repository.CriticalAlertRepository;
import com.support.triage.spring_server.repository.CustomerRepository;
import com.support.triage.spring_server.repository.IssueRepository;
import com.support.triage.spring_server.repository.IssueResolutionRepository;
import com.support.triage.spring_server.repository.SimilarIssueLinkRepository;
import com.mongodb.client.result.UpdateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
public class MongoService implements IssueStore {
    private static final Logger log = LoggerFactory.getLogger(MongoService.class);

    private final IssueRepository issueRepository;
    private final CustomerRepository customerRepository;
    private final CriticalAlertRepository criticalAlertRepository;
    private final IssueResolutionRepository issueResolutionRepository;
    private final SimilarIssueLinkRepository similarIssueLinkRepository;
    private final MongoTemplate mongoTemplate;

    @Autowired
    public MongoService(IssueRepository issueRepository,
                        CustomerRepository customerRepository,
                        CriticalAlertRepository criticalAlertRepository,
                        IssueResolutionRepository issueResolutionRepository,
                        SimilarIssueLinkRepository similarIssueLinkRepository,
                        MongoTemplate mongoTemplate) {
        this.issueRepository = issueRepository;
        this.customerRepository = customerRepository;
        this.criticalAlertRepository = criticalAlertRepository;
        this.issueResolutionRepository = issueResolutionRepository;
        this.similarIssueLinkRepository = similarIssueLinkRepository;
        this.mongoTemplate = mongoTemplate;
    }

    // ==================== ISSUES ====================

    @Override
    public Optional<Issue> findIssue(String issueId) {
        return issueRepository.findById(issueId);
    }

    @Override
    public Issue insertIssue(Issue issue) {
        Issue saved = issueRepository.insert(issue);
        log.info("Created issue {} for customer {}", saved.getIssueId(), saved.getCustomerId());
        return saved;
    }

    @Override
    public void applyAnalysis(String issueId, Severity severity, int priority, Map<String, TagValue> tags, LocalDateTime updatedAt) {
        Update update = new Update()
                .set("severity", severity)
                .set("priority", priority)
                .set("tags", tags)
                .set("updatedAt", updatedAt);
        UpdateResult result = mongoTemplate.updateFirst(byId(issueId), update, Issue.class);
        if (result.getMatchedCount() == 0) {
            log.warn("Analysis update matched no issue: {}", issueId);
        }
    }

    @Override
    public Optional<Issue> updateIssueStatus(String issueId, IssueStatus status, LocalDateTime updatedAt) {
        Optional<Issue> current = issueRepository.findById(issueId);
        if (current.isEmpty()) {
            return Optional.empty();
        }

        Update update = new Update()
                .set("status", status)
                .set("updatedAt", updatedAt);
        if (status == IssueStatus.RESOLVED) {
            LocalDateTime createdAt = current.get().getCreatedAt();
            double hours = createdAt == null ? 0.0 : Duration.between(createdAt, updatedAt).toMinutes() / 60.0;
            update.set("resolvedAt", updatedAt)
                    .set("resolutionTimeHours", Math.round(hours * 100.0) / 100.0);
        } else {
            update.unset("resolvedAt").unset("resolutionTimeHours");
        }

        Issue updated = mongoTemplate.findAndModify(byId(issueId), update,
                FindAndModifyOptions.options().returnNew(true), Issue.class);
        log.info("Issue {} status {} -> {}", issueId, current.get().getStatus(), status);
        return Optional.ofNullable(updated);
    }

    @Override
    public List<Issue> findIssuesByCustomer(String customerId) {
        return issueRepository.findByCustomerIdOrderByCreatedAtDesc(customerId);
    }

    @Override
    public List<Issue> findIssuesByCustomerAndStatus(String customerId, Collection<IssueStatus> statuses) {
        return issueRepository.findByCustomerIdAndStatusIn(customerId, statuses);
    }

    @Override
    public IssuePage findIssues(IssueFilter filter, int page, int perPage) {
        Criteria criteria = new Criteria();
        if (filter.getStatus() != null) {
            criteria.and("status").is(filter.getStatus());
        }
        if (filter.getSeverity() != null) {
            criteria.and("severity").is(filter.getSeverity());
        }
        if (filter.getCustomerId() != null) {
            criteria.and("customerId").is(filter.getCustomerId());
        }
        if (filter.getCreatedAfter() != null || filter.getCreatedBefore() != null) {
            Criteria created = criteria.and("createdAt");
            if (filter.getCreatedAfter() != null) {
                created.gte(filter.getCreatedAfter());
            }
            if (filter.getCreatedBefore() != null) {
                created.lt(filter.getCreatedBefore());
            }
        }

        long total = mongoTemplate.count(new Query(criteria), Issue.class);
        Query pageQuery = new Query(criteria)
                .with(Sort.by(Sort.Direction.DESC, "createdAt"))
                .skip((long) (page - 1) * perPage)
                .limit(perPage);
        List<Issue> issues = mongoTemplate.find(pageQuery, Issue.class);
        long pages = (total + perPage - 1) / perPage;
        return new IssuePage(issues, page, perPage, total, pages);
    }

    @Override
    public List<Issue> findIssuesCreatedSince(LocalDateTime since) {
        return issueRepository.findByCreatedAtGreaterThanEqual(since);
    }

    @Override
    public CollaboratorResult<List<Issue>> findRecentResolvedIssues(int limit, Duration timeout) {
        try {
            Query query = new Query(Criteria.where("status").is(IssueStatus.RESOLVED)
                    .and("resolutionTimeHours").ne(null))
                    .with(Sort.by(Sort.Direction.DESC, "createdAt"))
                    .limit(limit)
                    .maxTime(timeout);
            return CollaboratorResult.success(mongoTemplate.find(query, Issue.class));
        } catch (DataAccessException e) {
            log.error("Resolved issue corpus read failed: {}", e.getMessage());
            return CollaboratorResult.unavailable("Resolved issue corpus read failed: " + e.getMessage());
        }
    }

    // ==================== CUSTOMERS ====================

    @Override
    public Optional<Customer> findCustomer(String customerId) {
        return customerRepository.findById(customerId);
    }

    @Override
    public List<Customer> findAllCustomers() {
        return customerRepository.findAll();
    }

    @Override
    public long countCustomers() {
        return customerRepository.count();
    }

    @Override
    public boolean customerEmailExists(String email) {
        return customerRepository.existsByEmail(email);
    }

    @Override
    public Customer insertCustomer(Customer customer) {
        return customerRepository.insert(customer);
    }

    @Override
    public IssueResolution insertResolution(IssueResolution resolution) {
        return issueResolutionRepository.insert(resolution);
    }

    @Override
    public List<IssueResolution> findResolutionsByCustomer(String customerId) {
        return issueResolutionRepository.findByCustomerId(customerId);
    }

    // ==================== ALERTS ====================

    @Override
    public AlertWrite insertAlertIfAbsent(CriticalAlert alert) {
        Query openAlert = new Query(Criteria.where("dedupKey").is(alert.getDedupKey()).and("open").is(true));
        Update update = new Update()
                .setOnInsert("issueId", alert.getIssueId())
                .setOnInsert("customerId", alert.getCustomerId())
                .setOnInsert("alertType", alert.getAlertType())
                .setOnInsert("severity", alert.getSeverity())
                .setOnInsert("alertMessage", alert.getAlertMessage())
                .setOnInsert("status", AlertStatus.ACTIVE)
                .setOnInsert("createdAt", alert.getCreatedAt());

        try {
            UpdateResult result = mongoTemplate.upsert(openAlert, update, CriticalAlert.class);
            CriticalAlert stored = mongoTemplate.findOne(openAlert, CriticalAlert.class);
            boolean created = result.getUpsertedId() != null;
            if (created) {
                log.info("Raised {} alert {} ({})", alert.getAlertType(), stored != null ? stored.getAlertId() : null, alert.getDedupKey());
            }
            return new AlertWrite(stored, created);
        } catch (DuplicateKeyException e) {
            // a concurrent run inserted the same open alert first
            log.debug("Open alert already raised concurrently for {}", alert.getDedupKey());
            return new AlertWrite(mongoTemplate.findOne(openAlert, CriticalAlert.class), false);
        }
    }

    @Override
    public Optional<CriticalAlert> findAlert(String alertId) {
        return criticalAlertRepository.findById(alertId);
    }

    @Override
    public List<CriticalAlert> findActiveAlerts() {
        return criticalAlertRepository.findByStatusOrderByCreatedAtDesc(AlertStatus.ACTIVE);
    }

    @Override
    public long countActiveAlerts() {
        return criticalAlertRepository.countByStatus(AlertStatus.ACTIVE);
    }

    @Override
    public boolean acknowledgeAlert(String alertId, String actor, LocalDateTime at) {
        Query query = new Query(Criteria.where("_id").is(alertId).and("status").is(AlertStatus.ACTIVE));
        Update update = new Update()
                .set("status", AlertStatus.ACKNOWLEDGED)
                .set("acknowledgedAt", at)
                .set("acknowledgedBy", actor);
        return mongoTemplate.updateFirst(query, update, CriticalAlert.class).getModifiedCount() > 0;
    }

    @Override
    public boolean resolveAlert(String alertId, LocalDateTime at) {
        Query query = new Query(Criteria.where("_id").is(alertId).and("status").is(AlertStatus.ACKNOWLEDGED));
        Update update = new Update()
                .set("status", AlertStatus.RESOLVED)
                .set("resolvedAt", at)
                .set("open", false);
        return mongoTemplate.updateFirst(query, update, CriticalAlert.class).getModifiedCount() > 0;
    }

    // ==================== SIMILARITY CROSS-REFERENCE ====================

    @Override
    public void saveSimilarLinks(String sourceIssueId, List<SimilarIssue> similarIssues, LocalDateTime at) {
        if (similarIssues.isEmpty()) {
            return;
        }
        List<SimilarIssueLink> links = similarIssues.stream()
                .map(s -> new SimilarIssueLink(sourceIssueId, s.getIssueId(), s.getSimilarityScore(), at))
                .toList();
        similarIssueLinkRepository.insert(links);
        log.debug("Stored {} similar issue links for {}", links.size(), sourceIssueId);
    }

    private static Query byId(String id) {
        return new Query(Criteria.where("_id").is(id));
    }
}
