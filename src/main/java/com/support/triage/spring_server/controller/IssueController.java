package com.support.triage.spring_server.controller;

import com.support.triage.spring_server.dto.ApiResponse;
import com.support.triage.spring_server.dto.IssuePage;
import com.support.triage.spring_server.dto.ResolutionRequest;
import com.support.triage.spring_server.dto.StatusUpdateRequest;
import com.support.triage.spring_server.entity.Issue;
import com.support.triage.spring_server.entity.IssueResolution;
import com.support.triage.spring_server.exception.TriageException;
import com.support.triage.spring_server.service.IssueService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/issues")
public class IssueController {
    private static final Logger log = LoggerFactory.getLogger(IssueController.class);

    @Autowired
    private IssueService issueService;

    @GetMapping
    public ResponseEntity<ApiResponse<IssuePage>> listIssues(
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String severity,
            @RequestParam(required = false) String customerId,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "20") int perPage) {
        try {
            IssuePage issues = issueService.listIssues(status, severity, customerId, page, perPage);
            return ResponseEntity.ok(ApiResponse.success("Found " + issues.getTotal() + " issues", issues));
        } catch (TriageException e) {
            return ResponseEntity.status(e.getErrorKind().getHttpStatus()).body(ApiResponse.error(e));
        } catch (Exception e) {
            log.error("Unexpected error listing issues", e);
            return ResponseEntity.status(500).body(ApiResponse.error("Failed to retrieve issues"));
        }
    }

    @GetMapping("/{issueId}")
    public ResponseEntity<ApiResponse<Issue>> getIssue(@PathVariable String issueId) {
        try {
            return ResponseEntity.ok(ApiResponse.success("Issue found", issueService.getIssue(issueId)));
        } catch (TriageException e) {
            return ResponseEntity.status(e.getErrorKind().getHttpStatus()).body(ApiResponse.error(e));
        } catch (Exception e) {
            log.error("Unexpected error reading issue {}", issueId, e);
            return ResponseEntity.status(500).body(ApiResponse.error("Failed to retrieve issue details"));
        }
    }

    @PutMapping("/{issueId}/status")
    public ResponseEntity<ApiResponse<Issue>> updateStatus(@PathVariable String issueId,
                                                           @RequestBody StatusUpdateRequest request) {
        try {
            Issue updated = issueService.updateStatus(issueId, request);
            return ResponseEntity.ok(ApiResponse.success("Issue status updated", updated));
        } catch (TriageException e) {
            log.warn("Status update of issue {} rejected: {}", issueId, e.getMessage());
            return ResponseEntity.status(e.getErrorKind().getHttpStatus()).body(ApiResponse.error(e));
        } catch (Exception e) {
            log.error("Unexpected error updating status of issue {}", issueId, e);
            return ResponseEntity.status(500).body(ApiResponse.error("Failed to update issue status"));
        }
    }

    @PostMapping("/{issueId}/resolution")
    public ResponseEntity<ApiResponse<IssueResolution>> recordResolution(@PathVariable String issueId,
                                                                         @RequestBody ResolutionRequest request) {
        try {
            IssueResolution resolution = issueService.recordResolution(issueId, request);
            return ResponseEntity.status(201).body(ApiResponse.success("Resolution recorded", resolution));
        } catch (TriageException e) {
            return ResponseEntity.status(e.getErrorKind().getHttpStatus()).body(ApiResponse.error(e));
        } catch (Exception e) {
            log.error("Unexpected error recording resolution of issue {}", issueId, e);
            return ResponseEntity.status(500).body(ApiResponse.error("Failed to record resolution"));
        }
    }
}
