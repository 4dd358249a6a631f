package com.support.triage.spring_server.controller;

import com.support.triage.spring_server.dto.ApiResponse;
import com.support.triage.spring_server.dto.IssueAnalysisResult;
import com.support.triage.spring_server.dto.IssueIntakeRequest;
import com.support.triage.spring_server.dto.SimilarIssue;
import com.support.triage.spring_server.exception.TriageException;
import com.support.triage.spring_server.service.IssueTriageService;
import com.support.triage.spring_server.service.SimilarityRanker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/issues")
public class IssueTriageController {
    private static final Logger log = LoggerFactory.getLogger(IssueTriageController.class);

    @Autowired
    private IssueTriageService issueTriageService;

    @Autowired
    private SimilarityRanker similarityRanker;

    @PostMapping("/analyze")
    public ResponseEntity<ApiResponse<IssueAnalysisResult>> analyzeIssue(@RequestBody IssueIntakeRequest request) {
        try {
            IssueAnalysisResult result = issueTriageService.analyzeNewIssue(request);
            log.info("Analyzed issue {} for customer {}", result.getIssueId(), result.getCustomerId());
            return ResponseEntity.status(201).body(ApiResponse.success("Issue analyzed successfully", result));
        } catch (TriageException e) {
            log.warn("Issue analysis rejected: {}", e.getMessage());
            return ResponseEntity.status(e.getErrorKind().getHttpStatus()).body(ApiResponse.error(e));
        } catch (Exception e) {
            log.error("Unexpected error analyzing issue", e);
            return ResponseEntity.status(500).body(ApiResponse.error("Unexpected error occurred: " + e.getMessage()));
        }
    }

    @GetMapping("/{issueId}/similar")
    public ResponseEntity<ApiResponse<List<SimilarIssue>>> getSimilarIssues(
            @PathVariable String issueId,
            @RequestParam(defaultValue = "5") int limit) {
        try {
            List<SimilarIssue> similar = similarityRanker.findSimilarIssues(issueId, limit);
            return ResponseEntity.ok(ApiResponse.success("Found " + similar.size() + " similar issues", similar));
        } catch (TriageException e) {
            log.warn("Similar issue lookup for {} failed: {}", issueId, e.getMessage());
            return ResponseEntity.status(e.getErrorKind().getHttpStatus()).body(ApiResponse.error(e));
        } catch (Exception e) {
            log.error("Unexpected error finding similar issues for {}", issueId, e);
            return ResponseEntity.status(500).body(ApiResponse.error("Unexpected error occurred: " + e.getMessage()));
        }
    }

    @GetMapping("/{issueId}/analysis")
    public ResponseEntity<ApiResponse<IssueAnalysisResult>> getIssueAnalysis(@PathVariable String issueId) {
        try {
            return ResponseEntity.ok(ApiResponse.success("Issue analysis found",
                    issueTriageService.getIssueAnalysis(issueId)));
        } catch (TriageException e) {
            return ResponseEntity.status(e.getErrorKind().getHttpStatus()).body(ApiResponse.error(e));
        } catch (Exception e) {
            log.error("Unexpected error reading analysis of issue {}", issueId, e);
            return ResponseEntity.status(500).body(ApiResponse.error("Unexpected error occurred: " + e.getMessage()));
        }
    }
}
