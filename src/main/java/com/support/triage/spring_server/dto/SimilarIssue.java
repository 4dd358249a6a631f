package com.support.triage.spring_server.dto;

import com.support.triage.spring_server.entity.Severity;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SimilarIssue {
    private String issueId;
    private String title;
    private String description;
    private Severity severity;
    private double similarityScore;
    private Double resolutionTimeHours;
}
