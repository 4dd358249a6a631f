package com.support.triage.spring_server.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class IssueInsights {
    private String rootCause;
    private String resolutionApproach;
    private double estimatedTimeHours;
    private List<String> escalationTriggers;
    private String communicationStrategy;
    private boolean aiGenerated;
}
