package com.support.triage.spring_server.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ResolutionRequest {
    private String resolutionSummary;
    private Integer customerSatisfaction;
    private String resolvedBy;
}
