package com.support.triage.spring_server.dto;

import com.support.triage.spring_server.entity.RiskLevel;
import com.support.triage.spring_server.service.RiskPolicy;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RiskAssessment {
    private RiskPolicy policy;
    private double score;
    private RiskLevel level;
}
