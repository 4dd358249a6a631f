package com.support.triage.spring_server.dto;

import com.support.triage.spring_server.entity.CustomerTier;
import com.support.triage.spring_server.entity.RiskLevel;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CustomerRiskProfile {
    private String customerId;
    private String customerName;
    private String company;
    private CustomerTier tier;
    private CustomerHistoryAggregate statistics;
    private double riskScore;
    private RiskLevel riskLevel;
}
