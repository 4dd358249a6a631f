package com.support.triage.spring_server.service;

import com.support.triage.spring_server.dto.CustomerHistoryAggregate;
import com.support.triage.spring_server.dto.RiskAssessment;
import com.support.triage.spring_server.entity.RiskLevel;
import org.springframework.stereotype.Service;

@Service
public class RiskScorer {
    static final double MAX_SCORE = 10.0;
    private static final double SLOW_RESOLUTION_HOURS = 48.0;

    public RiskAssessment assess(CustomerHistoryAggregate aggregate, RiskPolicy policy) {
        if (aggregate == null) {
            return new RiskAssessment(policy, 0.0, RiskLevel.LOW);
        }
        double raw = switch (policy) {
            case HISTORY -> historyScore(aggregate);
            case DASHBOARD -> dashboardScore(aggregate);
        };
        double score = Math.max(0.0, Math.min(MAX_SCORE, raw));
        return new RiskAssessment(policy, score, level(score, policy));
    }

    private static double historyScore(CustomerHistoryAggregate a) {
        double score = volumeScore(a.getTotalIssues());
        if (a.getCriticalIssues() > 0) {
            score += 3;
        }
        if (a.getHighIssues() > 3) {
            score += 2;
        }
        if (a.getRecentIssues() > 5) {
            score += 2;
        }
        if (a.getAvgResolutionTimeHours() != null && a.getAvgResolutionTimeHours() > SLOW_RESOLUTION_HOURS) {
            score += 2;
        }
        return score;
    }

    private static double dashboardScore(CustomerHistoryAggregate a) {
        double score = volumeScore(a.getTotalIssues());
        score += a.getCriticalIssues() * 2.0;
        score += a.getHighIssues();
        score += a.getOpenIssues() * 1.5;
        if (a.getRecentIssues() > 5) {
            score += 2;
        } else if (a.getRecentIssues() > 2) {
            score += 1;
        }
        Double satisfaction = a.getAvgSatisfaction();
        if (satisfaction != null) {
            if (satisfaction < 3) {
                score += 2;
            } else if (satisfaction < 4) {
                score += 1;
            }
        }
        if (a.getAvgResolutionTimeHours() != null && a.getAvgResolutionTimeHours() > SLOW_RESOLUTION_HOURS) {
            score += 1;
        }
        return score;
    }

    private static double volumeScore(int totalIssues) {
        if (totalIssues > 20) {
            return 2;
        }
        if (totalIssues > 10) {
            return 1;
        }
        return 0;
    }

    private static RiskLevel level(double score, RiskPolicy policy) {
        if (score >= policy.getHighThreshold()) {
            return RiskLevel.HIGH;
        }
        if (score >= policy.getMediumThreshold()) {
            return RiskLevel.MEDIUM;
        }
        return RiskLevel.LOW;
    }
}
