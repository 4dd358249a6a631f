package com.support.triage.spring_server.service;

import com.support.triage.spring_server.entity.CustomerTier;
import com.support.triage.spring_server.entity.RiskLevel;
import com.support.triage.spring_server.entity.Severity;
import org.springframework.stereotype.Service;

/**
 * Issue priority on a 1..10 scale, 10 being the most urgent. Missing inputs count as neutral.
 */
@Service
public class PriorityScorer {
    static final int BASE_SCORE = 5;
    static final int MIN_PRIORITY = 1;
    static final int MAX_PRIORITY = 10;

    public int score(Severity severity, CustomerTier tier, RiskLevel riskLevel, int similarCount) {
        int score = BASE_SCORE + severityWeight(severity) + tierWeight(tier) + riskWeight(riskLevel);
        // well-trodden problem
        if (similarCount > 3) {
            score -= 1;
        }
        return Math.max(MIN_PRIORITY, Math.min(MAX_PRIORITY, score));
    }

    private static int severityWeight(Severity severity) {
        if (severity == null) {
            return 0;
        }
        return switch (severity) {
            case CRITICAL -> 4;
            case HIGH -> 3;
            case NORMAL -> 0;
            case LOW -> -2;
        };
    }

    private static int tierWeight(CustomerTier tier) {
        if (tier == null) {
            return 0;
        }
        return switch (tier) {
            case ENTERPRISE -> 2;
            case PREMIUM -> 1;
            case BASIC -> 0;
        };
    }

    private static int riskWeight(RiskLevel riskLevel) {
        if (riskLevel == null) {
            return 0;
        }
        return switch (riskLevel) {
            case HIGH -> 2;
            case MEDIUM -> 1;
            case LOW -> 0;
        };
    }
}
