package com.support.triage.spring_server.service;

import java.time.Duration;

/**
 * Cached entity kinds with their key prefix and time-to-live.
 */
public enum CacheKind {
    CUSTOMER_HISTORY("customer_history", Duration.ofMinutes(5)),
    CUSTOMER_RISK_ANALYSIS("customer_risk_analysis", Duration.ofMinutes(5)),
    ISSUE_ANALYSIS("issue_analysis", Duration.ofMinutes(30)),
    SIMILAR_ISSUES("similar_issues", Duration.ofHours(1));

    private final String prefix;
    private final Duration ttl;

    CacheKind(String prefix, Duration ttl) {
        this.prefix = prefix;
        this.ttl = ttl;
    }

    public String key(String identity) {
        return prefix + ":" + identity;
    }

    public String getPrefix() {
        return prefix;
    }

    public Duration getTtl() {
        return ttl;
    }
}
