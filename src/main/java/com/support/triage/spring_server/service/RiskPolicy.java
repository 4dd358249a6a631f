package com.support.triage.spring_server.service;

/**
 * Named risk scoring rules. Both cap the score to [0, 10] and are monotonic non-decreasing in
 * critical, high and recent issue counts.
 */
public enum RiskPolicy {
    /** Used while triaging a new issue. */
    HISTORY(6.0, 3.0),
    /** Used for the periodic account review. */
    DASHBOARD(7.0, 4.0);

    private final double highThreshold;
    private final double mediumThreshold;

    RiskPolicy(double highThreshold, double mediumThreshold) {
        this.highThreshold = highThreshold;
        this.mediumThreshold = mediumThreshold;
    }

    public double getHighThreshold() {
        return highThreshold;
    }

    public double getMediumThreshold() {
        return mediumThreshold;
    }
}
