package com.support.triage.spring_server.entity;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AlertStatus {
    ACTIVE("Active"),
    ACKNOWLEDGED("Acknowledged"),
    RESOLVED("Resolved");

    private final String label;

    AlertStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
