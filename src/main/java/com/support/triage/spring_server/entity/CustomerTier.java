package com.support.triage.spring_server.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Account class, ordered by priority weight: BASIC &lt; PREMIUM &lt; ENTERPRISE.
 */
public enum CustomerTier {
    BASIC("Basic"),
    PREMIUM("Premium"),
    ENTERPRISE("Enterprise");

    private final String label;

    CustomerTier(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static CustomerTier fromLabel(String value) {
        return Arrays.stream(values())
                .filter(t -> value != null && (t.label.equalsIgnoreCase(value.trim()) || t.name().equalsIgnoreCase(value.trim())))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown customer tier: " + value));
    }
}
