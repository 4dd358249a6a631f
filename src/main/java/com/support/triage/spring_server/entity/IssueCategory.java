package com.support.triage.spring_server.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum IssueCategory {
    TECHNICAL("Technical"),
    BILLING("Billing"),
    GENERAL("General"),
    FEATURE_REQUEST("Feature Request"),
    BUG_REPORT("Bug Report");

    private final String label;

    IssueCategory(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public static Optional<IssueCategory> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String candidate = value.trim();
        return Arrays.stream(values())
                .filter(c -> c.label.equalsIgnoreCase(candidate) || c.name().equalsIgnoreCase(candidate))
                .findFirst();
    }

    @JsonCreator
    public static IssueCategory fromLabel(String value) {
        return parse(value).orElseThrow(() -> new IllegalArgumentException("Unknown issue category: " + value));
    }
}
