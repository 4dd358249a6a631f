package com.support.triage.spring_server.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

public enum IssueStatus {
    OPEN("Open"),
    IN_PROGRESS("In Progress"),
    RESOLVED("Resolved"),
    CLOSED("Closed"),
    ESCALATED("Escalated");

    /** Statuses that still need work from the support team. */
    public static final Set<IssueStatus> ACTIVE = EnumSet.of(OPEN, IN_PROGRESS);

    private final String label;

    IssueStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public static Optional<IssueStatus> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String candidate = value.trim();
        return Arrays.stream(values())
                .filter(s -> s.label.equalsIgnoreCase(candidate) || s.name().equalsIgnoreCase(candidate))
                .findFirst();
    }

    @JsonCreator
    public static IssueStatus fromLabel(String value) {
        return parse(value).orElseThrow(() -> new IllegalArgumentException("Unknown issue status: " + value));
    }
}
