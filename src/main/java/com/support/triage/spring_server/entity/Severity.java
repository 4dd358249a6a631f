package com.support.triage.spring_server.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Issue impact, ordered by declaration: LOW &lt; NORMAL &lt; HIGH &lt; CRITICAL.
 */
public enum Severity {
    LOW("Low"),
    NORMAL("Normal"),
    HIGH("High"),
    CRITICAL("Critical");

    private final String label;

    Severity(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }

    /**
     * Lenient lookup by label or constant name, ignoring case and surrounding whitespace.
     */
    public static Optional<Severity> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String candidate = value.trim();
        return Arrays.stream(values())
                .filter(s -> s.label.equalsIgnoreCase(candidate) || s.name().equalsIgnoreCase(candidate))
                .findFirst();
    }

    @JsonCreator
    public static Severity fromLabel(String value) {
        return parse(value).orElseThrow(() -> new IllegalArgumentException("Unknown severity: " + value));
    }
}
