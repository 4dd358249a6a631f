package com.support.triage.spring_server.dto;

import com.fasterxml.jackson.annotation.JsonValue;
import com.support.triage.spring_server.entity.AlertType;
import com.support.triage.spring_server.entity.Severity;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A condition found by the detector. {@code newAlert} is false when an open alert for the same
 * condition already existed, {@code alertId} is null when the alert could not be written.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CriticalCondition {

    public enum ConditionType {
        UNATTENDED_CRITICAL("Unattended Critical Issue"),
        MULTIPLE_HIGH_SEVERITY("Multiple High Severity Issues");

        private final String label;

        ConditionType(String label) {
            this.label = label;
        }

        @JsonValue
        public String getLabel() {
            return label;
        }
    }

    private ConditionType type;
    private AlertType alertType;
    private String issueId;
    private String customerId;
    private String title;
    private Long hoursOpen;
    private Integer count;
    private Severity severity;
    private String message;
    private String alertId;
    private boolean newAlert;
}
