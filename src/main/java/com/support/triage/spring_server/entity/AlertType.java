package com.support.triage.spring_server.entity;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AlertType {
    UNATTENDED("Unattended"),
    ESCALATION("Escalation"),
    SLA_BREACH("SLA_Breach"),
    CUSTOMER_ESCALATION("Customer_Escalation");

    private final String label;

    AlertType(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
