package com.support.triage.spring_server.dto;

import lombok.Data;

@Data
public class AlertActionResult {
    private final String alertId;
    private final boolean success;
    private final String message;

    public AlertActionResult(String alertId, boolean success, String message) {
        this.alertId = alertId;
        this.success = success;
        this.message = message;
    }
}
