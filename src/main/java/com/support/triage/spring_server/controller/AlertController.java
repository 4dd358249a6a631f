package com.support.triage.spring_server.controller;

import com.support.triage.spring_server.dto.ActiveAlertView;
import com.support.triage.spring_server.dto.AlertActionResult;
import com.support.triage.spring_server.dto.ApiResponse;
import com.support.triage.spring_server.exception.TriageException;
import com.support.triage.spring_server.service.CriticalAlertService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/alerts")
public class AlertController {
    private static final Logger log = LoggerFactory.getLogger(AlertController.class);

    @Autowired
    private CriticalAlertService criticalAlertService;

    @GetMapping("/critical")
    public ResponseEntity<ApiResponse<List<ActiveAlertView>>> getCriticalAlerts() {
        try {
            List<ActiveAlertView> alerts = criticalAlertService.getActiveAlerts();
            return ResponseEntity.ok(ApiResponse.success(alerts.size() + " active alerts", alerts));
        } catch (Exception e) {
            log.error("Failed to get critical alerts", e);
            return ResponseEntity.status(500).body(ApiResponse.error("Failed to retrieve alerts"));
        }
    }

    @PostMapping("/{alertId}/acknowledge")
    public ResponseEntity<ApiResponse<AlertActionResult>> acknowledge(@PathVariable String alertId,
                                                                      @RequestBody AcknowledgeRequest request) {
        try {
            AlertActionResult result = criticalAlertService.acknowledge(alertId, request.acknowledgedBy());
            return respond(result);
        } catch (TriageException e) {
            return ResponseEntity.status(e.getErrorKind().getHttpStatus()).body(ApiResponse.error(e));
        } catch (Exception e) {
            log.error("Failed to acknowledge alert {}", alertId, e);
            return ResponseEntity.status(500).body(ApiResponse.error("Failed to acknowledge alert"));
        }
    }

    @PostMapping("/{alertId}/resolve")
    public ResponseEntity<ApiResponse<AlertActionResult>> resolve(@PathVariable String alertId) {
        try {
            return respond(criticalAlertService.resolve(alertId));
        } catch (TriageException e) {
            return ResponseEntity.status(e.getErrorKind().getHttpStatus()).body(ApiResponse.error(e));
        } catch (Exception e) {
            log.error("Failed to resolve alert {}", alertId, e);
            return ResponseEntity.status(500).body(ApiResponse.error("Failed to resolve alert"));
        }
    }

    // refused transitions answer 409 with the unchanged alert id
    private static ResponseEntity<ApiResponse<AlertActionResult>> respond(AlertActionResult result) {
        if (result.isSuccess()) {
            return ResponseEntity.ok(ApiResponse.success(result.getMessage(), result));
        }
        return ResponseEntity.status(409).body(new ApiResponse<>("error", result.getMessage(), null, result));
    }

    public record AcknowledgeRequest(String acknowledgedBy) {
    }
}
