package com.support.triage.spring_server.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;

/**
 * Alert raised by the critical condition detector.
 * <p>
 * {@code dedupKey} identifies the condition (issue or customer plus alert type); while {@code open}
 * is true there is at most one alert per key. Status only moves forward:
 * ACTIVE, then ACKNOWLEDGED, then RESOLVED.
 */
@Document(collection = "critical_alerts")
@CompoundIndex(name = "open_dedup_idx", def = "{'dedupKey': 1}", unique = true, partialFilter = "{'open': true}")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CriticalAlert {
    @Id
    private String alertId;
    private String issueId;
    private String customerId;
    private AlertType alertType;
    private Severity severity;
    private String alertMessage;
    private AlertStatus status;
    private LocalDateTime createdAt;
    private LocalDateTime acknowledgedAt;
    private String acknowledgedBy;
    private LocalDateTime resolvedAt;
    private String dedupKey;
    private boolean open;

    public static String issueKey(String issueId, AlertType type) {
        return "issue:" + issueId + ":" + type.name();
    }

    public static String customerKey(String customerId, AlertType type) {
        return "customer:" + customerId + ":" + type.name();
    }
}
