package com.support.triage.spring_server.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

@Document(collection = "issues")
@CompoundIndex(name = "status_created_idx", def = "{'status': 1, 'createdAt': -1}")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Issue {
    @Id
    private String issueId;
    @Indexed
    private String customerId;
    private String title;
    private String description;
    private IssueCategory category;
    private String productArea;
    private Severity severity = Severity.NORMAL;
    private IssueStatus status = IssueStatus.OPEN;
    private int priority = 5;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private LocalDateTime resolvedAt;
    // only set while status == RESOLVED
    private Double resolutionTimeHours;
    private Map<String, TagValue> tags = new LinkedHashMap<>();

    public String searchableText() {
        return (title == null ? "" : title) + " " + (description == null ? "" : description);
    }
}
