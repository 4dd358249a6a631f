package com.support.triage.spring_server.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;

@Document(collection = "issue_resolutions")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class IssueResolution {
    @Id
    private String resolutionId;
    @Indexed
    private String issueId;
    @Indexed
    private String customerId;
    private String resolutionSummary;
    // 1-5 rating, may be missing
    private Integer customerSatisfaction;
    private LocalDateTime createdAt;
}
