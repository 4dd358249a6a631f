package com.support.triage.spring_server.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;

@Document(collection = "similar_issues")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SimilarIssueLink {
    @Id
    private String mappingId;
    @Indexed
    private String sourceIssueId;
    private String similarIssueId;
    private double similarityScore;
    private LocalDateTime createdAt;

    public SimilarIssueLink(String sourceIssueId, String similarIssueId, double similarityScore, LocalDateTime createdAt) {
        this.sourceIssueId = sourceIssueId;
        this.similarIssueId = similarIssueId;
        this.similarityScore = similarityScore;
        this.createdAt = createdAt;
    }
}
