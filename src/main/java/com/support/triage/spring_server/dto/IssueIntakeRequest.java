package com.support.triage.spring_server.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class IssueIntakeRequest {
    private String customerId;
    private String title;
    private String description;
    private String category;
    private String productArea;
}
