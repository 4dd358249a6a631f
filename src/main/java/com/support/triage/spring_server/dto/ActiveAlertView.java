package com.support.triage.spring_server.dto;

import com.support.triage.spring_server.entity.CriticalAlert;
import com.support.triage.spring_server.entity.Severity;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ActiveAlertView {
    private CriticalAlert alert;
    private String issueTitle;
    private Severity issueSeverity;
    private String customerName;
    private String company;
}
