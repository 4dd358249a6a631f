package com.support.triage.spring_server.dto;

import com.support.triage.spring_server.entity.Severity;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SeverityClassification {

    public enum Source { KEYWORD, MODEL, DEFAULT }

    private Severity severity;
    private Source source;
    private Map<Severity, Double> keywordScores;
}
