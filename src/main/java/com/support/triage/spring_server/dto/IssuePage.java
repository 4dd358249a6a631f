package com.support.triage.spring_server.dto;

import com.support.triage.spring_server.entity.Issue;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class IssuePage {
    private List<Issue> issues;
    private int page;
    private int perPage;
    private long total;
    private long pages;
}
