package com.support.triage.spring_server.controller;

import com.support.triage.spring_server.dto.ApiResponse;
import com.support.triage.spring_server.dto.DashboardAnalytics;
import com.support.triage.spring_server.service.DashboardAnalyticsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/analytics")
public class AnalyticsController {
    private static final Logger log = LoggerFactory.getLogger(AnalyticsController.class);

    @Autowired
    private DashboardAnalyticsService dashboardAnalyticsService;

    @GetMapping("/dashboard")
    public ResponseEntity<ApiResponse<DashboardAnalytics>> getDashboard() {
        try {
            return ResponseEntity.ok(ApiResponse.success("Dashboard analytics",
                    dashboardAnalyticsService.getDashboardAnalytics()));
        } catch (Exception e) {
            log.error("Failed to compute dashboard analytics", e);
            return ResponseEntity.status(500).body(ApiResponse.error("Failed to retrieve dashboard analytics"));
        }
    }
}
