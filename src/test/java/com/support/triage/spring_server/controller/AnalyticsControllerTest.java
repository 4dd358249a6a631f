package com.support.triage.spring_server.controller;

import com.support.triage.spring_server.dto.DashboardAnalytics;
import com.support.triage.spring_server.service.DashboardAnalyticsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class AnalyticsControllerTest {

    private MockMvc mockMvc;

    @Mock
    private DashboardAnalyticsService dashboardAnalyticsService;

    @InjectMocks
    private AnalyticsController analyticsController;

    @BeforeEach
    void setup() {
        mockMvc = MockMvcBuilders.standaloneSetup(analyticsController).build();
    }

    @Test
    void dashboardReturnsAnalytics() throws Exception {
        DashboardAnalytics analytics = new DashboardAnalytics(
                new DashboardAnalytics.IssueStatistics(12, 4, 3, 5, 1, 2, 6.5, 2),
                new DashboardAnalytics.CustomerStatistics(8, 3, 1.5),
                2,
                List.of());
        when(dashboardAnalyticsService.getDashboardAnalytics()).thenReturn(analytics);

        mockMvc.perform(get("/api/analytics/dashboard"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.issueStatistics.totalIssues").value(12))
                .andExpect(jsonPath("$.data.customerStatistics.activeCustomersWeek").value(3))
                .andExpect(jsonPath("$.data.activeAlerts").value(2));
    }

    @Test
    void storeFailureAnswers500() throws Exception {
        when(dashboardAnalyticsService.getDashboardAnalytics())
                .thenThrow(new DataAccessResourceFailureException("mongo down"));

        mockMvc.perform(get("/api/analytics/dashboard"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.errorKind").value("INTERNAL"));
    }
}
