package com.support.triage.spring_server.service;

import com.support.triage.spring_server.dto.IssueFilter;
import com.support.triage.spring_server.dto.IssuePage;
import com.support.triage.spring_server.dto.ResolutionRequest;
import com.support.triage.spring_server.dto.StatusUpdateRequest;
import com.support.triage.spring_server.entity.Issue;
import com.support.triage.spring_server.entity.IssueResolution;
import com.support.triage.spring_server.entity.IssueStatus;
import com.support.triage.spring_server.entity.Severity;
import com.support.triage.spring_server.exception.InvalidInputException;
import com.support.triage.spring_server.exception.ResourceNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("IssueService")
class IssueServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 5, 1, 12, 0);

    @Mock
    private IssueStore issueStore;
    @Mock
    private CacheFacade cacheFacade;

    private IssueService service;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);
        service = new IssueService(issueStore, cacheFacade, clock);
    }

    @Test
    @DisplayName("listing parses filters by label")
    void listIssues() {
        IssuePage page = new IssuePage(List.of(), 2, 10, 0, 0);
        when(issueStore.findIssues(any(), eq(2), eq(10))).thenReturn(page);

        assertThat(service.listIssues("In Progress", "critical", "c-1", 2, 10)).isSameAs(page);

        ArgumentCaptor<IssueFilter> filter = ArgumentCaptor.forClass(IssueFilter.class);
        verify(issueStore).findIssues(filter.capture(), eq(2), eq(10));
        assertThat(filter.getValue().getStatus()).isEqualTo(IssueStatus.IN_PROGRESS);
        assertThat(filter.getValue().getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(filter.getValue().getCustomerId()).isEqualTo("c-1");
    }

    @Test
    @DisplayName("listing rejects unknown filters and bad paging")
    void listRejects() {
        assertThatThrownBy(() -> service.listIssues("Pending", null, null, 1, 20)).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> service.listIssues(null, null, null, 0, 20)).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> service.listIssues(null, null, null, 1, 500)).isInstanceOf(InvalidInputException.class);
    }

    @Test
    @DisplayName("status update goes through the store and invalidates caches")
    void updateStatus() {
        Issue updated = issue(IssueStatus.RESOLVED);
        updated.setResolutionTimeHours(5.0);
        when(issueStore.updateIssueStatus("i-1", IssueStatus.RESOLVED, NOW)).thenReturn(Optional.of(updated));

        Issue result = service.updateStatus("i-1", new StatusUpdateRequest("Resolved", "agent-7"));

        assertThat(result.getResolutionTimeHours()).isEqualTo(5.0);
        verify(cacheFacade).invalidateCustomer("c-1");
        verify(cacheFacade).invalidateIssue("i-1");
    }

    @Test
    @DisplayName("status update of a missing issue is NotFound")
    void updateMissing() {
        when(issueStore.updateIssueStatus("i-404", IssueStatus.CLOSED, NOW)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.updateStatus("i-404", new StatusUpdateRequest("Closed", "agent-7")))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("status is required and must be known")
    void statusValidation() {
        assertThatThrownBy(() -> service.updateStatus("i-1", new StatusUpdateRequest(null, "x")))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> service.updateStatus("i-1", new StatusUpdateRequest("Paused", "x")))
                .isInstanceOf(InvalidInputException.class);
        verify(issueStore, never()).updateIssueStatus(any(), any(), any());
    }

    @Test
    @DisplayName("recording a resolution resolves the issue and stores the rating")
    void recordResolution() {
        when(issueStore.findIssue("i-1")).thenReturn(Optional.of(issue(IssueStatus.IN_PROGRESS)));
        when(issueStore.insertResolution(any())).thenAnswer(inv -> inv.getArgument(0));

        IssueResolution resolution = service.recordResolution("i-1", new ResolutionRequest(" Rotated cert ", 4, "agent-7"));

        assertThat(resolution.getCustomerId()).isEqualTo("c-1");
        assertThat(resolution.getResolutionSummary()).isEqualTo("Rotated cert");
        assertThat(resolution.getCustomerSatisfaction()).isEqualTo(4);
        verify(issueStore).updateIssueStatus("i-1", IssueStatus.RESOLVED, NOW);
        verify(cacheFacade).invalidateCustomer("c-1");
    }

    @Test
    @DisplayName("satisfaction outside 1..5 is rejected")
    void satisfactionRange() {
        assertThatThrownBy(() -> service.recordResolution("i-1", new ResolutionRequest("done", 6, "x")))
                .isInstanceOf(InvalidInputException.class);
    }

    private static Issue issue(IssueStatus status) {
        Issue issue = new Issue();
        issue.setIssueId("i-1");
        issue.setCustomerId("c-1");
        issue.setStatus(status);
        return issue;
    }
}
