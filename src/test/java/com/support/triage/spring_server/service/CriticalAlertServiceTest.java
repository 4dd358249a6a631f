package com.support.triage.spring_server.service;

import com.support.triage.spring_server.dto.ActiveAlertView;
import com.support.triage.spring_server.dto.AlertActionResult;
import com.support.triage.spring_server.entity.AlertType;
import com.support.triage.spring_server.entity.CriticalAlert;
import com.support.triage.spring_server.entity.Customer;
import com.support.triage.spring_server.entity.Issue;
import com.support.triage.spring_server.entity.Severity;
import com.support.triage.spring_server.exception.InvalidInputException;
import com.support.triage.spring_server.exception.ResourceNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
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
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("CriticalAlertService")
class CriticalAlertServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Mock
    private IssueStore issueStore;

    private CriticalAlertService service;

    @BeforeEach
    void setUp() {
        service = new CriticalAlertService(issueStore, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("active alerts are joined with their issue and customer")
    void activeAlerts() {
        CriticalAlert unattended = alert("a-1", "i-1", "c-1", AlertType.UNATTENDED);
        CriticalAlert escalation = alert("a-2", "i-1", "c-1", AlertType.CUSTOMER_ESCALATION);
        Issue issue = new Issue();
        issue.setIssueId("i-1");
        issue.setTitle("Checkout down");
        issue.setSeverity(Severity.CRITICAL);
        Customer customer = new Customer();
        customer.setCustomerName("Ada");
        customer.setCompany("Acme");
        when(issueStore.findActiveAlerts()).thenReturn(List.of(unattended, escalation));
        when(issueStore.findIssue("i-1")).thenReturn(Optional.of(issue));
        when(issueStore.findCustomer("c-1")).thenReturn(Optional.of(customer));

        List<ActiveAlertView> views = service.getActiveAlerts();

        assertThat(views).hasSize(2);
        assertThat(views.get(0).getIssueTitle()).isEqualTo("Checkout down");
        assertThat(views.get(0).getIssueSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(views.get(1).getCompany()).isEqualTo("Acme");
        verify(issueStore, times(1)).findIssue("i-1");
        verify(issueStore, times(1)).findCustomer("c-1");
    }

    @Test
    @DisplayName("acknowledging an active alert succeeds")
    void acknowledge() {
        when(issueStore.findAlert("a-1")).thenReturn(Optional.of(alert("a-1", "i-1", "c-1", AlertType.UNATTENDED)));
        when(issueStore.acknowledgeAlert("a-1", "agent-7", LocalDateTime.ofInstant(NOW, ZoneOffset.UTC))).thenReturn(true);

        AlertActionResult result = service.acknowledge("a-1", "agent-7");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getMessage()).isEqualTo("Alert acknowledged successfully");
    }

    @Test
    @DisplayName("acknowledging a non-active alert fails")
    void acknowledgeNotActive() {
        when(issueStore.findAlert("a-1")).thenReturn(Optional.of(alert("a-1", "i-1", "c-1", AlertType.UNATTENDED)));
        when(issueStore.acknowledgeAlert(anyString(), anyString(), any())).thenReturn(false);

        assertThat(service.acknowledge("a-1", "agent-7").isSuccess()).isFalse();
    }

    @Test
    @DisplayName("acknowledging needs an actor")
    void acknowledgeWithoutActor() {
        assertThatThrownBy(() -> service.acknowledge("a-1", " ")).isInstanceOf(InvalidInputException.class);
        verify(issueStore, never()).acknowledgeAlert(anyString(), anyString(), any());
    }

    @Test
    @DisplayName("resolving requires the alert to be acknowledged first")
    void resolveBeforeAcknowledge() {
        when(issueStore.findAlert("a-1")).thenReturn(Optional.of(alert("a-1", "i-1", "c-1", AlertType.UNATTENDED)));
        when(issueStore.resolveAlert(anyString(), any())).thenReturn(false);

        AlertActionResult result = service.resolve("a-1");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getMessage()).contains("acknowledged");
    }

    @Test
    @DisplayName("unknown alert is NotFound")
    void unknownAlert() {
        when(issueStore.findAlert("a-404")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.resolve("a-404")).isInstanceOf(ResourceNotFoundException.class);
    }

    private static CriticalAlert alert(String id, String issueId, String customerId, AlertType type) {
        CriticalAlert alert = new CriticalAlert();
        alert.setAlertId(id);
        alert.setIssueId(issueId);
        alert.setCustomerId(customerId);
        alert.setAlertType(type);
        return alert;
    }
}
