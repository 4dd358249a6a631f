package com.support.triage.spring_server.service;

import com.support.triage.spring_server.dto.CriticalCondition;
import com.support.triage.spring_server.entity.AlertStatus;
import com.support.triage.spring_server.entity.AlertType;
import com.support.triage.spring_server.entity.CriticalAlert;
import com.support.triage.spring_server.entity.Issue;
import com.support.triage.spring_server.entity.IssueStatus;
import com.support.triage.spring_server.entity.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("CriticalConditionDetector")
class CriticalConditionDetectorTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
    private static final LocalDateTime NOW_LOCAL = LocalDateTime.ofInstant(NOW, ZoneOffset.UTC);

    @Mock
    private IssueStore issueStore;

    private CriticalConditionDetector detector;

    @BeforeEach
    void setUp() {
        detector = new CriticalConditionDetector(issueStore, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Nested
    @DisplayName("unattended critical issues")
    class Unattended {

        @Test
        @DisplayName("critical issue open for 25 hours raises one Unattended alert")
        void twentyFiveHours() {
            givenActiveIssues(issue("i-1", Severity.CRITICAL, NOW_LOCAL.minusHours(25)));
            when(issueStore.insertAlertIfAbsent(any())).thenAnswer(inv -> {
                CriticalAlert alert = inv.getArgument(0);
                alert.setAlertId("a-1");
                return new IssueStore.AlertWrite(alert, true);
            });

            List<CriticalCondition> conditions = detector.detect("c-1", "i-9");

            assertThat(conditions).hasSize(1);
            CriticalCondition condition = conditions.get(0);
            assertThat(condition.getType()).isEqualTo(CriticalCondition.ConditionType.UNATTENDED_CRITICAL);
            assertThat(condition.getIssueId()).isEqualTo("i-1");
            assertThat(condition.getHoursOpen()).isEqualTo(25L);
            assertThat(condition.getMessage()).isEqualTo("Critical issue #i-1 has been unattended for 25 hours");
            assertThat(condition.getAlertId()).isEqualTo("a-1");
            assertThat(condition.isNewAlert()).isTrue();

            ArgumentCaptor<CriticalAlert> captor = ArgumentCaptor.forClass(CriticalAlert.class);
            verify(issueStore).insertAlertIfAbsent(captor.capture());
            CriticalAlert alert = captor.getValue();
            assertThat(alert.getAlertType()).isEqualTo(AlertType.UNATTENDED);
            assertThat(alert.getSeverity()).isEqualTo(Severity.HIGH);
            assertThat(alert.getStatus()).isEqualTo(AlertStatus.ACTIVE);
            assertThat(alert.getDedupKey()).isEqualTo("issue:i-1:UNATTENDED");
            assertThat(alert.isOpen()).isTrue();
        }

        @Test
        @DisplayName("critical issue open for 23 hours raises nothing")
        void twentyThreeHours() {
            givenActiveIssues(issue("i-1", Severity.CRITICAL, NOW_LOCAL.minusHours(23)));

            assertThat(detector.detect("c-1", null)).isEmpty();
            verify(issueStore, never()).insertAlertIfAbsent(any());
        }

        @Test
        @DisplayName("exactly 24 hours is not yet unattended")
        void boundary() {
            givenActiveIssues(issue("i-1", Severity.CRITICAL, NOW_LOCAL.minusHours(24)));

            assertThat(detector.detect("c-1", null)).isEmpty();
        }

        @Test
        @DisplayName("an already open alert is reported again but not duplicated")
        void deduplicated() {
            givenActiveIssues(issue("i-1", Severity.CRITICAL, NOW_LOCAL.minusHours(30)));
            CriticalAlert existing = new CriticalAlert();
            existing.setAlertId("a-existing");
            when(issueStore.insertAlertIfAbsent(any())).thenReturn(new IssueStore.AlertWrite(existing, false));

            List<CriticalCondition> conditions = detector.detect("c-1", null);

            assertThat(conditions).hasSize(1);
            assertThat(conditions.get(0).getAlertId()).isEqualTo("a-existing");
            assertThat(conditions.get(0).isNewAlert()).isFalse();
        }
    }

    @Nested
    @DisplayName("multiple high severity issues")
    class MultipleHighSeverity {

        @Test
        @DisplayName("three high or critical issues within 7 days raise a customer escalation")
        void threeIssues() {
            givenActiveIssues(
                    issue("i-1", Severity.HIGH, NOW_LOCAL.minusDays(1)),
                    issue("i-2", Severity.HIGH, NOW_LOCAL.minusDays(3)),
                    issue("i-3", Severity.CRITICAL, NOW_LOCAL.minusHours(2)),
                    issue("i-4", Severity.NORMAL, NOW_LOCAL.minusHours(2)));
            when(issueStore.insertAlertIfAbsent(any())).thenAnswer(inv -> new IssueStore.AlertWrite(inv.getArgument(0), true));

            List<CriticalCondition> conditions = detector.detect("c-1", "i-3");

            assertThat(conditions).hasSize(1);
            CriticalCondition condition = conditions.get(0);
            assertThat(condition.getType()).isEqualTo(CriticalCondition.ConditionType.MULTIPLE_HIGH_SEVERITY);
            assertThat(condition.getAlertType()).isEqualTo(AlertType.CUSTOMER_ESCALATION);
            assertThat(condition.getCount()).isEqualTo(3);
            assertThat(condition.getIssueId()).isEqualTo("i-3");
            assertThat(condition.getMessage()).isEqualTo("Customer has 3 high-severity issues in the last 7 days");

            ArgumentCaptor<CriticalAlert> captor = ArgumentCaptor.forClass(CriticalAlert.class);
            verify(issueStore).insertAlertIfAbsent(captor.capture());
            assertThat(captor.getValue().getDedupKey()).isEqualTo("customer:c-1:CUSTOMER_ESCALATION");
        }

        @Test
        @DisplayName("three high issues in progress raise a customer escalation")
        void threeInProgress() {
            givenActiveIssues(
                    issue("i-1", Severity.HIGH, NOW_LOCAL.minusDays(1), IssueStatus.IN_PROGRESS),
                    issue("i-2", Severity.HIGH, NOW_LOCAL.minusDays(2), IssueStatus.IN_PROGRESS),
                    issue("i-3", Severity.HIGH, NOW_LOCAL.minusHours(5), IssueStatus.IN_PROGRESS));
            when(issueStore.insertAlertIfAbsent(any())).thenAnswer(inv -> new IssueStore.AlertWrite(inv.getArgument(0), true));

            List<CriticalCondition> conditions = detector.detect("c-1", "i-3");

            assertThat(conditions).singleElement()
                    .satisfies(c -> {
                        assertThat(c.getType()).isEqualTo(CriticalCondition.ConditionType.MULTIPLE_HIGH_SEVERITY);
                        assertThat(c.getCount()).isEqualTo(3);
                    });
        }

        @Test
        @DisplayName("resolved and closed issues are not counted")
        void inactiveIssuesIgnored() {
            givenActiveIssues(
                    issue("i-1", Severity.HIGH, NOW_LOCAL.minusDays(1), IssueStatus.OPEN),
                    issue("i-2", Severity.HIGH, NOW_LOCAL.minusDays(2), IssueStatus.RESOLVED),
                    issue("i-3", Severity.CRITICAL, NOW_LOCAL.minusDays(2), IssueStatus.CLOSED));

            assertThat(detector.detect("c-1", null)).isEmpty();
            assertThat(IssueStatus.ACTIVE).containsExactlyInAnyOrder(IssueStatus.OPEN, IssueStatus.IN_PROGRESS);
            verify(issueStore, never()).insertAlertIfAbsent(any());
        }

        @Test
        @DisplayName("two high severity issues raise nothing")
        void twoIssues() {
            givenActiveIssues(
                    issue("i-1", Severity.HIGH, NOW_LOCAL.minusDays(1)),
                    issue("i-2", Severity.HIGH, NOW_LOCAL.minusDays(2)));

            assertThat(detector.detect("c-1", null)).isEmpty();
        }

        @Test
        @DisplayName("issues older than 7 days do not count")
        void outsideWindow() {
            givenActiveIssues(
                    issue("i-1", Severity.HIGH, NOW_LOCAL.minusDays(1)),
                    issue("i-2", Severity.HIGH, NOW_LOCAL.minusDays(2)),
                    issue("i-3", Severity.HIGH, NOW_LOCAL.minusDays(8)));

            assertThat(detector.detect("c-1", null)).isEmpty();
        }
    }

    @Test
    @DisplayName("store failure yields no conditions")
    void storeFailure() {
        when(issueStore.findIssuesByCustomerAndStatus(eq("c-1"), any()))
                .thenThrow(new DataAccessResourceFailureException("mongo down"));

        assertThat(detector.detect("c-1", null)).isEmpty();
    }

    @Test
    @DisplayName("alert write failure keeps the condition without an alert id")
    void alertWriteFailure() {
        givenActiveIssues(issue("i-1", Severity.CRITICAL, NOW_LOCAL.minusHours(48)));
        when(issueStore.insertAlertIfAbsent(any())).thenThrow(new DataAccessResourceFailureException("write failed"));

        List<CriticalCondition> conditions = detector.detect("c-1", null);

        assertThat(conditions).hasSize(1);
        assertThat(conditions.get(0).getAlertId()).isNull();
        assertThat(conditions.get(0).isNewAlert()).isFalse();
    }

    private void givenActiveIssues(Issue... issues) {
        when(issueStore.findIssuesByCustomerAndStatus("c-1", IssueStatus.ACTIVE)).thenReturn(List.of(issues));
    }

    private static Issue issue(String id, Severity severity, LocalDateTime createdAt) {
        return issue(id, severity, createdAt, IssueStatus.OPEN);
    }

    private static Issue issue(String id, Severity severity, LocalDateTime createdAt, IssueStatus status) {
        Issue issue = new Issue();
        issue.setIssueId(id);
        issue.setCustomerId("c-1");
        issue.setTitle("Issue " + id);
        issue.setSeverity(severity);
        issue.setStatus(status);
        issue.setCreatedAt(createdAt);
        return issue;
    }
}
