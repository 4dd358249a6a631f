package com.support.triage.spring_server.service;

import com.support.triage.spring_server.dto.CustomerHistoryAggregate;
import com.support.triage.spring_server.dto.RiskAssessment;
import com.support.triage.spring_server.entity.RiskLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RiskScorer")
class RiskScorerTest {

    private final RiskScorer scorer = new RiskScorer();

    @Nested
    @DisplayName("history policy")
    class HistoryPolicy {

        @Test
        @DisplayName("quiet customer is Low")
        void quietCustomer() {
            RiskAssessment result = scorer.assess(aggregate(2, 0, 0, 1, 0, null, null), RiskPolicy.HISTORY);

            assertThat(result.getScore()).isZero();
            assertThat(result.getLevel()).isEqualTo(RiskLevel.LOW);
        }

        @Test
        @DisplayName("one critical issue alone is Medium")
        void singleCritical() {
            RiskAssessment result = scorer.assess(aggregate(3, 0, 1, 0, 1, null, null), RiskPolicy.HISTORY);

            assertThat(result.getScore()).isEqualTo(3.0);
            assertThat(result.getLevel()).isEqualTo(RiskLevel.MEDIUM);
        }

        @Test
        @DisplayName("every factor together reaches the cap")
        void allFactors() {
            RiskAssessment result = scorer.assess(aggregate(25, 2, 1, 5, 8, 72.0, null), RiskPolicy.HISTORY);

            // 2 + 3 + 2 + 2 + 2
            assertThat(result.getScore()).isEqualTo(10.0);
            assertThat(result.getLevel()).isEqualTo(RiskLevel.HIGH);
        }
    }

    @Nested
    @DisplayName("dashboard policy")
    class DashboardPolicy {

        @Test
        @DisplayName("open issues and poor satisfaction raise the score")
        void openAndSatisfaction() {
            RiskAssessment result = scorer.assess(aggregate(4, 2, 0, 1, 3, null, 2.5), RiskPolicy.DASHBOARD);

            // high 1 + open 3.0 + recent 1 + satisfaction 2
            assertThat(result.getScore()).isEqualTo(7.0);
            assertThat(result.getLevel()).isEqualTo(RiskLevel.HIGH);
        }

        @Test
        @DisplayName("score is capped at 10")
        void capped() {
            RiskAssessment result = scorer.assess(aggregate(30, 10, 5, 5, 10, 100.0, 1.0), RiskPolicy.DASHBOARD);

            assertThat(result.getScore()).isEqualTo(10.0);
        }

        @Test
        @DisplayName("unknown satisfaction adds nothing")
        void unknownSatisfaction() {
            RiskAssessment known = scorer.assess(aggregate(1, 0, 0, 0, 0, null, 4.5), RiskPolicy.DASHBOARD);
            RiskAssessment unknown = scorer.assess(aggregate(1, 0, 0, 0, 0, null, null), RiskPolicy.DASHBOARD);

            assertThat(known.getScore()).isZero();
            assertThat(unknown.getScore()).isZero();
        }
    }

    @Test
    @DisplayName("the two policies can disagree on the same aggregate")
    void policiesDiffer() {
        CustomerHistoryAggregate aggregate = aggregate(5, 0, 2, 0, 2, null, null);

        RiskAssessment history = scorer.assess(aggregate, RiskPolicy.HISTORY);
        RiskAssessment dashboard = scorer.assess(aggregate, RiskPolicy.DASHBOARD);

        assertThat(history.getLevel()).isEqualTo(RiskLevel.MEDIUM);
        assertThat(dashboard.getLevel()).isEqualTo(RiskLevel.MEDIUM);
        assertThat(history.getScore()).isEqualTo(3.0);
        assertThat(dashboard.getScore()).isEqualTo(4.0);

        CustomerHistoryAggregate busy = aggregate(5, 3, 0, 2, 5, null, null);
        assertThat(scorer.assess(busy, RiskPolicy.HISTORY).getLevel()).isEqualTo(RiskLevel.LOW);
        assertThat(scorer.assess(busy, RiskPolicy.DASHBOARD).getLevel()).isEqualTo(RiskLevel.HIGH);
    }

    @ParameterizedTest
    @EnumSource(RiskPolicy.class)
    @DisplayName("score never decreases as critical, high or recent counts grow")
    void monotonic(RiskPolicy policy) {
        for (int critical = 0; critical < 6; critical++) {
            for (int high = 0; high < 6; high++) {
                for (int recent = 0; recent < 8; recent++) {
                    double base = scorer.assess(aggregate(10, 1, critical, high, recent, 30.0, 3.5), policy).getScore();
                    assertThat(scorer.assess(aggregate(10, 1, critical + 1, high, recent, 30.0, 3.5), policy).getScore())
                            .isGreaterThanOrEqualTo(base);
                    assertThat(scorer.assess(aggregate(10, 1, critical, high + 1, recent, 30.0, 3.5), policy).getScore())
                            .isGreaterThanOrEqualTo(base);
                    assertThat(scorer.assess(aggregate(10, 1, critical, high, recent + 1, 30.0, 3.5), policy).getScore())
                            .isGreaterThanOrEqualTo(base);
                    assertThat(base).isBetween(0.0, 10.0);
                }
            }
        }
    }

    @Test
    @DisplayName("missing aggregate is Low")
    void nullAggregate() {
        assertThat(scorer.assess(null, RiskPolicy.HISTORY).getLevel()).isEqualTo(RiskLevel.LOW);
    }

    private static CustomerHistoryAggregate aggregate(int total, int open, int critical, int high, int recent,
                                                      Double avgResolutionHours, Double avgSatisfaction) {
        return CustomerHistoryAggregate.builder()
                .totalIssues(total)
                .openIssues(open)
                .criticalIssues(critical)
                .highIssues(high)
                .recentIssues(recent)
                .avgResolutionTimeHours(avgResolutionHours)
                .avgSatisfaction(avgSatisfaction)
                .build();
    }
}
