package com.support.triage.spring_server.service;

import com.support.triage.spring_server.dto.CollaboratorResult;
import com.support.triage.spring_server.dto.CompletionRequest;
import com.support.triage.spring_server.dto.SeverityClassification;
import com.support.triage.spring_server.entity.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("SeverityClassifier")
class SeverityClassifierTest {

    @Mock
    private CompletionClient completionClient;

    private SeverityClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new SeverityClassifier(completionClient);
    }

    @Nested
    @DisplayName("keyword scoring")
    class KeywordScoring {

        @Test
        @DisplayName("production outage with data loss is Critical without asking the model")
        void productionDownIsCritical() {
            SeverityClassification result = classifier.classify(
                    "Production database is completely down",
                    "We have a production down situation with data loss risk");

            assertThat(result.getSeverity()).isEqualTo(Severity.CRITICAL);
            assertThat(result.getSource()).isEqualTo(SeverityClassification.Source.KEYWORD);
            assertThat(result.getKeywordScores().get(Severity.CRITICAL)).isEqualTo(6.0);
            verify(completionClient, never()).complete(any());
        }

        @Test
        @DisplayName("two or more critical keyword hits always give Critical")
        void twoCriticalHits() {
            SeverityClassification result = classifier.classify(
                    "Urgent: outage", "feature request for documentation, typo, cosmetic, nice to have, enhancement");

            assertThat(result.getSeverity()).isEqualTo(Severity.CRITICAL);
            verify(completionClient, never()).complete(any());
        }

        @Test
        @DisplayName("matching is case-insensitive over title and description")
        void caseInsensitive() {
            SeverityClassification result = classifier.classify("LOGIN IS BROKEN", "Not Working for everybody");

            assertThat(result.getSeverity()).isEqualTo(Severity.HIGH);
            assertThat(result.getKeywordScores().get(Severity.HIGH)).isEqualTo(4.0);
        }

        @Test
        @DisplayName("equal scores go to the more severe level")
        void tieGoesToMoreSevere() {
            var scores = classifier.keywordScores("error and question and help");
            assertThat(scores.get(Severity.HIGH)).isEqualTo(2.0);
            assertThat(scores.get(Severity.NORMAL)).isEqualTo(2.0);

            SeverityClassification result = classifier.classify("error", "question and help");
            assertThat(result.getSeverity()).isEqualTo(Severity.HIGH);
        }
    }

    @Nested
    @DisplayName("model fallback")
    class ModelFallback {

        @Test
        @DisplayName("weak signal asks the model with a short deterministic request")
        void weakSignalAsksModel() {
            when(completionClient.complete(any())).thenReturn(CollaboratorResult.success(" High. "));

            SeverityClassification result = classifier.classify("Reports page", "The totals look odd since Monday");

            assertThat(result.getSeverity()).isEqualTo(Severity.HIGH);
            assertThat(result.getSource()).isEqualTo(SeverityClassification.Source.MODEL);

            ArgumentCaptor<CompletionRequest> captor = ArgumentCaptor.forClass(CompletionRequest.class);
            verify(completionClient).complete(captor.capture());
            assertThat(captor.getValue().getMaxTokens()).isEqualTo(10);
            assertThat(captor.getValue().getTemperature()).isEqualTo(0.1);
            assertThat(captor.getValue().getPrompt()).contains("Reports page", "Critical, High, Normal, or Low");
        }

        @Test
        @DisplayName("an answer outside the four levels is discarded for the keyword result")
        void invalidAnswerDiscarded() {
            when(completionClient.complete(any())).thenReturn(CollaboratorResult.success("Severe"));

            SeverityClassification result = classifier.classify("Small question", "Exporting a report");

            assertThat(result.getSeverity()).isEqualTo(Severity.NORMAL);
            assertThat(result.getSource()).isEqualTo(SeverityClassification.Source.KEYWORD);
        }

        @Test
        @DisplayName("unavailable model and no keyword hit default to Normal")
        void defaultsToNormal() {
            when(completionClient.complete(any())).thenReturn(CollaboratorResult.unavailable("timeout"));

            SeverityClassification result = classifier.classify("Reports page", "The totals look odd");

            assertThat(result.getSeverity()).isEqualTo(Severity.NORMAL);
            assertThat(result.getSource()).isEqualTo(SeverityClassification.Source.DEFAULT);
        }

        @Test
        @DisplayName("low keyword score is kept when the model fails")
        void lowScoreKeptOnFailure() {
            when(completionClient.complete(any())).thenReturn(CollaboratorResult.unavailable("down"));

            SeverityClassification result = classifier.classify("Typo on pricing page", "cosmetic only");

            assertThat(result.getSeverity()).isEqualTo(Severity.LOW);
            assertThat(result.getSource()).isEqualTo(SeverityClassification.Source.KEYWORD);
        }
    }

    @Test
    @DisplayName("model answers are normalised before matching")
    void parseAnswer() {
        assertThat(SeverityClassifier.parseAnswer("critical")).contains(Severity.CRITICAL);
        assertThat(SeverityClassifier.parseAnswer("\"Low\"")).contains(Severity.LOW);
        assertThat(SeverityClassifier.parseAnswer("Normal.\n")).contains(Severity.NORMAL);
        assertThat(SeverityClassifier.parseAnswer("High priority")).isEmpty();
        assertThat(SeverityClassifier.parseAnswer(null)).isEmpty();
    }
}
