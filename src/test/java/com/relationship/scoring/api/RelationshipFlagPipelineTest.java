package com.relationship.scoring.api;

import com.relationship.scoring.core.model.FlagPayload;
import com.relationship.scoring.core.model.PipelineStage;
import com.relationship.scoring.core.model.Record;
import com.relationship.scoring.domain.BadDomainSet;
import com.relationship.scoring.judgment.JudgmentResult;
import com.relationship.scoring.judgment.RelationshipJudge;
import com.relationship.scoring.metrics.MetricsService;
import com.relationship.scoring.metrics.ScoreKind;
import com.relationship.scoring.scoring.ConsistencyScorer;
import com.relationship.scoring.source.RecordSource;
import com.relationship.scoring.source.RecordSourceException;
import com.relationship.scoring.tracing.AssessmentSpan;
import com.relationship.scoring.tracing.PipelineTracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@DisplayName("RelationshipFlagPipeline Tests")
class RelationshipFlagPipelineTest {

    private static final String CUSTOMER_ID = "001xx000003DGg2AAG";
    private static final String PARENT_ID = "001xx000004ABcD";

    private RecordSource recordSource;
    private RelationshipJudge judge;
    private MetricsService metrics;
    private PipelineTracer tracer;
    private AssessmentSpan span;
    private RelationshipFlagPipeline pipeline;

    @BeforeEach
    void setUp() {
        recordSource = mock(RecordSource.class);
        judge = mock(RelationshipJudge.class);
        metrics = mock(MetricsService.class);
        tracer = mock(PipelineTracer.class);
        span = mock(AssessmentSpan.class);
        when(tracer.startAssessment(any())).thenReturn(span);
        when(judge.judge(any(), any(), any())).thenReturn(JudgmentResult.of(90, List.of("Looks legitimate")));

        ConsistencyScorer scorer = new ConsistencyScorer(BadDomainSet.of("gmail.com", "ringcentral.com"));
        pipeline = new RelationshipFlagPipeline(scorer, recordSource, judge, metrics, tracer);
    }

    private static Record.Builder customer() {
        return Record.builder()
                .identifier(CUSTOMER_ID)
                .name("Acme Widgets")
                .website("acmewidgets.com")
                .contactEmail("ops@acmewidgets.com")
                .billingAddress("CA", "US", "94105");
    }

    private static Record shell() {
        return Record.builder()
                .identifier(PARENT_ID)
                .name("Acme Widgets Holdings")
                .website("acme-widgets.com")
                .enrichedAddress("CA", "US", "94105")
                .build();
    }

    @Nested
    @DisplayName("Shell detection")
    class ShellDetectionTests {

        @Test
        @DisplayName("Parent pointing at the record itself is not a shell")
        void selfParent() {
            Record self15 = customer().parentIdentifier("001xx000003DGg2").build();
            Record self18 = customer().parentIdentifier(CUSTOMER_ID).build();

            assertFalse(RelationshipFlagPipeline.hasShell(self15));
            assertFalse(RelationshipFlagPipeline.hasShell(self18));
        }

        @Test
        @DisplayName("Distinct parent is a shell, blank parent is not")
        void distinctParent() {
            assertTrue(RelationshipFlagPipeline.hasShell(customer().parentIdentifier(PARENT_ID).build()));
            assertFalse(RelationshipFlagPipeline.hasShell(customer().parentIdentifier(" ").build()));
            assertFalse(RelationshipFlagPipeline.hasShell(customer().build()));
        }

        @Test
        @DisplayName("Self-parent record runs without a lookup")
        void selfParentSkipsLookup() {
            RelationshipAssessment assessment = pipeline.run(customer().parentIdentifier("001xx000003DGg2").build());

            assertFalse(assessment.hasShell());
            verifyNoInteractions(recordSource);
            assertEquals(List.of(PipelineStage.START, PipelineStage.BAD_DOMAIN_CHECK, PipelineStage.SHELL_CHECK,
                    PipelineStage.CONSISTENCY_SCORING, PipelineStage.PAYLOAD_READY), assessment.getStages());
        }
    }

    @Nested
    @DisplayName("Bad domain short-circuit")
    class BadDomainTests {

        @Test
        @DisplayName("Bad domain stops the run before any scoring or judgment")
        void stops() {
            Record record = customer().contactEmail("owner@gmail.com").parentIdentifier(PARENT_ID).build();

            RelationshipAssessment assessment = pipeline.run(record);

            assertTrue(assessment.isBadDomain());
            assertEquals(PipelineStage.STOP, assessment.getFinalStage());
            assertEquals(List.of(PipelineStage.START, PipelineStage.BAD_DOMAIN_CHECK, PipelineStage.STOP),
                    assessment.getStages());
            FlagPayload flags = assessment.getFlags().orElseThrow();
            assertTrue(flags.getHasShell().isEmpty());
            assertTrue(flags.getCustomerConsistency().isEmpty());
            assertTrue(assessment.getJudgment().isEmpty());

            verifyNoInteractions(recordSource, judge);
            verify(metrics).incrementBadDomain();
            verify(span).complete(PipelineStage.STOP);
        }
    }

    @Nested
    @DisplayName("Full run")
    class FullRunTests {

        @Test
        @DisplayName("Resolved shell gets coherence and address flags")
        void withShell() {
            Record record = customer().parentIdentifier(PARENT_ID).build();
            when(recordSource.fetchByIdentifier(PARENT_ID)).thenReturn(Optional.of(shell()));

            RelationshipAssessment assessment = pipeline.run(record);

            FlagPayload flags = assessment.getFlags().orElseThrow();
            assertTrue(flags.hasShell());
            assertTrue(flags.getShellCoherence().isPresent());
            assertTrue(flags.getAddressConsistency().orElseThrow().consistent());
            assertEquals(shell(), assessment.getShellRecord().orElseThrow());
            assertEquals(List.of(PipelineStage.START, PipelineStage.BAD_DOMAIN_CHECK, PipelineStage.SHELL_CHECK,
                    PipelineStage.CONSISTENCY_SCORING, PipelineStage.SHELL_COHERENCE_SCORING,
                    PipelineStage.PAYLOAD_READY), assessment.getStages());
            assertEquals(90, assessment.getJudgment().orElseThrow().confidenceScore());

            verify(judge).judge(eq(record), eq(shell()), eq(flags));
            verify(metrics).incrementShellDetected();
            verify(metrics).recordConsistencyScore(eq(ScoreKind.CUSTOMER_CONSISTENCY), anyDouble());
            verify(metrics).recordConsistencyScore(eq(ScoreKind.SHELL_COHERENCE), anyDouble());
            verify(metrics).recordAssessmentDuration(eq(PipelineStage.PAYLOAD_READY), any(Duration.class));
            verify(span).complete(PipelineStage.PAYLOAD_READY);
        }

        @Test
        @DisplayName("No parent: only customer consistency is scored")
        void withoutShell() {
            RelationshipAssessment assessment = pipeline.run(customer().build());

            FlagPayload flags = assessment.getFlags().orElseThrow();
            assertEquals(Optional.of(false), flags.getHasShell());
            assertTrue(flags.getCustomerConsistency().isPresent());
            assertTrue(flags.getShellCoherence().isEmpty());
            assertTrue(flags.getAddressConsistency().isEmpty());
            verify(judge).judge(any(), isNull(), eq(flags));
        }

        @Test
        @DisplayName("Parent not found: shell scoring skipped, judgment still requested")
        void parentNotFound() {
            Record record = customer().parentIdentifier(PARENT_ID).build();
            when(recordSource.fetchByIdentifier(PARENT_ID)).thenReturn(Optional.empty());

            RelationshipAssessment assessment = pipeline.run(record);

            FlagPayload flags = assessment.getFlags().orElseThrow();
            assertTrue(flags.hasShell());
            assertTrue(flags.getShellCoherence().isEmpty());
            assertFalse(assessment.getStages().contains(PipelineStage.SHELL_COHERENCE_SCORING));
            assertTrue(assessment.getJudgment().orElseThrow().success());
            verify(judge).judge(any(), isNull(), any());
        }

        @Test
        @DisplayName("Parent lookup failure: payload built, judgment replaced by an error")
        void lookupFailure() {
            Record record = customer().parentIdentifier(PARENT_ID).build();
            when(recordSource.fetchByIdentifier(PARENT_ID))
                    .thenThrow(new RecordSourceException(PARENT_ID, "connection refused"));

            RelationshipAssessment assessment = pipeline.run(record);

            assertFalse(assessment.isFailed());
            assertEquals(PipelineStage.PAYLOAD_READY, assessment.getFinalStage());
            assertTrue(assessment.getFlags().orElseThrow().getCustomerConsistency().isPresent());
            JudgmentResult judgment = assessment.getJudgment().orElseThrow();
            assertFalse(judgment.success());
            assertEquals(0, judgment.confidenceScore());
            assertTrue(judgment.explanationBullets().get(0).contains("Parent record lookup failed: connection refused"));

            verifyNoInteractions(judge);
            verify(metrics).incrementJudgmentFailure();
            verify(span).setFlag("relationship.parent_lookup_failed", true);
        }

        @Test
        @DisplayName("Without a judge only computed scores are returned")
        void withoutJudge() {
            RelationshipFlagPipeline scoresOnly = new RelationshipFlagPipeline(
                    new ConsistencyScorer(BadDomainSet.empty()), recordSource);

            RelationshipAssessment assessment = scoresOnly.run(customer().build());

            assertTrue(assessment.getJudgment().isEmpty());
            assertTrue(assessment.getFlags().isPresent());
        }
    }

    @Nested
    @DisplayName("Tracing")
    class TracingTests {

        @Test
        @DisplayName("An escaping exception marks the span failed and is rethrown")
        void escapingExceptionFailsSpan() {
            IllegalStateException error = new IllegalStateException("judge exploded");
            when(judge.judge(any(), any(), any())).thenThrow(error);

            IllegalStateException thrown = assertThrows(IllegalStateException.class,
                    () -> pipeline.run(customer().build()));

            assertSame(error, thrown);
            verify(span).fail(error);
            verify(span, never()).complete(any());
            verify(span).close();
        }
    }
}
