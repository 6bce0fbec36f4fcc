package com.relationship.scoring.api;

import com.relationship.scoring.core.model.BadDomainResult;
import com.relationship.scoring.core.model.ConsistencyResult;
import com.relationship.scoring.core.model.FlagPayload;
import com.relationship.scoring.core.model.PipelineStage;
import com.relationship.scoring.core.model.Record;
import com.relationship.scoring.core.model.RecordField;
import com.relationship.scoring.identifier.IdentifierCodec;
import com.relationship.scoring.judgment.JudgmentResult;
import com.relationship.scoring.judgment.RelationshipJudge;
import com.relationship.scoring.logging.LogContext;
import com.relationship.scoring.metrics.MetricsService;
import com.relationship.scoring.metrics.NoOpMetricsService;
import com.relationship.scoring.metrics.ScoreKind;
import com.relationship.scoring.scoring.ConsistencyScorer;
import com.relationship.scoring.source.RecordSource;
import com.relationship.scoring.tracing.AssessmentSpan;
import com.relationship.scoring.tracing.NoOpPipelineTracer;
import com.relationship.scoring.tracing.PipelineTracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs one customer record through the flag state machine:
 *
 * <pre>
 * START -> BAD_DOMAIN_CHECK -> STOP
 *                           -> SHELL_CHECK -> CONSISTENCY_SCORING [-> SHELL_COHERENCE_SCORING] -> PAYLOAD_READY
 * </pre>
 *
 * <p>A bad domain ends the run with only the bad-domain result populated and no judgment.
 * Shell coherence and address consistency are scored only when the record has a distinct
 * parent and the parent could be fetched. A failed parent lookup is not fatal: the payload
 * is still built, and the judgment is replaced by an error result.</p>
 *
 * <p>Thread-safe; one instance serves concurrent batch workers.</p>
 */
public class RelationshipFlagPipeline {
    private static final Logger log = LoggerFactory.getLogger(RelationshipFlagPipeline.class);

    private final ConsistencyScorer scorer;
    private final RecordSource recordSource;
    private final RelationshipJudge judge;
    private final MetricsService metrics;
    private final PipelineTracer tracer;

    public RelationshipFlagPipeline(ConsistencyScorer scorer, RecordSource recordSource) {
        this(scorer, recordSource, null, new NoOpMetricsService(), new NoOpPipelineTracer());
    }

    /**
     * @param judge the judgment orchestrator, or null to return computed scores only
     */
    public RelationshipFlagPipeline(ConsistencyScorer scorer, RecordSource recordSource,
                                    RelationshipJudge judge, MetricsService metrics,
                                    PipelineTracer tracer) {
        this.scorer = Objects.requireNonNull(scorer, "scorer is required");
        this.recordSource = Objects.requireNonNull(recordSource, "recordSource is required");
        this.judge = judge;
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
        this.tracer = Objects.requireNonNull(tracer, "tracer is required");
    }

    /**
     * True when {@code ParentIdentifier} is set and does not denote the record itself.
     * A record whose parent points to itself, in either 15- or 18-character form, has no shell.
     */
    public static boolean hasShell(Record customer) {
        String parentId = customer.get(RecordField.PARENT_IDENTIFIER);
        return !parentId.isEmpty() && !IdentifierCodec.sameEntity(customer.identifier(), parentId);
    }

    public RelationshipAssessment run(Record customer) {
        Objects.requireNonNull(customer, "customer record is required");
        String recordId = customer.identifier();
        long start = System.nanoTime();
        List<PipelineStage> stages = new ArrayList<>();

        try (LogContext ctx = LogContext.forAssessment(LogContext.generateCorrelationId(), recordId);
             AssessmentSpan span = tracer.startAssessment(recordId)) {
            try {
                return runStages(customer, recordId, stages, span, start);
            } catch (RuntimeException e) {
                span.fail(e);
                log.error("assessment.failed recordId={} reason={}", recordId, e.getMessage(), e);
                throw e;
            }
        }
    }

    private RelationshipAssessment runStages(Record customer, String recordId, List<PipelineStage> stages,
                                             AssessmentSpan span, long start) {
        enter(PipelineStage.START, stages, span);

        enter(PipelineStage.BAD_DOMAIN_CHECK, stages, span);
        BadDomainResult badDomain = scorer.badDomain(customer);
        span.setFlag("relationship.bad_domain", badDomain.bad());
        if (badDomain.bad()) {
            enter(PipelineStage.STOP, stages, span);
            metrics.incrementBadDomain();
            log.info("assessment.stopped recordId={} reason=\"{}\"", recordId, badDomain.summary());
            return finish(RelationshipAssessment.builder()
                    .recordId(recordId)
                    .flags(FlagPayload.badDomainOnly(badDomain))
                    .stages(stages)
                    .build(), span, start);
        }

        enter(PipelineStage.SHELL_CHECK, stages, span);
        boolean hasShell = hasShell(customer);
        span.setFlag("relationship.has_shell", hasShell);
        Record shell = null;
        String lookupError = null;
        if (hasShell) {
            metrics.incrementShellDetected();
            String parentId = customer.get(RecordField.PARENT_IDENTIFIER);
            try {
                Optional<Record> fetched = recordSource.fetchByIdentifier(parentId);
                if (fetched.isPresent()) {
                    shell = fetched.get();
                } else {
                    log.info("Parent record {} of {} not found, skipping shell scoring", parentId, recordId);
                }
            } catch (RuntimeException e) {
                lookupError = "Parent record lookup failed: " + e.getMessage();
                log.warn("Parent record lookup for {} failed: {}", recordId, e.getMessage(), e);
                span.setFlag("relationship.parent_lookup_failed", true);
            }
        }

        enter(PipelineStage.CONSISTENCY_SCORING, stages, span);
        ConsistencyResult customerConsistency = scorer.customerConsistency(customer);
        metrics.recordConsistencyScore(ScoreKind.CUSTOMER_CONSISTENCY, customerConsistency.score());
        span.setScore("relationship.customer_consistency", customerConsistency.score());
        FlagPayload.Builder flags = FlagPayload.builder()
                .badDomain(badDomain)
                .hasShell(hasShell)
                .customerConsistency(customerConsistency);

        if (shell != null) {
            enter(PipelineStage.SHELL_COHERENCE_SCORING, stages, span);
            ConsistencyResult coherence = scorer.shellCoherence(customer, shell);
            metrics.recordConsistencyScore(ScoreKind.SHELL_COHERENCE, coherence.score());
            span.setScore("relationship.shell_coherence", coherence.score());
            flags.shellCoherence(coherence)
                    .addressConsistency(scorer.addressConsistency(customer, shell));
        }

        enter(PipelineStage.PAYLOAD_READY, stages, span);
        FlagPayload payload = flags.build();

        JudgmentResult judgment = null;
        if (lookupError != null) {
            judgment = JudgmentResult.error(lookupError);
        } else if (judge != null) {
            judgment = judge.judge(customer, shell, payload);
        }
        if (judgment != null && !judgment.success()) {
            metrics.incrementJudgmentFailure();
        }

        return finish(RelationshipAssessment.builder()
                .recordId(recordId)
                .flags(payload)
                .stages(stages)
                .shellRecord(shell)
                .judgment(judgment)
                .build(), span, start);
    }

    private RelationshipAssessment finish(RelationshipAssessment assessment, AssessmentSpan span, long start) {
        PipelineStage finalStage = assessment.getFinalStage();
        span.complete(finalStage);
        metrics.recordAssessmentDuration(finalStage, Duration.ofNanos(System.nanoTime() - start));
        log.info("assessment.completed recordId={} stage={} hasShell={}",
                assessment.getRecordId(), finalStage, assessment.hasShell());
        return assessment;
    }

    private static void enter(PipelineStage stage, List<PipelineStage> stages, AssessmentSpan span) {
        stages.add(stage);
        span.enterStage(stage);
    }
}
