package com.relationship.scoring.tracing;

import com.relationship.scoring.core.model.PipelineStage;

/**
 * A traced assessment or batch. Closing the span ends it.
 *
 * <pre>
 * try (AssessmentSpan span = tracer.startAssessment(recordId)) {
 *     span.enterStage(PipelineStage.BAD_DOMAIN_CHECK);
 *     span.setFlag("relationship.bad_domain", false);
 *     span.complete(PipelineStage.PAYLOAD_READY);
 * }
 * </pre>
 */
public interface AssessmentSpan extends AutoCloseable {

    /**
     * Records entry into a pipeline state as a span event.
     */
    void enterStage(PipelineStage stage);

    void setFlag(String key, boolean value);

    void setScore(String key, double value);

    void setCount(String key, long value);

    /**
     * Marks the span successful and records the terminal stage.
     */
    void complete(PipelineStage finalStage);

    /**
     * Marks the span failed and attaches the exception.
     */
    void fail(Throwable error);

    @Override
    void close();
}
