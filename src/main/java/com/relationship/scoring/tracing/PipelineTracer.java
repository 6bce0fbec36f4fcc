package com.relationship.scoring.tracing;

/**
 * Interface for tracing pipeline runs.
 * The default {@link NoOpPipelineTracer} does nothing, so the engine works
 * without a tracing backend.
 */
public interface PipelineTracer {

    AssessmentSpan startAssessment(String recordId);

    AssessmentSpan startBatch(String batchId, int size);
}
