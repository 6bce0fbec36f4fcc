package com.relationship.scoring.tracing;

import com.relationship.scoring.core.model.PipelineStage;

/**
 * No-op implementation of {@link PipelineTracer}. Every call returns the same inert span.
 */
public class NoOpPipelineTracer implements PipelineTracer {

    private static final AssessmentSpan NO_OP_SPAN = new NoOpSpan();

    @Override
    public AssessmentSpan startAssessment(String recordId) {
        return NO_OP_SPAN;
    }

    @Override
    public AssessmentSpan startBatch(String batchId, int size) {
        return NO_OP_SPAN;
    }

    private static class NoOpSpan implements AssessmentSpan {
        @Override
        public void enterStage(PipelineStage stage) {
        }

        @Override
        public void setFlag(String key, boolean value) {
        }

        @Override
        public void setScore(String key, double value) {
        }

        @Override
        public void setCount(String key, long value) {
        }

        @Override
        public void complete(PipelineStage finalStage) {
        }

        @Override
        public void fail(Throwable error) {
        }

        @Override
        public void close() {
        }
    }
}
