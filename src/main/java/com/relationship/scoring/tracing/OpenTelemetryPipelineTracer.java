package com.relationship.scoring.tracing;

import com.relationship.scoring.core.model.PipelineStage;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

import java.util.Objects;

/**
 * OpenTelemetry-based implementation of {@link PipelineTracer}.
 *
 * <p>Spans: {@code relationship.assess} (attribute {@code relationship.record_id}) and
 * {@code relationship.batch} (attributes {@code relationship.batch_id},
 * {@code relationship.batch_size}). Stage transitions are span events named
 * {@code stage.<STAGE>}.</p>
 */
public class OpenTelemetryPipelineTracer implements PipelineTracer {

    static final String ASSESS_SPAN = "relationship.assess";
    static final String BATCH_SPAN = "relationship.batch";
    static final String FINAL_STAGE = "relationship.final_stage";

    private final Tracer tracer;

    public OpenTelemetryPipelineTracer(Tracer tracer) {
        this.tracer = Objects.requireNonNull(tracer, "tracer is required");
    }

    @Override
    public AssessmentSpan startAssessment(String recordId) {
        Span span = tracer.spanBuilder(ASSESS_SPAN)
                .setAttribute("relationship.record_id", recordId != null ? recordId : "")
                .startSpan();
        return new OTelAssessmentSpan(span);
    }

    @Override
    public AssessmentSpan startBatch(String batchId, int size) {
        Span span = tracer.spanBuilder(BATCH_SPAN)
                .setAttribute("relationship.batch_id", batchId)
                .setAttribute("relationship.batch_size", (long) size)
                .startSpan();
        return new OTelAssessmentSpan(span);
    }

    private static class OTelAssessmentSpan implements AssessmentSpan {

        private final Span span;

        OTelAssessmentSpan(Span span) {
            this.span = span;
        }

        @Override
        public void enterStage(PipelineStage stage) {
            span.addEvent("stage." + stage.name());
        }

        @Override
        public void setFlag(String key, boolean value) {
            span.setAttribute(key, value);
        }

        @Override
        public void setScore(String key, double value) {
            span.setAttribute(key, value);
        }

        @Override
        public void setCount(String key, long value) {
            span.setAttribute(key, value);
        }

        @Override
        public void complete(PipelineStage finalStage) {
            span.setAttribute(FINAL_STAGE, finalStage.name());
            span.setStatus(StatusCode.OK);
        }

        @Override
        public void fail(Throwable error) {
            span.recordException(error);
            span.setStatus(StatusCode.ERROR, String.valueOf(error.getMessage()));
        }

        @Override
        public void close() {
            span.end();
        }
    }
}
