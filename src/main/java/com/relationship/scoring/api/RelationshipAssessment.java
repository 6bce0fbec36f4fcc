package com.relationship.scoring.api;

import com.relationship.scoring.core.model.FlagPayload;
import com.relationship.scoring.core.model.PipelineStage;
import com.relationship.scoring.core.model.Record;
import com.relationship.scoring.judgment.JudgmentResult;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of running one customer record through the flag pipeline.
 *
 * <p>A completed run carries the flag payload and the stages it passed through. A failed
 * run (the record could not be assessed at all, e.g. it timed out inside a batch) has no
 * payload and an error judgment.</p>
 */
public final class RelationshipAssessment {

    private final String recordId;
    private final FlagPayload flags;
    private final List<PipelineStage> stages;
    private final Record shellRecord;
    private final JudgmentResult judgment;
    private final String error;

    private RelationshipAssessment(Builder builder) {
        this.recordId = builder.recordId != null ? builder.recordId : "";
        this.flags = builder.flags;
        this.stages = List.copyOf(builder.stages);
        this.shellRecord = builder.shellRecord;
        this.judgment = builder.judgment;
        this.error = builder.error;
        if (stages.isEmpty()) {
            throw new IllegalStateException("An assessment records at least the START stage");
        }
        if (error == null && flags == null) {
            throw new IllegalStateException("A completed assessment must carry flags");
        }
    }

    /**
     * Creates an assessment for a record that could not be processed.
     */
    public static RelationshipAssessment failed(String recordId, String error) {
        Objects.requireNonNull(error, "error is required");
        return builder()
                .recordId(recordId)
                .stages(List.of(PipelineStage.START))
                .judgment(JudgmentResult.error(error))
                .error(error)
                .build();
    }

    public String getRecordId() {
        return recordId;
    }

    public Optional<FlagPayload> getFlags() {
        return Optional.ofNullable(flags);
    }

    /**
     * Stages visited in order, starting with {@link PipelineStage#START}.
     */
    public List<PipelineStage> getStages() {
        return stages;
    }

    public PipelineStage getFinalStage() {
        return stages.get(stages.size() - 1);
    }

    public Optional<Record> getShellRecord() {
        return Optional.ofNullable(shellRecord);
    }

    /**
     * The judgment merged into this assessment; empty when judgment is disabled
     * or the record stopped at the bad-domain check.
     */
    public Optional<JudgmentResult> getJudgment() {
        return Optional.ofNullable(judgment);
    }

    public Optional<String> getError() {
        return Optional.ofNullable(error);
    }

    public boolean isFailed() {
        return error != null;
    }

    public boolean isBadDomain() {
        return flags != null && flags.isBadDomain();
    }

    public boolean hasShell() {
        return flags != null && flags.hasShell();
    }

    @Override
    public String toString() {
        return "RelationshipAssessment{" +
                "recordId='" + recordId + '\'' +
                ", finalStage=" + getFinalStage() +
                ", badDomain=" + isBadDomain() +
                ", hasShell=" + hasShell() +
                ", judgment=" + (judgment != null ? judgment.confidenceScore() : "none") +
                (error != null ? ", error='" + error + '\'' : "") +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String recordId;
        private FlagPayload flags;
        private List<PipelineStage> stages = List.of();
        private Record shellRecord;
        private JudgmentResult judgment;
        private String error;

        public Builder recordId(String recordId) {
            this.recordId = recordId;
            return this;
        }

        public Builder flags(FlagPayload flags) {
            this.flags = flags;
            return this;
        }

        public Builder stages(List<PipelineStage> stages) {
            this.stages = stages;
            return this;
        }

        public Builder shellRecord(Record shellRecord) {
            this.shellRecord = shellRecord;
            return this;
        }

        public Builder judgment(JudgmentResult judgment) {
            this.judgment = judgment;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public RelationshipAssessment build() {
            return new RelationshipAssessment(this);
        }
    }
}
