package com.relationship.scoring.api;

import com.relationship.scoring.core.model.PipelineStage;
import com.relationship.scoring.judgment.JudgmentResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RelationshipAssessmentTest {

    @Test
    @DisplayName("Failed assessment carries an error judgment and no flags")
    void failed() {
        RelationshipAssessment assessment = RelationshipAssessment.failed("001xx000003DGg2", "boom");

        assertTrue(assessment.isFailed());
        assertEquals(PipelineStage.START, assessment.getFinalStage());
        assertTrue(assessment.getFlags().isEmpty());
        assertFalse(assessment.isBadDomain());
        assertFalse(assessment.hasShell());
        JudgmentResult judgment = assessment.getJudgment().orElseThrow();
        assertEquals(List.of("Error: boom", "Using computed scores only due to judgment service error"),
                judgment.explanationBullets());
    }

    @Test
    @DisplayName("Completed assessment requires flags and stages")
    void invariants() {
        assertThrows(IllegalStateException.class, () -> RelationshipAssessment.builder()
                .recordId("x")
                .stages(List.of(PipelineStage.START))
                .build());
        assertThrows(IllegalStateException.class, () -> RelationshipAssessment.builder()
                .recordId("x")
                .error("boom")
                .build());
    }
}
