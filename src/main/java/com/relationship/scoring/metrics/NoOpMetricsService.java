package com.relationship.scoring.metrics;

import com.relationship.scoring.core.model.PipelineStage;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordAssessmentDuration(PipelineStage finalStage, Duration duration) {
    }

    @Override
    public void incrementBadDomain() {
    }

    @Override
    public void incrementShellDetected() {
    }

    @Override
    public void recordConsistencyScore(ScoreKind kind, double score) {
    }

    @Override
    public void incrementJudgmentFailure() {
    }

    @Override
    public void recordBatchSize(int size) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
