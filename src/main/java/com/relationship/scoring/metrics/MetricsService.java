package com.relationship.scoring.metrics;

import com.relationship.scoring.core.model.PipelineStage;

import java.time.Duration;

/**
 * Interface for recording relationship scoring metrics.
 * The default {@link NoOpMetricsService} does nothing, so the engine works
 * without a meter registry.
 */
public interface MetricsService {

    void recordAssessmentDuration(PipelineStage finalStage, Duration duration);

    void incrementBadDomain();

    void incrementShellDetected();

    void recordConsistencyScore(ScoreKind kind, double score);

    void incrementJudgmentFailure();

    void recordBatchSize(int size);

    void recordCacheHit();

    void recordCacheMiss();
}
