package com.relationship.scoring.metrics;

import com.relationship.scoring.core.model.PipelineStage;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code relationship.assessment.duration} Timer (tag: stage)</li>
 *   <li>{@code relationship.bad_domain} Counter</li>
 *   <li>{@code relationship.shell.detected} Counter</li>
 *   <li>{@code relationship.consistency.score} DistributionSummary (tag: kind)</li>
 *   <li>{@code relationship.judgment.failure} Counter</li>
 *   <li>{@code relationship.batch.size} DistributionSummary</li>
 *   <li>{@code relationship.cache.hit} / {@code relationship.cache.miss} Counters</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final Map<PipelineStage, Timer> durationTimers = new EnumMap<>(PipelineStage.class);
    private final Map<ScoreKind, DistributionSummary> scoreSummaries = new EnumMap<>(ScoreKind.class);
    private final Counter badDomainCounter;
    private final Counter shellDetectedCounter;
    private final Counter judgmentFailureCounter;
    private final DistributionSummary batchSizeSummary;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        Objects.requireNonNull(registry, "registry is required");
        // Only terminal stages are ever recorded; the maps are filled up front and read-only afterwards
        for (PipelineStage stage : PipelineStage.values()) {
            if (stage.isTerminal()) {
                durationTimers.put(stage, Timer.builder("relationship.assessment.duration")
                        .description("Duration of single-record assessments")
                        .tag("stage", stage.name())
                        .register(registry));
            }
        }
        for (ScoreKind kind : ScoreKind.values()) {
            scoreSummaries.put(kind, DistributionSummary.builder("relationship.consistency.score")
                    .description("Distribution of consistency scores (0-100)")
                    .tag("kind", kind.name())
                    .register(registry));
        }
        this.badDomainCounter = Counter.builder("relationship.bad_domain")
                .description("Assessments stopped by the bad-domain check")
                .register(registry);
        this.shellDetectedCounter = Counter.builder("relationship.shell.detected")
                .description("Assessments whose record has a distinct parent")
                .register(registry);
        this.judgmentFailureCounter = Counter.builder("relationship.judgment.failure")
                .description("Judgment calls that fell back to an error result")
                .register(registry);
        this.batchSizeSummary = DistributionSummary.builder("relationship.batch.size")
                .description("Distribution of batch sizes")
                .register(registry);
        this.cacheHitCounter = Counter.builder("relationship.cache.hit")
                .description("Number of record cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("relationship.cache.miss")
                .description("Number of record cache misses")
                .register(registry);
    }

    @Override
    public void recordAssessmentDuration(PipelineStage finalStage, Duration duration) {
        Timer timer = durationTimers.get(finalStage);
        if (timer != null) {
            timer.record(duration);
        }
    }

    @Override
    public void incrementBadDomain() {
        badDomainCounter.increment();
    }

    @Override
    public void incrementShellDetected() {
        shellDetectedCounter.increment();
    }

    @Override
    public void recordConsistencyScore(ScoreKind kind, double score) {
        scoreSummaries.get(kind).record(score);
    }

    @Override
    public void incrementJudgmentFailure() {
        judgmentFailureCounter.increment();
    }

    @Override
    public void recordBatchSize(int size) {
        batchSizeSummary.record(size);
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }
}
