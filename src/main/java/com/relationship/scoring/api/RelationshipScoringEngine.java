package com.relationship.scoring.api;

import com.relationship.scoring.cache.CacheConfig;
import com.relationship.scoring.cache.CachingRecordSource;
import com.relationship.scoring.core.model.Record;
import com.relationship.scoring.domain.BadDomainListLoader;
import com.relationship.scoring.domain.BadDomainSet;
import com.relationship.scoring.domain.DomainResolver;
import com.relationship.scoring.health.BadDomainListHealthCheck;
import com.relationship.scoring.health.HealthCheckRegistry;
import com.relationship.scoring.health.HealthStatus;
import com.relationship.scoring.health.JudgmentProviderHealthCheck;
import com.relationship.scoring.health.MemoryHealthCheck;
import com.relationship.scoring.identifier.IdentifierCodec;
import com.relationship.scoring.identifier.IdentifierValidation;
import com.relationship.scoring.judgment.JudgmentProvider;
import com.relationship.scoring.judgment.NoOpJudgmentProvider;
import com.relationship.scoring.judgment.RelationshipJudge;
import com.relationship.scoring.metrics.MetricsService;
import com.relationship.scoring.metrics.NoOpMetricsService;
import com.relationship.scoring.rules.TextNormalizer;
import com.relationship.scoring.scoring.ConsistencyScorer;
import com.relationship.scoring.similarity.SimilarityEngine;
import com.relationship.scoring.source.RecordSource;
import com.relationship.scoring.tracing.NoOpPipelineTracer;
import com.relationship.scoring.tracing.PipelineTracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Main entry point for relationship scoring.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * try (RelationshipScoringEngine engine = RelationshipScoringEngine.builder()
 *         .recordSource(source)
 *         .badDomainList(Path.of("/etc/scoring/bad_domains.csv"))
 *         .judgmentProvider(OpenAiJudgmentProvider.builder().apiKey(key).build())
 *         .build()) {
 *
 *     RelationshipAssessment one = engine.assess(record);
 *     BatchAssessmentResult many = engine.assessIdentifiers(ids, OptionalInt.of(50));
 * }
 * </pre>
 *
 * <p>The bad-domain list is loaded once at build time and shared read-only by every
 * assessment. Parent records are fetched through a Caffeine cache unless caching is disabled.</p>
 */
public class RelationshipScoringEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RelationshipScoringEngine.class);

    private final ScoringOptions options;
    private final RecordSource recordSource;
    private final RelationshipFlagPipeline pipeline;
    private final BatchRelationshipScorer batchScorer;
    private final HealthCheckRegistry healthCheckRegistry;
    private final BadDomainSet badDomains;

    private RelationshipScoringEngine(Builder builder) {
        this.options = builder.options;
        MetricsService metrics = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        PipelineTracer tracer = builder.tracer != null
                ? builder.tracer : new NoOpPipelineTracer();

        if (builder.badDomains != null) {
            this.badDomains = builder.badDomains;
        } else if (builder.badDomainListPath != null) {
            this.badDomains = BadDomainListLoader.load(builder.badDomainListPath);
        } else {
            this.badDomains = BadDomainListLoader.loadResource(BadDomainListLoader.DEFAULT_RESOURCE);
        }

        TextNormalizer normalizer = builder.normalizer != null ? builder.normalizer : new TextNormalizer();
        DomainResolver domainResolver = builder.domainResolver != null
                ? builder.domainResolver : new DomainResolver();
        ConsistencyScorer scorer = new ConsistencyScorer(new SimilarityEngine(normalizer), domainResolver,
                badDomains, options.getCoherenceWeights());

        CacheConfig cacheConfig = builder.cacheConfig != null ? builder.cacheConfig : CacheConfig.defaults();
        this.recordSource = cacheConfig.enabled()
                ? new CachingRecordSource(builder.recordSource, cacheConfig, metrics)
                : builder.recordSource;

        JudgmentProvider provider = builder.judgmentProvider != null
                ? builder.judgmentProvider : new NoOpJudgmentProvider();
        RelationshipJudge judge = null;
        if (options.isJudgmentEnabled()) {
            judge = builder.judge != null ? builder.judge : new RelationshipJudge(provider);
        }

        this.pipeline = new RelationshipFlagPipeline(scorer, recordSource, judge, metrics, tracer);
        this.batchScorer = new BatchRelationshipScorer(pipeline, options.getMaxConcurrency(),
                options.getRecordTimeout(), metrics, tracer);

        this.healthCheckRegistry = new HealthCheckRegistry()
                .register(new BadDomainListHealthCheck(badDomains))
                .register(new MemoryHealthCheck());
        if (options.isJudgmentEnabled()) {
            healthCheckRegistry.register(new JudgmentProviderHealthCheck(provider));
        }

        log.info("RelationshipScoringEngine initialized: badDomains={}, judgment={}, cache={}, options={}",
                badDomains.size(), options.isJudgmentEnabled() ? provider.getProviderName() : "disabled",
                cacheConfig.enabled(), options);
    }

    // ========== Assessment API ==========

    /**
     * Runs one record through the flag pipeline.
     */
    public RelationshipAssessment assess(Record customer) {
        return pipeline.run(customer);
    }

    /**
     * Assesses records independently on the worker pool. Results are in input order;
     * a record that fails or times out yields a failed assessment in its slot.
     */
    public List<RelationshipAssessment> assessBatch(List<Record> records) {
        return batchScorer.assessAll(records);
    }

    /**
     * Validates, fetches and assesses records by identifier.
     *
     * @param identifiers 15- or 18-character identifiers, in any mix
     * @param limit       maximum number of well-formed identifiers to process; empty for the
     *                    configured batch ceiling
     * @throws IllegalArgumentException if {@code limit} is present and not positive
     */
    public BatchAssessmentResult assessIdentifiers(List<String> identifiers, OptionalInt limit) {
        Objects.requireNonNull(identifiers, "identifiers is required");
        int effectiveLimit = options.effectiveLimit(limit);

        IdentifierValidation validation = IdentifierCodec.partition(identifiers, options.getIdentifierPrefix());
        List<String> selected = validation.wellFormed();
        if (selected.size() > effectiveLimit) {
            log.info("Limiting identifier batch from {} to {}", selected.size(), effectiveLimit);
            selected = selected.subList(0, effectiveLimit);
        }

        Map<String, String> unresolved = new LinkedHashMap<>();
        List<Record> records = new ArrayList<>(selected.size());
        for (String identifier : selected) {
            try {
                Optional<Record> record = recordSource.fetchByIdentifier(identifier);
                if (record.isPresent()) {
                    records.add(record.get());
                } else {
                    unresolved.put(identifier, "Record not found");
                }
            } catch (RuntimeException e) {
                log.warn("Lookup of record {} failed: {}", identifier, e.getMessage());
                unresolved.put(identifier, "Lookup failed: " + e.getMessage());
            }
        }

        List<RelationshipAssessment> assessments = batchScorer.assessAll(records);
        BatchAssessmentResult result = new BatchAssessmentResult(
                assessments,
                validation.malformed(),
                unresolved,
                BatchAssessmentResult.summarize(identifiers.size(), validation.malformed().size(),
                        unresolved.size(), assessments));
        log.info("identifiers.assessed result={}", result);
        return result;
    }

    // ========== Health & Config ==========

    public HealthStatus health() {
        return healthCheckRegistry.checkAll();
    }

    public HealthCheckRegistry getHealthCheckRegistry() {
        return healthCheckRegistry;
    }

    public ScoringOptions getOptions() {
        return options;
    }

    public BadDomainSet getBadDomains() {
        return badDomains;
    }

    @Override
    public void close() {
        batchScorer.close();
        log.info("RelationshipScoringEngine closed");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private RecordSource recordSource;
        private ScoringOptions options = ScoringOptions.defaults();
        private BadDomainSet badDomains;
        private Path badDomainListPath;
        private JudgmentProvider judgmentProvider;
        private RelationshipJudge judge;
        private CacheConfig cacheConfig;
        private MetricsService metricsService;
        private PipelineTracer tracer;
        private TextNormalizer normalizer;
        private DomainResolver domainResolver;

        public Builder recordSource(RecordSource recordSource) {
            this.recordSource = recordSource;
            return this;
        }

        public Builder options(ScoringOptions options) {
            this.options = options;
            return this;
        }

        /**
         * Uses an already loaded bad-domain set. Takes precedence over {@link #badDomainList(Path)}.
         */
        public Builder badDomains(BadDomainSet badDomains) {
            this.badDomains = badDomains;
            return this;
        }

        /**
         * Loads the bad-domain list from a file. Without either this or {@link #badDomains(BadDomainSet)}
         * the bundled classpath list is used.
         */
        public Builder badDomainList(Path path) {
            this.badDomainListPath = path;
            return this;
        }

        public Builder judgmentProvider(JudgmentProvider judgmentProvider) {
            this.judgmentProvider = judgmentProvider;
            return this;
        }

        /**
         * Replaces the judge built from {@link #judgmentProvider(JudgmentProvider)}.
         */
        public Builder judge(RelationshipJudge judge) {
            this.judge = judge;
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = cacheConfig;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracer(PipelineTracer tracer) {
            this.tracer = tracer;
            return this;
        }

        public Builder normalizer(TextNormalizer normalizer) {
            this.normalizer = normalizer;
            return this;
        }

        public Builder domainResolver(DomainResolver domainResolver) {
            this.domainResolver = domainResolver;
            return this;
        }

        public RelationshipScoringEngine build() {
            if (recordSource == null) {
                throw new IllegalStateException("recordSource is required");
            }
            if (options == null) {
                throw new IllegalStateException("options is required");
            }
            return new RelationshipScoringEngine(this);
        }
    }
}
