package com.relationship.scoring.cdi;

import com.relationship.scoring.api.RelationshipScoringEngine;
import com.relationship.scoring.api.ScoringOptions;
import com.relationship.scoring.cache.CacheConfig;
import com.relationship.scoring.health.HealthCheckRegistry;
import com.relationship.scoring.judgment.JudgmentProvider;
import com.relationship.scoring.judgment.NoOpJudgmentProvider;
import com.relationship.scoring.judgment.OpenAiJudgmentProvider;
import com.relationship.scoring.metrics.MicrometerMetricsService;
import com.relationship.scoring.scoring.CoherenceWeights;
import com.relationship.scoring.source.InMemoryRecordSource;
import com.relationship.scoring.source.RecordSource;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * CDI producer that wires the relationship scoring engine from MicroProfile Config properties.
 *
 * <p>The application supplies the {@link RecordSource} bean backed by its record store.
 * A {@link MeterRegistry} bean, when present, enables Micrometer metrics.</p>
 *
 * <h2>Example configuration</h2>
 * <pre>
 * relationship-scoring:
 *   bad-domains:
 *     path: /etc/scoring/bad_domains.csv
 *   judgment:
 *     enabled: true
 *     api-key: ${OPENAI_API_KEY}
 * </pre>
 *
 * <h2>Usage</h2>
 * <pre>
 * &#64;Inject RelationshipScoringEngine engine;
 * </pre>
 */
@ApplicationScoped
public class RelationshipScoringProducer {

    private static final Logger log = LoggerFactory.getLogger(RelationshipScoringProducer.class);

    // ── Reference data ────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "relationship-scoring.bad-domains.path")
    Optional<String> badDomainsPath;

    @Inject
    @ConfigProperty(name = "relationship-scoring.identifier.prefix", defaultValue = "001")
    String identifierPrefix;

    // ── Scoring ───────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "relationship-scoring.coherence.direct-weight", defaultValue = "0.7")
    double directWeight;

    @Inject
    @ConfigProperty(name = "relationship-scoring.coherence.cross-weight", defaultValue = "0.3")
    double crossWeight;

    // ── Batch ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "relationship-scoring.batch.max-size", defaultValue = "100")
    int maxBatchSize;

    @Inject
    @ConfigProperty(name = "relationship-scoring.batch.max-concurrency", defaultValue = "8")
    int maxConcurrency;

    @Inject
    @ConfigProperty(name = "relationship-scoring.batch.record-timeout-seconds", defaultValue = "60")
    int recordTimeoutSeconds;

    // ── Cache ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "relationship-scoring.cache.enabled", defaultValue = "true")
    boolean cacheEnabled;

    @Inject
    @ConfigProperty(name = "relationship-scoring.cache.max-size", defaultValue = "5000")
    int cacheMaxSize;

    @Inject
    @ConfigProperty(name = "relationship-scoring.cache.ttl-seconds", defaultValue = "600")
    int cacheTtlSeconds;

    // ── Judgment ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "relationship-scoring.judgment.enabled", defaultValue = "true")
    boolean judgmentEnabled;

    @Inject
    @ConfigProperty(name = "relationship-scoring.judgment.provider", defaultValue = "openai")
    String judgmentProviderType;

    @Inject
    @ConfigProperty(name = "relationship-scoring.judgment.openai.base-url", defaultValue = "https://api.openai.com/v1")
    String openAiBaseUrl;

    @Inject
    @ConfigProperty(name = "relationship-scoring.judgment.openai.model", defaultValue = "gpt-4o")
    String openAiModel;

    @Inject
    @ConfigProperty(name = "relationship-scoring.judgment.openai.api-key")
    Optional<String> openAiApiKey;

    @Inject
    @ConfigProperty(name = "relationship-scoring.judgment.openai.timeout-seconds", defaultValue = "60")
    int openAiTimeoutSeconds;

    // ── Collaborators ─────────────────────────────────────────

    @Inject
    Instance<RecordSource> recordSources;

    @Inject
    Instance<MeterRegistry> meterRegistries;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public RelationshipScoringEngine relationshipScoringEngine() {
        ScoringOptions options = ScoringOptions.builder()
                .coherenceWeights(new CoherenceWeights(directWeight, crossWeight))
                .identifierPrefix(identifierPrefix)
                .maxBatchSize(maxBatchSize)
                .maxConcurrency(maxConcurrency)
                .recordTimeout(Duration.ofSeconds(recordTimeoutSeconds))
                .judgmentEnabled(judgmentEnabled)
                .build();

        RelationshipScoringEngine.Builder builder = RelationshipScoringEngine.builder()
                .recordSource(resolveRecordSource())
                .options(options)
                .cacheConfig(cacheEnabled
                        ? new CacheConfig(cacheMaxSize, cacheTtlSeconds, true)
                        : CacheConfig.disabled());

        badDomainsPath.filter(p -> !p.isBlank())
                .ifPresent(p -> builder.badDomainList(Path.of(p)));

        if (meterRegistries != null && meterRegistries.isResolvable()) {
            builder.metricsService(new MicrometerMetricsService(meterRegistries.get()));
        }

        if (judgmentEnabled) {
            JudgmentProvider provider = createJudgmentProvider();
            builder.judgmentProvider(provider);
            log.info("Judgment enabled: provider={}", provider.getProviderName());
        } else {
            log.info("Judgment disabled");
        }

        log.info("Producing RelationshipScoringEngine: options={} badDomains={}",
                options, badDomainsPath.orElse("classpath"));
        return builder.build();
    }

    public void closeEngine(@Disposes RelationshipScoringEngine engine) {
        log.info("Closing RelationshipScoringEngine");
        engine.close();
    }

    @Produces
    @ApplicationScoped
    public HealthCheckRegistry healthCheckRegistry(RelationshipScoringEngine engine) {
        return engine.getHealthCheckRegistry();
    }

    // ══════════════════════════════════════════════════════════
    //  Internal
    // ══════════════════════════════════════════════════════════

    private RecordSource resolveRecordSource() {
        if (recordSources != null && recordSources.isResolvable()) {
            return recordSources.get();
        }
        log.warn("No RecordSource bean found, parent lookups will find nothing");
        return new InMemoryRecordSource();
    }

    JudgmentProvider createJudgmentProvider() {
        if ("openai".equalsIgnoreCase(judgmentProviderType)) {
            return OpenAiJudgmentProvider.builder()
                    .baseUrl(openAiBaseUrl)
                    .model(openAiModel)
                    .apiKey(openAiApiKey.orElse(""))
                    .timeout(Duration.ofSeconds(openAiTimeoutSeconds))
                    .build();
        }
        log.warn("Unknown judgment provider '{}', falling back to NoOp", judgmentProviderType);
        return new NoOpJudgmentProvider();
    }
}
