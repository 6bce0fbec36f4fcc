package com.relationship.scoring.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.relationship.scoring.core.model.Record;
import com.relationship.scoring.identifier.IdentifierCodec;
import com.relationship.scoring.metrics.MetricsService;
import com.relationship.scoring.metrics.NoOpMetricsService;
import com.relationship.scoring.source.RecordSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Caffeine-backed decorator for a {@link RecordSource}.
 *
 * <p>Entries are keyed by the 15-character identifier, so 15- and 18-character lookups
 * of the same record share one entry. Only found records are cached: not-found results
 * and {@link com.relationship.scoring.source.RecordSourceException}s always go back to
 * the delegate on the next call.</p>
 */
public class CachingRecordSource implements RecordSource {
    private static final Logger log = LoggerFactory.getLogger(CachingRecordSource.class);

    private final RecordSource delegate;
    private final Cache<String, Record> cache;
    private final MetricsService metrics;

    public CachingRecordSource(RecordSource delegate, CacheConfig config) {
        this(delegate, config, new NoOpMetricsService());
    }

    public CachingRecordSource(RecordSource delegate, CacheConfig config, MetricsService metrics) {
        this.delegate = Objects.requireNonNull(delegate, "delegate is required");
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .build();
        log.info("CachingRecordSource initialized: maxSize={}, ttl={}s", config.maxSize(), config.ttlSeconds());
    }

    @Override
    public Optional<Record> fetchByIdentifier(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            return Optional.empty();
        }
        String key = IdentifierCodec.to15(identifier.trim());
        Record cached = cache.getIfPresent(key);
        if (cached != null) {
            metrics.recordCacheHit();
            return Optional.of(cached);
        }
        metrics.recordCacheMiss();

        Optional<Record> fetched = delegate.fetchByIdentifier(identifier);
        fetched.ifPresent(record -> cache.put(key, record));
        return fetched;
    }

    public void invalidate(String identifier) {
        if (identifier != null && !identifier.isBlank()) {
            cache.invalidate(IdentifierCodec.to15(identifier.trim()));
        }
    }

    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("Invalidated all record cache entries");
    }

    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize()
        );
    }
}
