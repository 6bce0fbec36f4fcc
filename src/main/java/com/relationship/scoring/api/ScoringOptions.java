package com.relationship.scoring.api;

import com.relationship.scoring.identifier.IdentifierCodec;
import com.relationship.scoring.scoring.CoherenceWeights;

import java.time.Duration;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Options for relationship scoring runs.
 * Configures coherence weights, identifier validation, batch limits and judgment usage.
 */
public class ScoringOptions {

    private static final int DEFAULT_MAX_BATCH_SIZE = 100;
    private static final int DEFAULT_MAX_CONCURRENCY = 8;
    private static final Duration DEFAULT_RECORD_TIMEOUT = Duration.ofSeconds(60);

    private final CoherenceWeights coherenceWeights;
    private final String identifierPrefix;
    private final int maxBatchSize;
    private final int maxConcurrency;
    private final Duration recordTimeout;
    private final boolean judgmentEnabled;

    private ScoringOptions(Builder builder) {
        this.coherenceWeights = builder.coherenceWeights;
        this.identifierPrefix = builder.identifierPrefix;
        this.maxBatchSize = builder.maxBatchSize;
        this.maxConcurrency = builder.maxConcurrency;
        this.recordTimeout = builder.recordTimeout;
        this.judgmentEnabled = builder.judgmentEnabled;
    }

    public CoherenceWeights getCoherenceWeights() {
        return coherenceWeights;
    }

    public String getIdentifierPrefix() {
        return identifierPrefix;
    }

    public int getMaxBatchSize() {
        return maxBatchSize;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public Duration getRecordTimeout() {
        return recordTimeout;
    }

    public boolean isJudgmentEnabled() {
        return judgmentEnabled;
    }

    /**
     * Resolves a caller-supplied limit against {@link #getMaxBatchSize()}.
     * Empty means no limit was requested, so the batch ceiling applies.
     *
     * @throws IllegalArgumentException if a limit is present and not positive
     */
    public int effectiveLimit(OptionalInt requested) {
        Objects.requireNonNull(requested, "requested limit is required, use OptionalInt.empty()");
        if (requested.isEmpty()) {
            return maxBatchSize;
        }
        int limit = requested.getAsInt();
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive, got " + limit);
        }
        return Math.min(limit, maxBatchSize);
    }

    public static ScoringOptions defaults() {
        return builder().build();
    }

    /**
     * Computed scores only; the judgment service is never called.
     */
    public static ScoringOptions withoutJudgment() {
        return builder().judgmentEnabled(false).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private CoherenceWeights coherenceWeights = CoherenceWeights.defaultWeights();
        private String identifierPrefix = IdentifierCodec.DEFAULT_PREFIX;
        private int maxBatchSize = DEFAULT_MAX_BATCH_SIZE;
        private int maxConcurrency = DEFAULT_MAX_CONCURRENCY;
        private Duration recordTimeout = DEFAULT_RECORD_TIMEOUT;
        private boolean judgmentEnabled = true;

        public Builder coherenceWeights(CoherenceWeights coherenceWeights) {
            this.coherenceWeights = Objects.requireNonNull(coherenceWeights, "coherenceWeights is required");
            return this;
        }

        public Builder identifierPrefix(String identifierPrefix) {
            if (identifierPrefix == null || identifierPrefix.isBlank()) {
                throw new IllegalArgumentException("identifierPrefix must not be blank");
            }
            this.identifierPrefix = identifierPrefix.trim();
            return this;
        }

        public Builder maxBatchSize(int maxBatchSize) {
            if (maxBatchSize <= 0) {
                throw new IllegalArgumentException("maxBatchSize must be positive");
            }
            this.maxBatchSize = maxBatchSize;
            return this;
        }

        public Builder maxConcurrency(int maxConcurrency) {
            if (maxConcurrency <= 0) {
                throw new IllegalArgumentException("maxConcurrency must be positive");
            }
            this.maxConcurrency = maxConcurrency;
            return this;
        }

        public Builder recordTimeout(Duration recordTimeout) {
            if (recordTimeout == null || recordTimeout.isZero() || recordTimeout.isNegative()) {
                throw new IllegalArgumentException("recordTimeout must be positive");
            }
            this.recordTimeout = recordTimeout;
            return this;
        }

        public Builder judgmentEnabled(boolean judgmentEnabled) {
            this.judgmentEnabled = judgmentEnabled;
            return this;
        }

        public ScoringOptions build() {
            return new ScoringOptions(this);
        }
    }

    @Override
    public String toString() {
        return "ScoringOptions{" +
                "coherenceWeights=" + coherenceWeights +
                ", identifierPrefix='" + identifierPrefix + '\'' +
                ", maxBatchSize=" + maxBatchSize +
                ", maxConcurrency=" + maxConcurrency +
                ", recordTimeout=" + recordTimeout +
                ", judgmentEnabled=" + judgmentEnabled +
                '}';
    }
}
