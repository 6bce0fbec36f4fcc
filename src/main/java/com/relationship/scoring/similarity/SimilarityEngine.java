package com.relationship.scoring.similarity;

import com.relationship.scoring.rules.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Normalized fuzzy similarity between two free-text values.
 *
 * <p>Both inputs go through {@link TextNormalizer}; if either normalized form is empty the
 * similarity is 0. The pair is put in lexicographic order before scoring, which makes
 * {@code similarity(a, b) == similarity(b, a)} hold exactly.</p>
 */
public class SimilarityEngine {
    private static final Logger log = LoggerFactory.getLogger(SimilarityEngine.class);

    private final TextNormalizer normalizer;
    private final SimilarityAlgorithm algorithm;

    public SimilarityEngine() {
        this(new TextNormalizer(), new SequenceMatcherSimilarity());
    }

    public SimilarityEngine(TextNormalizer normalizer) {
        this(normalizer, new SequenceMatcherSimilarity());
    }

    public SimilarityEngine(TextNormalizer normalizer, SimilarityAlgorithm algorithm) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer is required");
        this.algorithm = Objects.requireNonNull(algorithm, "algorithm is required");
    }

    /**
     * Returns the similarity of the normalized forms of {@code a} and {@code b}, in [0, 1].
     */
    public double similarity(String a, String b) {
        String left = normalizer.normalize(a);
        String right = normalizer.normalize(b);
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }
        if (left.compareTo(right) > 0) {
            String swap = left;
            left = right;
            right = swap;
        }

        double score = algorithm.compute(left, right);
        log.debug("Similarity '{}' vs '{}' = {} ({})", left, right, score, algorithm.getName());
        return score;
    }

    public TextNormalizer getNormalizer() {
        return normalizer;
    }

    public String getAlgorithmName() {
        return algorithm.getName();
    }
}
