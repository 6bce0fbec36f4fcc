package com.relationship.scoring.scoring;

/**
 * Weights for combining direct (same-field) and cross-field comparisons in shell coherence.
 */
public record CoherenceWeights(double directWeight, double crossWeight) {

    public CoherenceWeights {
        if (directWeight < 0 || crossWeight < 0) {
            throw new IllegalArgumentException("Weights must be non-negative");
        }
        double sum = directWeight + crossWeight;
        if (Math.abs(sum - 1.0) > 0.001) {
            throw new IllegalArgumentException("Weights must sum to 1.0, got " + sum);
        }
    }

    /**
     * Direct comparisons count for 70%, cross comparisons for 30%.
     */
    public static CoherenceWeights defaultWeights() {
        return new CoherenceWeights(0.7, 0.3);
    }
}
