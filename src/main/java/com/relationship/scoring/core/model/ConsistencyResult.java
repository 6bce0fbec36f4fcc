package com.relationship.scoring.core.model;

import java.util.List;

/**
 * Outcome of a consistency scorer: a 0-100 score plus the ordered explanation lines
 * that justify it. Produced fresh per call and never mutated.
 */
public record ConsistencyResult(double score, List<String> explanation) {

    public ConsistencyResult {
        if (Double.isNaN(score) || score < 0.0 || score > 100.0) {
            throw new IllegalArgumentException("Score must be between 0 and 100, got " + score);
        }
        explanation = explanation != null ? List.copyOf(explanation) : List.of();
    }

    public static ConsistencyResult of(double score, String... explanation) {
        return new ConsistencyResult(score, List.of(explanation));
    }

    /**
     * Creates a zero score carrying the reason no comparison could be made.
     */
    public static ConsistencyResult noData(String reason) {
        return new ConsistencyResult(0.0, List.of(reason));
    }

    /**
     * Returns the score rounded to one decimal place, as presented downstream.
     */
    public double roundedScore() {
        return Math.round(score * 10.0) / 10.0;
    }

    /**
     * Returns the explanation lines joined with "; ".
     */
    public String summary() {
        return String.join("; ", explanation);
    }
}
