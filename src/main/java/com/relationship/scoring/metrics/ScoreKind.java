package com.relationship.scoring.metrics;

/**
 * Consistency score families, used as the {@code kind} metric tag.
 */
public enum ScoreKind {
    CUSTOMER_CONSISTENCY,
    SHELL_COHERENCE
}
