package com.relationship.scoring.judgment;

import java.util.List;

/**
 * Outcome of a judgment call.
 *
 * @param confidenceScore    0-100 likelihood that the customer/shell link is valid
 * @param explanationBullets the service's reasoning, or error bullets on failure
 * @param success            false when the result is a fallback produced after a failure
 */
public record JudgmentResult(int confidenceScore, List<String> explanationBullets, boolean success) {

    static final String FALLBACK_BULLET = "Using computed scores only due to judgment service error";

    public JudgmentResult {
        if (confidenceScore < 0 || confidenceScore > 100) {
            throw new IllegalArgumentException("Confidence score must be between 0 and 100, got " + confidenceScore);
        }
        explanationBullets = explanationBullets != null ? List.copyOf(explanationBullets) : List.of();
    }

    public static JudgmentResult of(int confidenceScore, List<String> explanationBullets) {
        return new JudgmentResult(confidenceScore, explanationBullets, true);
    }

    /**
     * Zero-confidence result carrying the error that prevented a judgment.
     */
    public static JudgmentResult error(String message) {
        String detail = message != null && !message.isBlank() ? message : "unknown error";
        return new JudgmentResult(0, List.of("Error: " + detail, FALLBACK_BULLET), false);
    }
}
