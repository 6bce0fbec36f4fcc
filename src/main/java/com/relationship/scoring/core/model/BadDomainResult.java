package com.relationship.scoring.core.model;

import java.util.List;

/**
 * Outcome of the bad-domain short-circuit check.
 * When {@code bad} is true, {@code explanation} names each field whose domain matched.
 */
public record BadDomainResult(boolean bad, List<String> explanation) {

    private static final String CLEAN = "No bad domains detected";

    public BadDomainResult {
        explanation = explanation != null ? List.copyOf(explanation) : List.of();
    }

    public static BadDomainResult clean() {
        return new BadDomainResult(false, List.of(CLEAN));
    }

    public String summary() {
        return String.join("; ", explanation);
    }
}
