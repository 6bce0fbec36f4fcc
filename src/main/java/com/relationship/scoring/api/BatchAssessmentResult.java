package com.relationship.scoring.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of assessing a list of identifiers.
 *
 * @param assessments           one per fetched record, in input order
 * @param malformedIdentifiers  inputs rejected by format validation, as given
 * @param unresolvedIdentifiers well-formed identifiers with no assessment, mapped to the reason
 * @param summary               counts over the whole run
 */
public record BatchAssessmentResult(
        List<RelationshipAssessment> assessments,
        List<String> malformedIdentifiers,
        Map<String, String> unresolvedIdentifiers,
        Summary summary
) {
    public BatchAssessmentResult {
        assessments = assessments != null ? List.copyOf(assessments) : List.of();
        malformedIdentifiers = malformedIdentifiers != null ? List.copyOf(malformedIdentifiers) : List.of();
        unresolvedIdentifiers = unresolvedIdentifiers != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(unresolvedIdentifiers)) : Map.of();
    }

    /**
     * Counts for a batch run.
     *
     * @param requested        number of identifiers passed in
     * @param malformed        identifiers failing format validation
     * @param unresolved       well-formed identifiers whose record was not found or could not be fetched
     * @param assessed         records run through the pipeline
     * @param badDomain        assessments stopped by the bad-domain check
     * @param withShell        assessments whose record has a distinct parent
     * @param judgmentFailures assessments whose judgment is an error result
     */
    public record Summary(int requested, int malformed, int unresolved, int assessed,
                          int badDomain, int withShell, int judgmentFailures) {
    }

    static Summary summarize(int requested, int malformed, int unresolved, List<RelationshipAssessment> assessments) {
        int badDomain = 0;
        int withShell = 0;
        int judgmentFailures = 0;
        for (RelationshipAssessment assessment : assessments) {
            if (assessment.isBadDomain()) {
                badDomain++;
            }
            if (assessment.hasShell()) {
                withShell++;
            }
            if (assessment.getJudgment().map(j -> !j.success()).orElse(false)) {
                judgmentFailures++;
            }
        }
        return new Summary(requested, malformed, unresolved, assessments.size(), badDomain, withShell,
                judgmentFailures);
    }

    public boolean hasErrors() {
        return !malformedIdentifiers.isEmpty() || !unresolvedIdentifiers.isEmpty()
                || assessments.stream().anyMatch(RelationshipAssessment::isFailed);
    }

    @Override
    public String toString() {
        return "BatchAssessmentResult{" +
                "requested=" + summary.requested() +
                ", assessed=" + summary.assessed() +
                ", malformed=" + summary.malformed() +
                ", unresolved=" + summary.unresolved() +
                ", badDomain=" + summary.badDomain() +
                ", withShell=" + summary.withShell() +
                ", judgmentFailures=" + summary.judgmentFailures() +
                '}';
    }
}
