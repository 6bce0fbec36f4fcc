package com.relationship.scoring.core.model;

import java.util.List;

/**
 * Outcome of the customer-vs-shell address comparison.
 */
public record AddressConsistencyResult(boolean consistent, List<String> explanation) {

    public AddressConsistencyResult {
        explanation = explanation != null ? List.copyOf(explanation) : List.of();
    }

    public static AddressConsistencyResult missingData(String reason) {
        return new AddressConsistencyResult(false, List.of(reason));
    }

    public String summary() {
        return String.join("; ", explanation);
    }
}
