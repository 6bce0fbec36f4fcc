package com.relationship.scoring.identifier;

import java.util.List;

/**
 * Identifiers split by format check.
 *
 * @param wellFormed canonical 18-character identifiers, deduplicated by entity, in input order
 * @param malformed  identifiers that failed the format check, as given
 */
public record IdentifierValidation(List<String> wellFormed, List<String> malformed) {

    public IdentifierValidation {
        wellFormed = wellFormed != null ? List.copyOf(wellFormed) : List.of();
        malformed = malformed != null ? List.copyOf(malformed) : List.of();
    }

    public boolean allWellFormed() {
        return malformed.isEmpty();
    }
}
