package com.relationship.scoring.source;

import com.relationship.scoring.core.model.Record;

import java.util.Optional;

/**
 * Looks up records in the backing record store.
 * Implementations must accept both 15- and 18-character identifiers.
 */
public interface RecordSource {

    /**
     * Fetches a record by identifier.
     *
     * @return the record, or empty if no record exists for the identifier
     * @throws RecordSourceException if the store could not be queried
     */
    Optional<Record> fetchByIdentifier(String identifier);
}
