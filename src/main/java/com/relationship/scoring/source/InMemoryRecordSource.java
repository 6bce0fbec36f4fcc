package com.relationship.scoring.source;

import com.relationship.scoring.core.model.Record;
import com.relationship.scoring.identifier.IdentifierCodec;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory record source keyed by canonical 15-character identifier.
 * Suitable for testing and for callers that already hold the records.
 */
public class InMemoryRecordSource implements RecordSource {

    private final Map<String, Record> records = new ConcurrentHashMap<>();

    public InMemoryRecordSource() {
    }

    public InMemoryRecordSource(Collection<Record> records) {
        records.forEach(this::add);
    }

    /**
     * Adds or replaces a record. The record must carry an {@code Identifier}.
     */
    public InMemoryRecordSource add(Record record) {
        String identifier = record.identifier();
        if (identifier.isEmpty()) {
            throw new IllegalArgumentException("Record has no Identifier: " + record);
        }
        records.put(IdentifierCodec.to15(identifier), record);
        return this;
    }

    @Override
    public Optional<Record> fetchByIdentifier(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(records.get(IdentifierCodec.to15(identifier.trim())));
    }

    public int size() {
        return records.size();
    }
}
