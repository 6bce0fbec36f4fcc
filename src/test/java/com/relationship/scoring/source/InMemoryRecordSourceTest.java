package com.relationship.scoring.source;

import com.relationship.scoring.core.model.Record;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryRecordSourceTest {

    private static final Record ACME = Record.builder().identifier("001xx000000000A").name("Acme").build();

    @Test
    @DisplayName("Finds records by 15- or 18-character identifier")
    void bothForms() {
        InMemoryRecordSource source = new InMemoryRecordSource(List.of(ACME));

        assertEquals(Optional.of(ACME), source.fetchByIdentifier("001xx000000000A"));
        assertEquals(Optional.of(ACME), source.fetchByIdentifier("001xx000000000AAAQ"));
        assertEquals(Optional.of(ACME), source.fetchByIdentifier(" 001xx000000000A "));
    }

    @Test
    @DisplayName("Unknown and blank identifiers are not found")
    void notFound() {
        InMemoryRecordSource source = new InMemoryRecordSource().add(ACME);

        assertTrue(source.fetchByIdentifier("001xx000000000B").isEmpty());
        assertTrue(source.fetchByIdentifier("").isEmpty());
        assertTrue(source.fetchByIdentifier(null).isEmpty());
    }

    @Test
    @DisplayName("Adding the same identifier replaces the record")
    void replaces() {
        Record renamed = Record.builder().identifier("001xx000000000AAAQ").name("Acme Corp").build();
        InMemoryRecordSource source = new InMemoryRecordSource().add(ACME).add(renamed);

        assertEquals(1, source.size());
        assertEquals(Optional.of(renamed), source.fetchByIdentifier("001xx000000000A"));
    }

    @Test
    @DisplayName("Records without identifier are rejected")
    void rejectsMissingIdentifier() {
        InMemoryRecordSource source = new InMemoryRecordSource();
        assertThrows(IllegalArgumentException.class, () -> source.add(Record.builder().name("x").build()));
    }

    @Test
    @DisplayName("Source exceptions carry the identifier")
    void exceptionIdentifier() {
        RecordSourceException e = new RecordSourceException("001xx000000000A", "down", new RuntimeException());
        assertEquals("001xx000000000A", e.getIdentifier());
        assertEquals("down", e.getMessage());
    }
}
