package com.relationship.scoring.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BadDomainSetTest {

    @Test
    @DisplayName("Entries are cleaned and deduplicated")
    void cleansEntries() {
        BadDomainSet set = BadDomainSet.of(" Gmail.com ", "gmail.com", "\"yahoo.com\"", "", "\t");

        assertEquals(2, set.size());
        assertTrue(set.contains("gmail.com"));
        assertTrue(set.contains("yahoo.com"));
        assertFalse(set.contains("Gmail.com"));
        assertFalse(set.contains(null));
    }

    @Test
    @DisplayName("Ordered view is longest first, then alphabetical")
    void orderedView() {
        BadDomainSet set = BadDomainSet.of("aol.com", "gmail.com", "msn.com", "ringcentral.com");
        assertEquals(List.of("ringcentral.com", "gmail.com", "aol.com", "msn.com"), set.ordered());
    }

    @Test
    @DisplayName("Empty set is shared")
    void emptySet() {
        assertTrue(BadDomainSet.empty().isEmpty());
        assertSame(BadDomainSet.empty(), BadDomainSet.empty());
        assertEquals(0, BadDomainSet.of(List.of()).size());
    }
}
