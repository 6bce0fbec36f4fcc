package com.relationship.scoring.identifier;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Converts record identifiers between their 15-character (case-sensitive) and
 * 18-character (case-insensitive, checksummed) representations.
 *
 * <p>Two identifiers denote the same entity iff their first 15 characters match.
 * Every identifier-equality decision must go through {@link #sameEntity(String, String)};
 * comparing raw strings treats the 15- and 18-character forms of one record as different.</p>
 */
public final class IdentifierCodec {

    public static final int SHORT_LENGTH = 15;
    public static final int LONG_LENGTH = 18;
    public static final String DEFAULT_PREFIX = "001";

    private static final int CHUNK_SIZE = 5;
    private static final int LETTER_COUNT = 26;

    private IdentifierCodec() {
        // Utility class
    }

    /**
     * Returns the 18-character form of a 15-character identifier.
     * Input of any other length is returned unchanged.
     */
    public static String to18(String id15) {
        if (id15 == null || id15.length() != SHORT_LENGTH) {
            return id15;
        }
        StringBuilder result = new StringBuilder(LONG_LENGTH).append(id15);
        for (int chunk = 0; chunk < SHORT_LENGTH / CHUNK_SIZE; chunk++) {
            result.append(checksumChar(id15, chunk * CHUNK_SIZE));
        }
        return result.toString();
    }

    /**
     * Returns the 15-character form of an 18-character identifier.
     * 15-character input and input of unrecognized length are returned unchanged.
     */
    public static String to15(String id) {
        if (id != null && id.length() == LONG_LENGTH) {
            return id.substring(0, SHORT_LENGTH);
        }
        return id;
    }

    /**
     * Returns true if both identifiers are non-empty and refer to the same entity,
     * regardless of whether each is given in 15- or 18-character form.
     */
    public static boolean sameEntity(String a, String b) {
        if (a == null || b == null) {
            return false;
        }
        String left = a.trim();
        String right = b.trim();
        if (left.isEmpty() || right.isEmpty()) {
            return false;
        }
        return to15(left).equals(to15(right));
    }

    /**
     * Returns true if the identifier is alphanumeric, 15 or 18 characters long,
     * and starts with the expected object-type prefix.
     */
    public static boolean isWellFormed(String id, String expectedPrefix) {
        if (id == null) {
            return false;
        }
        String trimmed = id.trim();
        if (trimmed.length() != SHORT_LENGTH && trimmed.length() != LONG_LENGTH) {
            return false;
        }
        if (expectedPrefix != null && !trimmed.startsWith(expectedPrefix)) {
            return false;
        }
        for (int i = 0; i < trimmed.length(); i++) {
            char c = trimmed.charAt(i);
            if (!isAsciiLetterOrDigit(c)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Splits identifiers into well-formed (canonical 18-character form, first occurrence
     * of each entity kept, input order preserved) and malformed (as given).
     */
    public static IdentifierValidation partition(List<String> ids, String expectedPrefix) {
        List<String> malformed = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        List<String> wellFormed = new ArrayList<>();

        for (String id : ids) {
            if (!isWellFormed(id, expectedPrefix)) {
                malformed.add(id == null ? "" : id);
                continue;
            }
            String trimmed = id.trim();
            if (seen.add(to15(trimmed))) {
                wellFormed.add(trimmed.length() == SHORT_LENGTH ? to18(trimmed) : trimmed);
            }
        }
        return new IdentifierValidation(wellFormed, malformed);
    }

    /**
     * Bit i of the chunk value is set when character i of the chunk is an uppercase letter.
     */
    private static char checksumChar(String id, int offset) {
        int value = 0;
        for (int i = 0; i < CHUNK_SIZE; i++) {
            char c = id.charAt(offset + i);
            if (c >= 'A' && c <= 'Z') {
                value += 1 << i;
            }
        }
        return value < LETTER_COUNT
                ? (char) ('A' + value)
                : (char) ('0' + (value - LETTER_COUNT));
    }

    private static boolean isAsciiLetterOrDigit(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
    }
}
