package com.relationship.scoring.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Canonicalizes company names and domain-derived names for comparison.
 *
 * <p>A normalization pass lowercases, strips one trailing legal-entity suffix
 * ({@code " inc"}, {@code ".llc"}, {@code ",ltd"}, {@code "-corp"}, ...; the longest matching
 * pattern wins), replaces everything outside {@code [a-z0-9 ]} with a space, collapses
 * whitespace and trims. Passes repeat until the text stops changing, so the result never
 * ends in a legal suffix and {@code normalize(normalize(x)).equals(normalize(x))}.</p>
 *
 * <p>Instances are immutable and safe to share between threads.</p>
 */
public class TextNormalizer {
    private static final Logger log = LoggerFactory.getLogger(TextNormalizer.class);

    /**
     * Legal suffixes in priority order.
     */
    public static final List<String> DEFAULT_LEGAL_SUFFIXES = List.of(
            "inc", "incorporated", "corp", "corporation", "ltd", "limited",
            "llc", "llp", "company", "co", "group", "holdings", "enterprises"
    );

    private static final List<Character> SEPARATORS = List.of(' ', '.', ',', '-');
    private static final Pattern DISALLOWED_CHARS = Pattern.compile("[^a-z0-9 ]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    // Separator-joined suffix patterns, longest first; ties keep suffix priority order
    private final List<String> suffixPatterns;

    public TextNormalizer() {
        this(DEFAULT_LEGAL_SUFFIXES);
    }

    public TextNormalizer(List<String> legalSuffixes) {
        Objects.requireNonNull(legalSuffixes, "legalSuffixes is required");
        List<String> patterns = new ArrayList<>();
        for (String suffix : legalSuffixes) {
            String lower = suffix.toLowerCase(Locale.ROOT).trim();
            if (lower.isEmpty()) {
                continue;
            }
            for (char separator : SEPARATORS) {
                patterns.add(separator + lower);
            }
        }
        patterns.sort(Comparator.comparingInt(String::length).reversed());
        this.suffixPatterns = List.copyOf(patterns);
    }

    /**
     * Returns the normalized form of the given text, or {@code ""} for null or blank input.
     */
    public String normalize(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }

        String current = text.toLowerCase(Locale.ROOT);
        String next = normalizePass(current);
        while (!next.equals(current)) {
            current = next;
            next = normalizePass(current);
        }

        if (log.isDebugEnabled() && !next.equals(text)) {
            log.debug("Normalized '{}' -> '{}'", text, next);
        }
        return next;
    }

    /**
     * Removes at most one trailing legal suffix from already-lowercased text.
     * A suffix is never removed if nothing but whitespace would remain.
     */
    public String stripLegalSuffix(String lowercased) {
        for (String pattern : suffixPatterns) {
            if (lowercased.endsWith(pattern)) {
                String stripped = lowercased.substring(0, lowercased.length() - pattern.length());
                if (!stripped.isBlank()) {
                    return stripped;
                }
            }
        }
        return lowercased;
    }

    private String normalizePass(String lowercased) {
        String result = stripLegalSuffix(lowercased);
        result = DISALLOWED_CHARS.matcher(result).replaceAll(" ");
        result = WHITESPACE.matcher(result).replaceAll(" ");
        return result.trim();
    }
}
