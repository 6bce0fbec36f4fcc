package com.relationship.scoring.domain;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable set of known-bad domains (free mail providers, telephony platforms, ...).
 *
 * <p>Built once at startup and shared read-only across concurrent scoring calls.
 * May be empty when the reference list is unavailable, in which case every
 * bad-domain check reports "no bad domain detected".</p>
 */
public final class BadDomainSet {

    private static final BadDomainSet EMPTY = new BadDomainSet(List.of());

    private final Set<String> domains;
    // Longest first, then alphabetical: fixes which entry wins when several match
    private final List<String> ordered;

    private BadDomainSet(Collection<String> rawDomains) {
        Set<String> cleaned = new TreeSet<>();
        for (String raw : rawDomains) {
            String domain = clean(raw);
            if (!domain.isEmpty()) {
                cleaned.add(domain);
            }
        }
        List<String> sorted = new ArrayList<>(cleaned);
        sorted.sort(Comparator.comparingInt(String::length).reversed()
                .thenComparing(Comparator.naturalOrder()));
        this.domains = Set.copyOf(cleaned);
        this.ordered = List.copyOf(sorted);
    }

    public static BadDomainSet empty() {
        return EMPTY;
    }

    public static BadDomainSet of(String... domains) {
        return new BadDomainSet(List.of(domains));
    }

    public static BadDomainSet of(Collection<String> domains) {
        return new BadDomainSet(domains);
    }

    /**
     * Exact membership test on a lowercase domain.
     */
    public boolean contains(String domain) {
        return domain != null && domains.contains(domain);
    }

    /**
     * Members ordered longest first, then alphabetically.
     */
    public List<String> ordered() {
        return ordered;
    }

    public int size() {
        return domains.size();
    }

    public boolean isEmpty() {
        return domains.isEmpty();
    }

    /**
     * Normalizes a raw reference-list cell: trims, lowercases, drops tabs and quotes.
     */
    static String clean(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.replace("\t", "")
                .replace("\"", "")
                .replace("\uFEFF", "")
                .trim()
                .toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return "BadDomainSet{size=" + domains.size() + '}';
    }
}
