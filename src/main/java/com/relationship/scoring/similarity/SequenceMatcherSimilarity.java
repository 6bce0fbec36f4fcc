package com.relationship.scoring.similarity;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Sequence-alignment similarity: {@code 2 * M / T}, where {@code M} is the total length of
 * the matching blocks found by recursively taking the longest common substring and then
 * matching the regions to its left and right, and {@code T} is the combined length of
 * both strings.
 *
 * <p>Among equally long common substrings the one starting earliest in {@code s1} wins,
 * then the one starting earliest in {@code s2}. That tie-break makes the raw score
 * order-dependent for some inputs; {@link SimilarityEngine} fixes the argument order.</p>
 */
public class SequenceMatcherSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        int total = s1.length() + s2.length();
        if (total == 0) {
            return 1.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        return 2.0 * matchedCharacters(s1, s2) / total;
    }

    @Override
    public String getName() {
        return "SequenceMatcher";
    }

    /**
     * Returns the total size of all matching blocks between the two strings.
     */
    int matchedCharacters(String a, String b) {
        int matched = 0;
        Deque<int[]> pending = new ArrayDeque<>();
        pending.push(new int[]{0, a.length(), 0, b.length()});

        while (!pending.isEmpty()) {
            int[] region = pending.pop();
            int alo = region[0];
            int ahi = region[1];
            int blo = region[2];
            int bhi = region[3];

            int[] match = longestMatch(a, b, alo, ahi, blo, bhi);
            int i = match[0];
            int j = match[1];
            int size = match[2];
            if (size == 0) {
                continue;
            }
            matched += size;
            if (alo < i && blo < j) {
                pending.push(new int[]{alo, i, blo, j});
            }
            if (i + size < ahi && j + size < bhi) {
                pending.push(new int[]{i + size, ahi, j + size, bhi});
            }
        }
        return matched;
    }

    /**
     * Longest common substring of {@code a[alo:ahi]} and {@code b[blo:bhi]}.
     *
     * @return {start in a, start in b, length}
     */
    private int[] longestMatch(String a, String b, int alo, int ahi, int blo, int bhi) {
        int bestI = alo;
        int bestJ = blo;
        int bestSize = 0;

        // runLength[j + 1] = length of the common run ending at a[i], b[j]
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];

        for (int i = alo; i < ahi; i++) {
            char c = a.charAt(i);
            for (int j = blo; j < bhi; j++) {
                if (b.charAt(j) == c) {
                    int k = (j > blo ? previous[j] : 0) + 1;
                    current[j + 1] = k;
                    if (k > bestSize) {
                        bestI = i - k + 1;
                        bestJ = j - k + 1;
                        bestSize = k;
                    }
                } else {
                    current[j + 1] = 0;
                }
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return new int[]{bestI, bestJ, bestSize};
    }
}
