package com.relationship.scoring.similarity;

import com.relationship.scoring.rules.TextNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class SimilarityEngineTest {

    private SimilarityEngine engine;
    private SequenceMatcherSimilarity sequenceMatcher;

    @BeforeEach
    void setUp() {
        engine = new SimilarityEngine();
        sequenceMatcher = new SequenceMatcherSimilarity();
    }

    // ============ SequenceMatcher Tests ============

    @ParameterizedTest
    @DisplayName("SequenceMatcher: ratio is 2 * matches / total length")
    @CsvSource({
            "abcd, bcda, 0.75",
            "acme, acme corp, 0.6154",
            "carlos reyes, carlosreyeszumba, 0.7857",
            "acme widgets, acmewidgets, 0.9565",
            "globex, initech, 0.1538"
    })
    void sequenceMatcherRatio(String a, String b, double expected) {
        assertEquals(expected, sequenceMatcher.compute(a, b), 0.0001);
    }

    @Test
    @DisplayName("SequenceMatcher: raw ratio depends on argument order for some inputs")
    void sequenceMatcherOrderDependent() {
        assertEquals(2.0 / 3.0, sequenceMatcher.compute("abbaa", "aaba"), 1e-9);
        assertEquals(4.0 / 9.0, sequenceMatcher.compute("aaba", "abbaa"), 1e-9);
    }

    @Test
    @DisplayName("SequenceMatcher: null and empty strings")
    void sequenceMatcherNullEmpty() {
        assertEquals(0.0, sequenceMatcher.compute(null, "test"));
        assertEquals(0.0, sequenceMatcher.compute("test", null));
        assertEquals(0.0, sequenceMatcher.compute("", "test"));
        assertEquals(1.0, sequenceMatcher.compute("", ""));
    }

    // ============ Engine Tests ============

    @Test
    @DisplayName("Engine: identical non-empty input scores 1.0")
    void identical() {
        assertEquals(1.0, engine.similarity("Acme", "Acme"));
        assertEquals(1.0, engine.similarity("Acme Widgets Inc.", "ACME-Widgets"));
    }

    @Test
    @DisplayName("Engine: empty on either side scores 0")
    void emptyScoresZero() {
        assertEquals(0.0, engine.similarity("", "Acme"));
        assertEquals(0.0, engine.similarity("Acme", null));
        assertEquals(0.0, engine.similarity("", ""));
        assertEquals(0.0, engine.similarity("!!!", "Acme"));
    }

    @ParameterizedTest
    @DisplayName("Engine: similarity is symmetric")
    @CsvSource({
            "abbaa, aaba",
            "Carlos Reyes, carlosreyeszumba",
            "Acme Holdings, Acme Group Holdings",
            "Globex, Initech"
    })
    void symmetric(String a, String b) {
        assertEquals(engine.similarity(a, b), engine.similarity(b, a));
    }

    @Test
    @DisplayName("Engine: scores stay within [0, 1]")
    void bounded() {
        double score = engine.similarity("Carlos Reyes", "carlosreyeszumba");
        assertTrue(score > 0.7 && score < 1.0, "Expected a strong partial match, got " + score);
    }

    @Test
    @DisplayName("Engine: delegates to the algorithm with normalized, ordered input")
    void delegatesNormalizedOrderedPair() {
        SimilarityAlgorithm algorithm = mock(SimilarityAlgorithm.class);
        when(algorithm.compute("acme", "globex")).thenReturn(0.25);
        SimilarityEngine custom = new SimilarityEngine(new TextNormalizer(), algorithm);

        assertEquals(0.25, custom.similarity("Globex Corp", "ACME Inc"));
        verify(algorithm).compute("acme", "globex");
    }
}
