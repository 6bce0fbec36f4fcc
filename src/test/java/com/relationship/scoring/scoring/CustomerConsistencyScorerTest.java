package com.relationship.scoring.scoring;

import com.relationship.scoring.core.model.ConsistencyResult;
import com.relationship.scoring.core.model.Record;
import com.relationship.scoring.domain.DomainResolver;
import com.relationship.scoring.similarity.SimilarityEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CustomerConsistencyScorer Tests")
class CustomerConsistencyScorerTest {

    private CustomerConsistencyScorer scorer;

    @BeforeEach
    void setUp() {
        scorer = new CustomerConsistencyScorer(new SimilarityEngine(), new DomainResolver());
    }

    @Nested
    @DisplayName("With Website")
    class WebsiteTests {

        @Test
        @DisplayName("Name sharing a long run with the domain-derived name scores high")
        void carlosReyes() {
            Record record = Record.builder()
                    .name("Carlos Reyes")
                    .website("carlosreyes.zumba.com")
                    .build();

            ConsistencyResult result = scorer.score(record);

            assertEquals(78.6, result.roundedScore());
            assertEquals(1, result.explanation().size());
            assertEquals("Using Website: Comparing 'Carlos Reyes' with domain 'carlosreyeszumba' "
                    + "from carlosreyes.zumba.com: 78.6", result.explanation().get(0));
        }

        @Test
        @DisplayName("Website wins over enriched fields even when it scores lower")
        void websiteTakesPrecedence() {
            Record record = Record.builder()
                    .name("Globex")
                    .website("initech.com")
                    .enrichedCompanyName("Globex")
                    .build();

            ConsistencyResult result = scorer.score(record);

            assertEquals(15.4, result.roundedScore());
            assertTrue(result.summary().startsWith("Using Website:"));
        }

        @Test
        @DisplayName("Missing name scores 0 with a reason")
        void missingName() {
            ConsistencyResult result = scorer.score(Record.builder().website("acme.com").build());

            assertEquals(0.0, result.score());
            assertEquals(List.of("Using Website: " + CustomerConsistencyScorer.NO_NAME), result.explanation());
        }

        @Test
        @DisplayName("Website without an extractable domain scores 0")
        void unparseableWebsite() {
            ConsistencyResult result = scorer.score(Record.builder().name("Acme").website("http://").build());

            assertEquals(0.0, result.score());
            assertTrue(result.summary().contains("Could not extract valid domain from 'http://'"));
        }
    }

    @Nested
    @DisplayName("Enriched fallback")
    class EnrichedTests {

        @Test
        @DisplayName("Best of the enriched comparisons is kept")
        void keepsBest() {
            Record record = Record.builder()
                    .name("Globex")
                    .enrichedCompanyName("Globex Corporation")
                    .enrichedWebsite("initech.com")
                    .build();

            ConsistencyResult result = scorer.score(record);

            assertEquals(100.0, result.score());
            assertEquals(3, result.explanation().size());
            assertEquals("No Website, using enriched fields", result.explanation().get(0));
            assertTrue(result.explanation().get(1).startsWith("Name 'Globex' vs EnrichedCompanyName"));
            assertTrue(result.explanation().get(2).startsWith("EnrichedWebsite: Comparing 'Globex'"));
        }

        @Test
        @DisplayName("Enriched website alone is enough")
        void websiteOnly() {
            Record record = Record.builder()
                    .name("Carlos Reyes")
                    .enrichedWebsite("https://carlosreyes.zumba.com")
                    .build();

            assertEquals(78.6, scorer.score(record).roundedScore());
        }

        @Test
        @DisplayName("No comparison data at all")
        void noData() {
            ConsistencyResult result = scorer.score(Record.builder().name("Acme").build());

            assertEquals(0.0, result.score());
            assertEquals(List.of(CustomerConsistencyScorer.NO_DATA), result.explanation());
        }

        @Test
        @DisplayName("Enriched data without a name")
        void noName() {
            ConsistencyResult result = scorer.score(Record.builder().enrichedCompanyName("Acme").build());

            assertEquals(0.0, result.score());
            assertEquals(List.of(CustomerConsistencyScorer.NO_NAME), result.explanation());
        }
    }
}
