package com.relationship.scoring.scoring;

import com.relationship.scoring.core.model.ConsistencyResult;
import com.relationship.scoring.core.model.Record;
import com.relationship.scoring.core.model.RecordField;
import com.relationship.scoring.domain.DomainResolver;
import com.relationship.scoring.similarity.SimilarityEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Scores how well a customer's name agrees with its own web presence.
 *
 * <p>When {@code Website} is present the score is the similarity between {@code Name} and the
 * name derived from the website's domain. Otherwise the enriched fields are used: {@code Name}
 * vs {@code EnrichedCompanyName}, and {@code Name} vs the domain name of {@code EnrichedWebsite},
 * keeping the higher of the two.</p>
 */
public class CustomerConsistencyScorer {
    private static final Logger log = LoggerFactory.getLogger(CustomerConsistencyScorer.class);

    static final String NO_NAME = "No company name provided";
    static final String NO_DATA = "No Website, EnrichedCompanyName or EnrichedWebsite to compare against";

    private final SimilarityEngine similarity;
    private final DomainResolver domainResolver;

    public CustomerConsistencyScorer(SimilarityEngine similarity, DomainResolver domainResolver) {
        this.similarity = Objects.requireNonNull(similarity, "similarity is required");
        this.domainResolver = Objects.requireNonNull(domainResolver, "domainResolver is required");
    }

    public ConsistencyResult score(Record customer) {
        String name = customer.get(RecordField.NAME);
        String website = customer.get(RecordField.WEBSITE);

        if (!website.isEmpty()) {
            Comparison comparison = compareWithWebsite(name, website);
            return new ConsistencyResult(comparison.score(), List.of("Using Website: " + comparison.detail()));
        }

        String enrichedName = customer.get(RecordField.ENRICHED_COMPANY_NAME);
        String enrichedWebsite = customer.get(RecordField.ENRICHED_WEBSITE);
        if (enrichedName.isEmpty() && enrichedWebsite.isEmpty()) {
            return ConsistencyResult.noData(NO_DATA);
        }
        if (name.isEmpty()) {
            return ConsistencyResult.noData(NO_NAME);
        }

        List<String> explanation = new ArrayList<>();
        explanation.add("No Website, using enriched fields");
        double best = 0.0;

        if (!enrichedName.isEmpty()) {
            double score = similarity.similarity(name, enrichedName) * 100.0;
            explanation.add(String.format(Locale.ROOT, "Name '%s' vs EnrichedCompanyName '%s': %.1f",
                    name, enrichedName, score));
            best = Math.max(best, score);
        }
        if (!enrichedWebsite.isEmpty()) {
            Comparison comparison = compareWithWebsite(name, enrichedWebsite);
            explanation.add("EnrichedWebsite: " + comparison.detail());
            best = Math.max(best, comparison.score());
        }

        log.debug("Customer consistency from enriched fields for '{}' = {}", name, best);
        return new ConsistencyResult(clamp(best), explanation);
    }

    private Comparison compareWithWebsite(String name, String website) {
        if (name.isEmpty()) {
            return new Comparison(0.0, NO_NAME);
        }
        String domain = domainResolver.extract(website);
        if (domain.isEmpty()) {
            return new Comparison(0.0, "Could not extract valid domain from '" + website + "'");
        }
        String domainName = domainResolver.domainDerivedName(domain);
        if (domainName.isEmpty()) {
            return new Comparison(0.0, "Could not derive a company name from domain '" + domain + "'");
        }
        double score = clamp(similarity.similarity(name, domainName) * 100.0);
        String detail = String.format(Locale.ROOT, "Comparing '%s' with domain '%s' from %s: %.1f",
                name, domainName, domain, score);
        return new Comparison(score, detail);
    }

    private static double clamp(double score) {
        return Math.max(0.0, Math.min(100.0, score));
    }

    private record Comparison(double score, String detail) {
    }
}
