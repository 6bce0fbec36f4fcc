package com.relationship.scoring.scoring;

import com.relationship.scoring.core.model.AddressConsistencyResult;
import com.relationship.scoring.core.model.BadDomainResult;
import com.relationship.scoring.core.model.ConsistencyResult;
import com.relationship.scoring.core.model.Record;
import com.relationship.scoring.domain.BadDomainSet;
import com.relationship.scoring.domain.DomainResolver;
import com.relationship.scoring.similarity.SimilarityEngine;

/**
 * Entry point for the four record-level checks used by the flag pipeline.
 * Stateless apart from its collaborators; safe to share across threads.
 */
public class ConsistencyScorer {

    private final CustomerConsistencyScorer customerScorer;
    private final ShellCoherenceScorer shellScorer;
    private final AddressConsistencyScorer addressScorer;
    private final BadDomainDetector badDomainDetector;

    public ConsistencyScorer(BadDomainSet badDomains) {
        this(new SimilarityEngine(), new DomainResolver(), badDomains, CoherenceWeights.defaultWeights());
    }

    public ConsistencyScorer(SimilarityEngine similarity, DomainResolver domainResolver,
                             BadDomainSet badDomains, CoherenceWeights weights) {
        this.customerScorer = new CustomerConsistencyScorer(similarity, domainResolver);
        this.shellScorer = new ShellCoherenceScorer(similarity, domainResolver, weights);
        this.addressScorer = new AddressConsistencyScorer();
        this.badDomainDetector = new BadDomainDetector(domainResolver, badDomains);
    }

    public ConsistencyResult customerConsistency(Record customer) {
        return customerScorer.score(customer);
    }

    /**
     * @param shell the parent record, or null when it could not be fetched
     */
    public ConsistencyResult shellCoherence(Record customer, Record shell) {
        return shellScorer.score(customer, shell);
    }

    /**
     * @param shell the parent record, or null when it could not be fetched
     */
    public AddressConsistencyResult addressConsistency(Record customer, Record shell) {
        return addressScorer.score(customer, shell);
    }

    public BadDomainResult badDomain(Record customer) {
        return badDomainDetector.check(customer);
    }

    public BadDomainSet getBadDomains() {
        return badDomainDetector.getBadDomains();
    }
}
