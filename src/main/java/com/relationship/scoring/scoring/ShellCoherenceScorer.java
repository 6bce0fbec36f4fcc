package com.relationship.scoring.scoring;

import com.relationship.scoring.core.model.ConsistencyResult;
import com.relationship.scoring.core.model.Record;
import com.relationship.scoring.domain.DomainResolver;
import com.relationship.scoring.scoring.FieldPrecedence.FieldSelection;
import com.relationship.scoring.similarity.SimilarityEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Scores name and website agreement between a customer and its parent shell.
 *
 * <p>Up to four comparisons are made, each only when both sides have data:</p>
 * <ul>
 *   <li>direct: name vs name, website domain name vs website domain name</li>
 *   <li>cross: customer name vs shell domain name, customer domain name vs shell name</li>
 * </ul>
 * Formula: {@code 100 * (direct * mean(direct) + cross * mean(cross))} when both groups have
 * scores, or {@code 100 * mean(group)} when only one does. Zero scores count toward the mean.
 */
public class ShellCoherenceScorer {
    private static final Logger log = LoggerFactory.getLogger(ShellCoherenceScorer.class);

    static final String NO_SHELL = "No shell record data available";
    static final String INSUFFICIENT = "Insufficient name or website data for shell coherence";

    private final SimilarityEngine similarity;
    private final DomainResolver domainResolver;
    private final CoherenceWeights weights;

    public ShellCoherenceScorer(SimilarityEngine similarity, DomainResolver domainResolver) {
        this(similarity, domainResolver, CoherenceWeights.defaultWeights());
    }

    public ShellCoherenceScorer(SimilarityEngine similarity, DomainResolver domainResolver,
                                CoherenceWeights weights) {
        this.similarity = Objects.requireNonNull(similarity, "similarity is required");
        this.domainResolver = Objects.requireNonNull(domainResolver, "domainResolver is required");
        this.weights = Objects.requireNonNull(weights, "weights is required");
    }

    public ConsistencyResult score(Record customer, Record shell) {
        if (shell == null) {
            return ConsistencyResult.noData(NO_SHELL);
        }

        FieldSelection customerName = FieldPrecedence.name(customer);
        FieldSelection customerWebsite = FieldPrecedence.website(customer);
        FieldSelection shellName = FieldPrecedence.name(shell);
        FieldSelection shellWebsite = FieldPrecedence.website(shell);
        String customerDomainName = domainResolver.nameFromWebsite(customerWebsite.value());
        String shellDomainName = domainResolver.nameFromWebsite(shellWebsite.value());

        List<String> explanation = new ArrayList<>();
        explanation.add(String.format("Customer uses %s and %s; shell uses %s and %s",
                customerName.sourceLabel(), customerWebsite.sourceLabel(),
                shellName.sourceLabel(), shellWebsite.sourceLabel()));

        List<Double> direct = new ArrayList<>();
        List<Double> cross = new ArrayList<>();

        if (customerName.isPresent() && shellName.isPresent()) {
            direct.add(compare("Name vs name", customerName.value(), shellName.value(), explanation));
        }
        if (!customerDomainName.isEmpty() && !shellDomainName.isEmpty()) {
            direct.add(compare("Website vs website", customerDomainName, shellDomainName, explanation));
        }
        if (customerName.isPresent() && !shellDomainName.isEmpty()) {
            cross.add(compare("Customer name vs shell website", customerName.value(), shellDomainName, explanation));
        }
        if (!customerDomainName.isEmpty() && shellName.isPresent()) {
            cross.add(compare("Customer website vs shell name", customerDomainName, shellName.value(), explanation));
        }

        if (direct.isEmpty() && cross.isEmpty()) {
            return ConsistencyResult.noData(INSUFFICIENT);
        }

        double combined;
        if (!direct.isEmpty() && !cross.isEmpty()) {
            double directMean = mean(direct);
            double crossMean = mean(cross);
            combined = weights.directWeight() * directMean + weights.crossWeight() * crossMean;
            explanation.add(String.format(Locale.ROOT, "Direct mean %.2f (weight %.1f), cross mean %.2f (weight %.1f)",
                    directMean, weights.directWeight(), crossMean, weights.crossWeight()));
        } else if (!direct.isEmpty()) {
            combined = mean(direct);
            explanation.add(String.format(Locale.ROOT, "Direct comparisons only, mean %.2f", combined));
        } else {
            combined = mean(cross);
            explanation.add(String.format(Locale.ROOT, "Cross comparisons only, mean %.2f", combined));
        }

        double score = Math.max(0.0, Math.min(100.0, combined * 100.0));
        log.debug("Shell coherence {} vs {} = {}", customer.identifier(), shell.identifier(), score);
        return new ConsistencyResult(score, explanation);
    }

    public CoherenceWeights getWeights() {
        return weights;
    }

    private double compare(String label, String left, String right, List<String> explanation) {
        double score = similarity.similarity(left, right);
        explanation.add(String.format(Locale.ROOT, "%s ('%s' vs '%s'): %.2f", label, left, right, score));
        return score;
    }

    private static double mean(List<Double> values) {
        double sum = 0.0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.size();
    }
}
