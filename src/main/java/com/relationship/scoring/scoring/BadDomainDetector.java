package com.relationship.scoring.scoring;

import com.relationship.scoring.core.model.BadDomainResult;
import com.relationship.scoring.core.model.Record;
import com.relationship.scoring.core.model.RecordField;
import com.relationship.scoring.domain.BadDomainSet;
import com.relationship.scoring.domain.DomainResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Checks a customer's contact email and website against the bad-domain list.
 * Each domain is repaired before the membership test.
 */
public class BadDomainDetector {
    private static final Logger log = LoggerFactory.getLogger(BadDomainDetector.class);

    private final DomainResolver domainResolver;
    private final BadDomainSet badDomains;

    public BadDomainDetector(DomainResolver domainResolver, BadDomainSet badDomains) {
        this.domainResolver = Objects.requireNonNull(domainResolver, "domainResolver is required");
        this.badDomains = Objects.requireNonNull(badDomains, "badDomains is required");
    }

    public BadDomainResult check(Record customer) {
        if (badDomains.isEmpty()) {
            return BadDomainResult.clean();
        }

        List<String> matches = new ArrayList<>(2);

        String email = customer.get(RecordField.CONTACT_EMAIL);
        if (email.indexOf('@') >= 0) {
            String domain = domainResolver.repair(domainResolver.extract(email), badDomains);
            if (!domain.isEmpty() && badDomains.contains(domain)) {
                matches.add("Email domain '" + domain + "' from " + RecordField.CONTACT_EMAIL.key());
            }
        }

        String website = customer.get(RecordField.WEBSITE);
        if (!website.isEmpty()) {
            String domain = domainResolver.repair(domainResolver.extract(website), badDomains);
            if (!domain.isEmpty() && badDomains.contains(domain)) {
                matches.add("Website domain '" + domain + "' from " + RecordField.WEBSITE.key());
            }
        }

        if (matches.isEmpty()) {
            return BadDomainResult.clean();
        }
        String verb = matches.size() == 1 ? " matches" : " both match";
        String explanation = String.join(" and ", matches) + verb + " bad domain list";
        log.debug("Bad domain detected for {}: {}", customer.identifier(), explanation);
        return new BadDomainResult(true, List.of(explanation));
    }

    public BadDomainSet getBadDomains() {
        return badDomains;
    }
}
