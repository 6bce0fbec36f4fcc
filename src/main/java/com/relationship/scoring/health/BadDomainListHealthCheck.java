package com.relationship.scoring.health;

import com.relationship.scoring.domain.BadDomainSet;

import java.util.Objects;

/**
 * DEGRADED when the bad-domain list is empty: scoring still works, but no record
 * will ever be stopped by the bad-domain check.
 */
public class BadDomainListHealthCheck implements HealthCheck {

    private final BadDomainSet badDomains;

    public BadDomainListHealthCheck(BadDomainSet badDomains) {
        this.badDomains = Objects.requireNonNull(badDomains, "badDomains is required");
    }

    @Override
    public String getName() {
        return "badDomainList";
    }

    @Override
    public HealthStatus check() {
        HealthStatus base = badDomains.isEmpty()
                ? HealthStatus.degraded("Bad-domain list is empty; bad-domain check disabled")
                : HealthStatus.up();
        return base.withDetail("domains", badDomains.size());
    }
}
