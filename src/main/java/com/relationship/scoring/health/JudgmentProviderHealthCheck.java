package com.relationship.scoring.health;

import com.relationship.scoring.judgment.JudgmentProvider;

import java.util.Objects;

/**
 * DEGRADED when the judgment provider is unavailable; assessments then carry
 * computed scores only.
 */
public class JudgmentProviderHealthCheck implements HealthCheck {

    private final JudgmentProvider provider;

    public JudgmentProviderHealthCheck(JudgmentProvider provider) {
        this.provider = Objects.requireNonNull(provider, "provider is required");
    }

    @Override
    public String getName() {
        return "judgmentProvider";
    }

    @Override
    public HealthStatus check() {
        HealthStatus base = provider.isAvailable()
                ? HealthStatus.up()
                : HealthStatus.degraded("Judgment provider " + provider.getProviderName() + " not available");
        return base.withDetail("provider", provider.getProviderName());
    }
}
