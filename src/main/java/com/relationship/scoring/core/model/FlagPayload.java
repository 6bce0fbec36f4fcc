package com.relationship.scoring.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * The structured flags handed to the judgment collaborator.
 *
 * <p>{@code Bad_Domain} is always present. When a bad domain short-circuits the pipeline
 * nothing else is populated. Otherwise {@code Has_Shell} and {@code Customer_Consistency}
 * are present, and {@code Customer_Shell_Coherence} / {@code Address_Consistency} are present
 * only when the record has a shell and the shell record was resolved.</p>
 */
public final class FlagPayload {

    private final BadDomainResult badDomain;
    private final Boolean hasShell;
    private final ConsistencyResult customerConsistency;
    private final ConsistencyResult shellCoherence;
    private final AddressConsistencyResult addressConsistency;

    private FlagPayload(Builder builder) {
        this.badDomain = Objects.requireNonNull(builder.badDomain, "badDomain is required");
        this.hasShell = builder.hasShell;
        this.customerConsistency = builder.customerConsistency;
        this.shellCoherence = builder.shellCoherence;
        this.addressConsistency = builder.addressConsistency;

        boolean shellFlags = shellCoherence != null || addressConsistency != null;
        if (shellFlags && !Boolean.TRUE.equals(hasShell)) {
            throw new IllegalStateException("Shell flags require Has_Shell to be true");
        }
        if (!badDomain.bad() && (hasShell == null || customerConsistency == null)) {
            throw new IllegalStateException("Has_Shell and Customer_Consistency are required when no bad domain was found");
        }
    }

    /**
     * Payload for a record stopped at the bad-domain check.
     */
    public static FlagPayload badDomainOnly(BadDomainResult badDomain) {
        return builder().badDomain(badDomain).build();
    }

    public BadDomainResult getBadDomain() {
        return badDomain;
    }

    public boolean isBadDomain() {
        return badDomain.bad();
    }

    /**
     * Returns the shell flag, or empty when the pipeline stopped at the bad-domain check.
     */
    public Optional<Boolean> getHasShell() {
        return Optional.ofNullable(hasShell);
    }

    public boolean hasShell() {
        return Boolean.TRUE.equals(hasShell);
    }

    public Optional<ConsistencyResult> getCustomerConsistency() {
        return Optional.ofNullable(customerConsistency);
    }

    public Optional<ConsistencyResult> getShellCoherence() {
        return Optional.ofNullable(shellCoherence);
    }

    public Optional<AddressConsistencyResult> getAddressConsistency() {
        return Optional.ofNullable(addressConsistency);
    }

    @Override
    public String toString() {
        return "FlagPayload{" +
                "badDomain=" + badDomain.bad() +
                ", hasShell=" + hasShell +
                ", customerConsistency=" + (customerConsistency != null ? customerConsistency.roundedScore() : null) +
                ", shellCoherence=" + (shellCoherence != null ? shellCoherence.roundedScore() : null) +
                ", addressConsistency=" + (addressConsistency != null ? addressConsistency.consistent() : null) +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private BadDomainResult badDomain;
        private Boolean hasShell;
        private ConsistencyResult customerConsistency;
        private ConsistencyResult shellCoherence;
        private AddressConsistencyResult addressConsistency;

        public Builder badDomain(BadDomainResult badDomain) {
            this.badDomain = badDomain;
            return this;
        }

        public Builder hasShell(boolean hasShell) {
            this.hasShell = hasShell;
            return this;
        }

        public Builder customerConsistency(ConsistencyResult customerConsistency) {
            this.customerConsistency = customerConsistency;
            return this;
        }

        public Builder shellCoherence(ConsistencyResult shellCoherence) {
            this.shellCoherence = shellCoherence;
            return this;
        }

        public Builder addressConsistency(AddressConsistencyResult addressConsistency) {
            this.addressConsistency = addressConsistency;
            return this;
        }

        public FlagPayload build() {
            return new FlagPayload(this);
        }
    }
}
