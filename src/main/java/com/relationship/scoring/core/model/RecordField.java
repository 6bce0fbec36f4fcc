package com.relationship.scoring.core.model;

/**
 * Field names read from a {@link Record}.
 * Native fields are entered by operators; enriched fields come from a
 * third-party enrichment vendor and are treated as lower-trust fallbacks.
 */
public enum RecordField {
    IDENTIFIER("Identifier"),
    NAME("Name"),
    WEBSITE("Website"),
    BILLING_STATE("BillingState"),
    BILLING_COUNTRY("BillingCountry"),
    BILLING_POSTAL_CODE("BillingPostalCode"),
    ENRICHED_COMPANY_NAME("EnrichedCompanyName"),
    ENRICHED_WEBSITE("EnrichedWebsite"),
    ENRICHED_STATE("EnrichedState"),
    ENRICHED_COUNTRY("EnrichedCountry"),
    ENRICHED_POSTAL_CODE("EnrichedPostalCode"),
    PARENT_IDENTIFIER("ParentIdentifier"),
    CONTACT_EMAIL("ContactEmail");

    private final String key;

    RecordField(String key) {
        this.key = key;
    }

    /**
     * Returns the key under which this field appears in a flat field map.
     */
    public String key() {
        return key;
    }

    @Override
    public String toString() {
        return key;
    }
}
