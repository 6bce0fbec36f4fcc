package com.relationship.scoring.scoring;

import com.relationship.scoring.core.model.Record;
import com.relationship.scoring.core.model.RecordField;

import java.util.ArrayList;
import java.util.List;

/**
 * Fallback chains between native record fields and their enrichment-vendor mirrors.
 *
 * <p>Names and websites prefer the native field on both sides. Addresses do not: the
 * customer prefers its own billing address, while the shell prefers the enriched address.
 * See {@link #customerAddress(Record)} and {@link #shellAddress(Record)}.</p>
 */
public final class FieldPrecedence {

    private FieldPrecedence() {
        // Utility class
    }

    /**
     * A field value together with the field it was read from.
     * {@code source} is null when neither candidate field had a value.
     */
    public record FieldSelection(String value, RecordField source) {

        static FieldSelection none() {
            return new FieldSelection("", null);
        }

        public boolean isPresent() {
            return !value.isEmpty();
        }

        /**
         * Field name for explanation text, or "none".
         */
        public String sourceLabel() {
            return source != null ? source.key() : "none";
        }
    }

    /**
     * Which set of address fields an address string was built from.
     */
    public enum AddressSource {
        BILLING("Billing_Address"),
        ENRICHED("Enriched_Billing_Address"),
        NONE("no address");

        private final String label;

        AddressSource(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    /**
     * A joined "State, Country, PostalCode" string and the field set it came from.
     */
    public record AddressSelection(String address, AddressSource source) {

        static AddressSelection none() {
            return new AddressSelection("", AddressSource.NONE);
        }

        public boolean isPresent() {
            return !address.isEmpty();
        }
    }

    /**
     * {@code Name}, falling back to {@code EnrichedCompanyName}.
     */
    public static FieldSelection name(Record record) {
        return firstPresent(record, RecordField.NAME, RecordField.ENRICHED_COMPANY_NAME);
    }

    /**
     * {@code Website}, falling back to {@code EnrichedWebsite}.
     */
    public static FieldSelection website(Record record) {
        return firstPresent(record, RecordField.WEBSITE, RecordField.ENRICHED_WEBSITE);
    }

    /**
     * Customer side: native billing fields first, enriched fields as fallback.
     */
    public static AddressSelection customerAddress(Record customer) {
        String billing = billingAddress(customer);
        if (!billing.isEmpty()) {
            return new AddressSelection(billing, AddressSource.BILLING);
        }
        String enriched = enrichedAddress(customer);
        if (!enriched.isEmpty()) {
            return new AddressSelection(enriched, AddressSource.ENRICHED);
        }
        return AddressSelection.none();
    }

    /**
     * Shell side: enriched fields first, native billing fields as fallback.
     * This is the reverse of {@link #customerAddress(Record)}.
     */
    public static AddressSelection shellAddress(Record shell) {
        String enriched = enrichedAddress(shell);
        if (!enriched.isEmpty()) {
            return new AddressSelection(enriched, AddressSource.ENRICHED);
        }
        String billing = billingAddress(shell);
        if (!billing.isEmpty()) {
            return new AddressSelection(billing, AddressSource.BILLING);
        }
        return AddressSelection.none();
    }

    /**
     * Native billing State, Country and PostalCode joined with ", ", empty parts omitted.
     */
    public static String billingAddress(Record record) {
        return joinAddress(record, RecordField.BILLING_STATE, RecordField.BILLING_COUNTRY,
                RecordField.BILLING_POSTAL_CODE);
    }

    /**
     * Enriched State, Country and PostalCode joined with ", ", empty parts omitted.
     */
    public static String enrichedAddress(Record record) {
        return joinAddress(record, RecordField.ENRICHED_STATE, RecordField.ENRICHED_COUNTRY,
                RecordField.ENRICHED_POSTAL_CODE);
    }

    private static FieldSelection firstPresent(Record record, RecordField primary, RecordField fallback) {
        String value = record.get(primary);
        if (!value.isEmpty()) {
            return new FieldSelection(value, primary);
        }
        value = record.get(fallback);
        if (!value.isEmpty()) {
            return new FieldSelection(value, fallback);
        }
        return FieldSelection.none();
    }

    private static String joinAddress(Record record, RecordField... fields) {
        List<String> parts = new ArrayList<>(fields.length);
        for (RecordField field : fields) {
            String value = record.get(field);
            if (!value.isEmpty()) {
                parts.add(value);
            }
        }
        return String.join(", ", parts);
    }
}
