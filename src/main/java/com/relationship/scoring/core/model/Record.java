package com.relationship.scoring.core.model;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Read-only business record: a flat mapping from field name to optional text or number.
 * Values are copied on construction; the scoring engine never mutates a record.
 *
 * <p>Accessors never return {@code null}: absent, {@code null} and blank values all
 * read as the empty string, and present values are trimmed.</p>
 */
public final class Record {

    private final Map<String, Object> fields;

    private Record(Map<String, Object> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /**
     * Creates a record from a flat field map as returned by a record source.
     *
     * @throws NullPointerException if {@code fields} is null
     */
    public static Record of(Map<String, ?> fields) {
        Objects.requireNonNull(fields, "fields is required");
        return new Record(new LinkedHashMap<>(fields));
    }

    public static Record empty() {
        return new Record(Map.of());
    }

    /**
     * Returns the trimmed text value of a field, or {@code ""} when absent.
     */
    public String get(RecordField field) {
        return get(field.key());
    }

    /**
     * Returns the trimmed text value of a field by raw key, or {@code ""} when absent.
     */
    public String get(String key) {
        return asText(fields.get(key));
    }

    /**
     * Returns true if the field holds a non-blank value.
     */
    public boolean has(RecordField field) {
        return !get(field).isEmpty();
    }

    public String identifier() {
        return get(RecordField.IDENTIFIER);
    }

    /**
     * Returns the raw field map, including fields the engine does not read.
     */
    public Map<String, Object> fields() {
        return fields;
    }

    private static String asText(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.stripTrailingZeros().toPlainString();
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return "";
            }
            return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
        }
        return String.valueOf(value).trim();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Record record = (Record) o;
        return fields.equals(record.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "Record{" +
                "identifier='" + identifier() + '\'' +
                ", name='" + get(RecordField.NAME) + '\'' +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, Object> fields = new LinkedHashMap<>();

        public Builder field(RecordField field, Object value) {
            return field(field.key(), value);
        }

        public Builder field(String key, Object value) {
            Objects.requireNonNull(key, "key is required");
            fields.put(key, value);
            return this;
        }

        public Builder identifier(String identifier) {
            return field(RecordField.IDENTIFIER, identifier);
        }

        public Builder name(String name) {
            return field(RecordField.NAME, name);
        }

        public Builder website(String website) {
            return field(RecordField.WEBSITE, website);
        }

        public Builder parentIdentifier(String parentIdentifier) {
            return field(RecordField.PARENT_IDENTIFIER, parentIdentifier);
        }

        public Builder contactEmail(String contactEmail) {
            return field(RecordField.CONTACT_EMAIL, contactEmail);
        }

        public Builder enrichedCompanyName(String name) {
            return field(RecordField.ENRICHED_COMPANY_NAME, name);
        }

        public Builder enrichedWebsite(String website) {
            return field(RecordField.ENRICHED_WEBSITE, website);
        }

        public Builder billingAddress(Object state, Object country, Object postalCode) {
            field(RecordField.BILLING_STATE, state);
            field(RecordField.BILLING_COUNTRY, country);
            return field(RecordField.BILLING_POSTAL_CODE, postalCode);
        }

        public Builder enrichedAddress(Object state, Object country, Object postalCode) {
            field(RecordField.ENRICHED_STATE, state);
            field(RecordField.ENRICHED_COUNTRY, country);
            return field(RecordField.ENRICHED_POSTAL_CODE, postalCode);
        }

        public Record build() {
            return new Record(fields);
        }
    }
}
