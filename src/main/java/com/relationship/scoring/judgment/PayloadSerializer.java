package com.relationship.scoring.judgment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.relationship.scoring.core.model.AddressConsistencyResult;
import com.relationship.scoring.core.model.ConsistencyResult;
import com.relationship.scoring.core.model.FlagPayload;
import com.relationship.scoring.core.model.Record;
import com.relationship.scoring.core.model.RecordField;
import com.relationship.scoring.scoring.FieldPrecedence;

/**
 * Renders the customer/shell field subset and the computed flags as the JSON document
 * sent to the judgment service.
 *
 * <pre>
 * {
 *   "customer": { Name, ParentIdentifier, Website, Billing_Address,
 *                 EnrichedCompanyName, EnrichedWebsite, Enriched_Billing_Address },
 *   "parent":   { same fields without ParentIdentifier },          // only when the shell was scored
 *   "flags":    { Has_Shell, Customer_Consistency, Customer_Shell_Coherence?, Address_Consistency? }
 * }
 * </pre>
 * Empty fields are written as {@code null}; scores are rounded to one decimal.
 */
public class PayloadSerializer {

    private final ObjectMapper objectMapper;

    public PayloadSerializer() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public PayloadSerializer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Builds the payload tree.
     *
     * @param customer the customer record
     * @param shell    the parent record, or null when none was scored
     * @param flags    the pipeline's flag payload; must not be a bad-domain stop
     */
    public ObjectNode toTree(Record customer, Record shell, FlagPayload flags) {
        if (flags.isBadDomain()) {
            throw new IllegalArgumentException("Bad-domain payloads are never sent for judgment");
        }
        ObjectNode root = objectMapper.createObjectNode();

        ObjectNode customerNode = root.putObject("customer");
        writeFields(customerNode, customer, true);

        if (shell != null && flags.getShellCoherence().isPresent()) {
            ObjectNode parentNode = root.putObject("parent");
            writeFields(parentNode, shell, false);
        }

        ObjectNode flagsNode = root.putObject("flags");
        flagsNode.put("Has_Shell", flags.hasShell());
        flags.getCustomerConsistency()
                .ifPresent(result -> writeScore(flagsNode.putObject("Customer_Consistency"), result));
        flags.getShellCoherence()
                .ifPresent(result -> writeScore(flagsNode.putObject("Customer_Shell_Coherence"), result));
        flags.getAddressConsistency()
                .ifPresent(result -> writeAddress(flagsNode.putObject("Address_Consistency"), result));
        return root;
    }

    public String serialize(Record customer, Record shell, FlagPayload flags) {
        try {
            return objectMapper.writeValueAsString(toTree(customer, shell, flags));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize judgment payload", e);
        }
    }

    private static void writeFields(ObjectNode node, Record record, boolean includeParent) {
        putText(node, RecordField.NAME.key(), record.get(RecordField.NAME));
        if (includeParent) {
            putText(node, RecordField.PARENT_IDENTIFIER.key(), record.get(RecordField.PARENT_IDENTIFIER));
        }
        putText(node, RecordField.WEBSITE.key(), record.get(RecordField.WEBSITE));
        putText(node, "Billing_Address", FieldPrecedence.billingAddress(record));
        putText(node, RecordField.ENRICHED_COMPANY_NAME.key(), record.get(RecordField.ENRICHED_COMPANY_NAME));
        putText(node, RecordField.ENRICHED_WEBSITE.key(), record.get(RecordField.ENRICHED_WEBSITE));
        putText(node, "Enriched_Billing_Address", FieldPrecedence.enrichedAddress(record));
    }

    private static void writeScore(ObjectNode node, ConsistencyResult result) {
        node.put("score", result.roundedScore());
        node.put("explanation", result.summary());
    }

    private static void writeAddress(ObjectNode node, AddressConsistencyResult result) {
        node.put("is_consistent", result.consistent());
        node.put("explanation", result.summary());
    }

    private static void putText(ObjectNode node, String field, String value) {
        if (value == null || value.isEmpty()) {
            node.putNull(field);
        } else {
            node.put(field, value);
        }
    }
}
