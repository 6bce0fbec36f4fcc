package com.relationship.scoring.judgment;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.relationship.scoring.core.model.AddressConsistencyResult;
import com.relationship.scoring.core.model.BadDomainResult;
import com.relationship.scoring.core.model.ConsistencyResult;
import com.relationship.scoring.core.model.FlagPayload;
import com.relationship.scoring.core.model.Record;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PayloadSerializerTest {

    private final PayloadSerializer serializer = new PayloadSerializer();

    private static final Record CUSTOMER = Record.builder()
            .identifier("001xx000003DGg2")
            .name("Acme Widgets")
            .website("acmewidgets.com")
            .parentIdentifier("001xx000004ABcD")
            .billingAddress("CA", "US", "94105")
            .build();

    private static final Record SHELL = Record.builder()
            .identifier("001xx000004ABcD")
            .name("Acme Holdings")
            .enrichedAddress("CA", "US", "94105")
            .build();

    @Test
    @DisplayName("Payload with shell includes parent fields and all flags")
    void withShell() {
        FlagPayload flags = FlagPayload.builder()
                .badDomain(BadDomainResult.clean())
                .hasShell(true)
                .customerConsistency(new ConsistencyResult(87.654, List.of("a", "b")))
                .shellCoherence(ConsistencyResult.of(64.25, "c"))
                .addressConsistency(new AddressConsistencyResult(true, List.of("x", "Addresses match")))
                .build();

        ObjectNode tree = serializer.toTree(CUSTOMER, SHELL, flags);

        JsonNode customer = tree.get("customer");
        assertEquals("Acme Widgets", customer.get("Name").asText());
        assertEquals("001xx000004ABcD", customer.get("ParentIdentifier").asText());
        assertEquals("CA, US, 94105", customer.get("Billing_Address").asText());
        assertTrue(customer.get("EnrichedCompanyName").isNull());
        assertTrue(customer.get("Enriched_Billing_Address").isNull());

        JsonNode parent = tree.get("parent");
        assertFalse(parent.has("ParentIdentifier"));
        assertTrue(parent.get("Website").isNull());
        assertEquals("CA, US, 94105", parent.get("Enriched_Billing_Address").asText());

        JsonNode flagNode = tree.get("flags");
        assertTrue(flagNode.get("Has_Shell").asBoolean());
        assertEquals(87.7, flagNode.get("Customer_Consistency").get("score").asDouble());
        assertEquals("a; b", flagNode.get("Customer_Consistency").get("explanation").asText());
        assertEquals(64.3, flagNode.get("Customer_Shell_Coherence").get("score").asDouble());
        assertTrue(flagNode.get("Address_Consistency").get("is_consistent").asBoolean());
        assertEquals("x; Addresses match", flagNode.get("Address_Consistency").get("explanation").asText());
    }

    @Test
    @DisplayName("Payload without shell omits parent and shell flags")
    void withoutShell() {
        FlagPayload flags = FlagPayload.builder()
                .badDomain(BadDomainResult.clean())
                .hasShell(true)
                .customerConsistency(ConsistencyResult.of(50.0, "only"))
                .build();

        ObjectNode tree = serializer.toTree(CUSTOMER, null, flags);

        assertFalse(tree.has("parent"));
        assertFalse(tree.get("flags").has("Customer_Shell_Coherence"));
        assertFalse(tree.get("flags").has("Address_Consistency"));
        assertFalse(tree.get("flags").has("Bad_Domain"));
    }

    @Test
    @DisplayName("Serialized text parses back as JSON")
    void serialize() throws Exception {
        FlagPayload flags = FlagPayload.builder()
                .badDomain(BadDomainResult.clean())
                .hasShell(false)
                .customerConsistency(ConsistencyResult.of(10.0, "x"))
                .build();

        String text = serializer.serialize(CUSTOMER, null, flags);

        JsonNode parsed = new ObjectMapper().readTree(text);
        assertFalse(parsed.get("flags").get("Has_Shell").asBoolean());
    }

    @Test
    @DisplayName("Bad-domain payloads are rejected")
    void badDomainRejected() {
        FlagPayload flags = FlagPayload.badDomainOnly(new BadDomainResult(true, List.of("bad")));
        assertThrows(IllegalArgumentException.class, () -> serializer.toTree(CUSTOMER, null, flags));
    }
}
