package com.relationship.scoring.judgment;

import java.util.Objects;

/**
 * A single judgment call: the instructions plus the serialized record payload.
 *
 * @param recordId     identifier of the customer record being judged, for logging
 * @param systemPrompt standing instructions for the judgment service
 * @param payload      JSON produced by {@link PayloadSerializer}
 */
public record JudgmentRequest(String recordId, String systemPrompt, String payload) {

    public JudgmentRequest {
        Objects.requireNonNull(systemPrompt, "systemPrompt is required");
        Objects.requireNonNull(payload, "payload is required");
        recordId = recordId != null ? recordId : "";
    }
}
