package com.relationship.scoring.judgment;

import com.relationship.scoring.core.model.FlagPayload;
import com.relationship.scoring.core.model.Record;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Orchestrates judgment calls for scored records.
 *
 * <p>Never throws for collaborator trouble: an unavailable provider, a failed call or a
 * malformed response all come back as {@link JudgmentResult#error(String)}.</p>
 */
public class RelationshipJudge {
    private static final Logger log = LoggerFactory.getLogger(RelationshipJudge.class);

    private final JudgmentProvider provider;
    private final PayloadSerializer serializer;
    private final JudgmentResponseParser parser;
    private final String systemPrompt;

    public RelationshipJudge(JudgmentProvider provider) {
        this(provider, new PayloadSerializer(), new JudgmentResponseParser(), SystemPrompt.load());
    }

    public RelationshipJudge(JudgmentProvider provider, PayloadSerializer serializer,
                             JudgmentResponseParser parser, String systemPrompt) {
        this.provider = Objects.requireNonNull(provider, "provider is required");
        this.serializer = Objects.requireNonNull(serializer, "serializer is required");
        this.parser = Objects.requireNonNull(parser, "parser is required");
        this.systemPrompt = Objects.requireNonNull(systemPrompt, "systemPrompt is required");
    }

    /**
     * Requests a judgment for a record whose pipeline run reached the payload stage.
     *
     * @param shell the parent record, or null when none was scored
     */
    public JudgmentResult judge(Record customer, Record shell, FlagPayload flags) {
        String recordId = customer.identifier();
        if (!provider.isAvailable()) {
            log.warn("Judgment provider {} not available, record {} keeps computed scores only",
                    provider.getProviderName(), recordId);
            return JudgmentResult.error("Judgment provider " + provider.getProviderName() + " not available");
        }

        try {
            String payload = serializer.serialize(customer, shell, flags);
            log.info("Requesting judgment for record {} via {}", recordId, provider.getProviderName());
            String raw = provider.requestJudgment(new JudgmentRequest(recordId, systemPrompt, payload));
            JudgmentResult result = parser.parse(raw);
            log.info("judgment.completed recordId={} confidence={} success={}",
                    recordId, result.confidenceScore(), result.success());
            return result;
        } catch (RuntimeException e) {
            log.error("Judgment call failed for record {}: {}", recordId, e.getMessage(), e);
            return JudgmentResult.error(e.getMessage());
        }
    }

    public boolean isAvailable() {
        return provider.isAvailable();
    }

    public String getProviderName() {
        return provider.getProviderName();
    }
}
