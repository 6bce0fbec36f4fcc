package com.relationship.scoring.judgment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Provider used when judgment is disabled. Always unavailable; the judge
 * falls back to an error result without calling it.
 */
public class NoOpJudgmentProvider implements JudgmentProvider {
    private static final Logger log = LoggerFactory.getLogger(NoOpJudgmentProvider.class);

    @Override
    public String requestJudgment(JudgmentRequest request) {
        log.debug("NoOp judgment provider called for record {}", request.recordId());
        throw new JudgmentException("Judgment service not configured");
    }

    @Override
    public String getProviderName() {
        return "NoOp";
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
