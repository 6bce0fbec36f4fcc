package com.relationship.scoring.core.model;

/**
 * States of the relationship flag pipeline.
 *
 * <pre>
 * START -> BAD_DOMAIN_CHECK -> STOP (bad domain)
 *                           -> SHELL_CHECK -> CONSISTENCY_SCORING
 *                                          -> SHELL_COHERENCE_SCORING (shell resolved)
 *                                          -> PAYLOAD_READY
 * </pre>
 */
public enum PipelineStage {
    START,
    BAD_DOMAIN_CHECK,
    STOP,
    SHELL_CHECK,
    CONSISTENCY_SCORING,
    SHELL_COHERENCE_SCORING,
    PAYLOAD_READY;

    /**
     * Returns true for the two states a pipeline run can end in.
     */
    public boolean isTerminal() {
        return this == STOP || this == PAYLOAD_READY;
    }
}
