package com.relationship.scoring.judgment;

/**
 * Interface for the external judgment service that turns a scored payload into a
 * confidence score and explanation bullets.
 *
 * <p>Providers return the raw response text; validation is done by
 * {@link JudgmentResponseParser} so that every provider is held to the same contract.</p>
 */
public interface JudgmentProvider {

    /**
     * Sends the request and returns the raw response text.
     *
     * @throws JudgmentException if the service could not be called
     */
    String requestJudgment(JudgmentRequest request);

    /**
     * Returns the name/identifier of this provider.
     */
    String getProviderName();

    /**
     * Checks if the provider is configured and usable.
     */
    boolean isAvailable();
}
