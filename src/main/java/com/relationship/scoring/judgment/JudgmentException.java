package com.relationship.scoring.judgment;

/**
 * Thrown by a {@link JudgmentProvider} when the judgment service cannot be reached
 * or answers with an error status.
 */
public class JudgmentException extends RuntimeException {

    public JudgmentException(String message) {
        super(message);
    }

    public JudgmentException(String message, Throwable cause) {
        super(message, cause);
    }
}
