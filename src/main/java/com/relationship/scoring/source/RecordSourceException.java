package com.relationship.scoring.source;

/**
 * Thrown when the record store cannot be queried.
 * A missing record is not an error; sources return an empty Optional for that.
 */
public class RecordSourceException extends RuntimeException {

    private final String identifier;

    public RecordSourceException(String identifier, String message) {
        super(message);
        this.identifier = identifier;
    }

    public RecordSourceException(String identifier, String message, Throwable cause) {
        super(message, cause);
        this.identifier = identifier;
    }

    public String getIdentifier() {
        return identifier;
    }
}
