package org.replaysafe.datapipeline.services.pipeline.components;

/**
 * A record lacks an identity field, or carries one that cannot be canonicalized.
 * Affects a single event: the caller skips it and keeps going.
 */
public class MissingFieldException extends Exception {

    private final String field;

    public MissingFieldException(String field, String message) {
        super(message);
        this.field = field;
    }

    /**
     * @return Name of the offending field as it appears in the upstream record, e.g. {@code principal_id}.
     */
    public String getField() {
        return field;
    }
}
