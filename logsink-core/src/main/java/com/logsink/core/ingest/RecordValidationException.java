package com.logsink.core.ingest;

/** A submission is missing a required field or carries an invalid one. Never retried. */
public class RecordValidationException extends IllegalArgumentException {

    public enum Kind {
        /** Body is not the expected shape at all. */
        INVALID_BODY,
        REQUIRED_FIELD_MISSING,
        INVALID_FIELD,
        TEXT_TOO_LONG
    }

    private final Kind kind;
    private final String field;

    public RecordValidationException(Kind kind, String field, String message) {
        super(message);
        this.kind = kind;
        this.field = field;
    }

    public Kind getKind() {
        return kind;
    }

    /** Name of the offending wire field, e.g. {@code tenant_id}. */
    public String getField() {
        return field;
    }
}
