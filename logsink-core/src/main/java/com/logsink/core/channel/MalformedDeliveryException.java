package com.logsink.core.channel;

/** A delivered payload cannot be turned into a canonical record. Redelivery will not fix it. */
public class MalformedDeliveryException extends RuntimeException {

    private final String reason;

    public MalformedDeliveryException(String reason, String message) {
        this(reason, message, null);
    }

    public MalformedDeliveryException(String reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    /** Stable machine-readable reason, e.g. {@code JSON_PARSE_ERROR}. */
    public String getReason() {
        return reason;
    }
}
