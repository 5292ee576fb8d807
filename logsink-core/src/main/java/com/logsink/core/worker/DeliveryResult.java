package com.logsink.core.worker;

import java.util.Objects;

/**
 * Outcome of handling one delivery. Transport adapters translate {@link Outcome} into their own
 * acknowledgement primitive (HTTP status, AMQP ack/nack).
 */
public record DeliveryResult(Outcome outcome, String tenantId, String logId, String reason, String detail) {

    public enum Outcome {
        /** Persisted; the channel may forget the message. */
        ACK,
        /** Transient failure; the channel must redeliver after its deadline. */
        RETRY,
        /** Malformed; the channel must not redeliver. */
        DISCARD
    }

    public DeliveryResult {
        Objects.requireNonNull(outcome, "outcome");
    }

    public static DeliveryResult ack(String tenantId, String logId) {
        return new DeliveryResult(Outcome.ACK, tenantId, logId, null, null);
    }

    public static DeliveryResult retry(String tenantId, String logId, String reason, String detail) {
        return new DeliveryResult(Outcome.RETRY, tenantId, logId, reason, detail);
    }

    public static DeliveryResult discard(String reason, String detail) {
        return new DeliveryResult(Outcome.DISCARD, null, null, reason, detail);
    }
}
