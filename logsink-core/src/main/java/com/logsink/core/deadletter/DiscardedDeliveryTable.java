package com.logsink.core.deadletter;

/**
 * Keeps raw payloads the worker discarded as malformed, so data-quality problems can be traced
 * back to a producer. Implementations must not throw.
 */
public interface DiscardedDeliveryTable {
    void record(String messageId, String payload, String reason, String detail, String source);
}
