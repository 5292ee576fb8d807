package com.logsink.core.channel;

import com.logsink.core.model.CanonicalRecord;
import java.io.Closeable;
import java.io.IOException;

/**
 * Producer side of the durable, at-least-once channel between the intake edge and the worker
 * tier.
 */
public interface DeliveryChannel extends Closeable {

    /**
     * Durably enqueues {@code record}. Returns only once the channel has accepted responsibility
     * for delivery.
     *
     * @return channel-assigned message id
     * @throws ChannelPublishException when the channel did not take the record
     */
    String publish(CanonicalRecord record);

    /** Human-readable channel identity for health output. */
    default String describe() {
        return getClass().getSimpleName();
    }

    @Override
    default void close() throws IOException {
        /* no-op */
    }
}
