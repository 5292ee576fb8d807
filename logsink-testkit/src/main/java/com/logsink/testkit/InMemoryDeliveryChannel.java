package com.logsink.testkit;

import com.logsink.core.channel.CanonicalRecordCodec;
import com.logsink.core.channel.ChannelPublishException;
import com.logsink.core.channel.DeliveryChannel;
import com.logsink.core.model.CanonicalRecord;
import com.logsink.core.worker.DeliveryProcessor;
import com.logsink.core.worker.DeliveryResult;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Test double for the at-least-once channel. Published records stay pending until a delivery
 * returns {@code ACK} or {@code DISCARD}; {@code RETRY} leaves them pending for the next round.
 */
public class InMemoryDeliveryChannel implements DeliveryChannel {

    /** A message the channel still owes to the worker. */
    public record PendingMessage(String messageId, byte[] payload, int deliveries) {}

    private final CanonicalRecordCodec codec;
    private final Map<String, PendingMessage> pending = new LinkedHashMap<>();
    private final List<String> published = new ArrayList<>();
    private ChannelPublishException nextPublishFailure;

    public InMemoryDeliveryChannel() {
        this(new CanonicalRecordCodec());
    }

    public InMemoryDeliveryChannel(CanonicalRecordCodec codec) {
        this.codec = codec;
    }

    @Override
    public synchronized String publish(CanonicalRecord record) {
        if (nextPublishFailure != null) {
            ChannelPublishException failure = nextPublishFailure;
            nextPublishFailure = null;
            throw failure;
        }
        return enqueue(codec.encode(record));
    }

    /** Enqueues bytes as-is, bypassing the codec. */
    public synchronized String enqueue(byte[] payload) {
        String messageId = UUID.randomUUID().toString();
        pending.put(messageId, new PendingMessage(messageId, payload, 0));
        published.add(messageId);
        return messageId;
    }

    /** Makes the next {@link #publish} fail as an unreachable broker would. */
    public synchronized void failNextPublish(String reason) {
        nextPublishFailure = new ChannelPublishException(reason, null);
    }

    /** Delivers every pending message once and applies the acknowledgement. */
    public List<DeliveryResult> deliverAll(DeliveryProcessor processor) {
        return deliver(processor, true);
    }

    /**
     * Delivers every pending message once as if the worker crashed before acknowledging: whatever
     * the outcome, the messages stay pending.
     */
    public List<DeliveryResult> deliverWithoutAck(DeliveryProcessor processor) {
        return deliver(processor, false);
    }

    /** Delivers rounds until nothing is pending or {@code maxRounds} is reached. */
    public int drain(DeliveryProcessor processor, int maxRounds) {
        int rounds = 0;
        while (rounds < maxRounds && !pending().isEmpty()) {
            deliverAll(processor);
            rounds++;
        }
        return rounds;
    }

    public synchronized List<PendingMessage> pending() {
        return List.copyOf(pending.values());
    }

    public synchronized List<String> published() {
        return List.copyOf(published);
    }

    @Override
    public String describe() {
        return "in-memory";
    }

    private List<DeliveryResult> deliver(DeliveryProcessor processor, boolean acknowledge) {
        List<DeliveryResult> results = new ArrayList<>();
        for (PendingMessage message : pending()) {
            DeliveryResult result = processor.process(message.messageId(), message.payload(), "IN_MEMORY");
            results.add(result);
            synchronized (this) {
                if (acknowledge && result.outcome() != DeliveryResult.Outcome.RETRY) {
                    pending.remove(message.messageId());
                } else {
                    pending.computeIfPresent(
                            message.messageId(),
                            (id, m) -> new PendingMessage(id, m.payload(), m.deliveries() + 1));
                }
            }
        }
        return results;
    }
}
