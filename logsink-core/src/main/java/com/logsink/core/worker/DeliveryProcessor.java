package com.logsink.core.worker;

import com.logsink.core.channel.CanonicalRecordCodec;
import com.logsink.core.channel.MalformedDeliveryException;
import com.logsink.core.deadletter.DiscardedDeliveryTable;
import com.logsink.core.delay.ProcessingDelay;
import com.logsink.core.model.CanonicalRecord;
import com.logsink.core.model.ProcessedDocument;
import com.logsink.core.redact.PhoneNumberRedactor;
import com.logsink.core.store.TenantStore;
import com.logsink.core.store.TenantStoreException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handles one delivered record: receive, process, persist, acknowledge.
 *
 * <ol>
 *   <li>Receiving: decode the payload. Anything undecodable is discarded and recorded.
 *   <li>Processing: run the delay simulator, then redact phone numbers.
 *   <li>Persisting: full replace of the document at {@code (tenant_id, log_id)}. Storage
 *       failures ask for redelivery.
 * </ol>
 *
 * <p>There is no retry counter. A crash anywhere before the result is returned means no
 * acknowledgement, so the channel redelivers and every step runs again; the keyed overwrite
 * makes that repetition harmless.
 */
public class DeliveryProcessor {

    private static final Logger log = LoggerFactory.getLogger(DeliveryProcessor.class);

    public static final String REASON_STORE_FAILURE = "STORE_FAILURE";
    public static final String REASON_INTERRUPTED = "INTERRUPTED";

    private final CanonicalRecordCodec codec;
    private final ProcessingDelay delay;
    private final PhoneNumberRedactor redactor;
    private final TenantStore store;
    private final DiscardedDeliveryTable discards;
    private final Clock clock;

    public DeliveryProcessor(
            CanonicalRecordCodec codec,
            ProcessingDelay delay,
            PhoneNumberRedactor redactor,
            TenantStore store,
            DiscardedDeliveryTable discards,
            Clock clock) {
        this.codec = Objects.requireNonNull(codec, "codec");
        this.delay = Objects.requireNonNull(delay, "delay");
        this.redactor = Objects.requireNonNull(redactor, "redactor");
        this.store = Objects.requireNonNull(store, "store");
        this.discards = Objects.requireNonNull(discards, "discards");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * @param messageId channel-assigned id, used for logging only
     * @param payload canonical record JSON
     * @param source transport label recorded with discards, e.g. {@code HTTP_PUSH}
     */
    public DeliveryResult process(String messageId, byte[] payload, String source) {
        CanonicalRecord record;
        try {
            record = codec.decode(payload);
        } catch (MalformedDeliveryException ex) {
            String raw = payload == null ? null : new String(payload, StandardCharsets.UTF_8);
            return discard(messageId, raw, ex, source);
        }
        return process(messageId, record);
    }

    public DeliveryResult process(String messageId, CanonicalRecord record) {
        String tenantId = record.tenantId();
        String logId = record.logId();
        log.info("Processing log_id={} for tenant={} (message {})", logId, tenantId, messageId);

        Duration elapsed;
        try {
            elapsed = delay.simulate(record.text());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while processing log_id={} for tenant={}; requesting redelivery", logId, tenantId);
            return DeliveryResult.retry(tenantId, logId, REASON_INTERRUPTED, "Processing interrupted");
        }
        String modified = redactor.redact(record.text());

        ProcessedDocument document = new ProcessedDocument(
                record.source(),
                record.text(),
                modified,
                clock.instant(),
                record.receivedAt(),
                elapsed.toNanos() / 1_000_000_000d,
                record.text().codePointCount(0, record.text().length()));

        try {
            store.put(record.documentPath(), document);
        } catch (TenantStoreException ex) {
            log.warn("Failed to store {}; requesting redelivery: {}", record.documentPath(), ex.getMessage());
            return DeliveryResult.retry(tenantId, logId, REASON_STORE_FAILURE, ex.getMessage());
        } catch (RuntimeException ex) {
            log.error("Unexpected failure storing {}; requesting redelivery", record.documentPath(), ex);
            return DeliveryResult.retry(tenantId, logId, REASON_STORE_FAILURE, ex.getMessage());
        }

        log.info("Stored {}", record.documentPath());
        return DeliveryResult.ack(tenantId, logId);
    }

    /**
     * Records a payload that could not be decoded and tells the channel to drop it. Transport
     * adapters also call this when their own envelope is unusable.
     */
    public DeliveryResult discard(String messageId, String rawPayload, MalformedDeliveryException cause, String source) {
        String detail = (cause.getMessage() == null || cause.getMessage().isBlank())
                ? cause.getClass().getSimpleName()
                : cause.getMessage();
        log.warn("Discarding malformed delivery {} from {} ({}): {}", messageId, source, cause.getReason(), detail);
        try {
            discards.record(messageId, rawPayload, cause.getReason(), detail, source);
        } catch (RuntimeException recordError) {
            log.error("Failed to record discarded delivery {}", messageId, recordError);
        }
        return DeliveryResult.discard(cause.getReason(), detail);
    }
}
