package com.logsink.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.logsink.core.store.TenantDocumentPath;
import java.time.Instant;
import java.util.Objects;

/**
 * Format-agnostic, in-flight representation of one log submission. This is the unit placed on
 * the delivery channel; it is never persisted on its own.
 *
 * <p>JSON view (snake_case):
 * <pre>
 *   { "tenant_id": "acme", "log_id": "t1", "text": "...",
 *     "source": "structured_upload", "received_at": "2025-01-01T00:00:00Z" }
 * </pre>
 *
 * <p>{@code tenant_id} and {@code log_id} form the storage key and stay fixed across
 * redeliveries of the same record.
 */
public record CanonicalRecord(
        @JsonProperty("tenant_id") String tenantId,
        @JsonProperty("log_id") String logId,
        @JsonProperty("text") String text,
        @JsonProperty("source") RecordSource source,
        @JsonProperty("received_at") Instant receivedAt) {

    public CanonicalRecord {
        if (!TenantDocumentPath.isValidSegment(tenantId)) {
            throw new IllegalArgumentException("tenant_id is missing or not a valid identifier");
        }
        if (!TenantDocumentPath.isValidSegment(logId)) {
            throw new IllegalArgumentException("log_id is missing or not a valid identifier");
        }
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(receivedAt, "received_at");
    }

    public TenantDocumentPath documentPath() {
        return TenantDocumentPath.of(tenantId, logId);
    }
}
