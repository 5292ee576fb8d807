package com.logsink.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Objects;

/**
 * Durable, transformed record stored under {@code tenants/{tenant_id}/processed_logs/{log_id}}.
 * A redelivery of the same canonical record replaces the whole document.
 *
 * @param processingTime seconds spent in the delay simulator
 * @param charCount number of Unicode code points in {@code originalText}
 */
public record ProcessedDocument(
        @JsonProperty("source") RecordSource source,
        @JsonProperty("original_text") String originalText,
        @JsonProperty("modified_data") String modifiedData,
        @JsonProperty("processed_at") Instant processedAt,
        @JsonProperty("received_at") Instant receivedAt,
        @JsonProperty("processing_time") double processingTime,
        @JsonProperty("char_count") int charCount) {

    public ProcessedDocument {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(originalText, "originalText");
        Objects.requireNonNull(modifiedData, "modifiedData");
        Objects.requireNonNull(processedAt, "processedAt");
        Objects.requireNonNull(receivedAt, "receivedAt");
    }
}
