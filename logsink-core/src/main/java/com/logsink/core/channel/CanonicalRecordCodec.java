package com.logsink.core.channel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.exc.ValueInstantiationException;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.logsink.core.model.CanonicalRecord;
import java.io.IOException;

/**
 * Wire codec for records on the channel: UTF-8 JSON, snake_case keys, ISO-8601 instants. The
 * codec owns its mapper so the wire format does not drift with application-level Jackson
 * settings.
 */
public final class CanonicalRecordCodec {

    private final ObjectMapper mapper;

    public CanonicalRecordCodec() {
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public byte[] encode(CanonicalRecord record) {
        try {
            return mapper.writeValueAsBytes(record);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Canonical record encode failed", e);
        }
    }

    /**
     * @throws MalformedDeliveryException when {@code payload} is not JSON or violates the record
     *     invariants
     */
    public CanonicalRecord decode(byte[] payload) {
        if (payload == null || payload.length == 0) {
            throw new MalformedDeliveryException("EMPTY_PAYLOAD", "Delivered payload is empty");
        }
        CanonicalRecord record;
        try {
            record = mapper.readValue(payload, CanonicalRecord.class);
        } catch (ValueInstantiationException e) {
            String detail = e.getCause() != null && e.getCause().getMessage() != null
                    ? e.getCause().getMessage()
                    : e.getOriginalMessage();
            throw new MalformedDeliveryException("INVALID_RECORD", detail, e);
        } catch (JsonProcessingException e) {
            throw new MalformedDeliveryException("JSON_PARSE_ERROR", e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new MalformedDeliveryException("JSON_PARSE_ERROR", e.getMessage(), e);
        }
        if (record == null) {
            throw new MalformedDeliveryException("INVALID_RECORD", "Delivered payload is JSON null");
        }
        return record;
    }
}
