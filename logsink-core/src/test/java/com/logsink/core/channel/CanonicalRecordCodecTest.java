package com.logsink.core.channel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.logsink.core.model.CanonicalRecord;
import com.logsink.core.model.RecordSource;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class CanonicalRecordCodecTest {

    private final CanonicalRecordCodec codec = new CanonicalRecordCodec();

    @Test
    void encodesSnakeCaseWithIsoInstant() throws Exception {
        CanonicalRecord record = new CanonicalRecord(
                "acme", "t1", "Call 555-0199 now", RecordSource.TEXT_UPLOAD, Instant.parse("2025-03-01T10:00:00Z"));

        JsonNode json = new ObjectMapper().readTree(codec.encode(record));

        assertThat(json.get("tenant_id").asText()).isEqualTo("acme");
        assertThat(json.get("log_id").asText()).isEqualTo("t1");
        assertThat(json.get("source").asText()).isEqualTo("text_upload");
        assertThat(json.get("received_at").asText()).isEqualTo("2025-03-01T10:00:00Z");
        assertThat(codec.decode(codec.encode(record))).isEqualTo(record);
    }

    @Test
    void ignoresUnknownFields() {
        String json = "{\"tenant_id\":\"acme\",\"log_id\":\"t1\",\"text\":\"x\",\"source\":\"structured_upload\","
                + "\"received_at\":\"2025-03-01T10:00:00Z\",\"trace\":\"abc\"}";

        CanonicalRecord record = codec.decode(json.getBytes(StandardCharsets.UTF_8));

        assertThat(record.source()).isEqualTo(RecordSource.STRUCTURED_UPLOAD);
    }

    @Test
    void emptyPayloadIsMalformed() {
        assertThatThrownBy(() -> codec.decode(new byte[0]))
                .isInstanceOf(MalformedDeliveryException.class)
                .extracting(e -> ((MalformedDeliveryException) e).getReason())
                .isEqualTo("EMPTY_PAYLOAD");
    }

    @Test
    void nonJsonPayloadIsMalformed() {
        assertThatThrownBy(() -> codec.decode("not json".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(MalformedDeliveryException.class)
                .extracting(e -> ((MalformedDeliveryException) e).getReason())
                .isEqualTo("JSON_PARSE_ERROR");
    }

    @Test
    void missingTenantIsInvalidRecord() {
        String json = "{\"log_id\":\"t1\",\"text\":\"x\",\"source\":\"structured_upload\","
                + "\"received_at\":\"2025-03-01T10:00:00Z\"}";

        assertThatThrownBy(() -> codec.decode(json.getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(MalformedDeliveryException.class)
                .hasMessageContaining("tenant_id")
                .extracting(e -> ((MalformedDeliveryException) e).getReason())
                .isEqualTo("INVALID_RECORD");
    }

    @Test
    void jsonNullIsInvalidRecord() {
        assertThatThrownBy(() -> codec.decode("null".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(MalformedDeliveryException.class)
                .extracting(e -> ((MalformedDeliveryException) e).getReason())
                .isEqualTo("INVALID_RECORD");
    }
}
