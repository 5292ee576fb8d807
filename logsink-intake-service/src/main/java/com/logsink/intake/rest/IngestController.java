package com.logsink.intake.rest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.logsink.core.channel.DeliveryChannel;
import com.logsink.core.ingest.LogIdSource;
import com.logsink.core.ingest.RecordNormalizer;
import com.logsink.core.model.CanonicalRecord;
import com.logsink.intake.config.IntakeProperties;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

/**
 * Edge endpoint. The body is read as a string and routed by Content-Type:
 *   - application/json -> structured record (tenant_id in the body)
 *   - text/plain       -> text record (tenant in the tenant header)
 * The response is sent once the channel has taken the record; processing happens later.
 */
@RestController
public class IngestController {

    private static final Logger log = LoggerFactory.getLogger(IngestController.class);
    static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final RecordNormalizer normalizer;
    private final DeliveryChannel channel;
    private final ObjectMapper mapper;
    private final IntakeProperties props;
    private final Clock clock;

    public IngestController(
            RecordNormalizer normalizer,
            DeliveryChannel channel,
            ObjectMapper mapper,
            IntakeProperties props,
            Clock clock) {
        this.normalizer = normalizer;
        this.channel = channel;
        this.mapper = mapper;
        this.props = props;
        this.clock = clock;
    }

    @PostMapping("/ingest")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Map<String, Object> ingest(
            @RequestBody(required = false) String body,
            @RequestHeader(value = HttpHeaders.CONTENT_TYPE, required = false) String contentType,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            HttpServletRequest request) {
        String raw = body == null ? "" : body;
        Instant receivedAt = clock.instant();
        // One id source per request: the log id is minted at most once, before the enqueue.
        LogIdSource ids = idempotencyKey == null || idempotencyKey.isBlank()
                ? LogIdSource.randomUuid()
                : LogIdSource.idempotencyKey(idempotencyKey.trim());

        MediaType mediaType = parseContentType(contentType);
        CanonicalRecord record;
        if (isJson(mediaType)) {
            record = normalizer.normalizeStructured(parseJson(raw), ids, receivedAt);
        } else if (MediaType.TEXT_PLAIN.isCompatibleWith(mediaType)) {
            record = normalizer.normalizeText(raw, request.getHeader(props.getTenantHeader()), ids, receivedAt);
        } else {
            throw unsupported(contentType);
        }

        String messageId = channel.publish(record);
        log.info(
                "Accepted log_id={} for tenant={} as message {} ({})",
                record.logId(),
                record.tenantId(),
                messageId,
                record.source().wireName());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "accepted");
        response.put("message_id", messageId);
        response.put("tenant_id", record.tenantId());
        response.put("log_id", record.logId());
        return response;
    }

    private JsonNode parseJson(String raw) {
        try {
            return mapper.readTree(raw);
        } catch (JsonProcessingException ex) {
            log.info("Rejected ingest payload due to {}", ex.getOriginalMessage());
            if (log.isDebugEnabled()) {
                log.debug("Rejected payload:\n{}", raw);
            }
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Invalid JSON payload", ex);
        }
    }

    private static MediaType parseContentType(String contentType) {
        if (contentType == null || contentType.isBlank()) {
            throw unsupported(contentType);
        }
        try {
            return MediaType.parseMediaType(contentType);
        } catch (InvalidMediaTypeException ex) {
            throw unsupported(contentType);
        }
    }

    private static boolean isJson(MediaType mediaType) {
        return MediaType.APPLICATION_JSON.isCompatibleWith(mediaType)
                || (mediaType.getSubtypeSuffix() != null && mediaType.getSubtypeSuffix().equals("json"));
    }

    private static ResponseStatusException unsupported(String contentType) {
        return new ResponseStatusException(
                HttpStatus.UNSUPPORTED_MEDIA_TYPE,
                "Unsupported Content-Type '" + (contentType == null ? "" : contentType)
                        + "'; use application/json or text/plain");
    }
}
