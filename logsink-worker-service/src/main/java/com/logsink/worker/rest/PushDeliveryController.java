package com.logsink.worker.rest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.logsink.core.channel.MalformedDeliveryException;
import com.logsink.core.worker.DeliveryProcessor;
import com.logsink.core.worker.DeliveryResult;
import com.logsink.worker.dto.PushEnvelope;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Push-delivery adapter. The status code is the acknowledgement: 200 acks, 500 asks the pusher to
 * redeliver after its deadline, 400 tells it never to send the message again.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class PushDeliveryController {

    static final String SOURCE = "HTTP_PUSH";

    private final DeliveryProcessor processor;
    private final ObjectMapper mapper;

    @PostMapping("/process")
    public ResponseEntity<Map<String, Object>> process(@RequestBody(required = false) String body) {
        PushEnvelope envelope;
        try {
            envelope = mapper.readValue(body == null ? "" : body, PushEnvelope.class);
        } catch (JsonProcessingException ex) {
            return respond(processor.discard(
                    null, body, new MalformedDeliveryException("INVALID_ENVELOPE", "Push body is not JSON", ex), SOURCE));
        }

        PushEnvelope.Message message = envelope == null ? null : envelope.getMessage();
        if (message == null || message.getData() == null || message.getData().isBlank()) {
            return respond(processor.discard(
                    message == null ? null : message.getMessageId(),
                    body,
                    new MalformedDeliveryException("INVALID_ENVELOPE", "Push envelope has no message data"),
                    SOURCE));
        }

        byte[] payload;
        try {
            payload = Base64.getDecoder().decode(message.getData().trim());
        } catch (IllegalArgumentException ex) {
            return respond(processor.discard(
                    message.getMessageId(),
                    message.getData(),
                    new MalformedDeliveryException("INVALID_BASE64", "Message data is not valid base64", ex),
                    SOURCE));
        }

        return respond(processor.process(message.getMessageId(), payload, SOURCE));
    }

    private static ResponseEntity<Map<String, Object>> respond(DeliveryResult result) {
        Map<String, Object> body = new LinkedHashMap<>();
        switch (result.outcome()) {
            case ACK -> {
                body.put("status", "processed");
                body.put("tenant_id", result.tenantId());
                body.put("log_id", result.logId());
                return ResponseEntity.ok(body);
            }
            case RETRY -> {
                body.put("status", "retry");
                body.put("log_id", result.logId());
                body.put("reason", result.reason());
                return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
            }
            default -> {
                body.put("status", "discarded");
                body.put("reason", result.reason());
                body.put("detail", result.detail());
                return ResponseEntity.badRequest().body(body);
            }
        }
    }
}
