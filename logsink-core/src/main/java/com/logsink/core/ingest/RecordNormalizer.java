package com.logsink.core.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import com.logsink.core.ingest.RecordValidationException.Kind;
import com.logsink.core.model.CanonicalRecord;
import com.logsink.core.model.RecordSource;
import com.logsink.core.store.TenantDocumentPath;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts the two accepted wire shapes into a {@link CanonicalRecord}.
 *
 * <ul>
 *   <li>Structured: a JSON object with {@code tenant_id}, optional {@code log_id} and the payload
 *       in {@code text} (or its alias {@code data}).
 *   <li>Text: a free-text body whose tenant arrives out-of-band. The body may carry
 *       {@code tenant_id:}, {@code log_id:} and {@code data:} lines. Those key lines are removed;
 *       every other line, and everything from the {@code data:} value onwards, is the payload.
 * </ul>
 *
 * <p>Stateless. The identifier source and receive time are supplied by the caller.
 */
public class RecordNormalizer {

    public static final int DEFAULT_MAX_TEXT_LENGTH = 10_000;

    static final String TENANT_ID = "tenant_id";
    static final String LOG_ID = "log_id";
    static final String TEXT = "text";
    static final String DATA = "data";

    private static final Pattern KEY_LINE =
            Pattern.compile("^\\s*(tenant_id|log_id|data|text)\\s*:[ \\t]*(.*)$", Pattern.CASE_INSENSITIVE);

    private final int maxTextLength;

    public RecordNormalizer() {
        this(DEFAULT_MAX_TEXT_LENGTH);
    }

    public RecordNormalizer(int maxTextLength) {
        if (maxTextLength <= 0) {
            throw new IllegalArgumentException("maxTextLength must be positive");
        }
        this.maxTextLength = maxTextLength;
    }

    public CanonicalRecord normalizeStructured(JsonNode body, LogIdSource ids, Instant receivedAt) {
        Objects.requireNonNull(ids, "ids");
        Objects.requireNonNull(receivedAt, "receivedAt");
        if (body == null || !body.isObject()) {
            throw new RecordValidationException(Kind.INVALID_BODY, null, "Request body must be a JSON object");
        }

        String tenantId = optionalString(body, TENANT_ID);
        if (tenantId == null || tenantId.isBlank()) {
            throw new RecordValidationException(Kind.REQUIRED_FIELD_MISSING, TENANT_ID, "Missing tenant_id in JSON payload");
        }
        String logId = optionalString(body, LOG_ID);

        String textField = body.has(TEXT) ? TEXT : DATA;
        String text = optionalString(body, textField);

        return build(tenantId, logId, text == null ? "" : text, RecordSource.STRUCTURED_UPLOAD, ids, receivedAt);
    }

    public CanonicalRecord normalizeText(String body, String sideChannelTenantId, LogIdSource ids, Instant receivedAt) {
        Objects.requireNonNull(ids, "ids");
        Objects.requireNonNull(receivedAt, "receivedAt");
        TextPayload payload = TextPayload.parse(body == null ? "" : body);

        String tenantId = isBlank(sideChannelTenantId) ? payload.tenantId() : sideChannelTenantId.trim();
        if (isBlank(tenantId)) {
            throw new RecordValidationException(
                    Kind.REQUIRED_FIELD_MISSING,
                    TENANT_ID,
                    "Missing tenant_id for text/plain payload; supply the tenant header or a 'tenant_id:' line");
        }
        return build(tenantId, payload.logId(), payload.text(), RecordSource.TEXT_UPLOAD, ids, receivedAt);
    }

    private CanonicalRecord build(
            String tenantId, String logId, String text, RecordSource source, LogIdSource ids, Instant receivedAt) {
        if (!TenantDocumentPath.isValidSegment(tenantId)) {
            throw new RecordValidationException(
                    Kind.INVALID_FIELD, TENANT_ID, "Invalid tenant_id: use letters, digits, '.', '_' or '-' (max 128 characters)");
        }
        if (logId == null) {
            logId = ids.logIdFor(tenantId);
        } else if (!TenantDocumentPath.isValidSegment(logId)) {
            throw new RecordValidationException(
                    Kind.INVALID_FIELD, LOG_ID, "Invalid log_id: use letters, digits, '.', '_' or '-' (max 128 characters)");
        }
        if (text.codePointCount(0, text.length()) > maxTextLength) {
            throw new RecordValidationException(
                    Kind.TEXT_TOO_LONG, TEXT, "text exceeds the maximum length of " + maxTextLength + " characters");
        }
        return new CanonicalRecord(tenantId, logId, text, source, receivedAt);
    }

    private static String optionalString(JsonNode body, String field) {
        JsonNode node = body.get(field);
        if (node == null || node.isNull()) return null;
        if (!node.isTextual()) {
            throw new RecordValidationException(Kind.INVALID_FIELD, field, field + " must be a string");
        }
        return node.asText();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    /** Parsed form of a text/plain body. */
    record TextPayload(String tenantId, String logId, String text) {

        static TextPayload parse(String body) {
            String[] lines = body.split("\\r?\\n", -1);
            boolean keyed = false;
            for (String line : lines) {
                if (KEY_LINE.matcher(line).matches()) {
                    keyed = true;
                    break;
                }
            }
            if (!keyed) {
                return new TextPayload(null, null, body);
            }

            String tenantId = null;
            String logId = null;
            List<String> loose = new ArrayList<>();
            for (int i = 0; i < lines.length; i++) {
                Matcher m = KEY_LINE.matcher(lines[i]);
                if (!m.matches()) {
                    loose.add(lines[i]);
                    continue;
                }
                String key = m.group(1).toLowerCase(Locale.ROOT);
                String value = m.group(2);
                switch (key) {
                    case TENANT_ID -> tenantId = value.trim();
                    case LOG_ID -> logId = value.trim().isEmpty() ? null : value.trim();
                    default -> {
                        // free lines seen before the data line stay in front of it
                        loose.add(value);
                        loose.addAll(Arrays.asList(lines).subList(i + 1, lines.length));
                        return new TextPayload(tenantId, logId, String.join("\n", loose));
                    }
                }
            }
            return new TextPayload(tenantId, logId, String.join("\n", loose));
        }
    }
}
