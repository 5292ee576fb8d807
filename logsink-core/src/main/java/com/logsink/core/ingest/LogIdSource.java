package com.logsink.core.ingest;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.UUID;

/**
 * Supplies the {@code log_id} for a submission that did not carry one. Callers create one source
 * per inbound request, before any enqueue attempt, so a record never gets a second identifier.
 */
@FunctionalInterface
public interface LogIdSource {

    String logIdFor(String tenantId);

    static LogIdSource randomUuid() {
        return tenantId -> UUID.randomUUID().toString();
    }

    /**
     * Name-based UUID over tenant and caller key: resubmitting the same request with the same key
     * lands on the same storage key.
     */
    static LogIdSource idempotencyKey(String key) {
        Objects.requireNonNull(key, "key");
        return tenantId -> UUID.nameUUIDFromBytes((tenantId + "|" + key).getBytes(StandardCharsets.UTF_8))
                .toString();
    }

    static LogIdSource fixed(String logId) {
        Objects.requireNonNull(logId, "logId");
        return tenantId -> logId;
    }
}
