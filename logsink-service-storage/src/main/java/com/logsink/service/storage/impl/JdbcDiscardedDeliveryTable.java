package com.logsink.service.storage.impl;

import com.logsink.core.deadletter.DiscardedDeliveryTable;
import java.sql.Types;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Keeps deliveries the worker gave up on in {@code discarded_deliveries}. The delivery has already
 * been acknowledged by the time it lands here, so a failed insert is logged and the record is lost
 * rather than redelivered.
 */
@Component
@ConditionalOnProperty(prefix = "logsink.store", name = "type", havingValue = "jdbc", matchIfMissing = true)
public class JdbcDiscardedDeliveryTable implements DiscardedDeliveryTable {

    private static final Logger log = LoggerFactory.getLogger(JdbcDiscardedDeliveryTable.class);

    static final String INSERT_SQL =
            """
        insert into discarded_deliveries(
              id, message_id, source, reason, error, payload, recorded_at
        ) values (
              :id, :message_id, :source, :reason, :error, :payload, :recorded_at
        )
        """;

    private final NamedParameterJdbcTemplate jdbc;
    private final Clock clock;

    public JdbcDiscardedDeliveryTable(NamedParameterJdbcTemplate jdbc, Clock clock) {
        this.jdbc = jdbc;
        this.clock = clock;
    }

    @Override
    public void record(String messageId, String payload, String reason, String detail, String source) {
        MapSqlParameterSource row = new MapSqlParameterSource()
                .addValue("id", UUID.randomUUID())
                .addValue("message_id", messageId)
                .addValue("source", source)
                .addValue("reason", reason)
                .addValue("error", detail)
                .addValue("payload", payload, Types.VARCHAR)
                .addValue(
                        "recorded_at",
                        OffsetDateTime.ofInstant(clock.instant(), ZoneOffset.UTC),
                        Types.TIMESTAMP_WITH_TIMEZONE);
        try {
            jdbc.update(INSERT_SQL, row);
            log.debug("Recorded discarded delivery {} from {} ({})", messageId, source, reason);
        } catch (DataAccessException ex) {
            log.error("Discarded delivery {} from {} ({}) could not be recorded", messageId, source, reason, ex);
        }
    }
}
