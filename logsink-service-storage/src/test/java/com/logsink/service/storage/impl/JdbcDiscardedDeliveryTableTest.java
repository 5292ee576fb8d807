package com.logsink.service.storage.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

class JdbcDiscardedDeliveryTableTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    private final NamedParameterJdbcTemplate jdbc = Mockito.mock(NamedParameterJdbcTemplate.class);
    private final JdbcDiscardedDeliveryTable table =
            new JdbcDiscardedDeliveryTable(jdbc, Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void recordInsertsRow() {
        table.record("m-1", "{oops", "JSON_PARSE_ERROR", "Unexpected character", "HTTP_PUSH");

        ArgumentCaptor<MapSqlParameterSource> params = ArgumentCaptor.forClass(MapSqlParameterSource.class);
        Mockito.verify(jdbc).update(Mockito.eq(JdbcDiscardedDeliveryTable.INSERT_SQL), params.capture());
        assertThat(params.getValue().getValue("message_id")).isEqualTo("m-1");
        assertThat(params.getValue().getValue("payload")).isEqualTo("{oops");
        assertThat(params.getValue().getValue("reason")).isEqualTo("JSON_PARSE_ERROR");
        assertThat(params.getValue().getValue("source")).isEqualTo("HTTP_PUSH");
        assertThat(params.getValue().getValue("recorded_at")).isEqualTo(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC));
        assertThat(params.getValue().getSqlType("recorded_at")).isEqualTo(Types.TIMESTAMP_WITH_TIMEZONE);
    }

    @Test
    void databaseFailureIsLoggedNotThrown() {
        Mockito.when(jdbc.update(Mockito.anyString(), Mockito.any(SqlParameterSource.class)))
                .thenThrow(new DataIntegrityViolationException("null source"));

        assertThatCode(() -> table.record("m-2", null, "EMPTY_PAYLOAD", "empty", "RMQ_CONSUMER"))
                .doesNotThrowAnyException();
    }
}
