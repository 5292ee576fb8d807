package com.logsink.service.storage.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.logsink.core.model.ProcessedDocument;
import com.logsink.core.model.RecordSource;
import com.logsink.core.store.TenantDocumentPath;
import com.logsink.core.store.TenantStoreException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

class JdbcTenantStoreTest {

    private static final Instant RECEIVED = Instant.parse("2025-03-01T10:00:00Z");
    private static final Instant PROCESSED = Instant.parse("2025-03-01T10:00:01Z");

    private final NamedParameterJdbcTemplate jdbc = Mockito.mock(NamedParameterJdbcTemplate.class);
    private final JdbcTenantStore store = new JdbcTenantStore(jdbc);

    @Test
    void putUpsertsUnderTenantCollection() {
        store.put(TenantDocumentPath.of("acme", "t1"), document());

        ArgumentCaptor<MapSqlParameterSource> params = ArgumentCaptor.forClass(MapSqlParameterSource.class);
        Mockito.verify(jdbc).update(Mockito.eq(JdbcTenantStore.UPSERT_SQL), params.capture());
        MapSqlParameterSource p = params.getValue();
        assertThat(p.getValue("collection_path")).isEqualTo("tenants/acme/processed_logs");
        assertThat(p.getValue("document_id")).isEqualTo("t1");
        assertThat(p.getValue("tenant_id")).isEqualTo("acme");
        assertThat(p.getValue("source")).isEqualTo("structured_upload");
        assertThat(p.getValue("modified_data")).isEqualTo("Call [REDACTED] now");
        assertThat(p.getValue("processed_at")).isEqualTo(OffsetDateTime.ofInstant(PROCESSED, ZoneOffset.UTC));
        assertThat(p.getValue("char_count")).isEqualTo(17);
        assertThat(JdbcTenantStore.UPSERT_SQL)
                .contains("on conflict (collection_path, document_id) do update")
                .contains("modified_data = excluded.modified_data");
    }

    @Test
    void putWrapsDataAccessFailures() {
        Mockito.when(jdbc.update(Mockito.anyString(), Mockito.any(SqlParameterSource.class)))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThatThrownBy(() -> store.put(TenantDocumentPath.of("acme", "t1"), document()))
                .isInstanceOf(TenantStoreException.class)
                .hasMessageContaining("tenants/acme/processed_logs/t1")
                .hasCauseInstanceOf(DataAccessResourceFailureException.class);
    }

    @Test
    @SuppressWarnings("unchecked")
    void getBindsOnlyTheRequestedTenant() {
        Mockito.when(jdbc.query(
                        Mockito.eq(JdbcTenantStore.SELECT_ONE_SQL),
                        Mockito.any(SqlParameterSource.class),
                        Mockito.any(RowMapper.class)))
                .thenReturn(List.of(document()));

        Optional<ProcessedDocument> found = store.get(TenantDocumentPath.of("beta", "t1"));

        assertThat(found).contains(document());
        ArgumentCaptor<MapSqlParameterSource> params = ArgumentCaptor.forClass(MapSqlParameterSource.class);
        Mockito.verify(jdbc)
                .query(Mockito.eq(JdbcTenantStore.SELECT_ONE_SQL), params.capture(), Mockito.any(RowMapper.class));
        assertThat(params.getValue().getValue("collection_path")).isEqualTo("tenants/beta/processed_logs");
    }

    @Test
    @SuppressWarnings("unchecked")
    void getReturnsEmptyWhenNoRow() {
        Mockito.when(jdbc.query(Mockito.anyString(), Mockito.any(SqlParameterSource.class), Mockito.any(RowMapper.class)))
                .thenReturn(List.of());

        assertThat(store.get(TenantDocumentPath.of("acme", "missing"))).isEmpty();
    }

    @Test
    void listRejectsPathTraversal() {
        assertThatThrownBy(() -> store.list("acme/processed_logs/../../beta"))
                .isInstanceOf(IllegalArgumentException.class);
        Mockito.verifyNoInteractions(jdbc);
    }

    private static ProcessedDocument document() {
        return new ProcessedDocument(
                RecordSource.STRUCTURED_UPLOAD,
                "Call 555-0199 now",
                "Call [REDACTED] now",
                PROCESSED,
                RECEIVED,
                0.85,
                17);
    }
}
