package com.logsink.service.storage.impl;

import com.logsink.core.model.ProcessedDocument;
import com.logsink.core.model.RecordSource;
import com.logsink.core.store.TenantDocumentPath;
import com.logsink.core.store.TenantStore;
import com.logsink.core.store.TenantStoreException;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Service;

/**
 * PostgreSQL-backed {@link TenantStore}. Rows are keyed by {@code (collection_path, document_id)}
 * so the tenant subtree is part of the primary key; every query binds a single collection path.
 */
@Service
@ConditionalOnProperty(prefix = "logsink.store", name = "type", havingValue = "jdbc", matchIfMissing = true)
public class JdbcTenantStore implements TenantStore {

    static final String UPSERT_SQL =
            """
        insert into processed_logs(
              collection_path, document_id, tenant_id, source, original_text, modified_data,
              processed_at, received_at, processing_time, char_count
        ) values (
              :collection_path, :document_id, :tenant_id, :source, :original_text, :modified_data,
              :processed_at, :received_at, :processing_time, :char_count
        )
        on conflict (collection_path, document_id) do update set
              tenant_id = excluded.tenant_id,
              source = excluded.source,
              original_text = excluded.original_text,
              modified_data = excluded.modified_data,
              processed_at = excluded.processed_at,
              received_at = excluded.received_at,
              processing_time = excluded.processing_time,
              char_count = excluded.char_count
        """;

    static final String SELECT_ONE_SQL =
            """
        select document_id, source, original_text, modified_data, processed_at, received_at,
               processing_time, char_count
          from processed_logs
         where collection_path = :collection_path
           and document_id = :document_id
        """;

    static final String SELECT_COLLECTION_SQL =
            """
        select document_id, source, original_text, modified_data, processed_at, received_at,
               processing_time, char_count
          from processed_logs
         where collection_path = :collection_path
         order by document_id
        """;

    static final RowMapper<ProcessedDocument> DOCUMENT_MAPPER = JdbcTenantStore::mapDocument;

    private final NamedParameterJdbcTemplate jdbc;

    public JdbcTenantStore(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public void put(TenantDocumentPath path, ProcessedDocument document) {
        MapSqlParameterSource p = keyParams(path)
                .addValue("tenant_id", path.tenantId())
                .addValue("source", document.source().wireName())
                .addValue("original_text", document.originalText())
                .addValue("modified_data", document.modifiedData())
                .addValue("processed_at", utc(document.processedAt()), Types.TIMESTAMP_WITH_TIMEZONE)
                .addValue("received_at", utc(document.receivedAt()), Types.TIMESTAMP_WITH_TIMEZONE)
                .addValue("processing_time", document.processingTime())
                .addValue("char_count", document.charCount());
        try {
            jdbc.update(UPSERT_SQL, p);
        } catch (DataAccessException ex) {
            throw new TenantStoreException("Failed to write " + path, ex);
        }
    }

    @Override
    public Optional<ProcessedDocument> get(TenantDocumentPath path) {
        try {
            List<ProcessedDocument> rows = jdbc.query(SELECT_ONE_SQL, keyParams(path), DOCUMENT_MAPPER);
            return rows.stream().findFirst();
        } catch (DataAccessException ex) {
            throw new TenantStoreException("Failed to read " + path, ex);
        }
    }

    @Override
    public Map<String, ProcessedDocument> list(String tenantId) {
        String collection = TenantDocumentPath.collectionPath(tenantId);
        MapSqlParameterSource p = new MapSqlParameterSource("collection_path", collection);
        Map<String, ProcessedDocument> out = new LinkedHashMap<>();
        try {
            jdbc.query(SELECT_COLLECTION_SQL, p, rs -> {
                out.put(rs.getString("document_id"), mapDocument(rs, 0));
            });
        } catch (DataAccessException ex) {
            throw new TenantStoreException("Failed to list " + collection, ex);
        }
        return out;
    }

    private static MapSqlParameterSource keyParams(TenantDocumentPath path) {
        return new MapSqlParameterSource()
                .addValue("collection_path", path.collectionPath())
                .addValue("document_id", path.logId());
    }

    private static OffsetDateTime utc(Instant instant) {
        return OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    private static ProcessedDocument mapDocument(ResultSet rs, int rowNum) throws SQLException {
        return new ProcessedDocument(
                RecordSource.fromWireName(rs.getString("source")),
                rs.getString("original_text"),
                rs.getString("modified_data"),
                rs.getObject("processed_at", OffsetDateTime.class).toInstant(),
                rs.getObject("received_at", OffsetDateTime.class).toInstant(),
                rs.getDouble("processing_time"),
                rs.getInt("char_count"));
    }
}
