package com.logsink.core.store;

import com.logsink.core.model.ProcessedDocument;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/** Process-local store for local runs and tests. One nested map per tenant subtree. */
public class InMemoryTenantStore implements TenantStore {

    private final Map<String, Map<String, ProcessedDocument>> tenants = new ConcurrentHashMap<>();

    @Override
    public void put(TenantDocumentPath path, ProcessedDocument document) {
        Objects.requireNonNull(document, "document");
        tenants.computeIfAbsent(path.tenantId(), t -> new ConcurrentHashMap<>()).put(path.logId(), document);
    }

    @Override
    public Optional<ProcessedDocument> get(TenantDocumentPath path) {
        Map<String, ProcessedDocument> subtree = tenants.get(path.tenantId());
        return subtree == null ? Optional.empty() : Optional.ofNullable(subtree.get(path.logId()));
    }

    @Override
    public Map<String, ProcessedDocument> list(String tenantId) {
        TenantDocumentPath.requireSegment(tenantId, "tenant_id");
        Map<String, ProcessedDocument> subtree = tenants.get(tenantId);
        if (subtree == null) return Map.of();
        return Collections.unmodifiableMap(new TreeMap<>(subtree));
    }
}
