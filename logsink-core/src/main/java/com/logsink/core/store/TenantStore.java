package com.logsink.core.store;

import com.logsink.core.model.ProcessedDocument;
import java.util.Map;
import java.util.Optional;

/**
 * Hierarchical document store partitioned first by tenant, then by log id.
 *
 * <p>All operations are addressed through {@link TenantDocumentPath} or a single tenant id; the
 * store offers no operation that reads or writes across a tenant boundary.
 */
public interface TenantStore {

    /**
     * Full replace of whatever document lives at {@code path}. Repeating the call with the same
     * document leaves the store in the same state.
     *
     * @throws TenantStoreException when the backing store cannot complete the write
     */
    void put(TenantDocumentPath path, ProcessedDocument document);

    Optional<ProcessedDocument> get(TenantDocumentPath path);

    /** Documents in the tenant's subtree, keyed by log id. */
    Map<String, ProcessedDocument> list(String tenantId);

    default void put(String tenantId, String logId, ProcessedDocument document) {
        put(TenantDocumentPath.of(tenantId, logId), document);
    }
}
