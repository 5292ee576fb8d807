package com.logsink.worker.rest;

import com.logsink.core.model.ProcessedDocument;
import com.logsink.core.store.TenantDocumentPath;
import com.logsink.core.store.TenantStore;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

/** Read-only view of one tenant's processed documents. */
@RestController
@RequestMapping("/tenants/{tenantId}/processed_logs")
@RequiredArgsConstructor
public class TenantDocumentController {

    private final TenantStore store;

    @GetMapping
    public Map<String, Object> list(@PathVariable String tenantId) {
        Map<String, ProcessedDocument> documents = store.list(tenantId);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("tenant_id", tenantId);
        body.put("count", documents.size());
        body.put("documents", documents);
        return body;
    }

    @GetMapping("/{logId}")
    public ProcessedDocument get(@PathVariable String tenantId, @PathVariable String logId) {
        TenantDocumentPath path = TenantDocumentPath.of(tenantId, logId);
        return store.get(path)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "No document at " + path));
    }
}
