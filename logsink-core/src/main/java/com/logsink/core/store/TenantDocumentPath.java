package com.logsink.core.store;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Two-level address of a processed document: {@code tenants/{tenantId}/processed_logs/{logId}}.
 *
 * <p>Every tenant occupies its own subtree of the key space. Both segments are restricted to
 * path-safe identifiers so a segment can never climb into, or alias, another tenant's subtree.
 */
public record TenantDocumentPath(String tenantId, String logId) {

    public static final String TENANTS_COLLECTION = "tenants";
    public static final String PROCESSED_LOGS_COLLECTION = "processed_logs";

    private static final Pattern SEGMENT = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]{0,127}");

    public TenantDocumentPath {
        requireSegment(tenantId, "tenant_id");
        requireSegment(logId, "log_id");
    }

    public static TenantDocumentPath of(String tenantId, String logId) {
        return new TenantDocumentPath(tenantId, logId);
    }

    /** Parent collection of every document that belongs to {@code tenantId}. */
    public static String collectionPath(String tenantId) {
        requireSegment(tenantId, "tenant_id");
        return TENANTS_COLLECTION + "/" + tenantId + "/" + PROCESSED_LOGS_COLLECTION;
    }

    public static boolean isValidSegment(String value) {
        return value != null && SEGMENT.matcher(value).matches();
    }

    public static void requireSegment(String value, String field) {
        Objects.requireNonNull(field, "field");
        if (!isValidSegment(value)) {
            throw new IllegalArgumentException(field + " must match " + SEGMENT.pattern());
        }
    }

    public String collectionPath() {
        return collectionPath(tenantId);
    }

    public String documentPath() {
        return collectionPath() + "/" + logId;
    }

    @Override
    public String toString() {
        return documentPath();
    }
}
