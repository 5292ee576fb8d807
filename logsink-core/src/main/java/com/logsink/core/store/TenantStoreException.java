package com.logsink.core.store;

/** Storage was unavailable, timed out or refused the write. Always safe to retry. */
public class TenantStoreException extends RuntimeException {

    public TenantStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
