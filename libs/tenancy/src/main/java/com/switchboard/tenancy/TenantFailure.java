package com.switchboard.tenancy;

/**
 * Structured reason a request could not be bound to a tenant store.
 * <p>
 * The {@link #code()} is the stable wire form used in problem responses and metric tags.
 */
public enum TenantFailure {

    NOT_FOUND("not_found", false),
    NOT_READY("not_ready", true),
    SUSPENDED("suspended", false),
    RETIRED("retired", false),
    STORE_UNAVAILABLE("store_unavailable", true),
    POOL_EXHAUSTED("pool_exhausted", true),
    CANCELLED("cancelled", false);

    private final String code;
    private final boolean retryable;

    TenantFailure(String code, boolean retryable) {
        this.code = code;
        this.retryable = retryable;
    }

    public String code() {
        return code;
    }

    /** Whether the same request may succeed if the caller tries again later. */
    public boolean retryable() {
        return retryable;
    }
}
