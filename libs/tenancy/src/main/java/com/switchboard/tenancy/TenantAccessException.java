package com.switchboard.tenancy;

/**
 * Base type for every reason a request could not be bound to its tenant's store.
 * <p>
 * These failures end the request. The transport maps them to a response by {@link #failure()}.
 */
public abstract class TenantAccessException extends RuntimeException {

    private final TenantFailure failure;

    protected TenantAccessException(TenantFailure failure, String message) {
        super(message);
        this.failure = failure;
    }

    protected TenantAccessException(TenantFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }

    public TenantFailure failure() {
        return failure;
    }

    public boolean retryable() {
        return failure.retryable();
    }
}
