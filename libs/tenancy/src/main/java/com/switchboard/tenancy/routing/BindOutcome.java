package com.switchboard.tenancy.routing;

import com.switchboard.tenancy.TenantAccessException;
import com.switchboard.tenancy.TenantFailure;

import java.util.Optional;

/**
 * Result of {@link TenantRouter#tryBind}: either a binding the caller must close, or the
 * structured reason no binding was made.
 *
 * @param binding the binding (null on failure)
 * @param failure failure code (null on success)
 * @param error   the underlying exception (null on success)
 */
public record BindOutcome(TenantBinding binding, TenantFailure failure, TenantAccessException error) {

    public static BindOutcome bound(TenantBinding binding) {
        return new BindOutcome(binding, null, null);
    }

    public static BindOutcome failed(TenantAccessException error) {
        return new BindOutcome(null, error.failure(), error);
    }

    public boolean isBound() {
        return binding != null;
    }

    public Optional<TenantBinding> asOptional() {
        return Optional.ofNullable(binding);
    }
}
