package com.switchboard.tenancy;

import java.util.List;

/**
 * Result of validating tenant registration input.
 * <p>
 * Same shape as {@code ValidationResult} in event-model: either valid with no errors, or
 * invalid with every error found.
 *
 * @param valid  whether the input passed all checks
 * @param errors error messages (empty if valid)
 */
public record TenantValidationResult(boolean valid, List<String> errors) {

    public static TenantValidationResult ok() {
        return new TenantValidationResult(true, List.of());
    }

    public static TenantValidationResult fail(List<String> errors) {
        return new TenantValidationResult(false, List.copyOf(errors));
    }
}
