package com.switchboard.tenancy;

import java.util.List;

/**
 * Registration input was rejected by {@link TenantValidator}.
 */
public class TenantValidationException extends IllegalArgumentException {

    private final List<String> errors;

    public TenantValidationException(List<String> errors) {
        super("Invalid tenant registration: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> errors() {
        return errors;
    }
}
