package com.switchboard.tenancy;

/**
 * The requesting thread was interrupted while waiting for a slot or backing off between open
 * attempts. Nothing was acquired. The interrupt flag is restored before this is thrown.
 */
public class AcquisitionCancelledException extends TenantAccessException {

    public AcquisitionCancelledException(String tenantId, InterruptedException cause) {
        super(TenantFailure.CANCELLED, "Acquisition for tenant '%s' was cancelled".formatted(tenantId), cause);
    }
}
