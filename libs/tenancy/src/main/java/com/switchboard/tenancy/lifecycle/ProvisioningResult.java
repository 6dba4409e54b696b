package com.switchboard.tenancy.lifecycle;

/**
 * What an executor reports after creating a store.
 *
 * @param storeName     the store that was created
 * @param schemaVersion schema version the store is at
 */
public record ProvisioningResult(String storeName, int schemaVersion) {
}
