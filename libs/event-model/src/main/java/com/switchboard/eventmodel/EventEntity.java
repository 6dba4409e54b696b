package com.switchboard.eventmodel;

/**
 * The aggregate an event relates to.
 *
 * @param entityType kind of entity, e.g. "Tenant"
 * @param entityId   identifier of the entity instance (the tenant ID)
 * @param sequence   monotonically increasing event number for this entity within one producer
 */
public record EventEntity(String entityType, String entityId, long sequence) {

    /** Shorthand for a tenant entity reference. */
    public static EventEntity tenant(String tenantId, long sequence) {
        return new EventEntity(EntityType.TENANT.value(), tenantId, sequence);
    }
}
