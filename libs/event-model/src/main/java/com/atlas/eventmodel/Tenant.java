package com.atlas.eventmodel;

/**
 * A billing and usage-isolation unit.
 *
 * <p>Tenants are created lazily by the usage aggregator the first time an event references their
 * id, using the id as display name and the {@link #DEFAULT_PLAN_TIER} plan.
 *
 * @param id opaque tenant identifier
 * @param name human-readable display name
 * @param planTier billing plan (e.g., "free", "team", "enterprise")
 */
public record Tenant(String id, String name, String planTier) {

    /** Plan assigned to tenants created implicitly from usage events. */
    public static final String DEFAULT_PLAN_TIER = "free";

    /** Creates the row inserted when a usage event names a tenant nobody registered yet. */
    public static Tenant lazy(String id) {
        return new Tenant(id, id, DEFAULT_PLAN_TIER);
    }
}
