package com.atlas.security;

/**
 * Enforces tenant isolation by comparing the tenant an identity is pinned to against the tenant a
 * request targets.
 * <p>
 * Identities without a {@code tenant_id} in their metadata are not pinned (for example, operators
 * using platform-wide keys) and admins may read any tenant.
 */
public final class TenantIsolationEnforcer {

    private TenantIsolationEnforcer() {
        // utility class
    }

    /**
     * Verifies that {@code identity} may act on {@code requestedTenantId}.
     *
     * @param identity          the authenticated caller
     * @param requestedTenantId the tenant of the resource being accessed
     * @throws TenantMismatchException if the caller is pinned to a different tenant
     */
    public static void enforce(Identity identity, String requestedTenantId) {
        if (RoleChecker.hasRole(identity, Role.ADMIN)) {
            return;
        }
        identity.tenantId().ifPresent(pinned -> {
            if (!pinned.equals(requestedTenantId)) {
                throw new TenantMismatchException(pinned, requestedTenantId);
            }
        });
    }
}
