package com.atlas.security;

/**
 * Role-based access control over the linear {@link Role} hierarchy.
 * <p>
 * Pure functions with no side effects. Unknown role names on either side count as level 0, so a
 * misconfigured identity fails closed.
 */
public final class RoleChecker {

    private RoleChecker() {
        // utility class
    }

    /**
     * Checks if the identity's role is at least {@code required}.
     * <p>
     * Example: an ADMIN satisfies {@code hasRole(identity, AUDITOR)}.
     */
    public static boolean hasRole(Identity identity, Role required) {
        return Role.levelOf(identity.role()) >= required.level();
    }

    /**
     * Requires the identity's role to be at least {@code required}.
     *
     * @throws AuthException with {@link AuthFailure#INSUFFICIENT_PERMISSIONS} otherwise
     */
    public static void authorize(Identity identity, Role required) {
        authorize(identity, required.value());
    }

    /**
     * String form of {@link #authorize(Identity, Role)} for role names coming from configuration.
     */
    public static void authorize(Identity identity, String requiredRole) {
        if (Role.levelOf(identity.role()) < Role.levelOf(requiredRole)) {
            throw new AuthException(
                    AuthFailure.INSUFFICIENT_PERMISSIONS,
                    "Insufficient permissions: %s cannot perform %s actions"
                            .formatted(identity.role(), requiredRole));
        }
    }
}
