package com.atlas.security;

import java.util.Map;
import java.util.Optional;

/**
 * An authenticated caller, resolved from a bearer token or an API key.
 * <p>
 * Immutable for the lifetime of a request. The role is kept as a string because tokens and key
 * records may carry a role this build does not know; {@link Role#levelOf(String)} treats those as
 * least privilege.
 *
 * @param id       unique caller identifier (token {@code sub} claim)
 * @param username display name
 * @param role     role name; defaults to "viewer" when absent
 * @param email    contact address, empty when unknown
 * @param metadata free-form attributes (e.g., {@code tenant_id} pinning the caller to one tenant)
 */
public record Identity(
        String id,
        String username,
        String role,
        String email,
        Map<String, String> metadata
) {

    /** Metadata key that restricts a non-admin caller to a single tenant. */
    public static final String TENANT_ID = "tenant_id";

    public Identity {
        if (role == null || role.isBlank()) {
            role = Role.VIEWER.value();
        }
        if (email == null) {
            email = "";
        }
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    /** Creates an identity without email or metadata. */
    public static Identity of(String id, String username, String role) {
        return new Identity(id, username, role, "", Map.of());
    }

    /** The tenant this caller is pinned to, if any. */
    public Optional<String> tenantId() {
        String tenant = metadata.get(TENANT_ID);
        return tenant == null || tenant.isBlank() ? Optional.empty() : Optional.of(tenant);
    }
}
