package com.atlas.api.infrastructure.web;

/**
 * A tenant-scoped endpoint was called without {@code X-Tenant-Id}.
 */
public class MissingTenantException extends RuntimeException {

    public MissingTenantException() {
        super("Missing " + TenantHeader.NAME + " header");
    }
}
