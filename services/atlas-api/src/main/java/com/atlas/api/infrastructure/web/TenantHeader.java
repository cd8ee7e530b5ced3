package com.atlas.api.infrastructure.web;

/**
 * The {@code X-Tenant-Id} request header that scopes billing and scan requests to a tenant.
 */
public final class TenantHeader {

    public static final String NAME = "X-Tenant-Id";

    private TenantHeader() {
        // constants
    }

    /**
     * Returns the header value.
     *
     * @throws MissingTenantException if it is absent or blank
     */
    public static String require(String value) {
        if (value == null || value.isBlank()) {
            throw new MissingTenantException();
        }
        return value;
    }
}
