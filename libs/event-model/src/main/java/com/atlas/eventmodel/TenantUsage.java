package com.atlas.eventmodel;

import java.time.Instant;

/**
 * Usage counters accrued by one tenant. Counters only ever grow.
 *
 * @param tenantId owning tenant
 * @param scansCount number of scan requests seen on the scan-request stream
 * @param tokenCount sum of {@code tokens_used} seen on the usage stream
 * @param lastUpdated time of the last increment (null if never incremented)
 */
public record TenantUsage(String tenantId, long scansCount, long tokenCount, Instant lastUpdated) {

    /** Counters for a tenant that has not accrued anything yet. */
    public static TenantUsage empty(String tenantId) {
        return new TenantUsage(tenantId, 0, 0, null);
    }
}
