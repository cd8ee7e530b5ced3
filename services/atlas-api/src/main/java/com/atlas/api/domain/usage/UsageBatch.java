package com.atlas.api.domain.usage;

import com.atlas.eventmodel.Tenant;

/**
 * Writes available inside one {@link UsageStore#inTransaction} scope.
 * <p>
 * All writes are committed together when the scope ends. {@link #isolated(Runnable)} fences one
 * message's writes so a failure rolls back only that message.
 */
public interface UsageBatch {

    /** Inserts the tenant and a zeroed usage row unless they already exist. */
    void ensureTenant(Tenant tenant);

    void addTokens(String tenantId, long tokens);

    void addScans(String tenantId, long scans);

    /**
     * Runs {@code work} under a savepoint. If it throws, its writes are rolled back and the
     * exception is rethrown; earlier writes in the batch are kept.
     */
    void isolated(Runnable work);
}
