package com.atlas.api.api;

import com.atlas.api.domain.usage.TenantUsageView;
import com.atlas.api.domain.usage.UsageStore;
import com.atlas.api.infrastructure.web.CurrentIdentity;
import com.atlas.api.infrastructure.web.RequiresRole;
import com.atlas.api.infrastructure.web.TenantHeader;
import com.atlas.eventmodel.Tenant;
import com.atlas.security.Identity;
import com.atlas.security.Role;
import com.atlas.security.TenantIsolationEnforcer;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Plan and usage of the tenant named by {@code X-Tenant-Id}.
 */
@RestController
@RequestMapping("/api/v1/billing")
public class BillingController {

    private final UsageStore usage;

    public BillingController(UsageStore usage) {
        this.usage = usage;
    }

    public record BillingStatus(
            @JsonProperty("plan_tier") String planTier,
            @JsonProperty("scans_count") long scansCount,
            @JsonProperty("token_count") long tokenCount) {

        static BillingStatus from(TenantUsageView view) {
            return new BillingStatus(view.planTier(), view.scansCount(), view.tokenCount());
        }
    }

    /** Unknown tenants report the free plan with zero usage. */
    @GetMapping("/status")
    @RequiresRole(Role.VIEWER)
    public BillingStatus status(@RequestHeader(name = TenantHeader.NAME, required = false) String tenantHeader,
                                @CurrentIdentity Identity identity) {
        String tenantId = TenantHeader.require(tenantHeader);
        TenantIsolationEnforcer.enforce(identity, tenantId);
        return usage.findUsage(tenantId)
                .map(BillingStatus::from)
                .orElseGet(() -> new BillingStatus(Tenant.DEFAULT_PLAN_TIER, 0, 0));
    }
}
