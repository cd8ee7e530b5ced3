package com.atlas.observability;

import java.time.Instant;
import java.util.Map;

/**
 * Aggregate of every registered probe.
 *
 * @param status     worst component status, or OK with no components
 * @param components results keyed by component name, in registration order
 * @param checkedAt  when the probes completed
 */
public record HealthReport(
        HealthStatus status,
        Map<String, ComponentHealth> components,
        Instant checkedAt
) {

    public HealthReport {
        components = Map.copyOf(components);
    }

    /** Status of one component, ERROR when it was never registered. */
    public HealthStatus statusOf(String component) {
        ComponentHealth health = components.get(component);
        return health == null ? HealthStatus.ERROR : health.status();
    }

    /** True when every component is OK. */
    public boolean isUp() {
        return status == HealthStatus.OK;
    }
}
