package com.atlas.observability;

/**
 * Outcome of a single probe or of the aggregate.
 */
public enum HealthStatus {

    OK("ok"),
    DEGRADED("degraded"),
    ERROR("error");

    private final String label;

    HealthStatus(String label) {
        this.label = label;
    }

    /** Lower-case form used in JSON responses. */
    public String label() {
        return label;
    }

    /** The worse of two statuses. */
    public HealthStatus worst(HealthStatus other) {
        return other.ordinal() > ordinal() ? other : this;
    }
}
