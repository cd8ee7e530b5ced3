package com.atlas.security;

import java.util.Optional;

/**
 * Platform roles, totally ordered by privilege: VIEWER &lt; AUDITOR &lt; ADMIN.
 * <p>
 * Strings that name no role map to level 0.
 */
public enum Role {

    VIEWER("viewer", 0),
    AUDITOR("auditor", 1),
    ADMIN("admin", 2);

    private final String value;
    private final int level;

    Role(String value, int level) {
        this.value = value;
        this.level = level;
    }

    /** The canonical string representation carried in tokens and the key registry. */
    public String value() {
        return value;
    }

    /** Privilege level; higher levels include every lower one. */
    public int level() {
        return level;
    }

    /**
     * Checks whether this role grants at least the privileges of {@code other}.
     */
    public boolean implies(Role other) {
        return level >= other.level;
    }

    /**
     * Looks up a Role by its canonical string value (exact match, e.g. "auditor").
     *
     * @param value the string to match
     * @return the matching Role, or empty if not found
     */
    public static Optional<Role> fromString(String value) {
        for (Role role : values()) {
            if (role.value.equals(value)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the privilege level of a role name, treating unknown or null names as level 0.
     */
    public static int levelOf(String value) {
        return fromString(value).map(Role::level).orElse(0);
    }
}
