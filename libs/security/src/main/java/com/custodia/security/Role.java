package com.custodia.security;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Roles recognised by the audit trail.
 * <p>
 * The hierarchy is encoded once here: an administrator may do everything a compliance reviewer
 * may do, and a reviewer may do everything a records clerk may do.
 */
public enum Role {

    RECORDS_CLERK("ROLE_RECORDS_CLERK"),
    COMPLIANCE_REVIEWER("ROLE_COMPLIANCE_REVIEWER"),
    RECORDS_ADMIN("ROLE_RECORDS_ADMIN");

    private final String value;

    Role(String value) {
        this.value = value;
    }

    /** The canonical string representation (e.g., "ROLE_RECORDS_CLERK"). */
    public String value() {
        return value;
    }

    /**
     * Returns the set of roles that this role implies.
     */
    public Set<Role> impliedRoles() {
        return switch (this) {
            case RECORDS_ADMIN -> EnumSet.of(COMPLIANCE_REVIEWER, RECORDS_CLERK);
            case COMPLIANCE_REVIEWER -> EnumSet.of(RECORDS_CLERK);
            default -> EnumSet.noneOf(Role.class);
        };
    }

    /**
     * Checks whether this role implies the given role, directly or through the hierarchy.
     */
    public boolean implies(Role other) {
        return this == other || impliedRoles().contains(other);
    }

    /**
     * Looks up a Role by canonical value ("ROLE_RECORDS_ADMIN") or by bare name
     * ("RECORDS_ADMIN"), ignoring case and surrounding whitespace.
     *
     * @param value the string to match
     * @return the matching Role, or empty if not found
     */
    public static Optional<Role> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String candidate = value.trim();
        for (Role role : values()) {
            if (role.value.equalsIgnoreCase(candidate) || role.name().equalsIgnoreCase(candidate)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
