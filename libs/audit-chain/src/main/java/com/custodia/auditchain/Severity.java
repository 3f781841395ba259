package com.custodia.auditchain;

import java.util.Optional;

/**
 * Severity of an audit entry. Drives auto-validation and escalation.
 */
public enum Severity {

    INFO("info"),
    WARNING("warning"),
    ERROR("error"),
    CRITICAL("critical");

    private final String value;

    Severity(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Entries of this severity are left in draft by the recorder and escalated to compliance
     * reviewers when validated.
     */
    public boolean requiresReview() {
        return this == ERROR || this == CRITICAL;
    }

    public static Optional<Severity> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (Severity severity : values()) {
            if (severity.value.equalsIgnoreCase(value) || severity.name().equalsIgnoreCase(value)) {
                return Optional.of(severity);
            }
        }
        return Optional.empty();
    }
}
