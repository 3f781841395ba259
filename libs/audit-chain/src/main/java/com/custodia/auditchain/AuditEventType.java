package com.custodia.auditchain;

import java.util.Optional;

/**
 * Kinds of compliance-relevant events an audit entry can record.
 * <p>
 * Covers both document-signature events and records-custody events, so one entry kind serves
 * every collaborator. The {@code value} is the canonical string that enters the hash.
 */
public enum AuditEventType {

    // ---- Document lifecycle ----
    CREATED("created"),
    SIGNATURE_REQUESTED("signature_requested"),
    SIGNED("signed"),
    VERIFIED("verified"),
    REJECTED("rejected"),
    ARCHIVED("archived"),
    STATE_CHANGED("state_changed"),

    // ---- Access ----
    VIEWED("viewed"),
    DOWNLOADED("downloaded"),

    // ---- Custody ----
    LOCATION_UPDATE("location_update"),
    CUSTODY_TRANSFER("custody_transfer");

    private final String value;

    AuditEventType(String value) {
        this.value = value;
    }

    /** The canonical string representation (e.g. "custody_transfer"). */
    public String value() {
        return value;
    }

    /**
     * Looks up an event type by its canonical value or enum name, ignoring case.
     *
     * @param value the string to match (e.g. "signed" or "SIGNED")
     * @return the matching type, or empty if not found
     */
    public static Optional<AuditEventType> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (AuditEventType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /** Checks whether a string corresponds to a known event type. */
    public static boolean isKnown(String value) {
        return fromString(value).isPresent();
    }
}
