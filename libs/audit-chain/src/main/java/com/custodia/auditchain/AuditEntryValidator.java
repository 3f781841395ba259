package com.custodia.auditchain;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;

/**
 * Validates the input of a log call, returning all errors at once.
 */
public final class AuditEntryValidator {

    private AuditEntryValidator() {
        // utility class
    }

    /**
     * @param tenantId    chain partition, required
     * @param eventType   kind of event, required
     * @param description free-form text, required
     * @param options     optional inputs, may be null
     * @param now         reference time for the future-timestamp check
     * @param tolerance   allowed clock skew beyond {@code now}
     */
    public static ValidationResult validate(
            String tenantId,
            AuditEventType eventType,
            String description,
            LogOptions options,
            Instant now,
            Duration tolerance) {
        var errors = new ArrayList<String>();

        if (isBlank(tenantId)) {
            errors.add("tenantId must not be null or blank");
        }
        if (eventType == null) {
            errors.add("eventType must not be null");
        }
        if (isBlank(description)) {
            errors.add("description must not be null or blank");
        }
        if (options != null) {
            if (options.actorId() != null && options.actorId().isBlank()) {
                errors.add("actorId must not be blank when supplied");
            }
            if (options.timestamp() != null && options.timestamp().isAfter(now.plus(tolerance))) {
                errors.add("timestamp %s is in the future (now %s, tolerance %s)"
                        .formatted(options.timestamp(), now, tolerance));
            }
            SubjectRef subject = options.subjectRef();
            if (subject != null) {
                if (isBlank(subject.type())) {
                    errors.add("subjectRef.type must not be null or blank");
                }
                if (isBlank(subject.id())) {
                    errors.add("subjectRef.id must not be null or blank");
                }
            }
        }

        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
