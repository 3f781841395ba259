package com.custodia.auditservice.api.dto;

import jakarta.validation.constraints.NotBlank;
import java.time.Instant;
import java.util.Map;

/**
 * Body of {@code POST /audit-entries}. The actor is the authenticated caller, never taken from
 * the body.
 *
 * @param eventType   one of the audit event type values, e.g. {@code signed}
 * @param description free-form text
 * @param severity    {@code info} (default), {@code warning}, {@code error} or {@code critical}
 * @param timestamp   event time, defaults to now
 * @param subjectType type of the referenced business entity, e.g. {@code document}
 * @param subjectId   id of the referenced business entity
 * @param beforeState optional snapshot before a state change
 * @param afterState  optional snapshot after a state change
 * @param metadata    flat map of string or numeric values
 */
public record LogEntryRequest(
        @NotBlank String eventType,
        @NotBlank String description,
        String severity,
        Instant timestamp,
        String subjectType,
        String subjectId,
        String beforeState,
        String afterState,
        Map<String, Object> metadata) {}
