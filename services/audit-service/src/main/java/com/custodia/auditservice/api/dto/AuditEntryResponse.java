package com.custodia.auditservice.api.dto;

import com.custodia.auditchain.AuditEntry;
import java.time.Instant;
import java.util.Map;

public record AuditEntryResponse(
        long id,
        String tenantId,
        String sequenceReference,
        String eventType,
        String severity,
        String actorId,
        Instant timestamp,
        String subjectType,
        String subjectId,
        String description,
        String beforeState,
        String afterState,
        Map<String, Object> metadata,
        String contentHash,
        String previousHash,
        String lifecycleState,
        String reviewedBy,
        Instant reviewedAt,
        String reviewNotes) {

    public static AuditEntryResponse from(AuditEntry entry) {
        return new AuditEntryResponse(
                entry.id(),
                entry.tenantId(),
                entry.sequenceReference(),
                entry.eventType().value(),
                entry.severity().value(),
                entry.actorId(),
                entry.timestamp(),
                entry.subjectRef() == null ? null : entry.subjectRef().type(),
                entry.subjectRef() == null ? null : entry.subjectRef().id(),
                entry.description(),
                entry.beforeState(),
                entry.afterState(),
                entry.metadata().asMap(),
                entry.contentHash(),
                entry.previousHash(),
                entry.lifecycleState().value(),
                entry.reviewedBy(),
                entry.reviewedAt(),
                entry.reviewNotes());
    }
}
