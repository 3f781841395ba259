package com.custodia.auditchain;

import java.time.Instant;

/**
 * One link of a tenant's audit chain.
 * <p>
 * Only {@code lifecycleState}, {@code sequenceReference} and the review fields may change once
 * the entry is persisted; everything else is frozen, and the fields listed in
 * {@link ChainedFields} are covered by {@code contentHash}.
 *
 * @param id                store-assigned id, null until appended
 * @param tenantId          chain partition
 * @param sequenceReference human-readable reference assigned at validation, null before
 * @param eventType         kind of event
 * @param severity          severity, drives auto-validation and escalation
 * @param actorId           acting principal
 * @param timestamp         event time, millisecond precision
 * @param subjectRef        referenced business entity, may be null
 * @param description       free-form text
 * @param beforeState       optional snapshot before a state transition
 * @param afterState        optional snapshot after a state transition
 * @param metadata          structured side-channel data, never null
 * @param contentHash       SHA-256 over the canonical encoding of the chained fields
 * @param previousHash      content hash of the preceding entry, or the genesis sentinel
 * @param lifecycleState    current workflow state
 * @param reviewedBy        reviewer who resolved a flag, null otherwise
 * @param reviewedAt        time of review resolution, null otherwise
 * @param reviewNotes       notes of the review resolution, null otherwise
 */
public record AuditEntry(
        Long id,
        String tenantId,
        String sequenceReference,
        AuditEventType eventType,
        Severity severity,
        String actorId,
        Instant timestamp,
        SubjectRef subjectRef,
        String description,
        String beforeState,
        String afterState,
        Metadata metadata,
        String contentHash,
        String previousHash,
        LifecycleState lifecycleState,
        String reviewedBy,
        Instant reviewedAt,
        String reviewNotes) {

    public AuditEntry {
        metadata = metadata == null ? Metadata.empty() : metadata;
    }

    /**
     * The hashed portion of this entry, as stored.
     */
    public ChainedFields chainedFields() {
        return new ChainedFields(
                tenantId, eventType, actorId, timestamp, subjectRef, description, metadata, previousHash);
    }

    public AuditEntry withId(long newId) {
        return new AuditEntry(newId, tenantId, sequenceReference, eventType, severity, actorId, timestamp,
                subjectRef, description, beforeState, afterState, metadata, contentHash, previousHash,
                lifecycleState, reviewedBy, reviewedAt, reviewNotes);
    }

    public AuditEntry withLifecycleState(LifecycleState state) {
        return new AuditEntry(id, tenantId, sequenceReference, eventType, severity, actorId, timestamp,
                subjectRef, description, beforeState, afterState, metadata, contentHash, previousHash,
                state, reviewedBy, reviewedAt, reviewNotes);
    }

    public AuditEntry withSequenceReference(String reference) {
        return new AuditEntry(id, tenantId, reference, eventType, severity, actorId, timestamp,
                subjectRef, description, beforeState, afterState, metadata, contentHash, previousHash,
                lifecycleState, reviewedBy, reviewedAt, reviewNotes);
    }

    public AuditEntry withReview(String reviewer, Instant at, String notes) {
        return new AuditEntry(id, tenantId, sequenceReference, eventType, severity, actorId, timestamp,
                subjectRef, description, beforeState, afterState, metadata, contentHash, previousHash,
                lifecycleState, reviewer, at, notes);
    }

    /**
     * Copy with a different description. Only a store opened in maintenance mode accepts such a
     * copy as an update.
     */
    public AuditEntry withDescription(String newDescription) {
        return new AuditEntry(id, tenantId, sequenceReference, eventType, severity, actorId, timestamp,
                subjectRef, newDescription, beforeState, afterState, metadata, contentHash, previousHash,
                lifecycleState, reviewedBy, reviewedAt, reviewNotes);
    }

    /**
     * Copy with a different stored content hash. Maintenance use only, see
     * {@link #withDescription(String)}.
     */
    public AuditEntry withContentHash(String newContentHash) {
        return new AuditEntry(id, tenantId, sequenceReference, eventType, severity, actorId, timestamp,
                subjectRef, description, beforeState, afterState, metadata, newContentHash, previousHash,
                lifecycleState, reviewedBy, reviewedAt, reviewNotes);
    }

    public boolean isDraft() {
        return lifecycleState == LifecycleState.DRAFT;
    }
}
