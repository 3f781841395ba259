package com.custodia.auditchain;

import java.time.Instant;

/**
 * The fields of an audit entry that enter its content hash, in canonical order.
 *
 * @param tenantId     chain partition
 * @param eventType    kind of event
 * @param actorId      acting principal
 * @param timestamp    event time
 * @param subjectRef   referenced business entity, may be null
 * @param description  free-form text
 * @param metadata     structured side-channel data, never null
 * @param previousHash content hash of the preceding entry, or the genesis sentinel
 */
public record ChainedFields(
        String tenantId,
        AuditEventType eventType,
        String actorId,
        Instant timestamp,
        SubjectRef subjectRef,
        String description,
        Metadata metadata,
        String previousHash) {

    public ChainedFields {
        metadata = metadata == null ? Metadata.empty() : metadata;
    }
}
