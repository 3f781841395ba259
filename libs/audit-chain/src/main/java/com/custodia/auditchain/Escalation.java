package com.custodia.auditchain;

import com.custodia.security.Role;

import java.time.Instant;

/**
 * A request for compliance reviewers to look at an audit entry.
 *
 * @param entryId     the entry concerned
 * @param tenantId    tenant owning the entry
 * @param severity    severity of the entry
 * @param reason      why reviewers are notified
 * @param targetRole  role that should act on it
 * @param raisedAt    time the escalation was raised
 */
public record Escalation(
        long entryId,
        String tenantId,
        Severity severity,
        String reason,
        Role targetRole,
        Instant raisedAt) {

    public static Escalation toReviewers(AuditEntry entry, String reason, Instant raisedAt) {
        return new Escalation(entry.id(), entry.tenantId(), entry.severity(), reason,
                Role.COMPLIANCE_REVIEWER, raisedAt);
    }
}
