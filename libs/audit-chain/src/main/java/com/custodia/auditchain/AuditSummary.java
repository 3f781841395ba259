package com.custodia.auditchain;

import java.time.Instant;
import java.util.Map;

/**
 * Per-tenant totals over a time window.
 *
 * @param tenantId       tenant summarised
 * @param from           inclusive lower bound of the window, null for unbounded
 * @param to             exclusive upper bound of the window, null for unbounded
 * @param totalEntries   entries whose timestamp falls in the window
 * @param byEventType    counts per event type
 * @param bySeverity     counts per severity
 * @param byState        counts per lifecycle state
 * @param byActor        counts per acting principal
 * @param awaitingReview drafts of error or critical severity plus flagged entries
 * @param generatedAt    time the summary was computed
 */
public record AuditSummary(
        String tenantId,
        Instant from,
        Instant to,
        long totalEntries,
        Map<AuditEventType, Long> byEventType,
        Map<Severity, Long> bySeverity,
        Map<LifecycleState, Long> byState,
        Map<String, Long> byActor,
        long awaitingReview,
        Instant generatedAt) {
}
