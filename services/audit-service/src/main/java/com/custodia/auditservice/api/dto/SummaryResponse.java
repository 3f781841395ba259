package com.custodia.auditservice.api.dto;

import com.custodia.auditchain.AuditEventType;
import com.custodia.auditchain.AuditSummary;
import com.custodia.auditchain.LifecycleState;
import com.custodia.auditchain.Severity;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * {@link AuditSummary} with enum keys rendered as their wire values.
 */
public record SummaryResponse(
        String tenantId,
        Instant from,
        Instant to,
        long totalEntries,
        Map<String, Long> byEventType,
        Map<String, Long> bySeverity,
        Map<String, Long> byState,
        Map<String, Long> byActor,
        long awaitingReview,
        Instant generatedAt) {

    public static SummaryResponse from(AuditSummary summary) {
        return new SummaryResponse(
                summary.tenantId(),
                summary.from(),
                summary.to(),
                summary.totalEntries(),
                byValue(summary.byEventType(), AuditEventType::value),
                byValue(summary.bySeverity(), Severity::value),
                byValue(summary.byState(), LifecycleState::value),
                new TreeMap<>(summary.byActor()),
                summary.awaitingReview(),
                summary.generatedAt());
    }

    private static <K> Map<String, Long> byValue(Map<K, Long> counts, Function<K, String> key) {
        var result = new TreeMap<String, Long>();
        counts.forEach((k, v) -> result.put(key.apply(k), v));
        return result;
    }
}
