package com.custodia.auditchain;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Aggregates a tenant's audit entries for compliance reporting.
 */
public class AuditReporter {

    private final AuditStore store;
    private final Clock clock;

    public AuditReporter(AuditStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * @param from inclusive lower bound on the entry timestamp, null for unbounded
     * @param to   exclusive upper bound on the entry timestamp, null for unbounded
     * @throws AuditValidationException if {@code from} is not before {@code to}
     */
    public AuditSummary summarize(String tenantId, Instant from, Instant to) {
        if (from != null && to != null && !from.isBefore(to)) {
            throw new AuditValidationException("from must be before to");
        }
        var byEventType = new EnumMap<AuditEventType, Long>(AuditEventType.class);
        var bySeverity = new EnumMap<Severity, Long>(Severity.class);
        var byState = new EnumMap<LifecycleState, Long>(LifecycleState.class);
        var byActor = new TreeMap<String, Long>();
        long total = 0;
        long awaitingReview = 0;

        try (Stream<AuditEntry> entries = store.listForTenant(tenantId)) {
            Iterator<AuditEntry> it = entries.iterator();
            while (it.hasNext()) {
                AuditEntry entry = it.next();
                if (!inWindow(entry.timestamp(), from, to)) {
                    continue;
                }
                total++;
                byEventType.merge(entry.eventType(), 1L, Long::sum);
                bySeverity.merge(entry.severity(), 1L, Long::sum);
                byState.merge(entry.lifecycleState(), 1L, Long::sum);
                byActor.merge(entry.actorId(), 1L, Long::sum);
                if (awaitsReview(entry)) {
                    awaitingReview++;
                }
            }
        }

        return new AuditSummary(tenantId, from, to, total,
                Collections.unmodifiableMap(byEventType),
                Collections.unmodifiableMap(bySeverity),
                Collections.unmodifiableMap(byState),
                Collections.unmodifiableMap(byActor),
                awaitingReview,
                clock.instant());
    }

    private static boolean awaitsReview(AuditEntry entry) {
        return entry.lifecycleState() == LifecycleState.FLAGGED
                || (entry.isDraft() && entry.severity().requiresReview());
    }

    private static boolean inWindow(Instant timestamp, Instant from, Instant to) {
        return (from == null || !timestamp.isBefore(from)) && (to == null || timestamp.isBefore(to));
    }
}
