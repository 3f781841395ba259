package com.custodia.auditchain;

import com.custodia.observability.MetricFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Walks a tenant's chain in id order, checking every link and recomputing every hash.
 * <p>
 * Read-only and lock-free: entries appended after the walk started are simply not seen.
 */
public class ChainVerifier {

    private static final Logger log = LoggerFactory.getLogger(ChainVerifier.class);

    private final AuditStore store;
    private final MetricFactory metrics;
    private final Clock clock;

    public ChainVerifier(AuditStore store, MetricFactory metrics, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * @return every violation in chain order; empty if and only if the chain is consistent
     */
    public List<ChainViolation> verifyTenant(String tenantId) {
        return inspect(tenantId).violations();
    }

    public ChainVerificationReport inspect(String tenantId) {
        var violations = new ArrayList<ChainViolation>();
        long checked = 0;
        AuditEntry previous = null;

        try (Stream<AuditEntry> chain = store.listForTenant(tenantId)) {
            Iterator<AuditEntry> it = chain.iterator();
            while (it.hasNext()) {
                AuditEntry entry = it.next();
                checked++;
                if (previous == null) {
                    if (!HashChainer.GENESIS.equals(entry.previousHash())) {
                        report(tenantId, violations, new ChainViolation.InvalidGenesis(entry.id(), entry.previousHash()));
                    }
                } else if (!Objects.equals(previous.contentHash(), entry.previousHash())) {
                    report(tenantId, violations, new ChainViolation.BrokenLink(
                            entry.id(), previous.contentHash(), entry.previousHash()));
                }
                String recomputed = HashChainer.chain(entry.chainedFields());
                if (!recomputed.equals(entry.contentHash())) {
                    report(tenantId, violations, new ChainViolation.TamperedEntry(
                            entry.id(), entry.contentHash(), recomputed));
                }
                previous = entry;
            }
        }

        String head = previous == null ? HashChainer.GENESIS : previous.contentHash();
        if (violations.isEmpty()) {
            log.info("Audit chain of tenant {} intact: {} entries, head {}", tenantId, checked, head);
        }
        return new ChainVerificationReport(tenantId, checked, head, clock.instant(), violations);
    }

    /**
     * Checks a single entry: its hash against its own fields and its link to the entry before it
     * in the tenant's chain, or to genesis when it is the first.
     *
     * @return the entry's violations; empty if the entry is intact
     * @throws AuditEntryNotFoundException for an unknown id
     */
    public List<ChainViolation> verifyEntry(long entryId) {
        AuditEntry entry = store.get(entryId).orElseThrow(() -> new AuditEntryNotFoundException(entryId));
        AuditEntry previous = null;
        try (Stream<AuditEntry> chain = store.listForTenant(entry.tenantId())) {
            Iterator<AuditEntry> it = chain.iterator();
            while (it.hasNext()) {
                AuditEntry candidate = it.next();
                if (candidate.id() >= entryId) {
                    break;
                }
                previous = candidate;
            }
        }

        var violations = new ArrayList<ChainViolation>();
        String tenantId = entry.tenantId();
        if (previous == null) {
            if (!HashChainer.GENESIS.equals(entry.previousHash())) {
                report(tenantId, violations, new ChainViolation.InvalidGenesis(entryId, entry.previousHash()));
            }
        } else if (!Objects.equals(previous.contentHash(), entry.previousHash())) {
            report(tenantId, violations, new ChainViolation.BrokenLink(
                    entryId, previous.contentHash(), entry.previousHash()));
        }
        String recomputed = HashChainer.chain(entry.chainedFields());
        if (!recomputed.equals(entry.contentHash())) {
            report(tenantId, violations, new ChainViolation.TamperedEntry(entryId, entry.contentHash(), recomputed));
        }
        if (violations.isEmpty()) {
            log.debug("Audit entry {} of tenant {} intact", entryId, tenantId);
        }
        return violations;
    }

    private void report(String tenantId, List<ChainViolation> violations, ChainViolation violation) {
        log.warn("Audit chain violation in tenant {}: {}", tenantId, violation.message());
        metrics.counter("custodia.audit.chain.violations", "Integrity violations found by chain verification",
                "kind", violation.kind()).increment();
        violations.add(violation);
    }
}
