package com.custodia.auditchain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Drives audit entries through their lifecycle.
 * <p>
 * Transitions run under the tenant's lock and re-read the entry before changing it, so a
 * sequence reference is only reserved for an update that cannot lose a race inside this process.
 * The store's optimistic {@link AuditStore#update} still turns a change made elsewhere (another
 * instance on the same database) into a {@link ChainConflictException}. No transition touches a
 * hashed field.
 */
public class AuditWorkflow {

    private static final Logger log = LoggerFactory.getLogger(AuditWorkflow.class);

    private final AuditStore store;
    private final SequenceReferenceGenerator references;
    private final EscalationNotifier notifier;
    private final TenantLocks locks;
    private final Clock clock;

    public AuditWorkflow(
            AuditStore store,
            SequenceReferenceGenerator references,
            EscalationNotifier notifier,
            Clock clock) {
        this(store, references, notifier, new TenantLocks(AuditTrail.DEFAULT_LOCK_TIMEOUT), clock);
    }

    public AuditWorkflow(
            AuditStore store,
            SequenceReferenceGenerator references,
            EscalationNotifier notifier,
            TenantLocks locks,
            Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.references = Objects.requireNonNull(references, "references must not be null");
        this.notifier = Objects.requireNonNull(notifier, "notifier must not be null");
        this.locks = Objects.requireNonNull(locks, "locks must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * {@code draft -> validated}. Assigns the sequence reference; error and critical entries are
     * escalated to compliance reviewers.
     *
     * @throws InvalidTransitionException  unless the entry is a draft
     * @throws AuditEntryNotFoundException for an unknown id
     */
    public AuditEntry validate(long entryId) {
        return validateEntry(load(entryId));
    }

    /**
     * The recorder's path for freshly appended entries. Entries whose severity requires review
     * are returned unchanged, still in draft.
     */
    public AuditEntry autoValidate(AuditEntry entry) {
        if (entry.severity().requiresReview()) {
            log.info("Audit entry {} ({}) left in draft for explicit review",
                    entry.id(), entry.severity().value());
            return entry;
        }
        return validateEntry(entry);
    }

    /**
     * Moves a non-terminal entry to {@code flagged} and notifies reviewers. Flagging an already
     * flagged entry notifies them again.
     */
    public AuditEntry flagForReview(long entryId, String reason) {
        AuditEntry flagged = locks.withLock(load(entryId).tenantId(), () -> {
            AuditEntry entry = load(entryId);
            requireTransition(entry, LifecycleState.FLAGGED);
            return entry.lifecycleState() == LifecycleState.FLAGGED
                    ? entry
                    : store.update(entry, entry.withLifecycleState(LifecycleState.FLAGGED));
        });
        String because = reason == null || reason.isBlank() ? "no reason given" : reason;
        log.info("Audit entry {} of tenant {} flagged for review: {}", entryId, flagged.tenantId(), because);
        notifier.escalate(Escalation.toReviewers(flagged, "flagged for review: " + because, now()));
        return flagged;
    }

    /**
     * {@code flagged -> validated}, recording who resolved the review and why. An entry flagged
     * straight from draft receives its sequence reference here.
     */
    public AuditEntry resolveReview(long entryId, String reviewerId, String notes) {
        if (reviewerId == null || reviewerId.isBlank()) {
            throw new AuditValidationException("reviewerId must not be null or blank");
        }
        AuditEntry stored = locks.withLock(load(entryId).tenantId(), () -> {
            AuditEntry entry = load(entryId);
            if (entry.lifecycleState() != LifecycleState.FLAGGED) {
                throw new InvalidTransitionException(entryId, entry.lifecycleState(), LifecycleState.VALIDATED);
            }
            AuditEntry resolved = entry
                    .withReview(reviewerId, now(), notes)
                    .withLifecycleState(LifecycleState.VALIDATED);
            if (resolved.sequenceReference() == null) {
                resolved = resolved.withSequenceReference(references.next(entry.tenantId(), entry.eventType()));
            }
            return store.update(entry, resolved);
        });
        log.info("Review of audit entry {} resolved by {}", entryId, reviewerId);
        return stored;
    }

    /**
     * {@code validated|flagged -> archived}. Archived entries are terminal.
     */
    public AuditEntry archive(long entryId) {
        AuditEntry stored = locks.withLock(load(entryId).tenantId(), () -> {
            AuditEntry entry = load(entryId);
            requireTransition(entry, LifecycleState.ARCHIVED);
            return store.update(entry, entry.withLifecycleState(LifecycleState.ARCHIVED));
        });
        log.info("Audit entry {} of tenant {} archived", entryId, stored.tenantId());
        return stored;
    }

    /**
     * Retention sweep: archives every validated or flagged entry of the tenant whose timestamp is
     * before {@code cutoff}. Drafts are left for an explicit decision and nothing is deleted.
     *
     * @return number of entries archived by this call
     */
    public int archiveOlderThan(String tenantId, Instant cutoff) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new AuditValidationException("tenantId must not be null or blank");
        }
        if (cutoff == null) {
            throw new AuditValidationException("cutoff must not be null");
        }
        List<Long> candidates;
        try (Stream<AuditEntry> chain = store.listForTenant(tenantId)) {
            candidates = chain
                    .filter(entry -> entry.timestamp().isBefore(cutoff))
                    .filter(entry -> entry.lifecycleState().canTransitionTo(LifecycleState.ARCHIVED))
                    .map(AuditEntry::id)
                    .toList();
        }
        int archived = locks.withLock(tenantId, () -> {
            int count = 0;
            for (Long id : candidates) {
                AuditEntry entry = load(id);
                if (entry.lifecycleState().canTransitionTo(LifecycleState.ARCHIVED)) {
                    store.update(entry, entry.withLifecycleState(LifecycleState.ARCHIVED));
                    count++;
                }
            }
            return count;
        });
        log.info("Retention sweep archived {} audit entries of tenant {} older than {}", archived, tenantId, cutoff);
        return archived;
    }

    private AuditEntry validateEntry(AuditEntry candidate) {
        AuditEntry stored = locks.withLock(candidate.tenantId(), () -> {
            AuditEntry entry = load(candidate.id());
            if (entry.lifecycleState() != LifecycleState.DRAFT) {
                throw new InvalidTransitionException(entry.id(), entry.lifecycleState(), LifecycleState.VALIDATED);
            }
            AuditEntry validated = entry
                    .withSequenceReference(references.next(entry.tenantId(), entry.eventType()))
                    .withLifecycleState(LifecycleState.VALIDATED);
            return store.update(entry, validated);
        });
        log.debug("Audit entry {} validated as {}", stored.id(), stored.sequenceReference());
        if (stored.severity().requiresReview()) {
            notifier.escalate(Escalation.toReviewers(stored,
                    "validated with severity " + stored.severity().value(), now()));
        }
        return stored;
    }

    private void requireTransition(AuditEntry entry, LifecycleState target) {
        if (!entry.lifecycleState().canTransitionTo(target)) {
            throw new InvalidTransitionException(entry.id(), entry.lifecycleState(), target);
        }
    }

    private AuditEntry load(long entryId) {
        return store.get(entryId).orElseThrow(() -> new AuditEntryNotFoundException(entryId));
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }
}
