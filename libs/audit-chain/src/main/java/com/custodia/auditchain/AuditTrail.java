package com.custodia.auditchain;

import com.custodia.observability.MetricFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Public face of the audit chain: record, move through the lifecycle, read, verify, report.
 * <p>
 * Build one per store with {@link #builder(AuditStore)}; every collaborator has a default.
 */
public class AuditTrail {

    public static final Duration DEFAULT_CLOCK_SKEW_TOLERANCE = Duration.ofMinutes(5);
    public static final Duration DEFAULT_LOCK_TIMEOUT = Duration.ofSeconds(5);

    private final AuditStore store;
    private final AuditRecorder recorder;
    private final AuditWorkflow workflow;
    private final ChainVerifier verifier;
    private final AuditReporter reporter;

    public AuditTrail(
            AuditStore store,
            AuditRecorder recorder,
            AuditWorkflow workflow,
            ChainVerifier verifier,
            AuditReporter reporter) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.recorder = Objects.requireNonNull(recorder, "recorder must not be null");
        this.workflow = Objects.requireNonNull(workflow, "workflow must not be null");
        this.verifier = Objects.requireNonNull(verifier, "verifier must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
    }

    public static Builder builder(AuditStore store) {
        return new Builder(store);
    }

    public AuditEntry log(String tenantId, AuditEventType eventType, String description, LogOptions options) {
        return recorder.log(tenantId, eventType, description, options);
    }

    public AuditEntry log(String tenantId, AuditEventType eventType, String description) {
        return recorder.log(tenantId, eventType, description);
    }

    public AuditEntry validate(long entryId) {
        return workflow.validate(entryId);
    }

    public AuditEntry flagForReview(long entryId, String reason) {
        return workflow.flagForReview(entryId, reason);
    }

    public AuditEntry resolveReview(long entryId, String reviewerId, String notes) {
        return workflow.resolveReview(entryId, reviewerId, notes);
    }

    public AuditEntry archive(long entryId) {
        return workflow.archive(entryId);
    }

    /**
     * Archives validated and flagged entries recorded before {@code cutoff}; never deletes.
     *
     * @return number of entries archived
     */
    public int archiveOlderThan(String tenantId, Instant cutoff) {
        return workflow.archiveOlderThan(tenantId, cutoff);
    }

    /**
     * @throws AuditEntryNotFoundException for an unknown id
     */
    public AuditEntry get(long entryId) {
        return store.get(entryId).orElseThrow(() -> new AuditEntryNotFoundException(entryId));
    }

    /**
     * Entries of the tenant in ascending id order. The caller closes the stream.
     */
    public Stream<AuditEntry> listForTenant(String tenantId) {
        return store.listForTenant(tenantId);
    }

    public List<ChainViolation> verifyTenant(String tenantId) {
        return verifier.verifyTenant(tenantId);
    }

    /**
     * @throws AuditEntryNotFoundException for an unknown id
     */
    public List<ChainViolation> verifyEntry(long entryId) {
        return verifier.verifyEntry(entryId);
    }

    public ChainVerificationReport inspect(String tenantId) {
        return verifier.inspect(tenantId);
    }

    public AuditSummary summarize(String tenantId, Instant from, Instant to) {
        return reporter.summarize(tenantId, from, to);
    }

    public List<String> tenantIds() {
        return store.tenantIds();
    }

    public static final class Builder {

        private final AuditStore store;
        private Clock clock = Clock.systemUTC();
        private Duration clockSkewTolerance = DEFAULT_CLOCK_SKEW_TOLERANCE;
        private Duration lockTimeout = DEFAULT_LOCK_TIMEOUT;
        private EscalationNotifier notifier = new LoggingEscalationNotifier();
        private SequenceReferenceGenerator references = new InMemorySequenceReferenceGenerator();
        private MetricFactory metrics;

        private Builder(AuditStore store) {
            this.store = Objects.requireNonNull(store, "store must not be null");
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder clockSkewTolerance(Duration clockSkewTolerance) {
            this.clockSkewTolerance = clockSkewTolerance;
            return this;
        }

        public Builder lockTimeout(Duration lockTimeout) {
            this.lockTimeout = lockTimeout;
            return this;
        }

        public Builder escalationNotifier(EscalationNotifier notifier) {
            this.notifier = notifier;
            return this;
        }

        public Builder sequenceReferences(SequenceReferenceGenerator references) {
            this.references = references;
            return this;
        }

        public Builder metrics(MetricFactory metrics) {
            this.metrics = metrics;
            return this;
        }

        public AuditTrail build() {
            MetricFactory meters = metrics != null ? metrics : MetricFactory.standalone("custodia-audit");
            var locks = new TenantLocks(lockTimeout);
            var workflow = new AuditWorkflow(store, references, notifier, locks, clock);
            var recorder = new AuditRecorder(store, workflow, locks,
                    clockSkewTolerance, clock, meters);
            return new AuditTrail(store, recorder, workflow,
                    new ChainVerifier(store, meters, clock),
                    new AuditReporter(store, clock));
        }
    }
}
