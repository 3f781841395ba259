package com.custodia.auditchain;

import com.custodia.observability.CorrelationContextHolder;
import com.custodia.observability.MetricFactory;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * The single entry point for recording audit events.
 * <p>
 * Reading the tenant's head, hashing and appending run under the tenant's lock, so concurrent
 * callers for one tenant produce a linear chain. Info and warning entries are validated right
 * away; error and critical entries stay in draft for an explicit decision.
 */
public class AuditRecorder {

    /** Actor recorded when neither the caller nor the correlation context names one. */
    public static final String SYSTEM_ACTOR = "system";

    private static final Logger log = LoggerFactory.getLogger(AuditRecorder.class);

    private final AuditStore store;
    private final AuditWorkflow workflow;
    private final TenantLocks locks;
    private final Duration clockSkewTolerance;
    private final Clock clock;
    private final MetricFactory metrics;
    private final Timer appendTimer;

    public AuditRecorder(
            AuditStore store,
            AuditWorkflow workflow,
            TenantLocks locks,
            Duration clockSkewTolerance,
            Clock clock,
            MetricFactory metrics) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.workflow = Objects.requireNonNull(workflow, "workflow must not be null");
        this.locks = Objects.requireNonNull(locks, "locks must not be null");
        this.clockSkewTolerance = Objects.requireNonNull(clockSkewTolerance, "clockSkewTolerance must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.appendTimer = metrics.timer("custodia.audit.append.duration", "Time spent extending an audit chain");
    }

    /**
     * Records an event.
     *
     * @param tenantId    chain to extend
     * @param eventType   kind of event
     * @param description free-form text
     * @param options     optional inputs, may be null
     * @return the stored entry; validated for info/warning, draft for error/critical. An info or
     *         warning entry whose validation fails after the append is returned in draft, so a
     *         retry by the caller would record the event twice
     * @throws AuditValidationException on missing fields or a timestamp beyond the tolerance
     * @throws ChainBusyException       if the tenant's lock is not acquired in time
     * @throws ChainConflictException   if the store detects a concurrent append
     */
    public AuditEntry log(String tenantId, AuditEventType eventType, String description, LogOptions options) {
        LogOptions opts = options == null ? LogOptions.defaults() : options;
        Instant now = clock.instant();
        AuditEntryValidator.validate(tenantId, eventType, description, opts, now, clockSkewTolerance)
                .throwIfInvalid();

        String actorId = resolveActor(opts);
        Instant timestamp = (opts.timestamp() == null ? now : opts.timestamp()).truncatedTo(ChronoUnit.MILLIS);
        Severity severity = opts.severity() == null ? Severity.INFO : opts.severity();

        AuditEntry stored = appendTimer.record(() -> locks.withLock(tenantId, () -> {
            String previousHash = store.lastForTenant(tenantId)
                    .map(AuditEntry::contentHash)
                    .orElse(HashChainer.genesisHash());
            var fields = new ChainedFields(tenantId, eventType, actorId, timestamp,
                    opts.subjectRef(), description, opts.metadata(), previousHash);
            var draft = new AuditEntry(null, tenantId, null, eventType, severity, actorId, timestamp,
                    opts.subjectRef(), description, opts.beforeState(), opts.afterState(), fields.metadata(),
                    HashChainer.chain(fields), previousHash, LifecycleState.DRAFT, null, null, null);
            return store.append(draft);
        }));

        metrics.counter("custodia.audit.entries.recorded", "Audit entries appended",
                "eventType", eventType.value(), "severity", severity.value()).increment();
        log.debug("Appended audit entry {} to tenant {} ({}, {}) hash {}",
                stored.id(), tenantId, eventType.value(), severity.value(), stored.contentHash());

        try {
            return workflow.autoValidate(stored);
        } catch (RuntimeException e) {
            metrics.counter("custodia.audit.validation.failures", "Appended entries left in draft by a failed validation",
                    "eventType", eventType.value()).increment();
            log.error("Audit entry {} of tenant {} is stored but its validation failed; it stays in draft "
                    + "until validated explicitly", stored.id(), tenantId, e);
            return stored;
        }
    }

    public AuditEntry log(String tenantId, AuditEventType eventType, String description) {
        return log(tenantId, eventType, description, LogOptions.defaults());
    }

    private String resolveActor(LogOptions opts) {
        if (opts.actorId() != null) {
            return opts.actorId();
        }
        return CorrelationContextHolder.currentActorId().orElse(SYSTEM_ACTOR);
    }
}
