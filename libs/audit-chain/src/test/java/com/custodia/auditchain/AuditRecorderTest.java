package com.custodia.auditchain;

import com.custodia.observability.CorrelationContext;
import com.custodia.observability.CorrelationContextHolder;
import com.custodia.observability.MetricFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("AuditRecorder")
class AuditRecorderTest {

    private static final Instant NOW = Instant.parse("2026-01-05T10:15:30.123456Z");
    private static final Duration TOLERANCE = Duration.ofMinutes(5);

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private SimpleMeterRegistry registry;
    private InMemoryAuditStore store;
    private TenantLocks locks;
    private AuditRecorder recorder;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        store = new InMemoryAuditStore();
        locks = new TenantLocks(Duration.ofMillis(200));
        var workflow = new AuditWorkflow(store, new InMemorySequenceReferenceGenerator(),
                new LoggingEscalationNotifier(), clock);
        recorder = new AuditRecorder(store, workflow, locks, TOLERANCE, clock,
                new MetricFactory(registry, "audit-test"));
    }

    @AfterEach
    void clearContext() {
        CorrelationContextHolder.clear();
    }

    @Test
    @DisplayName("three severities chain correctly; info and warning validated, critical left in draft")
    void threeSeverityScenario() {
        var info = recorder.log("A", AuditEventType.CREATED, "Box created",
                LogOptions.builder().severity(Severity.INFO).build());
        var warning = recorder.log("A", AuditEventType.LOCATION_UPDATE, "Box moved",
                LogOptions.builder().severity(Severity.WARNING).build());
        var critical = recorder.log("A", AuditEventType.CUSTODY_TRANSFER, "Custody gap",
                LogOptions.builder().severity(Severity.CRITICAL).build());

        assertThat(info.previousHash()).isEqualTo(HashChainer.GENESIS);
        assertThat(warning.previousHash()).isEqualTo(info.contentHash());
        assertThat(critical.previousHash()).isEqualTo(warning.contentHash());

        assertThat(info.lifecycleState()).isEqualTo(LifecycleState.VALIDATED);
        assertThat(warning.lifecycleState()).isEqualTo(LifecycleState.VALIDATED);
        assertThat(critical.lifecycleState()).isEqualTo(LifecycleState.DRAFT);
        assertThat(critical.sequenceReference()).isNull();
        assertThat(info.sequenceReference()).isEqualTo("CREATED/000001");

        var verifier = new ChainVerifier(store, MetricFactory.standalone("audit-test"), clock);
        assertThat(verifier.verifyTenant("A")).isEmpty();
    }

    @Test
    @DisplayName("stored content hash is the hash of the stored chained fields")
    void hashMatchesFields() {
        var entry = recorder.log("A", AuditEventType.SIGNED, "Signed",
                LogOptions.builder()
                        .subject("document", "DOC-42")
                        .metadata(Metadata.fromJson("{\"pages\":12}"))
                        .beforeState("unsigned")
                        .afterState("signed")
                        .build());

        assertThat(entry.contentHash()).isEqualTo(HashChainer.chain(entry.chainedFields()));
        assertThat(entry.timestamp()).isEqualTo(Instant.parse("2026-01-05T10:15:30.123Z"));
        assertThat(entry.beforeState()).isEqualTo("unsigned");
        assertThat(entry.afterState()).isEqualTo("signed");
    }

    @Nested
    @DisplayName("actor resolution")
    class ActorResolution {

        @Test
        @DisplayName("explicit actor wins")
        void explicitActor() {
            CorrelationContextHolder.set(new CorrelationContext("corr-1", "A", "ctx-actor", null));

            var entry = recorder.log("A", AuditEventType.VIEWED, "Viewed",
                    LogOptions.builder().actorId("clerk-3").build());

            assertThat(entry.actorId()).isEqualTo("clerk-3");
        }

        @Test
        @DisplayName("falls back to the correlation context actor")
        void contextActor() {
            CorrelationContextHolder.set(new CorrelationContext("corr-1", "A", "ctx-actor", null));

            assertThat(recorder.log("A", AuditEventType.VIEWED, "Viewed").actorId()).isEqualTo("ctx-actor");
        }

        @Test
        @DisplayName("falls back to the system actor")
        void systemActor() {
            assertThat(recorder.log("A", AuditEventType.VIEWED, "Viewed").actorId())
                    .isEqualTo(AuditRecorder.SYSTEM_ACTOR);
        }
    }

    @Nested
    @DisplayName("validation")
    class Validation {

        @Test
        @DisplayName("rejects a timestamp beyond the clock-skew tolerance")
        void futureTimestamp() {
            var options = LogOptions.builder().timestamp(NOW.plus(TOLERANCE).plusSeconds(1)).build();

            assertThatThrownBy(() -> recorder.log("A", AuditEventType.CREATED, "Late", options))
                    .isInstanceOfSatisfying(AuditValidationException.class,
                            e -> assertThat(e.errors()).singleElement().asString().contains("future"));
            assertThat(store.lastForTenant("A")).isEmpty();
        }

        @Test
        @DisplayName("accepts a timestamp inside the tolerance window")
        void skewInsideTolerance() {
            var options = LogOptions.builder().timestamp(NOW.plus(Duration.ofMinutes(4))).build();

            assertThat(recorder.log("A", AuditEventType.CREATED, "Slightly ahead", options).timestamp())
                    .isEqualTo(Instant.parse("2026-01-05T10:19:30.123Z"));
        }

        @Test
        @DisplayName("reports all missing fields at once")
        void missingFields() {
            assertThatThrownBy(() -> recorder.log(" ", null, "", LogOptions.defaults()))
                    .isInstanceOfSatisfying(AuditValidationException.class,
                            e -> assertThat(e.errors()).hasSize(3));
        }
    }

    @Test
    @DisplayName("fails with ChainBusyException when the tenant lock is held too long")
    void busyTenant() throws Exception {
        var held = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        Thread holder = new Thread(() -> locks.withLock("A", () -> {
            held.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return null;
        }));
        holder.start();
        held.await(5, TimeUnit.SECONDS);

        try {
            assertThatThrownBy(() -> recorder.log("A", AuditEventType.CREATED, "Blocked"))
                    .isInstanceOfSatisfying(ChainBusyException.class,
                            e -> assertThat(e.tenantId()).isEqualTo("A"));
            assertThat(recorder.log("B", AuditEventType.CREATED, "Other tenant").id()).isNotNull();
        } finally {
            release.countDown();
            holder.join();
        }
    }

    @Test
    @DisplayName("counts recorded entries by event type and severity")
    void metrics() {
        recorder.log("A", AuditEventType.CREATED, "one");
        recorder.log("A", AuditEventType.CREATED, "two");
        recorder.log("B", AuditEventType.SIGNED, "three", LogOptions.builder().severity(Severity.ERROR).build());

        assertThat(registry.get("custodia.audit.entries.recorded")
                .tags("eventType", "created", "severity", "info").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("custodia.audit.entries.recorded")
                .tags("eventType", "signed", "severity", "error").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("custodia.audit.append.duration").timer().count()).isEqualTo(3);
    }

    @Test
    @DisplayName("a validation failure after the append returns the stored draft instead of failing the call")
    void validationFailureAfterAppend() {
        SequenceReferenceGenerator broken = (tenantId, eventType) -> {
            throw new IllegalStateException("sequence counter unavailable");
        };
        var workflow = new AuditWorkflow(store, broken, new LoggingEscalationNotifier(), clock);
        var failing = new AuditRecorder(store, workflow, locks, TOLERANCE, clock,
                new MetricFactory(registry, "audit-test"));

        var entry = failing.log("A", AuditEventType.CREATED, "Box created");

        assertThat(entry.id()).isNotNull();
        assertThat(entry.lifecycleState()).isEqualTo(LifecycleState.DRAFT);
        assertThat(store.listForTenant("A")).singleElement()
                .satisfies(stored -> assertThat(stored.lifecycleState()).isEqualTo(LifecycleState.DRAFT));
        assertThat(registry.get("custodia.audit.validation.failures")
                .tags("eventType", "created").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("tenants keep independent chains")
    void independentChains() {
        recorder.log("A", AuditEventType.CREATED, "a1");
        var b1 = recorder.log("B", AuditEventType.CREATED, "b1");
        recorder.log("A", AuditEventType.CREATED, "a2");

        assertThat(b1.previousHash()).isEqualTo(HashChainer.GENESIS);
        List<String> chainA = store.listForTenant("A").map(AuditEntry::description).collect(Collectors.toList());
        assertThat(chainA).containsExactly("a1", "a2");
    }
}
