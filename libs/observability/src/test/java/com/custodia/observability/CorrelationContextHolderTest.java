package com.custodia.observability;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link CorrelationContextHolder}: ThreadLocal storage, MDC bridge, actor lookup and
 * scoped execution.
 */
@DisplayName("CorrelationContextHolder")
class CorrelationContextHolderTest {

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Nested
    @DisplayName("set/get/clear lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("should return empty when no context is set")
        void shouldReturnEmptyWhenNoContext() {
            assertThat(CorrelationContextHolder.get()).isEmpty();
            assertThat(CorrelationContextHolder.currentActorId()).isEmpty();
        }

        @Test
        @DisplayName("should store and retrieve context")
        void shouldStoreAndRetrieveContext() {
            var ctx = new CorrelationContext("corr-1", "company-1", "clerk-7", "req-1");
            CorrelationContextHolder.set(ctx);

            assertThat(CorrelationContextHolder.get()).contains(ctx);
            assertThat(CorrelationContextHolder.currentActorId()).contains("clerk-7");
        }

        @Test
        @DisplayName("should treat a blank actor as absent")
        void shouldIgnoreBlankActor() {
            CorrelationContextHolder.set(new CorrelationContext("corr-1", "company-1", " ", null));

            assertThat(CorrelationContextHolder.currentActorId()).isEmpty();
        }

        @Test
        @DisplayName("should reject null context")
        void shouldRejectNullContext() {
            assertThatThrownBy(() -> CorrelationContextHolder.set(null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("context");
        }
    }

    @Nested
    @DisplayName("MDC bridge")
    class MdcBridge {

        @Test
        @DisplayName("should populate MDC keys when context is set")
        void shouldPopulateMdcOnSet() {
            CorrelationContextHolder.set(
                    new CorrelationContext("corr-1", "company-1", "clerk-7", "req-1"));

            assertThat(MDC.get("correlationId")).isEqualTo("corr-1");
            assertThat(MDC.get("tenantId")).isEqualTo("company-1");
            assertThat(MDC.get("actorId")).isEqualTo("clerk-7");
            assertThat(MDC.get("requestId")).isEqualTo("req-1");
        }

        @Test
        @DisplayName("should clear MDC keys when context is cleared")
        void shouldClearMdcOnClear() {
            CorrelationContextHolder.set(
                    new CorrelationContext("corr-1", "company-1", "clerk-7", "req-1"));
            CorrelationContextHolder.clear();

            assertThat(MDC.get("correlationId")).isNull();
            assertThat(MDC.get("tenantId")).isNull();
            assertThat(MDC.get("actorId")).isNull();
            assertThat(MDC.get("requestId")).isNull();
        }

        @Test
        @DisplayName("should remove stale MDC keys when a narrower context replaces a wider one")
        void shouldRemoveStaleKeys() {
            CorrelationContextHolder.set(
                    new CorrelationContext("corr-1", "company-1", "clerk-7", "req-1"));
            CorrelationContextHolder.set(new CorrelationContext("corr-2", null, null, null));

            assertThat(MDC.get("correlationId")).isEqualTo("corr-2");
            assertThat(MDC.get("tenantId")).isNull();
            assertThat(MDC.get("actorId")).isNull();
        }
    }

    @Nested
    @DisplayName("scoped execution")
    class ScopedExecution {

        @Test
        @DisplayName("should set context for the duration of the runnable and restore afterwards")
        void shouldSetContextAndRestore() {
            var outer = new CorrelationContext("outer-corr", "company-1", null, null);
            var inner = new CorrelationContext("inner-corr", "company-2", null, null);
            CorrelationContextHolder.set(outer);

            AtomicReference<String> captured = new AtomicReference<>();
            CorrelationContextHolder.runWithContext(inner, () -> captured.set(
                    CorrelationContextHolder.get().map(CorrelationContext::correlationId).orElse(null)));

            assertThat(captured.get()).isEqualTo("inner-corr");
            assertThat(CorrelationContextHolder.get()).contains(outer);
        }

        @Test
        @DisplayName("should clear context afterwards when no previous context existed")
        void shouldClearWhenNoPreviousContext() {
            var ctx = new CorrelationContext("temp-corr", "company-1", "clerk-1", null);

            String actor = CorrelationContextHolder.callWithContext(
                    ctx, () -> CorrelationContextHolder.currentActorId().orElseThrow());

            assertThat(actor).isEqualTo("clerk-1");
            assertThat(CorrelationContextHolder.get()).isEmpty();
        }

        @Test
        @DisplayName("should restore context even if the work throws")
        void shouldRestoreOnException() {
            var outer = new CorrelationContext("outer-corr", "company-1", null, null);
            var inner = new CorrelationContext("inner-corr", "company-2", null, null);
            CorrelationContextHolder.set(outer);

            assertThatThrownBy(() -> CorrelationContextHolder.runWithContext(inner, () -> {
                throw new IllegalStateException("boom");
            })).isInstanceOf(IllegalStateException.class);

            assertThat(CorrelationContextHolder.get()).contains(outer);
        }

        @Test
        @DisplayName("should not leak context across threads")
        void shouldNotLeakAcrossThreads() throws InterruptedException {
            CorrelationContextHolder.set(new CorrelationContext("main-corr", "company-1", null, null));

            AtomicReference<Boolean> otherThreadHasContext = new AtomicReference<>();
            Thread other = new Thread(
                    () -> otherThreadHasContext.set(CorrelationContextHolder.get().isPresent()));
            other.start();
            other.join();

            assertThat(otherThreadHasContext.get()).isFalse();
        }
    }
}
