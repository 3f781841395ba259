package com.custodia.auditchain;

import com.custodia.observability.CorrelationContext;
import com.custodia.observability.CorrelationContextHolder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Hands escalations to an {@link Executor} so that a slow notification channel never holds up
 * a workflow transition. The caller's correlation context travels with the task.
 * <p>
 * A failing delegate cannot undo the transition that raised the escalation, so its failures
 * are logged here at ERROR with the entry id.
 */
public class AsyncEscalationNotifier implements EscalationNotifier {

    private static final Logger log = LoggerFactory.getLogger(AsyncEscalationNotifier.class);

    private final EscalationNotifier delegate;
    private final Executor executor;

    public AsyncEscalationNotifier(EscalationNotifier delegate, Executor executor) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    @Override
    public void escalate(Escalation escalation) {
        Optional<CorrelationContext> context = CorrelationContextHolder.get();
        Runnable task = () -> {
            try {
                delegate.escalate(escalation);
            } catch (RuntimeException e) {
                log.error("Escalation for audit entry {} of tenant {} failed",
                        escalation.entryId(), escalation.tenantId(), e);
            }
        };
        try {
            executor.execute(() -> context.ifPresentOrElse(
                    ctx -> CorrelationContextHolder.runWithContext(ctx, task), task));
        } catch (RejectedExecutionException e) {
            log.error("Escalation for audit entry {} rejected by executor; notifying inline",
                    escalation.entryId(), e);
            task.run();
        }
    }
}
