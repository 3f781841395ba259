package com.custodia.auditchain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes escalations to the application log at WARN, where alerting picks them up.
 */
public class LoggingEscalationNotifier implements EscalationNotifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingEscalationNotifier.class);

    @Override
    public void escalate(Escalation escalation) {
        log.warn("Escalation to {}: audit entry {} of tenant {} ({}) - {}",
                escalation.targetRole().value(),
                escalation.entryId(),
                escalation.tenantId(),
                escalation.severity().value(),
                escalation.reason());
    }
}
