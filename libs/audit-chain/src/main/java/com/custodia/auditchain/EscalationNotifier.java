package com.custodia.auditchain;

/**
 * Side effect of high-severity validation and of flagging: tells reviewers to act.
 */
@FunctionalInterface
public interface EscalationNotifier {

    void escalate(Escalation escalation);
}
