package com.custodia.auditchain;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of walking one tenant's chain.
 *
 * @param tenantId       tenant verified
 * @param entriesChecked number of entries walked
 * @param headHash       content hash of the last entry walked, or the genesis sentinel
 * @param verifiedAt     time the walk finished
 * @param violations     every break found, in chain order
 */
public record ChainVerificationReport(
        String tenantId,
        long entriesChecked,
        String headHash,
        Instant verifiedAt,
        List<ChainViolation> violations) {

    public ChainVerificationReport {
        violations = List.copyOf(violations);
    }

    public boolean intact() {
        return violations.isEmpty();
    }
}
