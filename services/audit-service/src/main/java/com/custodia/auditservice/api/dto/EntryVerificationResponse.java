package com.custodia.auditservice.api.dto;

import com.custodia.auditchain.ChainViolation;
import java.util.List;

/**
 * Result of {@code GET /audit-entries/{id}/verification}.
 */
public record EntryVerificationResponse(
        long entryId,
        String tenantId,
        boolean intact,
        List<VerificationResponse.Violation> violations) {

    public static EntryVerificationResponse from(long entryId, String tenantId, List<ChainViolation> violations) {
        return new EntryVerificationResponse(
                entryId,
                tenantId,
                violations.isEmpty(),
                violations.stream().map(VerificationResponse.Violation::from).toList());
    }
}
