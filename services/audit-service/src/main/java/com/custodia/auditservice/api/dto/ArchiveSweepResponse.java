package com.custodia.auditservice.api.dto;

import java.time.Instant;

/**
 * Result of {@code POST /audit-entries/archive-sweep}.
 *
 * @param archived number of entries moved to {@code archived} by this sweep
 */
public record ArchiveSweepResponse(String tenantId, Instant before, int archived) {}
