package com.custodia.security;

/**
 * Tenant ("company") scope of a request. Every audit chain belongs to exactly one tenant.
 *
 * @param tenantId   unique tenant identifier
 * @param tenantName optional human-readable tenant name
 */
public record TenantContext(String tenantId, String tenantName) {}
