package com.custodia.security;

/**
 * Compares the request's tenant against the tenant that owns a chain or entry.
 * <p>
 * Audit chains never cross tenants, so any mismatch is a hard failure rather than a filtered
 * result.
 */
public final class TenantIsolationEnforcer {

    private TenantIsolationEnforcer() {
        // utility class
    }

    /**
     * Verifies that the security context's tenant matches the resource's tenant.
     *
     * @param context          the authenticated security context
     * @param resourceTenantId the tenant ID of the chain or entry being accessed
     * @throws TenantMismatchException if the tenants do not match
     */
    public static void enforce(CustodiaSecurityContext context, String resourceTenantId) {
        String contextTenantId = context.tenantId();
        if (contextTenantId == null || !contextTenantId.equals(resourceTenantId)) {
            throw new TenantMismatchException(contextTenantId, resourceTenantId);
        }
    }
}
