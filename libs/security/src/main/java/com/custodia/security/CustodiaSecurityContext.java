package com.custodia.security;

import java.util.List;

/**
 * Security context of one request: who is acting, for which tenant, with which roles.
 *
 * @param actor         the acting principal
 * @param tenant        tenant scope of the request
 * @param roles         granted roles (hierarchy is applied by {@link RoleChecker})
 * @param correlationId correlation ID of the request, for log and error correlation
 */
public record CustodiaSecurityContext(
        AuthenticatedActor actor,
        TenantContext tenant,
        List<Role> roles,
        String correlationId) {

    public CustodiaSecurityContext {
        roles = roles == null ? List.of() : List.copyOf(roles);
    }

    public String actorId() {
        return actor == null ? null : actor.actorId();
    }

    public String tenantId() {
        return tenant == null ? null : tenant.tenantId();
    }
}
