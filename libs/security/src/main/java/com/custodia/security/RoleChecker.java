package com.custodia.security;

/**
 * Role-based access checks with hierarchy support.
 */
public final class RoleChecker {

    private RoleChecker() {
        // utility class
    }

    /**
     * Checks if the security context has the required role (directly or via hierarchy).
     * <p>
     * Example: a context holding RECORDS_ADMIN passes {@code hasRole(ctx, RECORDS_CLERK)}.
     */
    public static boolean hasRole(CustodiaSecurityContext context, Role required) {
        return context.roles().stream()
                .anyMatch(granted -> granted.implies(required));
    }

    /**
     * Checks if the security context has ANY of the required roles.
     */
    public static boolean hasAnyRole(CustodiaSecurityContext context, Role... required) {
        for (Role role : required) {
            if (hasRole(context, role)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Fails with {@link AccessDeniedException} unless the context has the required role.
     */
    public static void require(CustodiaSecurityContext context, Role required) {
        if (!hasRole(context, required)) {
            throw new AccessDeniedException(context.actorId(), required);
        }
    }
}
