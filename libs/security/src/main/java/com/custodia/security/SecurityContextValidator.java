package com.custodia.security;

import java.util.ArrayList;

/**
 * Validates that a {@link CustodiaSecurityContext} has all required fields populated, reporting
 * every problem at once.
 */
public final class SecurityContextValidator {

    private SecurityContextValidator() {
        // utility class
    }

    /**
     * @param context the security context to validate
     * @return a {@link SecurityValidationResult} with any errors found
     */
    public static SecurityValidationResult validate(CustodiaSecurityContext context) {
        var errors = new ArrayList<String>();

        if (context.actor() == null || isBlank(context.actor().actorId())) {
            errors.add("actor.actorId must not be null or blank");
        }
        if (context.tenant() == null || isBlank(context.tenant().tenantId())) {
            errors.add("tenant.tenantId must not be null or blank");
        }
        if (context.roles().isEmpty()) {
            errors.add("roles must contain at least one role");
        }

        return errors.isEmpty() ? SecurityValidationResult.ok() : SecurityValidationResult.fail(errors);
    }

    /**
     * Like {@link #validate(CustodiaSecurityContext)} but fails fast.
     *
     * @throws SecurityContextException carrying every validation error
     */
    public static CustodiaSecurityContext requireValid(CustodiaSecurityContext context) {
        SecurityValidationResult result = validate(context);
        if (!result.valid()) {
            throw new SecurityContextException(result.errors());
        }
        return context;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
