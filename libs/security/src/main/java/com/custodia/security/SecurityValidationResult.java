package com.custodia.security;

import java.util.List;

/**
 * Result of validating a {@link CustodiaSecurityContext}.
 *
 * @param valid  whether the context passed all validation checks
 * @param errors validation error messages (empty if valid)
 */
public record SecurityValidationResult(boolean valid, List<String> errors) {

    public static SecurityValidationResult ok() {
        return new SecurityValidationResult(true, List.of());
    }

    public static SecurityValidationResult fail(List<String> errors) {
        return new SecurityValidationResult(false, List.copyOf(errors));
    }
}
