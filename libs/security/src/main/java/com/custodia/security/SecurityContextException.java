package com.custodia.security;

import java.util.List;

/**
 * Thrown when a request carries no usable caller identity (missing actor, tenant or roles).
 */
public class SecurityContextException extends RuntimeException {

    private final List<String> errors;

    public SecurityContextException(List<String> errors) {
        super("Invalid security context: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> errors() {
        return errors;
    }
}
