package com.custodia.security;

/**
 * Thrown when the acting principal lacks the role an operation requires.
 */
public class AccessDeniedException extends RuntimeException {

    private final String actorId;
    private final Role requiredRole;

    public AccessDeniedException(String actorId, Role requiredRole) {
        super("Actor '%s' lacks required role %s".formatted(actorId, requiredRole.value()));
        this.actorId = actorId;
        this.requiredRole = requiredRole;
    }

    public String actorId() {
        return actorId;
    }

    public Role requiredRole() {
        return requiredRole;
    }
}
