package com.custodia.security;

/**
 * The principal on whose behalf an audit event is recorded or a review action is taken.
 *
 * @param actorId     stable identifier of the user or integration
 * @param displayName optional human-readable name
 */
public record AuthenticatedActor(String actorId, String displayName) {
}
