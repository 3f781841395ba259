package com.custodia.auditchain;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Lifecycle of an audit entry.
 * <p>
 * {@code draft -> validated -> archived}, with {@code flagged} as a review side branch reachable
 * from any non-terminal state. A flagged entry returns to {@code validated} only through review
 * resolution. Nothing ever returns to {@code draft}; {@code archived} is terminal.
 */
public enum LifecycleState {

    DRAFT("draft"),
    VALIDATED("validated"),
    FLAGGED("flagged"),
    ARCHIVED("archived");

    private final String value;

    LifecycleState(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * States reachable from this one in a single workflow step.
     */
    public Set<LifecycleState> allowedTargets() {
        return switch (this) {
            case DRAFT -> EnumSet.of(VALIDATED, FLAGGED);
            case VALIDATED -> EnumSet.of(FLAGGED, ARCHIVED);
            case FLAGGED -> EnumSet.of(FLAGGED, VALIDATED, ARCHIVED);
            case ARCHIVED -> EnumSet.noneOf(LifecycleState.class);
        };
    }

    public boolean canTransitionTo(LifecycleState target) {
        return allowedTargets().contains(target);
    }

    public boolean isTerminal() {
        return this == ARCHIVED;
    }

    public static Optional<LifecycleState> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (LifecycleState state : values()) {
            if (state.value.equalsIgnoreCase(value) || state.name().equalsIgnoreCase(value)) {
                return Optional.of(state);
            }
        }
        return Optional.empty();
    }
}
