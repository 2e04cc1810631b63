package com.agentcrew.orchestrator.conflict;

import java.util.List;

/**
 * Result of running the resolution engine on one conflict.
 *
 * A resolved outcome carries an {@link ResolutionAction}. An unresolved one
 * carries a suggestion and the fallback options an operator can pick from.
 */
public record Resolution(
        boolean            resolved,
        ConflictCategory   category,
        ResolutionStrategy strategy,
        ResolutionAction   action,
        String             suggestion,
        List<String>       fallbackOptions
) {
    static final List<String> FALLBACK_OPTIONS = List.of(
            "Queue the unit until conflicting work completes",
            "Split the unit into smaller parts",
            "Reassign to a different agent type",
            "Coordinate manually between the affected agents");

    public Resolution {
        fallbackOptions = List.copyOf(fallbackOptions);
    }

    public static Resolution noConflict() {
        return new Resolution(true, null, ResolutionStrategy.NO_CONFLICT, null, null, List.of());
    }

    public static Resolution resolved(ConflictCategory category, ResolutionStrategy strategy,
                                      ResolutionAction action, String suggestion) {
        return new Resolution(true, category, strategy, action, suggestion, List.of());
    }

    public static Resolution unresolved(ConflictCategory category, String suggestion) {
        return new Resolution(false, category, ResolutionStrategy.MANUAL_INTERVENTION, null,
                suggestion, FALLBACK_OPTIONS);
    }
}
