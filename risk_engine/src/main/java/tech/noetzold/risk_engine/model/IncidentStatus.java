package tech.noetzold.risk_engine.model;

import java.util.EnumSet;
import java.util.Set;

public enum IncidentStatus {
    OPEN,
    INVESTIGATING,
    RESOLVED,
    DISMISSED,
    FALSE_POSITIVE;

    public boolean isTerminal() {
        return this == RESOLVED || this == DISMISSED || this == FALSE_POSITIVE;
    }

    public Set<IncidentStatus> allowedTransitions() {
        return switch (this) {
            case OPEN -> EnumSet.of(INVESTIGATING, RESOLVED, DISMISSED, FALSE_POSITIVE);
            case INVESTIGATING -> EnumSet.of(RESOLVED, DISMISSED, FALSE_POSITIVE);
            case RESOLVED, DISMISSED, FALSE_POSITIVE -> EnumSet.noneOf(IncidentStatus.class);
        };
    }

    public boolean canTransitionTo(IncidentStatus target) {
        return allowedTransitions().contains(target);
    }
}
