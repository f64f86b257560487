package com.solar.anomaly.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Resolution lifecycle of a stored anomaly.
 * RESOLVED and FALSE_POSITIVE are terminal.
 */
public enum AnomalyStatus {
    OPEN,
    ACKNOWLEDGED,
    RESOLVED,
    FALSE_POSITIVE;

    public Set<AnomalyStatus> allowedTransitions() {
        return switch (this) {
            case OPEN -> EnumSet.of(ACKNOWLEDGED, RESOLVED, FALSE_POSITIVE);
            case ACKNOWLEDGED -> EnumSet.of(RESOLVED, FALSE_POSITIVE);
            case RESOLVED, FALSE_POSITIVE -> EnumSet.noneOf(AnomalyStatus.class);
        };
    }

    public boolean canTransitionTo(AnomalyStatus target) {
        return allowedTransitions().contains(target);
    }

    public boolean isTerminal() {
        return this == RESOLVED || this == FALSE_POSITIVE;
    }

    public boolean isActive() {
        return this == OPEN || this == ACKNOWLEDGED;
    }
}
