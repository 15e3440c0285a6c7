package com.github.salilvnair.supportrouter.fault;

import com.github.salilvnair.supportrouter.model.Urgency;

public enum FaultUrgency {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /** High and critical faults go to staff straight away. */
    public boolean requiresEscalation() {
        return this == HIGH || this == CRITICAL;
    }

    public FaultUrgency atLeast(FaultUrgency other) {
        return other != null && other.compareTo(this) > 0 ? other : this;
    }

    public static FaultUrgency of(Urgency patternUrgency) {
        if (patternUrgency == null) {
            return LOW;
        }
        return switch (patternUrgency) {
            case CRITICAL -> CRITICAL;
            case HIGH -> HIGH;
            case NONE -> LOW;
        };
    }
}
