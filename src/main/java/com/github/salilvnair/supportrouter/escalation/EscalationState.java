package com.github.salilvnair.supportrouter.escalation;

/**
 * Session escalation states in transition order. {@link #ESCALATED} is terminal until the
 * session is reset.
 */
public enum EscalationState {
    LOCAL,
    AI_ASSISTED,
    ESCALATED;

    public EscalationState atLeast(EscalationState other) {
        return other != null && other.ordinal() > ordinal() ? other : this;
    }
}
