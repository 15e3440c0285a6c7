package com.github.salilvnair.supportrouter.escalation;

public record EscalationDecision(Outcome outcome, EscalationRule rule) {

    private static final EscalationDecision NONE = new EscalationDecision(Outcome.NONE, null);

    public enum Outcome {
        /** No rule matched. */
        NONE,
        /** Only an advisory rule matched; someone is told, the session is not handed off. */
        NOTIFY,
        /** An auto-escalate rule matched. */
        ESCALATE,
        /** The session was already escalated before this turn. */
        ALREADY_ESCALATED
    }

    public static EscalationDecision none() {
        return NONE;
    }

    public static EscalationDecision notify(EscalationRule rule) {
        return new EscalationDecision(Outcome.NOTIFY, rule);
    }

    public static EscalationDecision escalate(EscalationRule rule) {
        return new EscalationDecision(Outcome.ESCALATE, rule);
    }

    public static EscalationDecision alreadyEscalated() {
        return new EscalationDecision(Outcome.ALREADY_ESCALATED, null);
    }

    public boolean escalated() {
        return outcome == Outcome.ESCALATE || outcome == Outcome.ALREADY_ESCALATED;
    }

    public boolean notifies() {
        return outcome == Outcome.ESCALATE || outcome == Outcome.NOTIFY;
    }
}
