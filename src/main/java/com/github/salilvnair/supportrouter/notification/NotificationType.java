package com.github.salilvnair.supportrouter.notification;

public enum NotificationType {
    /** A rule handed the session to a human. */
    ESCALATION,
    /** An advisory rule matched without escalating. */
    ADVISORY,
    /** The lead score reached the notify threshold for the first time. */
    LEAD_THRESHOLD
}
