package com.github.salilvnair.supportrouter.notification;

import com.github.salilvnair.supportrouter.escalation.RulePriority;
import lombok.Builder;

import java.time.Instant;
import java.util.Set;

/**
 * Event for external sinks. The router decides that and what to notify; delivery is up to the
 * {@link NotificationListener}s.
 */
@Builder
public record RouterNotification(
        NotificationType type,
        String tenantId,
        String sessionId,
        RulePriority priority,
        String category,
        String summary,
        Set<String> notifyTargets,
        Instant createdAt
) {

    public RouterNotification {
        notifyTargets = notifyTargets == null ? Set.of() : Set.copyOf(notifyTargets);
    }
}
