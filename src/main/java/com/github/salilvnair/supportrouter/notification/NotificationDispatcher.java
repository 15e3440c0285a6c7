package com.github.salilvnair.supportrouter.notification;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Fans notifications out to every listener. A failing listener is logged and skipped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NotificationDispatcher {

    private final List<NotificationListener> listeners;

    public void dispatch(List<RouterNotification> notifications) {
        if (notifications == null) {
            return;
        }
        notifications.forEach(this::dispatch);
    }

    public void dispatch(RouterNotification notification) {
        if (listeners == null || listeners.isEmpty() || notification == null) {
            return;
        }
        for (NotificationListener listener : listeners) {
            try {
                listener.onNotification(notification);
            }
            catch (Exception e) {
                log.warn(
                        "Notification listener failed listener={} sessionId={} type={} msg={}",
                        listener.getClass().getSimpleName(),
                        notification.sessionId(),
                        notification.type(),
                        e.getMessage()
                );
            }
        }
    }
}
