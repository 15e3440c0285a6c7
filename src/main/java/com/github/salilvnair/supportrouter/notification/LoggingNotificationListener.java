package com.github.salilvnair.supportrouter.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class LoggingNotificationListener implements NotificationListener {

    @Override
    public void onNotification(RouterNotification notification) {
        log.info(
                "Notification type={} tenant={} sessionId={} priority={} category={} targets={} summary={}",
                notification.type(),
                notification.tenantId(),
                notification.sessionId(),
                notification.priority(),
                notification.category(),
                notification.notifyTargets(),
                notification.summary()
        );
    }
}
