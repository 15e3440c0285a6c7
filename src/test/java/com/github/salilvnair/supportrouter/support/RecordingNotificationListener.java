package com.github.salilvnair.supportrouter.support;

import com.github.salilvnair.supportrouter.notification.NotificationListener;
import com.github.salilvnair.supportrouter.notification.NotificationType;
import com.github.salilvnair.supportrouter.notification.RouterNotification;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public final class RecordingNotificationListener implements NotificationListener {

    private final List<RouterNotification> received = new CopyOnWriteArrayList<>();

    @Override
    public void onNotification(RouterNotification notification) {
        received.add(notification);
    }

    public List<RouterNotification> received() {
        return List.copyOf(received);
    }

    public List<RouterNotification> ofType(NotificationType type) {
        return received.stream().filter(n -> n.type() == type).toList();
    }

    public void clear() {
        received.clear();
    }
}
