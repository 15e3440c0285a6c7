package com.github.salilvnair.supportrouter.notification;

public interface NotificationListener {
    void onNotification(RouterNotification notification);
}
