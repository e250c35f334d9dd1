package com.example.rota.notification;

/**
 * Outbound port for notification events. Delivery and storage belong to the implementation.
 */
public interface NotificationSink {

    void publish(Notification notification);
}
