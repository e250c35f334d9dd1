package com.example.rota.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

@Component
public class NotificationDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final NotificationSink sink;

    public NotificationDispatcher(NotificationSink sink) {
        this.sink = sink;
    }

    /**
     * Runs after commit, or immediately when no transaction is active.
     * The transition is already durable here, so a failing sink is logged rather than rethrown.
     */
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void deliver(Notification notification) {
        try {
            sink.publish(notification);
        } catch (RuntimeException ex) {
            logger.error("Notification {} to staff {} could not be delivered",
                    notification.type(), notification.recipientId(), ex);
        }
    }
}
