package com.example.rota.notification;

import com.example.rota.config.RotaProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * Default sink: logs each event and keeps the most recent ones in memory.
 */
@Component
public class RecentNotificationBuffer implements NotificationSink {

    private static final Logger logger = LoggerFactory.getLogger(RecentNotificationBuffer.class);

    private final Deque<Notification> deque = new ConcurrentLinkedDeque<>();
    private final int max;

    public RecentNotificationBuffer(RotaProperties properties) {
        this.max = Math.max(1, properties.getNotificationBufferSize());
    }

    @Override
    public void publish(Notification notification) {
        logger.info("Notification {} -> staff {}: {}", notification.type(), notification.recipientId(), notification.title());
        deque.addFirst(notification);
        while (deque.size() > max) deque.removeLast();
    }

    public List<Notification> recentFor(Long recipientId) {
        return deque.stream()
                .filter(n -> n.recipientId().equals(recipientId))
                .toList();
    }

    public void clear() {
        deque.clear();
    }
}
