package com.example.rota.notification;

public record Notification(Long recipientId, NotificationType type, String title, String message, String link) {
}
