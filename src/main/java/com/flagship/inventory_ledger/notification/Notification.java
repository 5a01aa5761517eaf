package com.flagship.inventory_ledger.notification;

import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Value
public class Notification {
    UUID id;
    UUID recipientId;
    NotificationType type;
    String title;
    String message;
    String link;
    Map<String, Object> metadata;
    boolean read;
    Instant createdAt;
}
