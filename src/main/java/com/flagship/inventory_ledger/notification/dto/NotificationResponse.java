package com.flagship.inventory_ledger.notification.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.inventory_ledger.notification.Notification;
import com.flagship.inventory_ledger.notification.NotificationType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Value
@Builder
public class NotificationResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("type")
    NotificationType type;

    @JsonProperty("title")
    String title;

    @JsonProperty("message")
    String message;

    @JsonProperty("link")
    String link;

    @JsonProperty("metadata")
    Map<String, Object> metadata;

    @JsonProperty("is_read")
    boolean read;

    @JsonProperty("created_at")
    Instant createdAt;

    public static NotificationResponse from(Notification notification) {
        return NotificationResponse.builder()
            .id(notification.getId())
            .type(notification.getType())
            .title(notification.getTitle())
            .message(notification.getMessage())
            .link(notification.getLink())
            .metadata(notification.getMetadata())
            .read(notification.isRead())
            .createdAt(notification.getCreatedAt())
            .build();
    }
}
