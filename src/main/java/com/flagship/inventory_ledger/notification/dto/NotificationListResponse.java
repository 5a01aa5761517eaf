package com.flagship.inventory_ledger.notification.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.inventory_ledger.common.PageResponse;
import com.flagship.inventory_ledger.notification.NotificationInbox;
import lombok.Value;

@Value
public class NotificationListResponse {

    @JsonProperty("unread_count")
    long unreadCount;

    @JsonProperty("notifications")
    PageResponse<NotificationResponse> notifications;

    public static NotificationListResponse from(NotificationInbox inbox) {
        return new NotificationListResponse(inbox.getUnreadCount(), inbox.getPage().map(NotificationResponse::from));
    }
}
