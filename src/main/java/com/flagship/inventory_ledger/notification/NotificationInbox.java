package com.flagship.inventory_ledger.notification;

import com.flagship.inventory_ledger.common.PageResponse;
import lombok.Value;

/**
 * A page of a recipient's notifications plus their total unread count.
 */
@Value
public class NotificationInbox {
    long unreadCount;
    PageResponse<Notification> page;
}
