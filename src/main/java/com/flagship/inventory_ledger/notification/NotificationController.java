package com.flagship.inventory_ledger.notification;

import com.flagship.inventory_ledger.common.Actor;
import com.flagship.inventory_ledger.common.PageRequests;
import com.flagship.inventory_ledger.notification.dto.BroadcastRequest;
import com.flagship.inventory_ledger.notification.dto.NotificationListResponse;
import com.flagship.inventory_ledger.notification.dto.NotificationResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.UUID;

/**
 * The caller's own notifications. Admins can also broadcast system messages.
 */
@RestController
@RequestMapping("/api/notifications")
@RequiredArgsConstructor
public class NotificationController {

    private final NotificationFanout notificationFanout;

    @GetMapping
    public NotificationListResponse listNotifications(
            @RequestParam(value = "read", required = false) Boolean read,
            @RequestParam(value = "page", defaultValue = "1") int page,
            @RequestParam(value = "size", defaultValue = "" + PageRequests.DEFAULT_SIZE) int size,
            Actor actor) {
        return NotificationListResponse.from(notificationFanout.list(actor, read, page, size));
    }

    @GetMapping("/unread-count")
    public Map<String, Long> unreadCount(Actor actor) {
        return Map.of("unread_count", notificationFanout.unreadCount(actor));
    }

    @PatchMapping("/{id}/read")
    public NotificationResponse markRead(@PathVariable("id") UUID id, Actor actor) {
        return NotificationResponse.from(notificationFanout.markRead(id, actor));
    }

    @PatchMapping("/read-all")
    public Map<String, Integer> markAllRead(Actor actor) {
        return Map.of("updated", notificationFanout.markAllRead(actor));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable("id") UUID id, Actor actor) {
        notificationFanout.delete(id, actor);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/broadcast")
    public Map<String, Integer> broadcast(@Valid @RequestBody BroadcastRequest request, Actor actor) {
        return Map.of("recipients",
                notificationFanout.broadcast(request.getTitle(), request.getMessage(), request.getTargetRole(), actor));
    }
}
