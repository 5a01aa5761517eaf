package com.flagship.inventory_ledger.notification;

import com.flagship.inventory_ledger.common.AccessPolicy;
import com.flagship.inventory_ledger.common.Actor;
import com.flagship.inventory_ledger.common.PageRequests;
import com.flagship.inventory_ledger.common.PageResponse;
import com.flagship.inventory_ledger.common.Permission;
import com.flagship.inventory_ledger.common.Role;
import com.flagship.inventory_ledger.common.exception.NotFoundException;
import com.flagship.inventory_ledger.common.exception.ValidationException;
import com.flagship.inventory_ledger.observability.InventoryMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Persists notifications, one row per recipient, and serves each recipient's
 * inbox.
 *
 * Fan-out runs after the ledger change has committed, in its own transaction,
 * so recipients are resolved at that moment and a failure here cannot touch
 * the committed change.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationFanout {

    private final NotificationRepository notificationRepository;
    private final RecipientResolver recipientResolver;
    private final InventoryMetrics metrics;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Notification create(UUID recipientId, NotificationType type, String title, String message,
                               String link, Map<String, Object> metadata) {
        validate(recipientId, type, title, message);
        Notification created = notificationRepository.save(
                NotificationEntity.create(recipientId, type, title, message, link, metadata)).toDomain();
        metrics.recordNotificationsFannedOut(type.name(), 1);
        return created;
    }

    /**
     * One notification per active admin.
     *
     * @return number of notifications written
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int fanOutToAdmins(NotificationType type, String title, String message,
                              String link, Map<String, Object> metadata) {
        return fanOut(recipientResolver.admins(), type, title, message, link, metadata);
    }

    /**
     * System message from an admin to every active user, or to one role when
     * {@code targetRole} is given.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int broadcast(String title, String message, Role targetRole, Actor actor) {
        AccessPolicy.require(actor, Permission.BROADCAST_NOTIFICATIONS);
        List<UUID> recipients = targetRole != null
                ? recipientResolver.withRole(targetRole)
                : recipientResolver.everyone();
        int sent = fanOut(recipients, NotificationType.SYSTEM, title, message, null,
                Map.of("broadcastBy", actor.getId().toString()));
        log.info("System broadcast sent: recipients={}, targetRole={}", sent, targetRole);
        return sent;
    }

    @Transactional(readOnly = true)
    public NotificationInbox list(Actor actor, Boolean read, int page, int size) {
        Pageable pageable = PageRequests.newestFirst(page, size, "createdAt");
        PageResponse<Notification> items = PageResponse.from(
            read == null
                ? notificationRepository.findByRecipientId(actor.getId(), pageable)
                : notificationRepository.findByRecipientIdAndRead(actor.getId(), read, pageable),
            NotificationEntity::toDomain);
        return new NotificationInbox(unreadCount(actor), items);
    }

    @Transactional(readOnly = true)
    public long unreadCount(Actor actor) {
        return notificationRepository.countByRecipientIdAndReadFalse(actor.getId());
    }

    /**
     * Idempotent. Another recipient's notification is reported as not found.
     */
    @Transactional
    public Notification markRead(UUID notificationId, Actor actor) {
        NotificationEntity entity = notificationRepository.findByIdAndRecipientId(notificationId, actor.getId())
            .orElseThrow(() -> new NotFoundException("Notification", notificationId));
        if (!entity.isRead()) {
            entity.markRead();
            entity = notificationRepository.saveAndFlush(entity);
        }
        return entity.toDomain();
    }

    /**
     * Idempotent; returns how many notifications changed state.
     */
    @Transactional
    public int markAllRead(Actor actor) {
        int updated = notificationRepository.markAllRead(actor.getId());
        log.debug("Marked {} notifications read for recipient {}", updated, actor.getId());
        return updated;
    }

    @Transactional
    public void delete(UUID notificationId, Actor actor) {
        NotificationEntity entity = notificationRepository.findByIdAndRecipientId(notificationId, actor.getId())
            .orElseThrow(() -> new NotFoundException("Notification", notificationId));
        notificationRepository.delete(entity);
    }

    private int fanOut(List<UUID> recipients, NotificationType type, String title, String message,
                       String link, Map<String, Object> metadata) {
        if (recipients.isEmpty()) {
            log.debug("No recipients for {} notification", type);
            return 0;
        }
        validate(recipients.get(0), type, title, message);
        List<NotificationEntity> rows = recipients.stream()
            .map(recipient -> NotificationEntity.create(recipient, type, title, message, link, metadata))
            .toList();
        notificationRepository.saveAll(rows);
        metrics.recordNotificationsFannedOut(type.name(), rows.size());
        return rows.size();
    }

    private static void validate(UUID recipientId, NotificationType type, String title, String message) {
        if (recipientId == null) {
            throw new ValidationException("recipientId is required");
        }
        if (type == null) {
            throw new ValidationException("type is required");
        }
        if (title == null || title.isBlank()) {
            throw new ValidationException("title is required");
        }
        if (message == null || message.isBlank()) {
            throw new ValidationException("message is required");
        }
    }
}
