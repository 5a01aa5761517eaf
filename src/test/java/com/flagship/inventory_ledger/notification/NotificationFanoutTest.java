package com.flagship.inventory_ledger.notification;

import com.flagship.inventory_ledger.IntegrationTestSupport;
import com.flagship.inventory_ledger.catalog.Product;
import com.flagship.inventory_ledger.common.Actor;
import com.flagship.inventory_ledger.common.Role;
import com.flagship.inventory_ledger.common.exception.ForbiddenOperationException;
import com.flagship.inventory_ledger.common.exception.NotFoundException;
import com.flagship.inventory_ledger.expense.ExpenseCategory;
import com.flagship.inventory_ledger.expense.ExpenseDraft;
import com.flagship.inventory_ledger.expense.ExpenseService;
import com.flagship.inventory_ledger.ledger.TransactionRecorder;
import com.flagship.inventory_ledger.sale.PaymentMethod;
import com.flagship.inventory_ledger.sale.PaymentStatus;
import com.flagship.inventory_ledger.user.AppUserEntity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class NotificationFanoutTest extends IntegrationTestSupport {

    @Autowired
    private NotificationFanout notificationFanout;

    @Autowired
    private TransactionRecorder transactionRecorder;

    @Autowired
    private ExpenseService expenseService;

    private List<Notification> inboxOf(Actor actor) {
        return notificationFanout.list(actor, null, 1, 50).getPage().getItems();
    }

    private List<NotificationType> typesFor(Actor actor) {
        return inboxOf(actor).stream().map(Notification::getType).sorted().toList();
    }

    @Nested
    @DisplayName("Derived from ledger events")
    class Derived {

        @Test
        @DisplayName("A sale notifies every active admin and nobody else")
        void saleNotifiesAdmins() {
            Actor secondAdmin = registerUser("boss", Role.ADMIN);
            Product product = createProduct("NTF-1", 50, "10", "20");

            transactionRecorder.createSale(product.getId(), 2, new BigDecimal("1500"),
                    PaymentMethod.CASH, PaymentStatus.PAID, salesClerk);

            assertEquals(List.of(NotificationType.SALE), typesFor(admin));
            assertEquals(List.of(NotificationType.SALE), typesFor(secondAdmin));
            assertTrue(inboxOf(salesClerk).isEmpty());

            Notification sale = inboxOf(admin).get(0);
            assertEquals("Sale of 2 Product NTF-1 for TZS 3,000", sale.getMessage());
            assertFalse(sale.isRead());
        }

        @Test
        @DisplayName("Inactive admins are skipped")
        void inactiveAdminSkipped() {
            Actor retired = registerUser("retired", Role.ADMIN);
            AppUserEntity entity = userRepository.findById(retired.getId()).orElseThrow();
            entity.deactivate();
            userRepository.saveAndFlush(entity);
            Product product = createProduct("NTF-2", 50, "10", "20");

            transactionRecorder.createSale(product.getId(), 1, new BigDecimal("20"),
                    PaymentMethod.CASH, PaymentStatus.PAID, salesClerk);

            assertTrue(inboxOf(retired).isEmpty());
            assertEquals(1, inboxOf(admin).size());
        }

        @Test
        @DisplayName("Falling into low stock raises an alert; selling out does not")
        void lowStockAlert() {
            Product product = createProduct("NTF-3", 7, "10", "20");

            transactionRecorder.createSale(product.getId(), 3, new BigDecimal("20"),
                    PaymentMethod.CASH, PaymentStatus.PAID, salesClerk);
            assertEquals(List.of(NotificationType.LOW_STOCK, NotificationType.SALE), typesFor(admin));

            transactionRecorder.createSale(product.getId(), 4, new BigDecimal("20"),
                    PaymentMethod.CASH, PaymentStatus.PAID, salesClerk);
            long lowStockAlerts = inboxOf(admin).stream()
                    .filter(n -> n.getType() == NotificationType.LOW_STOCK)
                    .count();
            assertEquals(1, lowStockAlerts);
        }

        @Test
        @DisplayName("Expense alert names the person who recorded it")
        void expenseNotification() {
            expenseService.create(ExpenseDraft.builder()
                    .category(ExpenseCategory.TRANSPORT)
                    .amount(new BigDecimal("12500"))
                    .description("Delivery to Mwenge")
                    .build(), salesClerk);

            Notification expense = inboxOf(admin).get(0);
            assertEquals(NotificationType.EXPENSE, expense.getType());
            assertEquals("Sales User added a transport expense of TZS 12,500", expense.getMessage());
        }

        @Test
        @DisplayName("A rejected sale produces no notification")
        void rollbackSendsNothing() {
            Product product = createProduct("NTF-4", 1, "10", "20");

            assertThrows(RuntimeException.class, () ->
                    transactionRecorder.createSale(product.getId(), 5, new BigDecimal("20"),
                            PaymentMethod.CASH, PaymentStatus.PAID, salesClerk));

            assertTrue(inboxOf(admin).isEmpty());
        }
    }

    @Nested
    @DisplayName("Inbox")
    class Inbox {

        @Test
        @DisplayName("Mark all read is idempotent")
        void markAllReadTwice() {
            notificationFanout.create(admin.getId(), NotificationType.SYSTEM, "One", "first", null, Map.of());
            notificationFanout.create(admin.getId(), NotificationType.SYSTEM, "Two", "second", null, Map.of());
            assertEquals(2, notificationFanout.unreadCount(admin));

            assertEquals(2, notificationFanout.markAllRead(admin));
            assertEquals(0, notificationFanout.unreadCount(admin));
            assertEquals(0, notificationFanout.markAllRead(admin));
            assertEquals(0, notificationFanout.unreadCount(admin));
        }

        @Test
        @DisplayName("Read filter and unread count come back together")
        void listWithReadFilter() {
            Notification first = notificationFanout.create(admin.getId(), NotificationType.SYSTEM, "One", "first",
                    null, Map.of());
            notificationFanout.create(admin.getId(), NotificationType.SYSTEM, "Two", "second", null, Map.of());
            notificationFanout.markRead(first.getId(), admin);

            NotificationInbox unread = notificationFanout.list(admin, false, 1, 20);

            assertEquals(1, unread.getUnreadCount());
            assertEquals(1, unread.getPage().getTotalItems());
            assertEquals("Two", unread.getPage().getItems().get(0).getTitle());
        }

        @Test
        @DisplayName("Another user's notification cannot be read or deleted")
        void recipientScoped() {
            Notification mine = notificationFanout.create(admin.getId(), NotificationType.SYSTEM, "Mine", "hello",
                    null, Map.of());
            UUID id = mine.getId();

            assertThrows(NotFoundException.class, () -> notificationFanout.markRead(id, salesClerk));
            assertThrows(NotFoundException.class, () -> notificationFanout.delete(id, salesClerk));

            notificationFanout.delete(id, admin);
            assertTrue(inboxOf(admin).isEmpty());
        }

        @Test
        @DisplayName("Broadcast reaches a role, and only admins may send it")
        void broadcast() {
            Actor anotherClerk = registerUser("clerk", Role.SALES);

            int sent = notificationFanout.broadcast("Stocktake", "Shop closes at 4pm", Role.SALES, admin);

            assertEquals(2, sent);
            assertEquals(List.of(NotificationType.SYSTEM), typesFor(anotherClerk));
            assertTrue(inboxOf(stockKeeper).isEmpty());
            assertThrows(ForbiddenOperationException.class, () ->
                    notificationFanout.broadcast("Hi", "there", null, salesClerk));
        }
    }
}
