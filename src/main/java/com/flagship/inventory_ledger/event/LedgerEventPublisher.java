package com.flagship.inventory_ledger.event;

import com.flagship.inventory_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Emits an inventory event from inside an atomic scope: one outbox row for
 * Kafka, one in-process application event for the post-commit listeners.
 * Both vanish if the scope rolls back.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LedgerEventPublisher {

    private final OutboxService outboxService;
    private final ApplicationEventPublisher applicationEventPublisher;

    @Transactional(propagation = Propagation.MANDATORY)
    public void publish(InventoryEvent event) {
        outboxService.saveEvent(event.getAggregateType(), event.getAggregateId(),
                event.getEventType(), event);
        applicationEventPublisher.publishEvent(event);
        log.debug("Published {} for {} {}", event.getEventType(), event.getAggregateType(), event.getAggregateId());
    }
}
