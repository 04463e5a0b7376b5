package com.paycycle.obligation.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.paycycle.obligation.service.PaymentApplier;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Component;

/**
 * Routes ledger deletions to the schedule revert path.
 *
 * Deletions made through {@link LedgerStore} arrive as in-process events; deletions made
 * directly against the ledger arrive on the ledger topic.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class LedgerEventConsumer {

    private final PaymentApplier paymentApplier;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    @EventListener
    public void onTransactionDeleted(LedgerTransactionDeletedEvent event) {
        log.debug("Ledger deletion received in-process: transaction={}", event.getTransactionId());
        paymentApplier.revertForDeletedTransaction(event.getTransactionId(), event.getLinkedScheduleId());
    }

    @KafkaListener(
        topics = "${obligation.ledger.topic:ledger-transaction-events}",
        groupId = "${obligation.ledger.consumer-group:obligation-ledger-sync}"
    )
    public void handleLedgerEvent(
            @Payload String payload,
            @Header(KafkaHeaders.RECEIVED_PARTITION) int partition,
            @Header(KafkaHeaders.OFFSET) long offset) {

        LedgerTransactionEvent event;
        try {
            event = objectMapper.readValue(payload, LedgerTransactionEvent.class);
        } catch (JsonProcessingException e) {
            log.error("Unreadable ledger event at partition={}, offset={}: {}", partition, offset, e.getMessage());
            meterRegistry.counter("obligation.ledger.events.rejected").increment();
            throw new IllegalArgumentException("Unreadable ledger event", e);
        }

        if (!event.isDeletion()) {
            log.debug("Ignoring ledger event type {} for transaction {}", event.getEventType(), event.getTransactionId());
            return;
        }

        log.info("Ledger deletion received: transaction={}, schedule={}, partition={}, offset={}",
                event.getTransactionId(), event.getLinkedScheduleId(), partition, offset);
        paymentApplier.revertForDeletedTransaction(event.getTransactionId(), event.getLinkedScheduleId());
        meterRegistry.counter("obligation.ledger.events.processed", "type", event.getEventType()).increment();
    }
}
