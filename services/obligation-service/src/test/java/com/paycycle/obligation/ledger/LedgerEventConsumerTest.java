package com.paycycle.obligation.ledger;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.paycycle.obligation.service.PaymentApplier;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
@DisplayName("LedgerEventConsumer Unit Tests")
class LedgerEventConsumerTest {

    private static final UUID TX_ID = UUID.fromString("44444444-4444-4444-4444-444444444444");
    private static final UUID SCHEDULE_ID = UUID.fromString("55555555-5555-5555-5555-555555555555");

    @Mock
    private PaymentApplier paymentApplier;

    private SimpleMeterRegistry meterRegistry;
    private LedgerEventConsumer consumer;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        consumer = new LedgerEventConsumer(paymentApplier, new ObjectMapper(), meterRegistry);
    }

    @Test
    @DisplayName("Deletion from the ledger topic reverts the linked schedule")
    void shouldRevertOnDeletionEvent() {
        String payload = "{\"event_id\":\"e-1\",\"event_type\":\"TRANSACTION_DELETED\","
                + "\"transaction_id\":\"" + TX_ID + "\",\"linked_schedule_id\":\"" + SCHEDULE_ID + "\","
                + "\"amount\":1500,\"source\":\"ledger\"}";

        consumer.handleLedgerEvent(payload, 0, 42L);

        verify(paymentApplier).revertForDeletedTransaction(TX_ID, SCHEDULE_ID);
        assertThat(meterRegistry.get("obligation.ledger.events.processed").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Other ledger events are ignored")
    void shouldIgnoreNonDeletionEvents() {
        String payload = "{\"event_type\":\"TRANSACTION_CREATED\",\"transaction_id\":\"" + TX_ID + "\"}";

        consumer.handleLedgerEvent(payload, 0, 43L);

        verifyNoInteractions(paymentApplier);
    }

    @Test
    @DisplayName("Unreadable payloads are rejected and counted")
    void shouldRejectUnreadablePayload() {
        assertThatThrownBy(() -> consumer.handleLedgerEvent("not-json", 1, 7L))
                .isInstanceOf(IllegalArgumentException.class);

        assertThat(meterRegistry.get("obligation.ledger.events.rejected").counter().count()).isEqualTo(1.0);
        verifyNoInteractions(paymentApplier);
    }

    @Test
    @DisplayName("In-process deletion reverts the linked schedule")
    void shouldRevertOnApplicationEvent() {
        consumer.onTransactionDeleted(new LedgerTransactionDeletedEvent(TX_ID, SCHEDULE_ID, new BigDecimal("1500")));

        verify(paymentApplier).revertForDeletedTransaction(TX_ID, SCHEDULE_ID);
    }
}
