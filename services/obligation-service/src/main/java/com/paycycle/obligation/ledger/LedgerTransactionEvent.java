package com.paycycle.obligation.ledger;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Ledger change notification received from the ledger topic
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class LedgerTransactionEvent {

    public static final String TRANSACTION_DELETED = "TRANSACTION_DELETED";

    @JsonProperty("event_id")
    private String eventId;

    @JsonProperty("event_type")
    private String eventType;

    @JsonProperty("transaction_id")
    private UUID transactionId;

    @JsonProperty("linked_schedule_id")
    private UUID linkedScheduleId;

    @JsonProperty("amount")
    private BigDecimal amount;

    public boolean isDeletion() {
        return TRANSACTION_DELETED.equals(eventType);
    }
}
