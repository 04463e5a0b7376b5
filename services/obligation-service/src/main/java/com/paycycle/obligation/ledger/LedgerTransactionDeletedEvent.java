package com.paycycle.obligation.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Raised after a ledger entry has been removed
 */
@Value
public class LedgerTransactionDeletedEvent {

    UUID transactionId;
    UUID linkedScheduleId;
    BigDecimal amount;
}
