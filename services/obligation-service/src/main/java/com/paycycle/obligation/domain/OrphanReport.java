package com.paycycle.obligation.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A ledger entry left behind by a failed payment application
 */
@Value
@Builder
public class OrphanReport {

    UUID transactionId;
    UUID intendedScheduleId;
    BigDecimal amount;
    String reason;
    boolean scheduleExists;
    UUID scheduleLinkedTransactionId;

    public boolean isScheduleLinkedElsewhere() {
        return scheduleLinkedTransactionId != null && !scheduleLinkedTransactionId.equals(transactionId);
    }
}
