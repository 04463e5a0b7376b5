package com.paycycle.obligation.exception;

import java.util.UUID;

/**
 * Exception thrown when a ledger entry was written but the schedule update failed
 * and the entry could not be removed again. The entry is flagged as orphaned.
 * Results in HTTP 500 Internal Server Error
 */
public class PartialApplyFailureException extends ObligationException {

    private final UUID scheduleId;
    private final UUID transactionId;

    public PartialApplyFailureException(UUID scheduleId, UUID transactionId, Throwable cause) {
        super("PARTIAL_APPLY_FAILURE",
              String.format("Ledger transaction %s was recorded but schedule %s was not updated; " +
                          "transaction flagged for reconciliation", transactionId, scheduleId),
              cause);
        this.scheduleId = scheduleId;
        this.transactionId = transactionId;
    }

    public UUID getScheduleId() {
        return scheduleId;
    }

    public UUID getTransactionId() {
        return transactionId;
    }
}
