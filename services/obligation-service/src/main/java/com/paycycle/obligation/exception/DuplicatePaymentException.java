package com.paycycle.obligation.exception;

import java.util.UUID;

/**
 * Exception thrown when a schedule already has a ledger entry linked to it
 * Results in HTTP 409 Conflict
 */
public class DuplicatePaymentException extends ObligationException {

    public DuplicatePaymentException(UUID scheduleId, UUID existingTransactionId) {
        super("DUPLICATE_PAYMENT",
              String.format("Payment schedule %s is already linked to ledger transaction %s",
                          scheduleId, existingTransactionId),
              scheduleId, existingTransactionId);
    }

    public DuplicatePaymentException(String message) {
        super("DUPLICATE_PAYMENT", message);
    }
}
