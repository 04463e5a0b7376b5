package com.paycycle.obligation.exception;

import java.util.UUID;

/**
 * Exception thrown when an installment payment targets a schedule past the next payable one
 * Results in HTTP 409 Conflict
 */
public class OutOfOrderPaymentException extends ObligationException {

    public OutOfOrderPaymentException(UUID installmentId, int requestedNumber, int nextPayableNumber) {
        super("OUT_OF_ORDER_PAYMENT",
              String.format("Installment %s: payment %d requested but payment %d is still unpaid",
                          installmentId, requestedNumber, nextPayableNumber),
              installmentId, requestedNumber, nextPayableNumber);
    }
}
