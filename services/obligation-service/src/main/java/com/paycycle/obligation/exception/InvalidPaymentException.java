package com.paycycle.obligation.exception;

/**
 * Exception thrown for payment or correction requests with unusable amounts or state
 * Results in HTTP 400 Bad Request
 */
public class InvalidPaymentException extends ObligationException {

    public InvalidPaymentException(String message) {
        super("INVALID_PAYMENT", message);
    }
}
