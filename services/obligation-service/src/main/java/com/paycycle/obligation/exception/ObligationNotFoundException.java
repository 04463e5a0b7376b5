package com.paycycle.obligation.exception;

import java.util.UUID;

/**
 * Exception thrown when a biller or installment is not found
 * Results in HTTP 404 Not Found
 */
public class ObligationNotFoundException extends ObligationException {

    public ObligationNotFoundException(UUID obligationId) {
        super("OBLIGATION_NOT_FOUND", "Obligation not found with ID: " + obligationId, obligationId);
    }
}
