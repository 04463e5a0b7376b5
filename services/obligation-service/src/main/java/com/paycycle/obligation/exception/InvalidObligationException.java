package com.paycycle.obligation.exception;

import java.util.UUID;

/**
 * Exception thrown when an obligation's cadence or amount cannot be scheduled
 * Results in HTTP 422 Unprocessable Entity
 */
public class InvalidObligationException extends ObligationException {

    public InvalidObligationException(String message) {
        super("INVALID_OBLIGATION", message);
    }

    public InvalidObligationException(UUID obligationId, String reason) {
        super("INVALID_OBLIGATION",
              String.format("Obligation %s cannot be scheduled: %s", obligationId, reason),
              obligationId, reason);
    }
}
