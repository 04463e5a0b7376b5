package com.paycycle.obligation.exception;

import java.util.UUID;

/**
 * Exception thrown when an obligation has neither a due day nor an activation/start date
 * Results in HTTP 422 Unprocessable Entity
 */
public class MissingCadenceAnchorException extends ObligationException {

    public MissingCadenceAnchorException(UUID obligationId, String name) {
        super("MISSING_CADENCE_ANCHOR",
              String.format("Obligation '%s' (%s) has no due day or activation date to schedule from", name, obligationId),
              obligationId, name);
    }
}
