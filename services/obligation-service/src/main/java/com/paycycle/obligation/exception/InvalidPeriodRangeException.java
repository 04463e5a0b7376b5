package com.paycycle.obligation.exception;

import com.paycycle.obligation.domain.BudgetPeriod;

/**
 * Exception thrown when a period range ends before it starts.
 * Projection callers treat it as an empty result rather than a failure.
 */
public class InvalidPeriodRangeException extends ObligationException {

    public InvalidPeriodRangeException(BudgetPeriod start, BudgetPeriod end) {
        super("INVALID_PERIOD_RANGE",
              String.format("Period range start %s is after end %s", start, end),
              start, end);
    }
}
