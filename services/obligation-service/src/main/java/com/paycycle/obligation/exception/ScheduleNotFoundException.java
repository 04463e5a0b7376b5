package com.paycycle.obligation.exception;

import java.time.YearMonth;
import java.util.UUID;

/**
 * Exception thrown when a payment schedule is not found
 * Results in HTTP 404 Not Found
 */
public class ScheduleNotFoundException extends ObligationException {

    public ScheduleNotFoundException(UUID scheduleId) {
        super("SCHEDULE_NOT_FOUND", "Payment schedule not found with ID: " + scheduleId, scheduleId);
    }

    public ScheduleNotFoundException(UUID obligationId, YearMonth period) {
        super("SCHEDULE_NOT_FOUND",
              String.format("No payment schedule for obligation %s in %s", obligationId, period),
              obligationId, period);
    }
}
