package com.paycycle.obligation.domain;

import lombok.Value;

import java.time.LocalDate;
import java.time.YearMonth;

/**
 * Statement cycle of a credit account: from one billing day up to the day before the next.
 * Billing days past the end of a short month fall on its last day.
 */
@Value
public class BillingCycle {

    LocalDate start;
    LocalDate end;

    /**
     * The cycle whose statement closes in {@code month}
     */
    public static BillingCycle closingIn(YearMonth month, int billingDay) {
        if (billingDay < 1 || billingDay > 31) {
            throw new IllegalArgumentException("Billing day out of range: " + billingDay);
        }
        LocalDate nextStart = billingDay == 1
                ? month.plusMonths(1).atDay(1)
                : clamped(month, billingDay);
        LocalDate start = clamped(YearMonth.from(nextStart).minusMonths(1), billingDay);
        return new BillingCycle(start, nextStart.minusDays(1));
    }

    /**
     * The cycle a bill due in {@code dueMonth} settles: the one closing the month before
     */
    public static BillingCycle settledIn(YearMonth dueMonth, int billingDay) {
        return closingIn(dueMonth.minusMonths(1), billingDay);
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(start) && !date.isAfter(end);
    }

    private static LocalDate clamped(YearMonth month, int day) {
        return month.atDay(Math.min(day, month.lengthOfMonth()));
    }
}
