package com.paycycle.obligation.domain;

import com.paycycle.obligation.entity.TimingBucket;
import com.paycycle.obligation.exception.InvalidPeriodRangeException;
import lombok.Value;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;

/**
 * A month half: the unit budgets and projections are computed over.
 * Ordered chronologically, first half before second half.
 */
@Value
public class BudgetPeriod implements Comparable<BudgetPeriod> {

    YearMonth month;
    TimingBucket timing;

    public static BudgetPeriod of(YearMonth month, TimingBucket timing) {
        return new BudgetPeriod(month, timing);
    }

    public static BudgetPeriod of(int year, int month, TimingBucket timing) {
        return new BudgetPeriod(YearMonth.of(year, month), timing);
    }

    public BudgetPeriod next() {
        if (timing == TimingBucket.FIRST_HALF) {
            return new BudgetPeriod(month, TimingBucket.SECOND_HALF);
        }
        return new BudgetPeriod(month.plusMonths(1), TimingBucket.FIRST_HALF);
    }

    public boolean isAfter(BudgetPeriod other) {
        return compareTo(other) > 0;
    }

    /**
     * Every period from this one through {@code end}, inclusive.
     *
     * @throws InvalidPeriodRangeException when {@code end} precedes this period
     */
    public List<BudgetPeriod> rangeTo(BudgetPeriod end) {
        if (isAfter(end)) {
            throw new InvalidPeriodRangeException(this, end);
        }
        List<BudgetPeriod> periods = new ArrayList<>();
        BudgetPeriod cursor = this;
        while (!cursor.isAfter(end)) {
            periods.add(cursor);
            cursor = cursor.next();
        }
        return periods;
    }

    @Override
    public int compareTo(BudgetPeriod other) {
        int byMonth = month.compareTo(other.month);
        return byMonth != 0 ? byMonth : timing.compareTo(other.timing);
    }

    @Override
    public String toString() {
        return month + " " + timing.getLabel();
    }
}
