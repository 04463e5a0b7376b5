package com.paycycle.obligation.entity;

/**
 * Half-month classification of a due date.
 * Days 1-21 fall in the first half, days 22-31 in the second half.
 */
public enum TimingBucket {

    FIRST_HALF("1/2"),
    SECOND_HALF("2/2");

    public static final int FIRST_HALF_LAST_DAY = 21;

    private final String label;

    TimingBucket(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static TimingBucket fromDayOfMonth(int dayOfMonth) {
        if (dayOfMonth < 1 || dayOfMonth > 31) {
            throw new IllegalArgumentException("Day of month out of range: " + dayOfMonth);
        }
        return dayOfMonth <= FIRST_HALF_LAST_DAY ? FIRST_HALF : SECOND_HALF;
    }
}
