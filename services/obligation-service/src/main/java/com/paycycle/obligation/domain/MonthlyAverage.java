package com.paycycle.obligation.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.YearMonth;

/**
 * Average remaining amount over the month halves of one calendar month
 */
@Value
@Builder
public class MonthlyAverage {

    YearMonth month;
    int periodCount;
    BigDecimal averageRemaining;
}
