package com.paycycle.obligation.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class PeriodProjection {

    BudgetPeriod period;
    BigDecimal income;
    BigDecimal totalObligated;
    BigDecimal remaining;
}
