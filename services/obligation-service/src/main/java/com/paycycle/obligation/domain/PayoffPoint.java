package com.paycycle.obligation.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.YearMonth;

/**
 * One future period of an installment payoff projection
 */
@Value
@Builder
public class PayoffPoint {

    YearMonth period;
    BigDecimal payment;
    BigDecimal remainingBalance;
    BigDecimal percentComplete;
}
