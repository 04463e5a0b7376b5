package com.paycycle.obligation.service.matching;

import com.paycycle.obligation.domain.LedgerEvidence;
import com.paycycle.obligation.entity.Obligation;
import com.paycycle.obligation.entity.PaymentSchedule;

/**
 * One way of attributing ledger entries to a payment schedule.
 * Strategies are consulted in {@link org.springframework.core.annotation.Order} order and the
 * first one that applies supplies the evidence.
 */
public interface LedgerMatchStrategy {

    boolean appliesTo(PaymentSchedule schedule);

    LedgerEvidence collect(PaymentSchedule schedule, Obligation obligation);
}
