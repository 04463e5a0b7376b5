package com.paycycle.obligation.service.matching;

import com.paycycle.obligation.domain.LedgerEvidence;
import com.paycycle.obligation.domain.MatchPath;
import com.paycycle.obligation.entity.Obligation;
import com.paycycle.obligation.entity.PaymentSchedule;
import com.paycycle.obligation.ledger.LedgerStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;

/**
 * Exact path: a linked schedule is backed by its linked ledger entry and nothing else.
 */
@Component
@Order(1)
@RequiredArgsConstructor
@Slf4j
public class LinkedTransactionMatchStrategy implements LedgerMatchStrategy {

    private final LedgerStore ledgerStore;

    @Override
    public boolean appliesTo(PaymentSchedule schedule) {
        return schedule.isLinked();
    }

    @Override
    public LedgerEvidence collect(PaymentSchedule schedule, Obligation obligation) {
        return ledgerStore.findTransaction(schedule.getLinkedTransactionId())
                .map(transaction -> LedgerEvidence.of(MatchPath.LINKED, List.of(transaction)))
                .orElseGet(() -> {
                    log.warn("Schedule {} links to ledger transaction {} which no longer exists",
                            schedule.getId(), schedule.getLinkedTransactionId());
                    return LedgerEvidence.of(MatchPath.LINK_BROKEN, Collections.emptyList());
                });
    }
}
