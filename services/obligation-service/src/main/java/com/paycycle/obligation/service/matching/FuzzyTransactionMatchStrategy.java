package com.paycycle.obligation.service.matching;

import com.paycycle.obligation.domain.LedgerEvidence;
import com.paycycle.obligation.domain.MatchPath;
import com.paycycle.obligation.entity.LedgerTransaction;
import com.paycycle.obligation.entity.Obligation;
import com.paycycle.obligation.entity.ObligationType;
import com.paycycle.obligation.entity.PaymentSchedule;
import com.paycycle.obligation.entity.TimingBucket;
import com.paycycle.obligation.ledger.LedgerStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Fallback path for unlinked schedules. A ledger entry is a candidate only when all of these hold:
 * <ul>
 *   <li>its name contains the obligation name, ignoring case</li>
 *   <li>its amount equals the expected amount exactly</li>
 *   <li>it falls in the schedule's month, and for billers in the schedule's timing bucket</li>
 * </ul>
 * Entries already linked to some other schedule are never candidates.
 */
@Component
@Order(2)
@RequiredArgsConstructor
@Slf4j
public class FuzzyTransactionMatchStrategy implements LedgerMatchStrategy {

    private final LedgerStore ledgerStore;

    @Override
    public boolean appliesTo(PaymentSchedule schedule) {
        return !schedule.isLinked();
    }

    @Override
    public LedgerEvidence collect(PaymentSchedule schedule, Obligation obligation) {
        String needle = obligation.getName() == null ? "" : obligation.getName().toLowerCase(Locale.ROOT);

        List<LedgerTransaction> candidates = ledgerStore.getTransactionsForPeriod(schedule.getPeriod()).stream()
                .filter(tx -> !tx.isLinked() || schedule.getId().equals(tx.getLinkedScheduleId()))
                .filter(tx -> tx.getName() != null && tx.getName().toLowerCase(Locale.ROOT).contains(needle))
                .filter(tx -> tx.getAmount() != null && tx.getAmount().compareTo(schedule.getExpectedAmount()) == 0)
                .filter(tx -> inSameBucket(schedule, tx))
                .collect(Collectors.toList());

        log.debug("Fuzzy match for schedule {} ({} {}): {} candidate(s)",
                schedule.getId(), obligation.getName(), schedule.getPeriod(), candidates.size());
        return LedgerEvidence.of(MatchPath.FUZZY, candidates);
    }

    private boolean inSameBucket(PaymentSchedule schedule, LedgerTransaction transaction) {
        if (schedule.getObligationType() != ObligationType.BILLER) {
            return true;
        }
        TimingBucket bucket = TimingBucket.fromDayOfMonth(transaction.getOccurredOn().getDayOfMonth());
        return bucket == schedule.getTimingBucket();
    }
}
