package com.paycycle.obligation.service;

import com.paycycle.obligation.domain.BillingCycle;
import com.paycycle.obligation.entity.Biller;
import com.paycycle.obligation.entity.LedgerTransaction;
import com.paycycle.obligation.entity.PaymentSchedule;
import com.paycycle.obligation.exception.InvalidObligationException;
import com.paycycle.obligation.ledger.LedgerStore;
import com.paycycle.obligation.repository.InstallmentRepository;
import com.paycycle.obligation.repository.PaymentScheduleRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Sets the expected amount of a credit-card biller's schedules from the purchases recorded on
 * its linked account.
 *
 * A schedule due in month M takes the total of the statement cycle closing in M-1. Entries
 * already linked to a schedule and entries named after an installment charged to the same
 * account are not purchases and are left out.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class LinkedAccountSyncService {

    private final ObligationService obligationService;
    private final PaymentScheduleRepository scheduleRepository;
    private final InstallmentRepository installmentRepository;
    private final LedgerStore ledgerStore;
    private final MeterRegistry meterRegistry;

    private Counter schedulesSyncedCounter;

    @jakarta.annotation.PostConstruct
    public void initMetrics() {
        schedulesSyncedCounter = Counter.builder("obligation.schedules.synced")
                .description("Number of schedule amounts taken from linked account cycle totals")
                .register(meterRegistry);
    }

    /**
     * Update unpaid schedules whose statement cycle has started by {@code asOf}. Cycles without
     * purchases leave the schedule's amount unchanged.
     *
     * @return the schedules whose expected amount changed
     */
    @Transactional
    public List<PaymentSchedule> syncFromLinkedAccount(UUID billerId, LocalDate asOf) {
        Biller biller = obligationService.getBiller(billerId);
        String accountId = biller.getLinkedAccountId();
        Integer billingDay = biller.getBillingDay();
        if (accountId == null || billingDay == null) {
            throw new InvalidObligationException(billerId, "no linked credit account with a billing day");
        }

        Set<String> installmentNames = installmentRepository.findByAccountId(accountId).stream()
                .map(installment -> installment.getName().toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());

        List<PaymentSchedule> synced = new ArrayList<>();
        for (PaymentSchedule schedule : obligationService.findSchedules(billerId)) {
            if (schedule.getPaidAmount() != null || schedule.isLinked()) {
                continue;
            }
            BillingCycle cycle = BillingCycle.settledIn(schedule.getPeriod(), billingDay);
            if (cycle.getStart().isAfter(asOf)) {
                continue;
            }
            BigDecimal total = cycleTotal(accountId, cycle, installmentNames);
            if (total.signum() <= 0 || total.compareTo(schedule.getExpectedAmount()) == 0) {
                continue;
            }
            if (scheduleRepository.updateExpectedAmountIfUnpaid(schedule.getId(), total, LocalDateTime.now()) == 1) {
                log.debug("Schedule {} ({}) expected amount {} -> {}", schedule.getId(), schedule.getPeriod(),
                        schedule.getExpectedAmount(), total);
                schedule.setExpectedAmount(total);
                synced.add(schedule);
            }
        }

        schedulesSyncedCounter.increment(synced.size());
        log.info("Synced {} schedule(s) of biller {} from account {}", synced.size(), billerId, accountId);
        return synced;
    }

    private BigDecimal cycleTotal(String accountId, BillingCycle cycle, Set<String> installmentNames) {
        BigDecimal total = BigDecimal.ZERO;
        YearMonth last = YearMonth.from(cycle.getEnd());
        for (YearMonth month = YearMonth.from(cycle.getStart()); !month.isAfter(last); month = month.plusMonths(1)) {
            for (LedgerTransaction transaction : ledgerStore.getTransactionsForPeriodAndAccount(month, accountId)) {
                if (cycle.contains(transaction.getOccurredOn())
                        && !transaction.isLinked()
                        && !installmentNames.contains(transaction.getName().toLowerCase(Locale.ROOT))) {
                    total = total.add(transaction.getAmount());
                }
            }
        }
        return total;
    }
}
