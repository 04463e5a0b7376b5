package com.paycycle.obligation.service;

import com.paycycle.obligation.domain.BudgetPeriod;
import com.paycycle.obligation.domain.MonthlyAverage;
import com.paycycle.obligation.domain.PayoffPoint;
import com.paycycle.obligation.domain.PeriodProjection;
import com.paycycle.obligation.entity.BudgetSnapshot;
import com.paycycle.obligation.entity.Installment;
import com.paycycle.obligation.entity.ObligationType;
import com.paycycle.obligation.entity.PaymentSchedule;
import com.paycycle.obligation.exception.InvalidPeriodRangeException;
import com.paycycle.obligation.repository.PaymentScheduleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Read-side aggregation of budget snapshots into per-period and per-month figures.
 *
 * Obligated spend comes from snapshot line items only; schedules reach a projection by being
 * drafted into a snapshot first.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ProjectionEngine {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final BudgetSnapshotService budgetSnapshotService;
    private final ObligationService obligationService;
    private final PaymentScheduleRepository scheduleRepository;

    @Value("${obligation.projection.payoff-max-periods:24}")
    private int payoffMaxPeriods;

    /**
     * One projection per month half from {@code start} through {@code end}; empty when the range is reversed
     */
    public List<PeriodProjection> project(BudgetPeriod start, BudgetPeriod end) {
        List<BudgetPeriod> periods;
        try {
            periods = start.rangeTo(end);
        } catch (InvalidPeriodRangeException e) {
            log.debug("Reversed projection range {} .. {}; returning no periods", start, end);
            return Collections.emptyList();
        }
        return periods.stream().map(this::projectPeriod).collect(Collectors.toList());
    }

    public PeriodProjection projectPeriod(BudgetPeriod period) {
        Optional<BudgetSnapshot> snapshot = budgetSnapshotService.getSnapshot(period);
        BigDecimal income = snapshot.map(BudgetSnapshot::getEffectiveIncome).orElse(BigDecimal.ZERO);
        BigDecimal obligated = snapshot.map(BudgetSnapshot::sumIncludedItems).orElse(BigDecimal.ZERO);
        return PeriodProjection.builder()
                .period(period)
                .income(income)
                .totalObligated(obligated)
                .remaining(income.subtract(obligated))
                .build();
    }

    /**
     * Average remaining per calendar month, over the halves of that month present in the input
     */
    public List<MonthlyAverage> monthlyAverage(List<PeriodProjection> projections) {
        Map<YearMonth, List<PeriodProjection>> byMonth = projections.stream()
                .collect(Collectors.groupingBy(p -> p.getPeriod().getMonth(), TreeMap::new, Collectors.toList()));

        List<MonthlyAverage> averages = new ArrayList<>();
        byMonth.forEach((month, halves) -> {
            BigDecimal sum = halves.stream()
                    .map(PeriodProjection::getRemaining)
                    .reduce(BigDecimal.ZERO, BigDecimal::add);
            averages.add(MonthlyAverage.builder()
                    .month(month)
                    .periodCount(halves.size())
                    .averageRemaining(sum.divide(BigDecimal.valueOf(halves.size()), 2, RoundingMode.HALF_EVEN))
                    .build());
        });
        return averages;
    }

    /**
     * Month with the highest average remaining; the earliest wins a tie
     */
    public Optional<MonthlyAverage> bestMonth(List<MonthlyAverage> averages) {
        return pick(averages, Comparator.comparing(MonthlyAverage::getAverageRemaining));
    }

    /**
     * Month with the lowest average remaining; the earliest wins a tie
     */
    public Optional<MonthlyAverage> worstMonth(List<MonthlyAverage> averages) {
        return pick(averages, Comparator.comparing(MonthlyAverage::getAverageRemaining).reversed());
    }

    /**
     * Remaining payments of an installment from its next unpaid schedule on, capped at the
     * configured number of periods
     *
     * @param asOf first month used when no unpaid schedule exists
     */
    public List<PayoffPoint> projectPayoff(UUID installmentId, LocalDate asOf) {
        Installment installment = obligationService.getInstallment(installmentId);
        BigDecimal total = installment.getTotalAmount();
        BigDecimal remaining = installment.getRemainingBalance();
        BigDecimal payment = installment.getExpectedAmount();

        YearMonth month = scheduleRepository
                .findFirstByObligationTypeAndObligationIdAndPaidAmountIsNullAndLinkedTransactionIdIsNullOrderByPaymentNumberAsc(
                        ObligationType.INSTALLMENT, installmentId)
                .map(PaymentSchedule::getPeriod)
                .orElse(YearMonth.from(asOf));

        List<PayoffPoint> points = new ArrayList<>();
        while (remaining.signum() > 0 && points.size() < payoffMaxPeriods) {
            BigDecimal paid = payment.min(remaining);
            remaining = remaining.subtract(paid);
            points.add(PayoffPoint.builder()
                    .period(month)
                    .payment(paid)
                    .remainingBalance(remaining)
                    .percentComplete(total.subtract(remaining).multiply(HUNDRED)
                            .divide(total, 2, RoundingMode.HALF_EVEN))
                    .build());
            month = month.plusMonths(1);
        }

        log.debug("Payoff projection for installment {}: {} period(s), balance left {}",
                installmentId, points.size(), remaining);
        return points;
    }

    private static Optional<MonthlyAverage> pick(List<MonthlyAverage> averages, Comparator<MonthlyAverage> byValue) {
        MonthlyAverage chosen = null;
        for (MonthlyAverage candidate : sortedByMonth(averages)) {
            if (chosen == null || byValue.compare(candidate, chosen) > 0) {
                chosen = candidate;
            }
        }
        return Optional.ofNullable(chosen);
    }

    private static List<MonthlyAverage> sortedByMonth(List<MonthlyAverage> averages) {
        List<MonthlyAverage> sorted = new ArrayList<>(averages);
        sorted.sort(Comparator.comparing(MonthlyAverage::getMonth));
        return sorted;
    }
}
