package com.paycycle.obligation.service;

import com.paycycle.obligation.entity.Biller;
import com.paycycle.obligation.entity.Installment;
import com.paycycle.obligation.entity.Obligation;
import com.paycycle.obligation.entity.ObligationType;
import com.paycycle.obligation.entity.PaymentSchedule;
import com.paycycle.obligation.entity.TimingBucket;
import com.paycycle.obligation.exception.InvalidObligationException;
import com.paycycle.obligation.exception.MissingCadenceAnchorException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Expands an obligation into its dated payment schedules.
 *
 * Output is unsaved and depends only on the obligation and the horizon, so generating
 * twice yields equal sequences.
 */
@Component
@Slf4j
public class ScheduleGenerator {

    /**
     * @param horizonPeriods number of monthly periods to emit for billers; installments always
     *                       emit their full term and ignore it
     */
    public List<PaymentSchedule> generate(Obligation obligation, int horizonPeriods) {
        if (obligation.getObligationType() == ObligationType.BILLER) {
            return generateForBiller((Biller) obligation, horizonPeriods);
        }
        return generateForInstallment((Installment) obligation);
    }

    /**
     * One schedule per calendar month, starting at the later of the creation month and the
     * activation window, stopping before the deactivation window.
     */
    public List<PaymentSchedule> generateForBiller(Biller biller, int horizonPeriods) {
        BigDecimal expectedAmount = biller.getExpectedAmount();
        if (expectedAmount == null || expectedAmount.signum() < 0) {
            throw new InvalidObligationException(biller.getId(), "expected amount must be zero or more");
        }
        int bucketingDay = biller.getBucketingDay()
                .orElseThrow(() -> new MissingCadenceAnchorException(biller.getId(), biller.getName()));
        if (bucketingDay < 1 || bucketingDay > 31) {
            throw new InvalidObligationException(biller.getId(), "due day " + bucketingDay + " is not a day of month");
        }
        if (!biller.isActive()) {
            log.debug("Biller {} is inactive; no schedules generated", biller.getId());
            return Collections.emptyList();
        }
        if (horizonPeriods <= 0) {
            log.warn("Non-positive horizon {} for biller {}; no schedules generated", horizonPeriods, biller.getId());
            return Collections.emptyList();
        }

        YearMonth start = firstScheduledMonth(biller);
        YearMonth deactivation = biller.getDeactivationWindow();
        TimingBucket bucket = TimingBucket.fromDayOfMonth(bucketingDay);

        List<PaymentSchedule> schedules = new ArrayList<>();
        for (int i = 0; i < horizonPeriods; i++) {
            YearMonth month = start.plusMonths(i);
            if (deactivation != null && !month.isBefore(deactivation)) {
                break;
            }
            schedules.add(PaymentSchedule.builder()
                    .obligationType(ObligationType.BILLER)
                    .obligationId(biller.getId())
                    .scheduleYear(month.getYear())
                    .scheduleMonth(month.getMonthValue())
                    .timingBucket(bucket)
                    .dueDate(clampedDay(month, bucketingDay))
                    .expectedAmount(expectedAmount)
                    .build());
        }
        return schedules;
    }

    /**
     * Exactly {@code termPeriods} schedules numbered 1..N, one per month from the start date.
     */
    public List<PaymentSchedule> generateForInstallment(Installment installment) {
        BigDecimal periodAmount = installment.getExpectedAmount();
        if (periodAmount == null || periodAmount.signum() <= 0) {
            throw new InvalidObligationException(installment.getId(), "period amount must be greater than zero");
        }

        int term = installment.getTermPeriods() == null ? 0 : installment.getTermPeriods();
        if (term <= 0) {
            log.warn("Installment {} has term {}; scheduling a single period", installment.getId(), term);
            term = 1;
        }

        LocalDate start = installmentStart(installment);
        int dueDay = start.getDayOfMonth();
        TimingBucket bucket = installment.getTiming() != null
                ? installment.getTiming()
                : TimingBucket.fromDayOfMonth(dueDay);
        YearMonth first = YearMonth.from(start);

        List<PaymentSchedule> schedules = new ArrayList<>(term);
        for (int i = 0; i < term; i++) {
            YearMonth month = first.plusMonths(i);
            schedules.add(PaymentSchedule.builder()
                    .obligationType(ObligationType.INSTALLMENT)
                    .obligationId(installment.getId())
                    .scheduleYear(month.getYear())
                    .scheduleMonth(month.getMonthValue())
                    .timingBucket(bucket)
                    .dueDate(clampedDay(month, dueDay))
                    .paymentNumber(i + 1)
                    .expectedAmount(periodAmount)
                    .build());
        }
        return schedules;
    }

    /**
     * Schedules for the payment numbers missing from {@code keptNumbers}, one per month from the
     * start date. None lands before {@code notBefore}, on an {@code occupied} month, or ahead of a
     * lower number placed here; such schedules move to the next free month.
     */
    public List<PaymentSchedule> generateInstallmentRemainder(Installment installment, Set<Integer> keptNumbers,
                                                              Set<YearMonth> occupied, YearMonth notBefore) {
        int dueDay = installmentStart(installment).getDayOfMonth();
        Set<YearMonth> taken = new HashSet<>(occupied);
        YearMonth floor = notBefore;

        List<PaymentSchedule> remainder = new ArrayList<>();
        for (PaymentSchedule schedule : generateForInstallment(installment)) {
            if (keptNumbers.contains(schedule.getPaymentNumber())) {
                continue;
            }
            YearMonth month = schedule.getPeriod();
            if (floor != null && month.isBefore(floor)) {
                month = floor;
            }
            while (taken.contains(month)) {
                month = month.plusMonths(1);
            }
            taken.add(month);
            floor = month.plusMonths(1);

            remainder.add(month.equals(schedule.getPeriod()) ? schedule : schedule.toBuilder()
                    .scheduleYear(month.getYear())
                    .scheduleMonth(month.getMonthValue())
                    .dueDate(clampedDay(month, dueDay))
                    .build());
        }
        return remainder;
    }

    /**
     * Later of the creation month and the activation window
     */
    public YearMonth firstScheduledMonth(Biller biller) {
        YearMonth activation = biller.getActivationWindow();
        YearMonth created = biller.getCreatedAt() != null ? YearMonth.from(biller.getCreatedAt()) : null;
        if (activation == null && created == null) {
            throw new MissingCadenceAnchorException(biller.getId(), biller.getName());
        }
        if (activation == null) {
            return created;
        }
        if (created == null) {
            return activation;
        }
        return activation.isAfter(created) ? activation : created;
    }

    private static LocalDate installmentStart(Installment installment) {
        LocalDate start = installment.getStartDate();
        if (start == null && installment.getCreatedAt() != null) {
            start = installment.getCreatedAt().toLocalDate();
        }
        if (start == null) {
            throw new MissingCadenceAnchorException(installment.getId(), installment.getName());
        }
        return start;
    }

    private static LocalDate clampedDay(YearMonth month, int day) {
        return month.atDay(Math.min(day, month.lengthOfMonth()));
    }
}
