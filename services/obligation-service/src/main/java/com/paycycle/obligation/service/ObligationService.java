package com.paycycle.obligation.service;

import com.paycycle.obligation.dto.UpdateBillerRequest;
import com.paycycle.obligation.dto.UpdateInstallmentRequest;
import com.paycycle.obligation.entity.*;
import com.paycycle.obligation.events.ObligationEventPublisher;
import com.paycycle.obligation.exception.ObligationNotFoundException;
import com.paycycle.obligation.exception.ScheduleNotFoundException;
import com.paycycle.obligation.repository.BillerRepository;
import com.paycycle.obligation.repository.InstallmentRepository;
import com.paycycle.obligation.repository.PaymentScheduleRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Service for managing obligations and their generated schedules.
 * Handles creation, edits with future-schedule regeneration, soft deactivation and schedule queries.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ObligationService {

    private final BillerRepository billerRepository;
    private final InstallmentRepository installmentRepository;
    private final PaymentScheduleRepository scheduleRepository;
    private final ScheduleGenerator scheduleGenerator;
    private final ObligationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;

    @Value("${obligation.schedule.horizon-months:12}")
    private int defaultHorizonMonths;

    // Metrics
    private Counter obligationCreatedCounter;
    private Counter schedulesRegeneratedCounter;

    /**
     * Initialize metrics
     */
    @jakarta.annotation.PostConstruct
    public void initMetrics() {
        obligationCreatedCounter = Counter.builder("obligation.created")
                .description("Number of obligations created")
                .register(meterRegistry);

        schedulesRegeneratedCounter = Counter.builder("obligation.schedules.regenerated")
                .description("Number of future-schedule regenerations")
                .register(meterRegistry);
    }

    /**
     * Create a biller and persist its schedules for the given horizon
     *
     * @param horizonMonths months to schedule, or null for the configured default
     */
    @Transactional
    public Biller createBiller(Biller biller, Integer horizonMonths) {
        log.info("Creating biller: name={}, amount={}, dueDay={}, activation={}",
                biller.getName(), biller.getExpectedAmount(), biller.getDueDay(), biller.getActivationWindow());

        Biller saved = billerRepository.saveAndFlush(biller);
        int horizon = horizonMonths != null ? horizonMonths : defaultHorizonMonths;
        List<PaymentSchedule> schedules = scheduleRepository.saveAll(scheduleGenerator.generate(saved, horizon));

        obligationCreatedCounter.increment();
        log.info("Biller created: id={}, schedules={}", saved.getId(), schedules.size());
        return saved;
    }

    /**
     * Create an installment and persist its full term of schedules
     */
    @Transactional
    public Installment createInstallment(Installment installment) {
        log.info("Creating installment: name={}, total={}, term={}",
                installment.getName(), installment.getTotalAmount(), installment.getTermPeriods());

        Installment saved = installmentRepository.saveAndFlush(installment);
        List<PaymentSchedule> schedules = scheduleRepository.saveAll(scheduleGenerator.generate(saved, 0));

        obligationCreatedCounter.increment();
        log.info("Installment created: id={}, schedules={}", saved.getId(), schedules.size());
        return saved;
    }

    /**
     * Get a biller or installment by ID
     */
    @Transactional(readOnly = true)
    public Obligation getObligation(UUID obligationId) {
        return billerRepository.findById(obligationId)
                .<Obligation>map(biller -> biller)
                .or(() -> installmentRepository.findById(obligationId))
                .orElseThrow(() -> new ObligationNotFoundException(obligationId));
    }

    @Transactional(readOnly = true)
    public Obligation getObligation(ObligationType type, UUID obligationId) {
        if (type == ObligationType.BILLER) {
            return getBiller(obligationId);
        }
        return getInstallment(obligationId);
    }

    @Transactional(readOnly = true)
    public Biller getBiller(UUID billerId) {
        return billerRepository.findById(billerId)
                .orElseThrow(() -> new ObligationNotFoundException(billerId));
    }

    @Transactional(readOnly = true)
    public Installment getInstallment(UUID installmentId) {
        return installmentRepository.findById(installmentId)
                .orElseThrow(() -> new ObligationNotFoundException(installmentId));
    }

    /**
     * List obligations, optionally restricted to one type and/or one category
     */
    @Transactional(readOnly = true)
    public List<Obligation> listObligations(ObligationType type, String category) {
        List<Obligation> result = new ArrayList<>();
        if (type == null || type == ObligationType.BILLER) {
            result.addAll(category == null
                    ? billerRepository.findAllByOrderByNameAsc()
                    : billerRepository.findByCategoryIgnoreCase(category));
        }
        if (type == null || type == ObligationType.INSTALLMENT) {
            result.addAll(category == null
                    ? installmentRepository.findAllByOrderByNameAsc()
                    : installmentRepository.findByCategoryIgnoreCase(category));
        }
        return result;
    }

    /**
     * Edit a biller. A change to amount or cadence regenerates unpaid schedules from {@code asOf}'s month on.
     */
    @Transactional
    public Biller updateBiller(UUID billerId, UpdateBillerRequest request, LocalDate asOf) {
        Biller biller = getBiller(billerId);

        boolean cadenceChanged = changes(request.getExpectedAmount(), biller.getExpectedAmount())
                || changes(request.getDueDay(), biller.getDueDay())
                || changes(request.getActivationYear(), biller.getActivationYear())
                || changes(request.getActivationMonth(), biller.getActivationMonth());

        if (request.getName() != null) {
            biller.setName(request.getName());
        }
        if (request.getCategory() != null) {
            biller.setCategory(request.getCategory());
        }
        if (request.getExpectedAmount() != null) {
            biller.setExpectedAmount(request.getExpectedAmount());
        }
        if (request.getDueDay() != null) {
            biller.setDueDay(request.getDueDay());
        }
        if (request.getActivationYear() != null) {
            biller.setActivationYear(request.getActivationYear());
        }
        if (request.getActivationMonth() != null) {
            biller.setActivationMonth(request.getActivationMonth());
        }
        if (request.getLinkedAccountId() != null) {
            biller.setLinkedAccountId(request.getLinkedAccountId());
        }
        if (request.getBillingDay() != null) {
            biller.setBillingDay(request.getBillingDay());
        }

        Biller saved = billerRepository.saveAndFlush(biller);
        log.info("Biller updated: id={}, cadenceChanged={}", billerId, cadenceChanged);

        if (cadenceChanged) {
            regenerate(saved, asOf);
        }
        return saved;
    }

    /**
     * Edit an installment. A change to amounts, term or start regenerates unpaid schedules from
     * {@code asOf}'s month on.
     */
    @Transactional
    public Installment updateInstallment(UUID installmentId, UpdateInstallmentRequest request, LocalDate asOf) {
        Installment installment = getInstallment(installmentId);

        boolean cadenceChanged = changes(request.getTotalAmount(), installment.getTotalAmount())
                || changes(request.getPeriodAmount(), installment.getPeriodAmount())
                || changes(request.getTermPeriods(), installment.getTermPeriods())
                || changes(request.getStartDate(), installment.getStartDate())
                || changes(request.getTiming(), installment.getTiming());

        if (request.getName() != null) {
            installment.setName(request.getName());
        }
        if (request.getCategory() != null) {
            installment.setCategory(request.getCategory());
        }
        if (request.getTotalAmount() != null) {
            installment.setTotalAmount(request.getTotalAmount());
        }
        if (request.getPeriodAmount() != null) {
            installment.setPeriodAmount(request.getPeriodAmount());
        }
        if (request.getTermPeriods() != null) {
            installment.setTermPeriods(request.getTermPeriods());
        }
        if (request.getAccountId() != null) {
            installment.setAccountId(request.getAccountId());
        }
        if (request.getStartDate() != null) {
            installment.setStartDate(request.getStartDate());
        }
        if (request.getTiming() != null) {
            installment.setTiming(request.getTiming());
        }

        Installment saved = installmentRepository.saveAndFlush(installment);
        log.info("Installment updated: id={}, cadenceChanged={}", installmentId, cadenceChanged);

        if (cadenceChanged) {
            regenerate(saved, asOf);
        }
        return saved;
    }

    /**
     * Soft-deactivate a biller: no schedule is generated for {@code window} or later.
     * Existing schedules are kept.
     */
    @Transactional
    public Biller deactivateBiller(UUID billerId, YearMonth window) {
        Biller biller = getBiller(billerId);
        biller.setDeactivationWindow(window);
        Biller saved = billerRepository.save(biller);
        log.info("Biller deactivated: id={}, from={}", billerId, window);
        return saved;
    }

    /**
     * Delete an obligation together with all of its schedules
     */
    @Transactional
    public void deleteObligation(UUID obligationId) {
        Obligation obligation = getObligation(obligationId);
        long removed = scheduleRepository.deleteByObligationTypeAndObligationId(
                obligation.getObligationType(), obligationId);
        if (obligation instanceof Biller) {
            billerRepository.delete((Biller) obligation);
        } else {
            installmentRepository.delete((Installment) obligation);
        }
        log.info("Obligation deleted: id={}, type={}, schedulesRemoved={}",
                obligationId, obligation.getObligationType(), removed);
    }

    /**
     * Persist any generated schedules that do not exist yet. Existing schedules are left untouched.
     */
    @Transactional
    public List<PaymentSchedule> generateSchedules(UUID obligationId, Integer horizonMonths) {
        Obligation obligation = getObligation(obligationId);
        int horizon = horizonMonths != null ? horizonMonths : defaultHorizonMonths;

        List<PaymentSchedule> missing;
        if (obligation.getObligationType() == ObligationType.INSTALLMENT) {
            missing = missingInstallmentSchedules((Installment) obligation, null);
        } else {
            Set<YearMonth> existing = existingPeriods(obligation);
            missing = scheduleGenerator.generate(obligation, horizon).stream()
                    .filter(schedule -> !existing.contains(schedule.getPeriod()))
                    .collect(Collectors.toList());
        }

        List<PaymentSchedule> saved = scheduleRepository.saveAll(missing);
        log.info("Generated {} new schedule(s) for obligation {}", saved.size(), obligationId);
        return findSchedules(obligationId);
    }

    /**
     * Delete schedules from {@code asOf}'s month onward that carry no payment, then recreate them
     * from the obligation's current definition.
     */
    @Transactional
    public List<PaymentSchedule> regenerateFutureSchedules(UUID obligationId, LocalDate asOf) {
        regenerate(getObligation(obligationId), asOf);
        return findSchedules(obligationId);
    }

    @Transactional(readOnly = true)
    public PaymentSchedule getSchedule(UUID scheduleId) {
        return scheduleRepository.findById(scheduleId)
                .orElseThrow(() -> new ScheduleNotFoundException(scheduleId));
    }

    @Transactional(readOnly = true)
    public PaymentSchedule getSchedule(UUID obligationId, YearMonth period) {
        return scheduleRepository.findByObligationIdAndScheduleYearAndScheduleMonth(
                        obligationId, period.getYear(), period.getMonthValue())
                .orElseThrow(() -> new ScheduleNotFoundException(obligationId, period));
    }

    @Transactional(readOnly = true)
    public List<PaymentSchedule> findSchedules(UUID obligationId) {
        Obligation obligation = getObligation(obligationId);
        return scheduleRepository.findByObligationTypeAndObligationIdOrderByScheduleYearAscScheduleMonthAsc(
                obligation.getObligationType(), obligationId);
    }

    @Transactional(readOnly = true)
    public List<PaymentSchedule> findSchedulesForPeriod(YearMonth period, TimingBucket timing) {
        if (timing == null) {
            return scheduleRepository.findByScheduleYearAndScheduleMonth(period.getYear(), period.getMonthValue());
        }
        return scheduleRepository.findByScheduleYearAndScheduleMonthAndTimingBucket(
                period.getYear(), period.getMonthValue(), timing);
    }

    /**
     * Schedules with no payment whose due date lies before {@code asOf}
     */
    @Transactional(readOnly = true)
    public List<PaymentSchedule> findOverdue(LocalDate asOf) {
        return scheduleRepository.findUnpaidDueBefore(asOf);
    }

    private void regenerate(Obligation obligation, LocalDate asOf) {
        YearMonth fromMonth = YearMonth.from(asOf);
        ObligationType type = obligation.getObligationType();

        int removed = scheduleRepository.deleteUnpaidFrom(type, obligation.getId(),
                PaymentScheduleRepository.periodKey(fromMonth.getYear(), fromMonth.getMonthValue()));

        List<PaymentSchedule> fresh;
        if (type == ObligationType.INSTALLMENT) {
            fresh = missingInstallmentSchedules((Installment) obligation, fromMonth);
        } else {
            Set<YearMonth> kept = existingPeriods(obligation);
            fresh = scheduleGenerator.generate(obligation, horizonCovering(obligation, fromMonth)).stream()
                    .filter(schedule -> !schedule.getPeriod().isBefore(fromMonth))
                    .filter(schedule -> !kept.contains(schedule.getPeriod()))
                    .collect(Collectors.toList());
        }
        scheduleRepository.saveAll(fresh);

        schedulesRegeneratedCounter.increment();
        log.info("Regenerated future schedules for {} {}: removed={}, created={}, from={}",
                type, obligation.getId(), removed, fresh.size(), fromMonth);
        eventPublisher.publishSchedulesRegenerated(type.name(), obligation.getId(), removed, fresh.size());
    }

    /**
     * Installment schedules for the payment numbers with no stored schedule, keeping the term at
     * exactly {@code termPeriods} numbers
     */
    private List<PaymentSchedule> missingInstallmentSchedules(Installment installment, YearMonth notBefore) {
        List<PaymentSchedule> existing = scheduleRepository
                .findByObligationTypeAndObligationIdOrderByScheduleYearAscScheduleMonthAsc(
                        ObligationType.INSTALLMENT, installment.getId());
        Set<Integer> keptNumbers = existing.stream()
                .map(PaymentSchedule::getPaymentNumber)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
        Set<YearMonth> occupied = existing.stream()
                .map(PaymentSchedule::getPeriod)
                .collect(Collectors.toSet());
        return scheduleGenerator.generateInstallmentRemainder(installment, keptNumbers, occupied, notBefore);
    }

    /**
     * Biller horizon long enough to reach the configured number of months past {@code fromMonth}
     */
    private int horizonCovering(Obligation obligation, YearMonth fromMonth) {
        if (obligation.getObligationType() != ObligationType.BILLER) {
            return defaultHorizonMonths;
        }
        YearMonth start = scheduleGenerator.firstScheduledMonth((Biller) obligation);
        long elapsed = start == null ? 0 : Math.max(0, ChronoUnit.MONTHS.between(start, fromMonth));
        return (int) elapsed + defaultHorizonMonths;
    }

    private Set<YearMonth> existingPeriods(Obligation obligation) {
        return scheduleRepository.findByObligationTypeAndObligationIdOrderByScheduleYearAscScheduleMonthAsc(
                        obligation.getObligationType(), obligation.getId()).stream()
                .map(PaymentSchedule::getPeriod)
                .collect(Collectors.toSet());
    }

    private static boolean changes(Object requested, Object current) {
        if (requested == null) {
            return false;
        }
        if (requested instanceof BigDecimal && current instanceof BigDecimal) {
            return ((BigDecimal) requested).compareTo((BigDecimal) current) != 0;
        }
        return !Objects.equals(requested, current);
    }
}
