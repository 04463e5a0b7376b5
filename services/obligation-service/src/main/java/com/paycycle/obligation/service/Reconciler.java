package com.paycycle.obligation.service;

import com.paycycle.obligation.domain.LedgerEvidence;
import com.paycycle.obligation.domain.OrphanReport;
import com.paycycle.obligation.domain.SyncRecommendation;
import com.paycycle.obligation.domain.SyncReport;
import com.paycycle.obligation.entity.LedgerTransaction;
import com.paycycle.obligation.entity.Obligation;
import com.paycycle.obligation.entity.PaymentSchedule;
import com.paycycle.obligation.ledger.LedgerStore;
import com.paycycle.obligation.repository.PaymentScheduleRepository;
import com.paycycle.obligation.service.matching.LedgerMatchStrategy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Compares stored schedule payments against the ledger.
 *
 * Read-only: discrepancies are reported as {@link SyncReport}s and healed only through
 * {@link PaymentApplier#applyCorrection}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class Reconciler {

    private final ObligationService obligationService;
    private final PaymentScheduleRepository scheduleRepository;
    private final LedgerStore ledgerStore;
    private final List<LedgerMatchStrategy> matchStrategies;

    @Value("${obligation.reconciliation.sweep-enabled:true}")
    private boolean sweepEnabled;

    /**
     * Reconcile the schedule an obligation has for the given month
     */
    public SyncReport reconcile(UUID obligationId, YearMonth period) {
        log.debug("Reconciling obligation {} for {}", obligationId, period);
        return reconcileSchedule(obligationService.getSchedule(obligationId, period));
    }

    public SyncReport reconcileSchedule(UUID scheduleId) {
        return reconcileSchedule(obligationService.getSchedule(scheduleId));
    }

    /**
     * Reconcile every schedule of an obligation, in period order
     */
    public List<SyncReport> reconcileObligation(UUID obligationId) {
        return obligationService.findSchedules(obligationId).stream()
                .map(this::reconcileSchedule)
                .collect(Collectors.toList());
    }

    public SyncReport reconcileSchedule(PaymentSchedule schedule) {
        LedgerEvidence evidence = evidenceFor(schedule);

        BigDecimal stored = schedule.getPaidAmount() != null ? schedule.getPaidAmount() : BigDecimal.ZERO;
        BigDecimal ledgerDerived = evidence.getTotal();
        BigDecimal difference = stored.subtract(ledgerDerived);
        boolean inSync = difference.signum() == 0;

        SyncReport report = SyncReport.builder()
                .scheduleId(schedule.getId())
                .obligationId(schedule.getObligationId())
                .period(schedule.getPeriod())
                .storedPaidAmount(schedule.getPaidAmount())
                .ledgerDerivedPaidAmount(ledgerDerived)
                .difference(difference)
                .inSync(inSync)
                .recommendation(recommend(difference))
                .matchPath(evidence.getPath())
                .matchedTransactionIds(evidence.getTransactions().stream()
                        .map(LedgerTransaction::getId)
                        .collect(Collectors.toList()))
                .build();

        if (!inSync) {
            log.info("Schedule {} out of sync: stored={}, ledger={}, path={}, recommendation={}",
                    schedule.getId(), stored, ledgerDerived, evidence.getPath(), report.getRecommendation());
        }
        return report;
    }

    /**
     * Ledger entries backing a schedule, taken from the first matching strategy that applies
     */
    public LedgerEvidence evidenceFor(PaymentSchedule schedule) {
        Obligation obligation = obligationService.getObligation(schedule.getObligationType(), schedule.getObligationId());
        LedgerMatchStrategy strategy = matchStrategies.stream()
                .filter(candidate -> candidate.appliesTo(schedule))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No ledger match strategy for schedule " + schedule.getId()));
        return strategy.collect(schedule, obligation);
    }

    /**
     * Report ledger entries left orphaned by failed payment applications
     */
    public List<OrphanReport> sweepOrphans() {
        if (!sweepEnabled) {
            log.info("Orphan sweep disabled by configuration");
            return Collections.emptyList();
        }

        List<OrphanReport> reports = ledgerStore.findOrphaned().stream()
                .map(this::toOrphanReport)
                .collect(Collectors.toList());
        if (!reports.isEmpty()) {
            log.warn("Orphan sweep found {} ledger transaction(s) needing attention", reports.size());
        }
        return reports;
    }

    private OrphanReport toOrphanReport(LedgerTransaction transaction) {
        Optional<PaymentSchedule> schedule = transaction.getLinkedScheduleId() == null
                ? Optional.empty()
                : scheduleRepository.findById(transaction.getLinkedScheduleId());
        return OrphanReport.builder()
                .transactionId(transaction.getId())
                .intendedScheduleId(transaction.getLinkedScheduleId())
                .amount(transaction.getAmount())
                .reason(transaction.getOrphanReason())
                .scheduleExists(schedule.isPresent())
                .scheduleLinkedTransactionId(schedule.map(PaymentSchedule::getLinkedTransactionId).orElse(null))
                .build();
    }

    /**
     * @param difference stored minus ledger-derived
     */
    static SyncRecommendation recommend(BigDecimal difference) {
        int sign = difference.signum();
        if (sign == 0) {
            return SyncRecommendation.NO_ACTION;
        }
        return sign < 0 ? SyncRecommendation.ACCEPT_LEDGER_VALUE : SyncRecommendation.INVESTIGATE_MANUALLY;
    }
}
