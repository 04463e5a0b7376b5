package com.paycycle.obligation.service;

import com.paycycle.obligation.domain.LedgerEvidence;
import com.paycycle.obligation.domain.MatchPath;
import com.paycycle.obligation.entity.Installment;
import com.paycycle.obligation.entity.LedgerTransaction;
import com.paycycle.obligation.entity.Obligation;
import com.paycycle.obligation.entity.ObligationType;
import com.paycycle.obligation.entity.PaymentSchedule;
import com.paycycle.obligation.events.ObligationEventPublisher;
import com.paycycle.obligation.exception.DuplicatePaymentException;
import com.paycycle.obligation.exception.InvalidPaymentException;
import com.paycycle.obligation.exception.OutOfOrderPaymentException;
import com.paycycle.obligation.exception.PartialApplyFailureException;
import com.paycycle.obligation.exception.ScheduleNotFoundException;
import com.paycycle.obligation.ledger.LedgerStore;
import com.paycycle.obligation.repository.InstallmentRepository;
import com.paycycle.obligation.repository.PaymentScheduleRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Records payments against schedules together with their ledger entries.
 *
 * Applying a payment is a two-step saga: the ledger entry is written first (it commits on its
 * own), then the schedule is claimed with a conditional update in a transaction of its own. If
 * that transaction fails at any point up to its commit the ledger entry is deleted again; if that
 * also fails the entry is flagged orphaned and the caller gets a {@link PartialApplyFailureException}.
 * Callers must not hold an open transaction.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PaymentApplier {

    private final PaymentScheduleRepository scheduleRepository;
    private final InstallmentRepository installmentRepository;
    private final ObligationService obligationService;
    private final Reconciler reconciler;
    private final LedgerStore ledgerStore;
    private final ObligationEventPublisher eventPublisher;
    private final TransactionTemplate transactionTemplate;
    private final MeterRegistry meterRegistry;

    // Metrics
    private Counter paymentAppliedCounter;
    private Counter paymentRevertedCounter;
    private Counter duplicatePaymentCounter;
    private Counter partialApplyFailureCounter;

    /**
     * Initialize metrics
     */
    @jakarta.annotation.PostConstruct
    public void initMetrics() {
        paymentAppliedCounter = Counter.builder("obligation.payment.applied")
                .description("Number of payments applied to schedules")
                .register(meterRegistry);

        paymentRevertedCounter = Counter.builder("obligation.payment.reverted")
                .description("Number of schedule payments reverted after ledger deletion")
                .register(meterRegistry);

        duplicatePaymentCounter = Counter.builder("obligation.payment.duplicate")
                .description("Number of payment attempts rejected as duplicates")
                .register(meterRegistry);

        partialApplyFailureCounter = Counter.builder("obligation.payment.partial_failure")
                .description("Number of payments left with an orphaned ledger entry")
                .register(meterRegistry);
    }

    /**
     * Apply a first payment to a schedule and record the matching ledger entry.
     * Without an account the obligation's default payment account is used.
     *
     * @throws DuplicatePaymentException    when the schedule already carries a payment or link
     * @throws OutOfOrderPaymentException   when an earlier installment schedule is still unpaid
     * @throws PartialApplyFailureException when the ledger entry could neither be matched nor removed
     */
    public PaymentSchedule applyPayment(UUID scheduleId, BigDecimal amount, LocalDate date,
                                        String accountId, String note) {
        log.info("Applying payment: schedule={}, amount={}, date={}, account={}", scheduleId, amount, date, accountId);

        if (amount == null || amount.signum() <= 0) {
            throw new InvalidPaymentException("Payment amount must be greater than zero");
        }
        if (date == null) {
            throw new InvalidPaymentException("Payment date is required");
        }

        PaymentSchedule schedule = scheduleRepository.findById(scheduleId)
                .orElseThrow(() -> new ScheduleNotFoundException(scheduleId));

        if (schedule.isLinked()) {
            duplicatePaymentCounter.increment();
            log.warn("Duplicate payment attempt on schedule {} (linked to {})", scheduleId, schedule.getLinkedTransactionId());
            throw new DuplicatePaymentException(scheduleId, schedule.getLinkedTransactionId());
        }
        if (schedule.getPaidAmount() != null) {
            duplicatePaymentCounter.increment();
            log.warn("Payment attempt on schedule {} which already records {}", scheduleId, schedule.getPaidAmount());
            throw new DuplicatePaymentException(String.format(
                    "Payment schedule %s already records a paid amount; use a correction instead", scheduleId));
        }
        if (schedule.getObligationType() == ObligationType.INSTALLMENT) {
            enforceInstallmentOrder(schedule);
        }

        Obligation obligation = obligationService.getObligation(schedule.getObligationType(), schedule.getObligationId());
        String account = accountId != null ? accountId : obligation.getDefaultAccountId();

        // Step 1: ledger entry, committed independently
        LedgerTransaction transaction = ledgerStore.createTransaction(LedgerTransaction.builder()
                .name(obligation.getName())
                .occurredOn(date)
                .amount(amount)
                .accountId(account)
                .linkedScheduleId(scheduleId)
                .note(note)
                .build());

        // Step 2: claim the schedule, compensating step 1 on any failure up to the commit
        PaymentSchedule updated;
        try {
            updated = transactionTemplate.execute(status -> claim(scheduleId, amount, date, account, transaction.getId()));
        } catch (DuplicatePaymentException e) {
            duplicatePaymentCounter.increment();
            log.warn("Schedule {} was paid concurrently; removing ledger transaction {}", scheduleId, transaction.getId());
            compensate(schedule, transaction, e);
            throw e;
        } catch (RuntimeException e) {
            log.error("Schedule update failed after ledger write: schedule={}, transaction={}",
                    scheduleId, transaction.getId(), e);
            compensate(schedule, transaction, e);
            throw e;
        }

        paymentAppliedCounter.increment();
        eventPublisher.publishPaymentApplied(updated, transaction.getId(), amount);
        log.info("Payment applied: schedule={}, transaction={}, amount={}", scheduleId, transaction.getId(), amount);
        return updated;
    }

    private PaymentSchedule claim(UUID scheduleId, BigDecimal amount, LocalDate date, String accountId,
                                  UUID transactionId) {
        int claimed = scheduleRepository.markPaidIfUnlinked(
                scheduleId, amount, date, accountId, transactionId, LocalDateTime.now());
        if (claimed == 0) {
            throw new DuplicatePaymentException(String.format(
                    "Payment schedule %s was paid by a concurrent request", scheduleId));
        }
        PaymentSchedule updated = scheduleRepository.findById(scheduleId)
                .orElseThrow(() -> new ScheduleNotFoundException(scheduleId));
        recomputeCumulativePaid(updated);
        return updated;
    }

    /**
     * Apply a payment to the lowest-numbered unpaid schedule of an installment.
     * Falls back to the installment's own account when none is given.
     */
    public PaymentSchedule applyInstallmentPayment(UUID installmentId, BigDecimal amount, LocalDate date,
                                                   String accountId, String note) {
        Installment installment = obligationService.getInstallment(installmentId);
        PaymentSchedule next = nextPayable(installment.getId())
                .orElseThrow(() -> new InvalidPaymentException(
                        String.format("Installment %s has no unpaid schedule left", installmentId)));
        return applyPayment(next.getId(), amount, date, accountId, note);
    }

    /**
     * Lowest-numbered schedule of an installment with no payment recorded
     */
    @Transactional(readOnly = true)
    public Optional<PaymentSchedule> nextPayable(UUID installmentId) {
        return scheduleRepository
                .findFirstByObligationTypeAndObligationIdAndPaidAmountIsNullAndLinkedTransactionIdIsNullOrderByPaymentNumberAsc(
                        ObligationType.INSTALLMENT, installmentId);
    }

    /**
     * Delete a ledger entry. The linked schedule is reverted through the ledger deletion event.
     */
    public void deleteTransaction(UUID transactionId) {
        log.info("Deleting ledger transaction {}", transactionId);
        ledgerStore.deleteTransaction(transactionId);
    }

    /**
     * Return the schedule linked to a deleted ledger entry to unpaid. Running it again, or for
     * an entry that no schedule points to, does nothing.
     *
     * @param scheduleId schedule the entry claimed to be linked to; looked up by transaction when null
     */
    @Transactional
    public void revertForDeletedTransaction(UUID transactionId, UUID scheduleId) {
        Optional<PaymentSchedule> linked = scheduleId != null
                ? scheduleRepository.findById(scheduleId)
                : scheduleRepository.findByLinkedTransactionId(transactionId);
        if (linked.isEmpty()) {
            log.debug("No schedule to revert for deleted ledger transaction {}", transactionId);
            return;
        }

        PaymentSchedule schedule = linked.get();
        int reverted = scheduleRepository.revertPayment(schedule.getId(), transactionId, LocalDateTime.now());
        if (reverted == 0) {
            log.debug("Schedule {} not linked to ledger transaction {}; nothing to revert", schedule.getId(), transactionId);
            return;
        }

        PaymentSchedule updated = scheduleRepository.findById(schedule.getId())
                .orElseThrow(() -> new ScheduleNotFoundException(schedule.getId()));
        recomputeCumulativePaid(updated);

        paymentRevertedCounter.increment();
        eventPublisher.publishPaymentReverted(updated, transactionId);
        log.info("Payment reverted: schedule={}, deletedTransaction={}", schedule.getId(), transactionId);
    }

    /**
     * Overwrite a schedule's paid amount.
     *
     * A null amount takes the ledger-derived value. An unlinked schedule with exactly one fuzzy
     * candidate gets that entry linked on both sides. Zeroing a schedule clears its payment and
     * is refused while its linked ledger entry still exists. A ledger link made here is undone
     * when the schedule cannot be saved.
     */
    public PaymentSchedule applyCorrection(UUID scheduleId, BigDecimal newPaidAmount) {
        PaymentSchedule schedule = scheduleRepository.findById(scheduleId)
                .orElseThrow(() -> new ScheduleNotFoundException(scheduleId));

        List<LedgerTransaction> references = ledgerStore.findByLinkedSchedule(scheduleId);
        if (references.size() > 1) {
            duplicatePaymentCounter.increment();
            throw new DuplicatePaymentException(String.format(
                    "Payment schedule %s is referenced by %d ledger transactions", scheduleId, references.size()));
        }

        LedgerEvidence evidence = reconciler.evidenceFor(schedule);
        BigDecimal target = newPaidAmount != null ? newPaidAmount : evidence.getTotal();
        if (target.signum() < 0) {
            throw new InvalidPaymentException("Corrected amount cannot be negative");
        }

        BigDecimal previous = schedule.getPaidAmount();
        log.info("Correcting schedule {}: {} -> {} (path={})", scheduleId, previous, target, evidence.getPath());

        if (evidence.getPath() == MatchPath.LINK_BROKEN) {
            log.warn("Clearing broken ledger link {} on schedule {}", schedule.getLinkedTransactionId(), scheduleId);
            schedule.setLinkedTransactionId(null);
        }

        Optional<LedgerTransaction> candidate = Optional.empty();
        if (target.signum() == 0) {
            if (evidence.getPath() == MatchPath.LINKED) {
                throw new InvalidPaymentException(String.format(
                        "Schedule %s is linked to ledger transaction %s; delete the transaction instead of zeroing",
                        scheduleId, schedule.getLinkedTransactionId()));
            }
            schedule.clearPayment();
        } else {
            schedule.setPaidAmount(target);
            if (!schedule.isLinked()) {
                candidate = evidence.getSoleFuzzyCandidate();
            }
        }
        boolean linkedHere = candidate.isPresent() && link(schedule, candidate.get());

        PaymentSchedule saved;
        try {
            saved = transactionTemplate.execute(status -> {
                PaymentSchedule written = scheduleRepository.saveAndFlush(schedule);
                recomputeCumulativePaid(written);
                return written;
            });
        } catch (RuntimeException e) {
            if (linkedHere) {
                releaseLink(candidate.get().getId(), scheduleId, e);
            }
            if (e instanceof DataIntegrityViolationException) {
                duplicatePaymentCounter.increment();
                throw new DuplicatePaymentException(String.format(
                        "Ledger transaction %s is already linked to another schedule", schedule.getLinkedTransactionId()));
            }
            throw e;
        }

        eventPublisher.publishPaymentCorrected(saved, previous);
        log.info("Schedule corrected: id={}, paidAmount={}, linkedTransaction={}",
                scheduleId, saved.getPaidAmount(), saved.getLinkedTransactionId());
        return saved;
    }

    /**
     * @return true when the ledger side was linked by this call
     */
    private boolean link(PaymentSchedule schedule, LedgerTransaction candidate) {
        boolean ledgerLinked = false;
        if (!candidate.isLinked()) {
            if (!ledgerStore.linkToSchedule(candidate.getId(), schedule.getId())) {
                duplicatePaymentCounter.increment();
                throw new DuplicatePaymentException(schedule.getId(), candidate.getId());
            }
            ledgerLinked = true;
        }
        schedule.setLinkedTransactionId(candidate.getId());
        schedule.setLinkedAccountId(candidate.getAccountId());
        if (schedule.getDatePaid() == null) {
            schedule.setDatePaid(candidate.getOccurredOn());
        }
        log.info("Linked ledger transaction {} to schedule {}", candidate.getId(), schedule.getId());
        return ledgerLinked;
    }

    private void releaseLink(UUID transactionId, UUID scheduleId, RuntimeException cause) {
        try {
            ledgerStore.unlinkFromSchedule(transactionId, scheduleId);
            log.info("Released ledger link {} -> schedule {} after failed correction", transactionId, scheduleId);
        } catch (RuntimeException e) {
            log.error("CRITICAL: Could not release ledger link {} -> schedule {}", transactionId, scheduleId, e);
            cause.addSuppressed(e);
        }
    }

    private void enforceInstallmentOrder(PaymentSchedule schedule) {
        Optional<PaymentSchedule> next = nextPayable(schedule.getObligationId());
        if (next.isPresent() && next.get().getPaymentNumber() < schedule.getPaymentNumber()) {
            throw new OutOfOrderPaymentException(schedule.getObligationId(),
                    schedule.getPaymentNumber(), next.get().getPaymentNumber());
        }
    }

    /**
     * Undo the ledger write of a failed payment, or flag it orphaned when that fails too
     */
    private void compensate(PaymentSchedule schedule, LedgerTransaction transaction, Exception cause) {
        try {
            ledgerStore.deleteTransaction(transaction.getId());
            log.info("Compensated ledger transaction {} for schedule {}", transaction.getId(), schedule.getId());
        } catch (RuntimeException e) {
            partialApplyFailureCounter.increment();
            log.error("CRITICAL: Could not remove ledger transaction {} for schedule {}; flagging as orphaned",
                    transaction.getId(), schedule.getId(), e);
            try {
                ledgerStore.markOrphaned(transaction.getId(), cause.getMessage());
            } catch (RuntimeException markFailure) {
                log.error("CRITICAL: Could not flag ledger transaction {} as orphaned", transaction.getId(), markFailure);
                e.addSuppressed(markFailure);
            }
            eventPublisher.publishPartialApplyFailure(schedule, transaction.getId(), cause.getMessage());
            throw new PartialApplyFailureException(schedule.getId(), transaction.getId(), e);
        }
    }

    /**
     * Recompute an installment's cached total from its schedules
     */
    private void recomputeCumulativePaid(PaymentSchedule schedule) {
        if (schedule.getObligationType() != ObligationType.INSTALLMENT) {
            return;
        }
        BigDecimal total = scheduleRepository.sumPaidAmount(ObligationType.INSTALLMENT, schedule.getObligationId());
        installmentRepository.findById(schedule.getObligationId()).ifPresent(installment -> {
            installment.setCumulativePaid(total);
            installmentRepository.save(installment);
            log.debug("Installment {} cumulative paid recomputed: {}", installment.getId(), total);
        });
    }
}
