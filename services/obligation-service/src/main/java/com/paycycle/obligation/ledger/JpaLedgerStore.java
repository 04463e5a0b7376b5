package com.paycycle.obligation.ledger;

import com.paycycle.obligation.entity.LedgerTransaction;
import com.paycycle.obligation.exception.DuplicatePaymentException;
import com.paycycle.obligation.repository.LedgerTransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.YearMonth;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Ledger store backed by the local ledger_transactions table.
 * Every write runs in its own transaction, as an external ledger would.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaLedgerStore implements LedgerStore {

    private final LedgerTransactionRepository transactionRepository;
    private final ApplicationEventPublisher applicationEventPublisher;

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public LedgerTransaction createTransaction(LedgerTransaction transaction) {
        try {
            LedgerTransaction saved = transactionRepository.saveAndFlush(transaction);
            log.info("Ledger transaction recorded: id={}, name={}, amount={}, schedule={}",
                    saved.getId(), saved.getName(), saved.getAmount(), saved.getLinkedScheduleId());
            return saved;
        } catch (DataIntegrityViolationException e) {
            if (transaction.getLinkedScheduleId() != null) {
                throw new DuplicatePaymentException(String.format(
                        "A ledger transaction is already linked to payment schedule %s",
                        transaction.getLinkedScheduleId()));
            }
            throw e;
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<LedgerTransaction> findTransaction(UUID transactionId) {
        return transactionRepository.findById(transactionId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<LedgerTransaction> getTransactionsForPeriod(YearMonth period) {
        return transactionRepository.findByOccurredOnBetweenOrderByOccurredOnAsc(
                period.atDay(1), period.atEndOfMonth());
    }

    @Override
    @Transactional(readOnly = true)
    public List<LedgerTransaction> getTransactionsForPeriodAndAccount(YearMonth period, String accountId) {
        return transactionRepository.findByAccountIdAndOccurredOnBetweenOrderByOccurredOnAsc(
                accountId, period.atDay(1), period.atEndOfMonth());
    }

    @Override
    @Transactional(readOnly = true)
    public List<LedgerTransaction> findByLinkedSchedule(UUID scheduleId) {
        return transactionRepository.findByLinkedScheduleId(scheduleId);
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean linkToSchedule(UUID transactionId, UUID scheduleId) {
        try {
            return transactionRepository.linkIfUnlinked(transactionId, scheduleId) == 1;
        } catch (DataIntegrityViolationException e) {
            log.warn("Schedule {} already referenced by another ledger transaction", scheduleId);
            return false;
        }
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void unlinkFromSchedule(UUID transactionId, UUID scheduleId) {
        int updated = transactionRepository.unlinkIfLinkedTo(transactionId, scheduleId);
        log.info("Ledger transaction {} unlinked from schedule {}: {}", transactionId, scheduleId, updated == 1);
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void deleteTransaction(UUID transactionId) {
        Optional<LedgerTransaction> existing = transactionRepository.findById(transactionId);
        if (existing.isEmpty()) {
            log.debug("Ledger transaction {} already deleted", transactionId);
            return;
        }
        LedgerTransaction transaction = existing.get();
        transactionRepository.delete(transaction);
        transactionRepository.flush();
        log.info("Ledger transaction deleted: id={}, schedule={}", transactionId, transaction.getLinkedScheduleId());

        applicationEventPublisher.publishEvent(new LedgerTransactionDeletedEvent(
                transactionId, transaction.getLinkedScheduleId(), transaction.getAmount()));
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markOrphaned(UUID transactionId, String reason) {
        int updated = transactionRepository.markOrphaned(transactionId, reason);
        if (updated == 0) {
            log.warn("Could not flag ledger transaction {} as orphaned: not found", transactionId);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<LedgerTransaction> findOrphaned() {
        return transactionRepository.findByOrphanedTrueOrderByCreatedAtAsc();
    }
}
