package com.paycycle.obligation.ledger;

import com.paycycle.obligation.entity.LedgerTransaction;

import java.time.YearMonth;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Boundary to the ledger of money-movement records.
 *
 * Writes commit independently of the caller's transaction: a payment that fails after
 * {@link #createTransaction} must undo the entry with {@link #deleteTransaction} or flag it with
 * {@link #markOrphaned}. Deleting an entry raises a {@link LedgerTransactionDeletedEvent}.
 */
public interface LedgerStore {

    /**
     * @throws com.paycycle.obligation.exception.DuplicatePaymentException when another entry
     *         already references the same schedule
     */
    LedgerTransaction createTransaction(LedgerTransaction transaction);

    Optional<LedgerTransaction> findTransaction(UUID transactionId);

    List<LedgerTransaction> getTransactionsForPeriod(YearMonth period);

    List<LedgerTransaction> getTransactionsForPeriodAndAccount(YearMonth period, String accountId);

    List<LedgerTransaction> findByLinkedSchedule(UUID scheduleId);

    /**
     * Links an existing unlinked entry to a schedule.
     *
     * @return false when the entry is already linked
     */
    boolean linkToSchedule(UUID transactionId, UUID scheduleId);

    /**
     * Undoes {@link #linkToSchedule}; does nothing unless the entry is still linked to that schedule.
     */
    void unlinkFromSchedule(UUID transactionId, UUID scheduleId);

    void deleteTransaction(UUID transactionId);

    void markOrphaned(UUID transactionId, String reason);

    List<LedgerTransaction> findOrphaned();
}
