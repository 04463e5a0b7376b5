package com.paycycle.obligation.domain;

import com.paycycle.obligation.entity.LedgerTransaction;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Ledger entries attributed to one schedule, and how they were found
 */
@Value
public class LedgerEvidence {

    MatchPath path;
    List<LedgerTransaction> transactions;

    public static LedgerEvidence of(MatchPath path, List<LedgerTransaction> transactions) {
        return new LedgerEvidence(path, List.copyOf(transactions));
    }

    public BigDecimal getTotal() {
        return transactions.stream()
                .map(LedgerTransaction::getAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public boolean isEmpty() {
        return transactions.isEmpty();
    }

    /**
     * The fuzzy path's candidate when it found exactly one. The fuzzy path never returns entries
     * linked to another schedule, so the candidate is either unlinked or already points here.
     */
    public Optional<LedgerTransaction> getSoleFuzzyCandidate() {
        if (path != MatchPath.FUZZY || transactions.size() != 1) {
            return Optional.empty();
        }
        return Optional.of(transactions.get(0));
    }
}
