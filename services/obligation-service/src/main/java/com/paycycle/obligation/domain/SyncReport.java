package com.paycycle.obligation.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.List;
import java.util.UUID;

/**
 * Comparison of a schedule's stored paid amount against the amount the ledger supports.
 * {@code difference = stored - ledgerDerived}, with a missing stored amount counted as zero.
 */
@Value
@Builder
public class SyncReport {

    UUID scheduleId;
    UUID obligationId;
    YearMonth period;
    BigDecimal storedPaidAmount;
    BigDecimal ledgerDerivedPaidAmount;
    BigDecimal difference;
    boolean inSync;
    SyncRecommendation recommendation;
    MatchPath matchPath;
    List<UUID> matchedTransactionIds;
}
