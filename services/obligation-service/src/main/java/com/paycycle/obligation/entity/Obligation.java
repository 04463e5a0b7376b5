package com.paycycle.obligation.entity;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Common view over billers and installments.
 * Schedules reference an obligation by {@link #getObligationType()} plus {@link #getId()}.
 */
public interface Obligation {

    UUID getId();

    String getName();

    String getCategory();

    ObligationType getObligationType();

    /**
     * Amount expected per scheduled period
     */
    BigDecimal getExpectedAmount();

    LocalDateTime getCreatedAt();

    /**
     * Account a payment is recorded against when the caller names none
     */
    String getDefaultAccountId();
}
