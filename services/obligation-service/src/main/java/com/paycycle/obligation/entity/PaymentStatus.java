package com.paycycle.obligation.entity;

/**
 * Payment status of a schedule instance.
 * Never persisted; always derived from the paid amount and an explicit as-of date.
 */
public enum PaymentStatus {
    PENDING,
    OVERDUE,
    PARTIAL,
    PAID
}
