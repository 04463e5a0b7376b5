package com.paycycle.obligation.entity;

/**
 * Kind of recurring commitment that owns a payment schedule
 */
public enum ObligationType {
    BILLER,
    INSTALLMENT
}
