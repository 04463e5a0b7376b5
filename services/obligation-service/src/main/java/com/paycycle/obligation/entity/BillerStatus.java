package com.paycycle.obligation.entity;

public enum BillerStatus {
    ACTIVE,
    INACTIVE
}
