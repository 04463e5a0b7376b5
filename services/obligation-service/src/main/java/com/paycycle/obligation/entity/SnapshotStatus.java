package com.paycycle.obligation.entity;

public enum SnapshotStatus {
    DRAFT,
    SAVED
}
