package com.paycycle.obligation.domain;

public enum SyncRecommendation {
    NO_ACTION("no action"),
    ACCEPT_LEDGER_VALUE("accept ledger value"),
    INVESTIGATE_MANUALLY("investigate manually");

    private final String description;

    SyncRecommendation(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
