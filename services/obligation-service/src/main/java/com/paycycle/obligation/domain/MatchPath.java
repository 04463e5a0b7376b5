package com.paycycle.obligation.domain;

/**
 * How ledger evidence for a schedule was found
 */
public enum MatchPath {
    /** Schedule is linked and the linked ledger entry still exists */
    LINKED,
    /** Schedule is linked but the linked ledger entry is gone */
    LINK_BROKEN,
    /** Schedule is unlinked; evidence comes from name/amount/date matching */
    FUZZY
}
