package com.capitalallocator.domain.enums;

public enum KillSwitchKind {

    /** Realized P&L for the current trading day. */
    MAX_DAILY_LOSS,

    /** Equity drop from the running peak. */
    MAX_DRAWDOWN
}
