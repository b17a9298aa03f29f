package com.portfolioengine.domain.enums;

public enum DecisionType {
    ENTRY_ADMITTED,
    ENTRY_REJECTED,
    LADDER_TRIGGERED,
    LADDER_REJECTED,
    EXIT_ADMITTED,
    EXIT_DELAYED,
    STOP_UPDATED,
    REBALANCE_PROPOSED,
    REBALANCE_SKIPPED,
    RESERVATION_DENIED,
    TRADING_PAUSED,
    TRADING_RESUMED,
    EVALUATION_FAILED
}
