package com.portfolioengine.domain.enums;

/**
 * Identifies which component produced a decision log entry.
 */
public enum DecisionSource {
    DECISION_ENGINE,
    ADMISSION_GATE,
    RISK_LEDGER,
    STOP_LOSS,
    REBALANCER,
    SYSTEM
}
