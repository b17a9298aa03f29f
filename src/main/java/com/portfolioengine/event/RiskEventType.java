package com.portfolioengine.event;

/**
 * Classifies the portfolio condition that triggered a {@link RiskEvent}.
 */
public enum RiskEventType {

    /** A reservation was denied because the aggregate risk ceiling would be exceeded. */
    RISK_BUDGET_EXHAUSTED,

    /** Ledger utilisation crossed the warning fraction. */
    RISK_BUDGET_HIGH,

    /** Maximum number of concurrent positions has been reached. */
    MAX_POSITIONS_REACHED,

    /** An entry would push a category over its allocation ceiling. */
    CATEGORY_CEILING_REACHED,

    /** Drawdown from peak capital reached the configured maximum. */
    DRAWDOWN_LIMIT_BREACH,

    /** Loss since the start of the trading day reached the daily limit; new exposure is paused. */
    DAILY_LOSS_LIMIT_BREACH,

    /** A benchmark or portfolio crash tripped the emergency stop. */
    EMERGENCY_STOP_TRIGGERED,

    /** An entry would exceed the per-asset or correlation-group limits. */
    POSITION_LIMIT_REACHED
}
