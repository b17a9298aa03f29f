package com.portfolioengine.risk;

import lombok.Builder;
import lombok.Getter;

/**
 * Represents a single risk limit violation detected by the admission gate or the risk ledger.
 *
 * <p>Each violation has a code (machine-readable) and a message (human-readable).
 * Codes used: MAX_OPEN_POSITIONS, CATEGORY_CEILING_EXCEEDED, RISK_BUDGET_EXHAUSTED,
 * SPREAD_TOO_WIDE, MAX_DRAWDOWN_BREACHED, DAILY_LOSS_PAUSE, EMERGENCY_STOP_ACTIVE,
 * ASSET_ALLOCATION_EXCEEDED, MAX_CORRELATED_POSITIONS, EXIT_DELAYED, NO_CAPITAL, STAKE_TOO_SMALL.
 *
 * <p>Multiple violations can be returned in a single admission check to give the decision log
 * a complete picture of why the order was rejected.
 */
@Getter
@Builder
public class RiskViolation {

    public static final String MAX_OPEN_POSITIONS = "MAX_OPEN_POSITIONS";
    public static final String CATEGORY_CEILING_EXCEEDED = "CATEGORY_CEILING_EXCEEDED";
    public static final String RISK_BUDGET_EXHAUSTED = "RISK_BUDGET_EXHAUSTED";
    public static final String SPREAD_TOO_WIDE = "SPREAD_TOO_WIDE";
    public static final String MAX_DRAWDOWN_BREACHED = "MAX_DRAWDOWN_BREACHED";
    public static final String DAILY_LOSS_PAUSE = "DAILY_LOSS_PAUSE";
    public static final String EMERGENCY_STOP_ACTIVE = "EMERGENCY_STOP_ACTIVE";
    public static final String ASSET_ALLOCATION_EXCEEDED = "ASSET_ALLOCATION_EXCEEDED";
    public static final String MAX_CORRELATED_POSITIONS = "MAX_CORRELATED_POSITIONS";
    public static final String EXIT_DELAYED = "EXIT_DELAYED";
    public static final String NO_CAPITAL = "NO_CAPITAL";
    public static final String STAKE_TOO_SMALL = "STAKE_TOO_SMALL";

    /** Machine-readable violation code (e.g., "MAX_OPEN_POSITIONS"). */
    private final String code;

    /** Human-readable description of the violation. */
    private final String message;

    public static RiskViolation of(String code, String message) {
        return RiskViolation.builder().code(code).message(message).build();
    }

    @Override
    public String toString() {
        return code + ": " + message;
    }
}
