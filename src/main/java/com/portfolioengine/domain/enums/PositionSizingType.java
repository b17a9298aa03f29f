package com.portfolioengine.domain.enums;

/**
 * Selects the raw stake formula used before clamping and ledger reservation.
 *
 * <ul>
 *   <li>VOLATILITY_SCALED -- capital x base fraction x clamped inverse-volatility multiplier</li>
 *   <li>RISK_BASED -- same, further capped so that stake x stop distance stays within risk per trade</li>
 * </ul>
 */
public enum PositionSizingType {
    VOLATILITY_SCALED,
    RISK_BASED
}
