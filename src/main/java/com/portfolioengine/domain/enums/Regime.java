package com.portfolioengine.domain.enums;

/**
 * Coarse market-state classification of a single instrument, recomputed every tick.
 *
 * <ul>
 *   <li>UPTREND -- trend strength above the trend threshold with positive directional bias</li>
 *   <li>DOWNTREND -- trend strength above the trend threshold with negative directional bias</li>
 *   <li>RANGE -- trend strength below the range threshold</li>
 *   <li>UNCERTAIN -- anything in between, or missing indicator data</li>
 * </ul>
 */
public enum Regime {
    UPTREND,
    DOWNTREND,
    RANGE,
    UNCERTAIN
}
