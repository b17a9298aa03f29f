package com.portfolioengine.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * Inputs for sizing one order.
 *
 * <p>For an initial entry {@code ladderLevel} is 0 and {@code ladderMultiplier} 1.0. A
 * non-null {@code requestedStake} replaces the sizer formula (rebalance orders arrive with
 * their amount already decided) but still goes through every clamp and the ledger.
 */
@Data
@Builder
public class PositionSizingContext {

    private String instrumentId;
    private String category;
    private BigDecimal totalCapital;

    /** Recent volatility as a fraction (0.02 = 2%); null when unknown. */
    private Double volatility;

    /** Distance to the static stop as a positive fraction; used by risk-based sizing. */
    private double stopDistance;

    private int ladderLevel;

    @Builder.Default
    private double ladderMultiplier = 1.0;

    /** Remaining room under the position's maximum allocation; null for no limit. */
    private BigDecimal allocationHeadroom;

    private BigDecimal requestedStake;

    public boolean isLadderOrder() {
        return ladderLevel > 0;
    }
}
