package com.portfolioengine.domain.enums;

/**
 * Why an exit was proposed. The admission gate treats the first two as unconditional.
 *
 * <ul>
 *   <li>STOP_LOSS -- price crossed the protective stop</li>
 *   <li>EMERGENCY -- forced liquidation requested by the caller</li>
 *   <li>SIGNAL -- an exit predicate of a signal family fired</li>
 *   <li>ROI -- the time-based minimum return table was satisfied</li>
 *   <li>TAKE_PROFIT -- one or more take-profit levels were reached; may close only part of the position</li>
 *   <li>REBALANCE -- capital is being moved out of an over-weight category</li>
 * </ul>
 */
public enum ExitReason {
    STOP_LOSS,
    EMERGENCY,
    SIGNAL,
    ROI,
    TAKE_PROFIT,
    REBALANCE;

    public boolean isUnconditional() {
        return this == STOP_LOSS || this == EMERGENCY;
    }

    public boolean isProfitTaking() {
        return this == SIGNAL || this == ROI || this == TAKE_PROFIT;
    }
}
