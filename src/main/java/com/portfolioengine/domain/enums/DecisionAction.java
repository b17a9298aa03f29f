package com.portfolioengine.domain.enums;

/**
 * What the engine asks the execution collaborator to do for one instrument on one tick.
 */
public enum DecisionAction {
    /** Open a new position. */
    ENTER,
    /** Add an averaging order to an open position. */
    LADDER,
    /** Close the position, or part of it when a take-profit level leaves some stake open. */
    EXIT,
    /** No order this tick. The stop level may still have moved. */
    HOLD
}
