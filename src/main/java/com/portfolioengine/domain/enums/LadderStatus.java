package com.portfolioengine.domain.enums;

/**
 * State of a position's DCA ladder. A position returns to IDLE after each triggered level
 * until every level has been used, then stays EXHAUSTED.
 */
public enum LadderStatus {
    IDLE,
    LEVEL_TRIGGERED,
    EXHAUSTED
}
