package com.portfolioengine.domain.enums;

public enum PositionSide {
    LONG,
    SHORT;

    /** +1 for long, -1 for short. Used to orient profit and stop offsets. */
    public int sign() {
        return this == LONG ? 1 : -1;
    }
}
