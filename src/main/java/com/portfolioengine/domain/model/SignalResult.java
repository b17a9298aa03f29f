package com.portfolioengine.domain.model;

import com.portfolioengine.domain.enums.PositionSide;

/**
 * Output of the signal evaluator. Entry and exit are evaluated independently and may both
 * be true; the engine lets the exit win.
 */
public record SignalResult(boolean enter, PositionSide entrySide, String entryTag, boolean exit, String exitTag) {

    public static SignalResult none() {
        return new SignalResult(false, null, null, false, null);
    }
}
