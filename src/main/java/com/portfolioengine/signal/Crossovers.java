package com.portfolioengine.signal;

import com.portfolioengine.domain.model.IndicatorKeys;
import com.portfolioengine.domain.model.InstrumentSnapshot;

/**
 * Cross detection between the current and previous bar of a snapshot.
 * All methods return false when any of the four values is missing.
 */
final class Crossovers {

    private Crossovers() {}

    /** {@code a} was at or below {@code b} on the previous bar and is above it now. */
    static boolean crossedAbove(InstrumentSnapshot snapshot, String a, String b) {
        if (!snapshot.hasAll(a, b, IndicatorKeys.prev(a), IndicatorKeys.prev(b))) {
            return false;
        }
        return snapshot.requirePrevious(a) <= snapshot.requirePrevious(b) && snapshot.require(a) > snapshot.require(b);
    }

    /** {@code a} was at or above {@code b} on the previous bar and is below it now. */
    static boolean crossedBelow(InstrumentSnapshot snapshot, String a, String b) {
        if (!snapshot.hasAll(a, b, IndicatorKeys.prev(a), IndicatorKeys.prev(b))) {
            return false;
        }
        return snapshot.requirePrevious(a) >= snapshot.requirePrevious(b) && snapshot.require(a) < snapshot.require(b);
    }
}
