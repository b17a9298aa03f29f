package com.portfolioengine.signal;

import com.portfolioengine.domain.enums.PositionSide;
import com.portfolioengine.domain.enums.Regime;
import com.portfolioengine.domain.model.InstrumentSnapshot;
import java.util.Optional;

/**
 * One row of the signal table: a family of entry and exit predicates sharing thresholds.
 *
 * <p>Implementations must be pure functions of their arguments and configuration. A
 * predicate whose indicators are missing is simply not satisfied.
 */
public interface SignalFamily {

    SignalFamilyType getType();

    /**
     * Returns the entry tag if this family wants to open a position on {@code side}.
     */
    Optional<String> entry(Regime regime, InstrumentSnapshot snapshot, PositionSide side);

    /**
     * Returns the exit tag if this family wants to close a position held on {@code side}.
     */
    Optional<String> exit(Regime regime, InstrumentSnapshot snapshot, PositionSide side);
}
