package com.portfolioengine.regime;

import com.portfolioengine.domain.enums.Regime;
import com.portfolioengine.domain.model.IndicatorKeys;
import com.portfolioengine.domain.model.InstrumentSnapshot;
import org.springframework.stereotype.Component;

/**
 * Maps a snapshot to a {@link Regime} using trend strength (ADX) and directional bias
 * (+DI versus -DI).
 *
 * <p>The range check is applied first: a snapshot below the range threshold is RANGE
 * regardless of bias. Missing indicators yield UNCERTAIN. Stateless, so the same snapshot
 * always classifies the same way.
 */
@Component
public class RegimeClassifier {

    private final RegimeConfig regimeConfig;

    public RegimeClassifier(RegimeConfig regimeConfig) {
        this.regimeConfig = regimeConfig;
    }

    public Regime classify(InstrumentSnapshot snapshot) {
        if (snapshot == null || !snapshot.has(IndicatorKeys.ADX)) {
            return Regime.UNCERTAIN;
        }
        double adx = snapshot.require(IndicatorKeys.ADX);

        if (adx < regimeConfig.getRangeThreshold()) {
            return Regime.RANGE;
        }
        if (adx <= regimeConfig.getTrendThreshold()
                || !snapshot.hasAll(IndicatorKeys.PLUS_DI, IndicatorKeys.MINUS_DI)) {
            return Regime.UNCERTAIN;
        }

        double plusDi = snapshot.require(IndicatorKeys.PLUS_DI);
        double minusDi = snapshot.require(IndicatorKeys.MINUS_DI);
        if (plusDi > minusDi) {
            return Regime.UPTREND;
        }
        if (minusDi > plusDi) {
            return Regime.DOWNTREND;
        }
        return Regime.UNCERTAIN;
    }

    /** True for a DOWNTREND whose trend strength is at or above {@code minAdx}. */
    public boolean isStrongDowntrend(InstrumentSnapshot snapshot, double minAdx) {
        return classify(snapshot) == Regime.DOWNTREND && snapshot.require(IndicatorKeys.ADX) >= minAdx;
    }
}
