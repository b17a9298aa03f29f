package com.portfolioengine.signal;

import static com.portfolioengine.domain.model.IndicatorKeys.EMA_FAST;
import static com.portfolioengine.domain.model.IndicatorKeys.EMA_SLOW;
import static com.portfolioengine.domain.model.IndicatorKeys.MACD;
import static com.portfolioengine.domain.model.IndicatorKeys.MACD_SIGNAL;
import static com.portfolioengine.domain.model.IndicatorKeys.VOLUME_RATIO;

import com.portfolioengine.domain.enums.PositionSide;
import com.portfolioengine.domain.enums.Regime;
import com.portfolioengine.domain.model.InstrumentSnapshot;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Enters in the direction of an established trend when MACD crosses its signal line, the
 * fast EMA confirms the direction and volume is above average. Exits on the opposite cross.
 */
@Component
public class TrendFollowingFamily implements SignalFamily {

    private final SignalConfig signalConfig;

    public TrendFollowingFamily(SignalConfig signalConfig) {
        this.signalConfig = signalConfig;
    }

    @Override
    public SignalFamilyType getType() {
        return SignalFamilyType.TREND_FOLLOWING;
    }

    @Override
    public Optional<String> entry(Regime regime, InstrumentSnapshot snapshot, PositionSide side) {
        if (!snapshot.hasAll(EMA_FAST, EMA_SLOW, VOLUME_RATIO)) {
            return Optional.empty();
        }
        boolean volumeConfirms =
                snapshot.require(VOLUME_RATIO) > signalConfig.getTrendFollowing().getMinVolumeRatio();
        if (!volumeConfirms) {
            return Optional.empty();
        }

        if (side == PositionSide.LONG) {
            boolean matches = regime == Regime.UPTREND
                    && Crossovers.crossedAbove(snapshot, MACD, MACD_SIGNAL)
                    && snapshot.require(EMA_FAST) > snapshot.require(EMA_SLOW);
            return matches ? Optional.of("trend_macd_cross") : Optional.empty();
        }

        boolean matches = regime == Regime.DOWNTREND
                && Crossovers.crossedBelow(snapshot, MACD, MACD_SIGNAL)
                && snapshot.require(EMA_FAST) < snapshot.require(EMA_SLOW);
        return matches ? Optional.of("trend_macd_cross_short") : Optional.empty();
    }

    @Override
    public Optional<String> exit(Regime regime, InstrumentSnapshot snapshot, PositionSide side) {
        boolean reversed = side == PositionSide.LONG
                ? Crossovers.crossedBelow(snapshot, MACD, MACD_SIGNAL)
                : Crossovers.crossedAbove(snapshot, MACD, MACD_SIGNAL);
        return reversed ? Optional.of("exit_macd_cross") : Optional.empty();
    }
}
