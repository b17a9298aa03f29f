package com.portfolioengine.signal;

import static com.portfolioengine.domain.model.IndicatorKeys.BB_LOWER;
import static com.portfolioengine.domain.model.IndicatorKeys.BB_UPPER;
import static com.portfolioengine.domain.model.IndicatorKeys.STOCH_D;
import static com.portfolioengine.domain.model.IndicatorKeys.STOCH_K;

import com.portfolioengine.domain.enums.PositionSide;
import com.portfolioengine.domain.enums.Regime;
import com.portfolioengine.domain.model.InstrumentSnapshot;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Fades extremes inside a ranging market: the stochastic is in its extreme band and turns
 * back toward the centre while price sits on the matching Bollinger band.
 */
@Component
public class MeanReversionFamily implements SignalFamily {

    private final SignalConfig signalConfig;

    public MeanReversionFamily(SignalConfig signalConfig) {
        this.signalConfig = signalConfig;
    }

    @Override
    public SignalFamilyType getType() {
        return SignalFamilyType.MEAN_REVERSION;
    }

    @Override
    public Optional<String> entry(Regime regime, InstrumentSnapshot snapshot, PositionSide side) {
        if (regime != Regime.RANGE || !snapshot.hasAll(STOCH_K, BB_LOWER, BB_UPPER)) {
            return Optional.empty();
        }
        SignalConfig.MeanReversion config = signalConfig.getMeanReversion();
        double stochK = snapshot.require(STOCH_K);
        double price = snapshot.getPrice();

        if (side == PositionSide.LONG) {
            boolean matches = stochK < config.getOversoldLevel()
                    && Crossovers.crossedAbove(snapshot, STOCH_K, STOCH_D)
                    && price < snapshot.require(BB_LOWER) * (1 + config.getBandTouchTolerance());
            return matches ? Optional.of("mean_reversion_oversold") : Optional.empty();
        }

        boolean matches = stochK > config.getOverboughtLevel()
                && Crossovers.crossedBelow(snapshot, STOCH_K, STOCH_D)
                && price > snapshot.require(BB_UPPER) * (1 - config.getBandTouchTolerance());
        return matches ? Optional.of("mean_reversion_overbought") : Optional.empty();
    }

    @Override
    public Optional<String> exit(Regime regime, InstrumentSnapshot snapshot, PositionSide side) {
        if (!snapshot.has(STOCH_K)) {
            return Optional.empty();
        }
        double exitLevel = signalConfig.getMeanReversion().getExitLevel();
        double stochK = snapshot.require(STOCH_K);

        if (side == PositionSide.LONG) {
            boolean turned = stochK > exitLevel && Crossovers.crossedBelow(snapshot, STOCH_K, STOCH_D);
            return turned ? Optional.of("exit_stoch_overbought") : Optional.empty();
        }
        boolean turned = stochK < 100 - exitLevel && Crossovers.crossedAbove(snapshot, STOCH_K, STOCH_D);
        return turned ? Optional.of("exit_stoch_oversold") : Optional.empty();
    }
}
