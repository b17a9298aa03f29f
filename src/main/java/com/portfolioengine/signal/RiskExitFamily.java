package com.portfolioengine.signal;

import static com.portfolioengine.domain.model.IndicatorKeys.BB_POSITION;
import static com.portfolioengine.domain.model.IndicatorKeys.BB_WIDTH;
import static com.portfolioengine.domain.model.IndicatorKeys.RSI;

import com.portfolioengine.domain.enums.PositionSide;
import com.portfolioengine.domain.enums.Regime;
import com.portfolioengine.domain.model.InstrumentSnapshot;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Exit-only family: leaves on a volatility spike or when price is overextended in the
 * position's favour. Never proposes entries.
 */
@Component
public class RiskExitFamily implements SignalFamily {

    private final SignalConfig signalConfig;

    public RiskExitFamily(SignalConfig signalConfig) {
        this.signalConfig = signalConfig;
    }

    @Override
    public SignalFamilyType getType() {
        return SignalFamilyType.RISK_EXIT;
    }

    @Override
    public Optional<String> entry(Regime regime, InstrumentSnapshot snapshot, PositionSide side) {
        return Optional.empty();
    }

    @Override
    public Optional<String> exit(Regime regime, InstrumentSnapshot snapshot, PositionSide side) {
        SignalConfig.RiskExit config = signalConfig.getRiskExit();

        if (snapshot.has(BB_WIDTH) && snapshot.require(BB_WIDTH) > config.getVolatilitySpikeBandWidth()) {
            return Optional.of("exit_volatility_spike");
        }
        if (!snapshot.hasAll(RSI, BB_POSITION)) {
            return Optional.empty();
        }
        double rsi = snapshot.require(RSI);
        double bandPosition = snapshot.require(BB_POSITION);
        boolean overextended = side == PositionSide.LONG
                ? rsi > config.getOverextendedRsi() && bandPosition > config.getOverextendedBandPosition()
                : rsi < 100 - config.getOverextendedRsi() && bandPosition < 1 - config.getOverextendedBandPosition();
        return overextended ? Optional.of("exit_overextended") : Optional.empty();
    }
}
