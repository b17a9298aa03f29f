package com.portfolioengine.sizing.impl;

import com.portfolioengine.domain.enums.PositionSizingType;
import com.portfolioengine.domain.model.PositionSizingContext;
import com.portfolioengine.sizing.PositionSizer;
import com.portfolioengine.sizing.PositionSizingConfig;
import java.math.BigDecimal;
import java.math.RoundingMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Stake = capital x base fraction x volatility multiplier.
 *
 * <p>The multiplier is {@code 1 / (1 + volatility x sensitivity)} clamped into the configured
 * bounds (default [0.5, 2.0]), so calm instruments get larger stakes than volatile ones.
 * Unknown volatility uses a multiplier of 1.
 */
@Component
public class VolatilityScaledSizer implements PositionSizer {

    private static final Logger log = LoggerFactory.getLogger(VolatilityScaledSizer.class);

    private final PositionSizingConfig positionSizingConfig;

    public VolatilityScaledSizer(PositionSizingConfig positionSizingConfig) {
        this.positionSizingConfig = positionSizingConfig;
    }

    @Override
    public BigDecimal calculateStake(PositionSizingContext positionSizingContext) {
        BigDecimal capital = positionSizingContext.getTotalCapital();
        if (capital == null || capital.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        double multiplier = volatilityMultiplier(positionSizingContext.getVolatility());
        BigDecimal stake = capital.multiply(positionSizingConfig.getBaseStakeFraction())
                .multiply(BigDecimal.valueOf(multiplier))
                .setScale(2, RoundingMode.DOWN);

        log.debug(
                "Volatility sizing for {}: capital {} x {} x {} = {}",
                positionSizingContext.getInstrumentId(),
                capital,
                positionSizingConfig.getBaseStakeFraction(),
                multiplier,
                stake);
        return stake;
    }

    public double volatilityMultiplier(Double volatility) {
        if (volatility == null || volatility.isNaN() || volatility < 0) {
            return 1.0;
        }
        double raw = 1.0 / (1.0 + volatility * positionSizingConfig.getVolatilitySensitivity());
        return Math.max(
                positionSizingConfig.getMinVolatilityMultiplier(),
                Math.min(positionSizingConfig.getMaxVolatilityMultiplier(), raw));
    }

    @Override
    public PositionSizingType getType() {
        return PositionSizingType.VOLATILITY_SCALED;
    }
}
