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
 * Volatility-scaled stake, further capped so that a stop-out loses at most
 * {@code capital x riskPerTrade}: stake <= capital x riskPerTrade / stopDistance.
 *
 * <p>With 10,000 capital, 2% risk and a 10% stop distance the cap is 2,000. If the stop
 * distance is unknown (zero) only the volatility-scaled stake applies.
 */
@Component
public class RiskBasedSizer implements PositionSizer {

    private static final Logger log = LoggerFactory.getLogger(RiskBasedSizer.class);

    private final PositionSizingConfig positionSizingConfig;
    private final VolatilityScaledSizer volatilityScaledSizer;

    public RiskBasedSizer(PositionSizingConfig positionSizingConfig, VolatilityScaledSizer volatilityScaledSizer) {
        this.positionSizingConfig = positionSizingConfig;
        this.volatilityScaledSizer = volatilityScaledSizer;
    }

    @Override
    public BigDecimal calculateStake(PositionSizingContext positionSizingContext) {
        BigDecimal scaled = volatilityScaledSizer.calculateStake(positionSizingContext);
        double stopDistance = positionSizingContext.getStopDistance();
        if (stopDistance <= 0 || scaled.signum() == 0) {
            log.warn("Stop distance unknown for {}, using volatility-scaled stake", positionSizingContext.getInstrumentId());
            return scaled;
        }

        BigDecimal maxLoss = positionSizingContext.getTotalCapital().multiply(positionSizingConfig.getRiskPerTrade());
        BigDecimal riskCap = maxLoss.divide(BigDecimal.valueOf(stopDistance), 2, RoundingMode.DOWN);
        BigDecimal stake = scaled.min(riskCap);

        log.debug(
                "Risk-based sizing for {}: max loss {} over stop {} caps at {}, stake {}",
                positionSizingContext.getInstrumentId(),
                maxLoss,
                stopDistance,
                riskCap,
                stake);
        return stake;
    }

    @Override
    public PositionSizingType getType() {
        return PositionSizingType.RISK_BASED;
    }
}
