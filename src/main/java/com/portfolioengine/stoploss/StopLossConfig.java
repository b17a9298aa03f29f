package com.portfolioengine.stoploss;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Stop-loss parameters. Properties prefix: {@code engine.stop-loss.*}.
 *
 * <p>All levels are profit ratios: -0.10 means "close at a 10% loss".
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "engine.stop-loss")
public class StopLossConfig {

    /** Worst acceptable loss. No computed stop is ever looser than this. */
    private double staticFloor = -0.15;

    private boolean volatilityStopEnabled = true;

    /** Distance of the volatility stop from the current price, in ATRs. */
    @Positive
    private double atrMultiplier = 2.5;

    /** Profit at which the trailing stop activates. */
    @PositiveOrZero
    private double trailingActivationProfit = 0.05;

    /** Trailing distance right after activation. */
    @PositiveOrZero
    private double trailingMaxDistance = 0.05;

    /** Trailing distance once profit reaches trailingFullProfit. */
    @PositiveOrZero
    private double trailingMinDistance = 0.02;

    private double trailingFullProfit = 0.20;

    /**
     * While ladder rungs remain, the volatility and time-decay stops stay at least this far
     * below the deepest armed rung so the ladder can fire before the stop does.
     */
    @PositiveOrZero
    private double ladderStopBuffer = 0.01;

    private boolean timeDecayEnabled = false;

    /** Hours over which the static floor shrinks towards minTimeDecayFactor of itself. */
    @Positive
    private double timeDecayHours = 48.0;

    @Positive
    private double minTimeDecayFactor = 0.5;
}
