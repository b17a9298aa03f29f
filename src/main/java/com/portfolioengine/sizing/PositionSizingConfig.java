package com.portfolioengine.sizing;

import com.portfolioengine.domain.enums.PositionSizingType;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for position sizing. Properties prefix: {@code engine.sizing.*}.
 *
 * <p>All clamping bounds used by {@link RiskBudgetedSizingService} come from here. Fractions
 * are of total capital.
 *
 * <p>Defaults:
 * <ul>
 *   <li>type: VOLATILITY_SCALED</li>
 *   <li>baseStakeFraction: 0.10</li>
 *   <li>volatility multiplier: 1 / (1 + volatility x 10), clamped to [0.5, 2.0]</li>
 *   <li>perOrderCeilingFraction: 0.15 (no single order above 15% of capital)</li>
 *   <li>riskPerTrade: 0.02 (RISK_BASED only)</li>
 * </ul>
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "engine.sizing")
public class PositionSizingConfig {

    @NotNull
    private PositionSizingType type = PositionSizingType.VOLATILITY_SCALED;

    @NotNull
    @Positive
    private BigDecimal baseStakeFraction = new BigDecimal("0.10");

    @PositiveOrZero
    private double volatilitySensitivity = 10.0;

    private double minVolatilityMultiplier = 0.5;
    private double maxVolatilityMultiplier = 2.0;

    /** Smallest stake worth sending, in account currency. */
    @NotNull
    @PositiveOrZero
    private BigDecimal minStake = new BigDecimal("10");

    /** Largest stake for any order, as a fraction of capital. */
    @NotNull
    @Positive
    private BigDecimal maxStakeFraction = new BigDecimal("0.25");

    /** Hard per-order ceiling, as a fraction of capital; applied after every other clamp. */
    @NotNull
    @Positive
    private BigDecimal perOrderCeilingFraction = new BigDecimal("0.15");

    @NotNull
    @Positive
    private BigDecimal riskPerTrade = new BigDecimal("0.02");

    /** On a denied reservation, retry with whatever the remaining budget supports. */
    private boolean tokenOnDenial = true;

    /** Multiplier on initial stakes when laddering is enabled, keeping room for averaging orders. */
    @NotNull
    @Positive
    private BigDecimal dcaReserveFactor = BigDecimal.ONE;
}
