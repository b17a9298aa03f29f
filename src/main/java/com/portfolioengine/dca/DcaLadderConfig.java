package com.portfolioengine.dca;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Ladder definition and spacing rules. Properties prefix: {@code engine.dca.*}.
 *
 * <p>Levels must be listed from least to most severe loss, with strictly increasing size
 * multipliers, and every trigger must sit above the static stop floor (a deeper rung could
 * only be reached after the stop has closed the position). Startup validation rejects
 * anything else.
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "engine.dca")
public class DcaLadderConfig {

    private boolean enabled = true;

    @NotNull
    private List<Level> levels = new ArrayList<>(List.of(
            new Level(-0.04, 1.2), new Level(-0.08, 1.5), new Level(-0.12, 2.0)));

    @NotNull
    private Duration minTimeBetweenEntries = Duration.ofHours(4);

    /** Upper bound of a single position's cumulative stake, as a fraction of capital. */
    @NotNull
    private BigDecimal maxPositionAllocation = new BigDecimal("0.35");

    /** Largest discount below market for ladder limit orders. */
    @PositiveOrZero
    private double maxLimitDiscount = 0.01;

    /** Discount as a fraction of ATR / price, capped by maxLimitDiscount. */
    private double atrDiscountFactor = 0.5;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Level {
        private double trigger;
        private double multiplier;
    }
}
