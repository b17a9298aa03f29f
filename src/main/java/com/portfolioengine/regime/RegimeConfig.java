package com.portfolioengine.regime;

import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Thresholds for regime classification. Properties prefix: {@code engine.regime.*}.
 *
 * <p>Defaults follow the common ADX reading: above 25 the market trends, below 20 it ranges.
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "engine.regime")
public class RegimeConfig {

    @PositiveOrZero
    private double trendThreshold = 25.0;

    @PositiveOrZero
    private double rangeThreshold = 20.0;
}
