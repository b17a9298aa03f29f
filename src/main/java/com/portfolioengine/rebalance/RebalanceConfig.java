package com.portfolioengine.rebalance;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Category targets and rebalance gates. Properties prefix: {@code engine.rebalance.*}.
 *
 * <p>The cadence itself is {@code engine.rebalance.interval-ms} and is read by the
 * {@code @Scheduled} annotation on {@link RebalanceService}.
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "engine.rebalance")
public class RebalanceConfig {

    private boolean enabled = true;

    /** Target share of total capital per category. Must sum to at most 1.0. */
    @NotEmpty
    private Map<String, Double> targets = new LinkedHashMap<>(
            Map.of("btc", 0.40, "eth", 0.25, "alt", 0.20, "stable", 0.10, "other", 0.05));

    /** Category that uncommitted wallet balance is attributed to. */
    @NotBlank
    private String stableCategory = "stable";

    private double threshold = 0.15;

    @NotNull
    @PositiveOrZero
    private BigDecimal minRebalanceAmount = new BigDecimal("100");

    /** Proposal amounts are clamped into [min, max] fractions of capital. */
    @NotNull
    private BigDecimal minPositionFraction = new BigDecimal("0.05");

    @NotNull
    private BigDecimal maxPositionFraction = new BigDecimal("0.25");

    /** Category snapshots with volatility above this skip rebalancing. */
    private double maxPortfolioVolatility = 0.25;

    /** Category snapshots with volume ratio below this skip rebalancing. */
    private double minVolumeRatio = 0.5;

    /** ADX at or above which a DOWNTREND counts as strong. */
    private double strongDowntrendAdx = 30.0;

    /** Category of each base asset; instruments whose base asset is not listed fall into "other". */
    private Map<String, String> assetCategories = new LinkedHashMap<>(Map.ofEntries(
            Map.entry("BTC", "btc"),
            Map.entry("ETH", "eth"),
            Map.entry("ADA", "alt"),
            Map.entry("SOL", "alt"),
            Map.entry("DOT", "alt"),
            Map.entry("ALGO", "alt"),
            Map.entry("MATIC", "alt"),
            Map.entry("USDC", "stable"),
            Map.entry("DAI", "stable")));

    @NotBlank
    private String defaultCategory = "other";

    /** Instruments that increase proposals may buy, per category, in order of preference. */
    private Map<String, List<String>> categoryInstruments = new LinkedHashMap<>(Map.of(
            "btc", List.of("BTC/USDT"),
            "eth", List.of("ETH/USDT"),
            "alt", List.of("SOL/USDT", "ADA/USDT", "DOT/USDT")));
}
