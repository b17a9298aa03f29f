package com.portfolioengine.risk;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Crash detection that pauses new exposure. Properties prefix: {@code engine.emergency-stop.*}.
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "engine.emergency-stop")
public class EmergencyStopConfig {

    private boolean enabled = true;

    /** Instrument whose price is watched as the market benchmark. */
    private String benchmarkInstrument = "BTC/USDT";

    /** Fall of the benchmark from its high within {@code benchmarkWindow} that trips the stop. */
    @Positive
    private double benchmarkDrop = 0.15;

    @NotNull
    private Duration benchmarkWindow = Duration.ofMinutes(60);

    /** Fall of total capital from its high within {@code portfolioWindow} that trips the stop. */
    @Positive
    private double portfolioDrop = 0.20;

    @NotNull
    private Duration portfolioWindow = Duration.ofHours(24);

    /** How long new exposure stays paused after the stop trips. */
    @NotNull
    private Duration pauseDuration = Duration.ofHours(4);

    /** When true, open positions are also liquidated while the stop is active. */
    private boolean closeAllPositions = false;
}
