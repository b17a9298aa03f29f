package com.portfolioengine.risk;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Exit-delay policy, per-category ceilings and per-asset position limits for the admission gate.
 * Properties prefix: {@code engine.admission.*}.
 */
@Data
@Component
@ConfigurationProperties(prefix = "engine.admission")
public class AdmissionConfig {

    /** Profit-taking exits below this profit ratio are delayed unless the move is overextended. */
    private double minProfitForSignalExit = 0.02;

    /** RSI above which (below 100 minus which, for shorts) a position counts as overextended. */
    private double overextendedRsi = 80.0;

    /** Band width above which a position counts as overextended. */
    private double overextendedBandWidth = 0.20;

    /** When true, rebalance exits skip the profit-taking delay. */
    private boolean rebalanceExitBypassesProfitDelay = false;

    /** Overrides of the default category ceiling, as fractions of capital. */
    private Map<String, BigDecimal> categoryCeilings = new HashMap<>();

    /**
     * Ceiling of one base asset's committed stake ("BTC" across BTC/USDT and BTC/EUR), as a
     * fraction of capital. Null disables the check.
     */
    private BigDecimal maxAssetAllocation;

    /** Groups of base assets that move together, e.g. {@code layer1: [BTC, ETH, SOL]}. */
    private Map<String, List<String>> correlationGroups = new HashMap<>();

    /** Maximum open positions within one correlation group. Ignored when no groups are configured. */
    private int maxCorrelatedPositions = 2;

    /** Ledger utilisation at which a RISK_BUDGET_HIGH event is published. */
    private double utilizationWarning = 0.8;
}
