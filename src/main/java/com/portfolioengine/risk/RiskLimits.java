package com.portfolioengine.risk;

import java.math.BigDecimal;
import java.time.Duration;
import lombok.Builder;
import lombok.Data;

/**
 * Portfolio-wide limits, built by {@code RiskConfig} from {@code engine.risk.*}.
 *
 * <p>Fractions are of total capital. A null optional limit disables that check;
 * {@code maxTotalRisk} and {@code assumedAdverseMove} always carry a value because the
 * ledger cannot operate without them.
 */
@Data
@Builder
public class RiskLimits {

    /** Ceiling of aggregate reserved risk, as a fraction of total capital. */
    private BigDecimal maxTotalRisk;

    /** Fraction of a stake assumed lost in an adverse move; reserved risk = stake x this. */
    private BigDecimal assumedAdverseMove;

    /** Maximum number of concurrently open positions. */
    private Integer maxOpenPositions;

    /** Default ceiling of any one category's share of total capital. */
    private BigDecimal maxCategoryAllocation;

    /** Maximum relative bid/ask spread accepted for entries. */
    private BigDecimal maxSpread;

    /** Drawdown from peak capital at which new exposure is refused. */
    private BigDecimal maxDrawdown;

    /** Loss since the start of the UTC trading day at which new exposure is paused. */
    private BigDecimal maxDailyLoss;

    /** How long a daily-loss pause lasts; null pauses until the next UTC day. */
    private Duration dailyLossPause;
}
