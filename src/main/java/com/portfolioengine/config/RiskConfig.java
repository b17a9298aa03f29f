package com.portfolioengine.config;

import com.portfolioengine.risk.RiskLimits;
import java.math.BigDecimal;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the global {@link RiskLimits} bean from {@code engine.risk.*}.
 *
 * <p>Optional limits default to null (check disabled). When {@code engine.risk.level} is set,
 * {@link RiskProfile} supplies the total-risk ceiling and drawdown limit that were not
 * configured explicitly. Without either, the ledger ceiling falls back to 25% of capital.
 */
@Configuration
public class RiskConfig {

    static final BigDecimal DEFAULT_MAX_TOTAL_RISK = new BigDecimal("0.25");
    static final BigDecimal DEFAULT_ASSUMED_ADVERSE_MOVE = new BigDecimal("0.08");

    @Bean
    public RiskLimits riskLimits(
            @Value("${engine.risk.level:#{null}}") Integer riskLevel,
            @Value("${engine.risk.max-total-risk:#{null}}") BigDecimal maxTotalRisk,
            @Value("${engine.risk.assumed-adverse-move:#{null}}") BigDecimal assumedAdverseMove,
            @Value("${engine.risk.max-open-positions:#{null}}") Integer maxOpenPositions,
            @Value("${engine.risk.max-category-allocation:#{null}}") BigDecimal maxCategoryAllocation,
            @Value("${engine.risk.max-spread:#{null}}") BigDecimal maxSpread,
            @Value("${engine.risk.max-drawdown:#{null}}") BigDecimal maxDrawdown,
            @Value("${engine.risk.max-daily-loss:#{null}}") BigDecimal maxDailyLoss,
            @Value("${engine.risk.daily-loss-pause:#{null}}") Duration dailyLossPause) {
        RiskProfile profile = riskLevel != null ? RiskProfile.forLevel(riskLevel) : null;

        if (maxTotalRisk == null) {
            maxTotalRisk = profile != null ? profile.getMaxTotalRisk() : DEFAULT_MAX_TOTAL_RISK;
        }
        if (maxDrawdown == null && profile != null) {
            maxDrawdown = profile.getMaxDrawdown();
        }

        return RiskLimits.builder()
                .maxTotalRisk(maxTotalRisk)
                .assumedAdverseMove(assumedAdverseMove != null ? assumedAdverseMove : DEFAULT_ASSUMED_ADVERSE_MOVE)
                .maxOpenPositions(maxOpenPositions)
                .maxCategoryAllocation(maxCategoryAllocation)
                .maxSpread(maxSpread)
                .maxDrawdown(maxDrawdown)
                .maxDailyLoss(maxDailyLoss)
                .dailyLossPause(dailyLossPause)
                .build();
    }
}
