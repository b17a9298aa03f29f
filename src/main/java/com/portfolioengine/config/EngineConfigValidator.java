package com.portfolioengine.config;

import com.portfolioengine.dca.DcaLadderConfig;
import com.portfolioengine.exception.EngineConfigurationException;
import com.portfolioengine.rebalance.RebalanceConfig;
import com.portfolioengine.regime.RegimeConfig;
import com.portfolioengine.risk.RiskLimits;
import com.portfolioengine.sizing.PositionSizingConfig;
import com.portfolioengine.stoploss.StopLossConfig;
import com.portfolioengine.takeprofit.TakeProfitConfig;
import jakarta.annotation.PostConstruct;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Rejects inconsistent engine configuration while the context starts, so misconfiguration
 * never surfaces as a per-tick error.
 *
 * <p>Depends on {@link RiskProfileApplier} so that derived values are validated too.
 */
@Component
public class EngineConfigValidator {

    private static final Logger log = LoggerFactory.getLogger(EngineConfigValidator.class);

    private final RiskLimits riskLimits;
    private final RegimeConfig regimeConfig;
    private final PositionSizingConfig positionSizingConfig;
    private final DcaLadderConfig dcaLadderConfig;
    private final StopLossConfig stopLossConfig;
    private final RebalanceConfig rebalanceConfig;
    private final TakeProfitConfig takeProfitConfig;

    public EngineConfigValidator(
            RiskProfileApplier riskProfileApplier,
            RiskLimits riskLimits,
            RegimeConfig regimeConfig,
            PositionSizingConfig positionSizingConfig,
            DcaLadderConfig dcaLadderConfig,
            StopLossConfig stopLossConfig,
            RebalanceConfig rebalanceConfig,
            TakeProfitConfig takeProfitConfig) {
        this.riskLimits = riskLimits;
        this.regimeConfig = regimeConfig;
        this.positionSizingConfig = positionSizingConfig;
        this.dcaLadderConfig = dcaLadderConfig;
        this.stopLossConfig = stopLossConfig;
        this.rebalanceConfig = rebalanceConfig;
        this.takeProfitConfig = takeProfitConfig;
    }

    /**
     * @throws EngineConfigurationException listing every problem found
     */
    @PostConstruct
    public void validate() {
        List<String> problems = new ArrayList<>();

        validateRisk(problems);
        validateRegime(problems);
        validateSizing(problems);
        validateLadder(problems);
        validateStopLoss(problems);
        validateRebalance(problems);
        validateTakeProfit(problems);

        if (!problems.isEmpty()) {
            throw new EngineConfigurationException(
                    "Invalid engine configuration: " + String.join("; ", problems), Map.of("problems", problems));
        }
        log.info(
                "Engine configuration valid: max total risk {}, {} ladder levels, static stop {}",
                riskLimits.getMaxTotalRisk(),
                dcaLadderConfig.isEnabled() ? dcaLadderConfig.getLevels().size() : 0,
                stopLossConfig.getStaticFloor());
    }

    private void validateRisk(List<String> problems) {
        if (!isFraction(riskLimits.getMaxTotalRisk())) {
            problems.add("max-total-risk must be within (0, 1]");
        }
        if (!isFraction(riskLimits.getAssumedAdverseMove())) {
            problems.add("assumed-adverse-move must be within (0, 1]");
        }
        if (riskLimits.getMaxOpenPositions() != null && riskLimits.getMaxOpenPositions() < 1) {
            problems.add("max-open-positions must be at least 1");
        }
        if (riskLimits.getMaxDailyLoss() != null && !isFraction(riskLimits.getMaxDailyLoss())) {
            problems.add("max-daily-loss must be within (0, 1]");
        }
        if (riskLimits.getDailyLossPause() != null && (riskLimits.getDailyLossPause().isNegative() || riskLimits.getDailyLossPause().isZero())) {
            problems.add("daily-loss-pause must be positive");
        }
    }

    private void validateRegime(List<String> problems) {
        if (regimeConfig.getRangeThreshold() > regimeConfig.getTrendThreshold()) {
            problems.add("regime range-threshold must not exceed trend-threshold");
        }
    }

    private void validateSizing(List<String> problems) {
        if (positionSizingConfig.getMinVolatilityMultiplier() <= 0
                || positionSizingConfig.getMinVolatilityMultiplier()
                        > positionSizingConfig.getMaxVolatilityMultiplier()) {
            problems.add("volatility multiplier bounds must satisfy 0 < min <= max");
        }
        if (!isFraction(positionSizingConfig.getBaseStakeFraction())
                || !isFraction(positionSizingConfig.getMaxStakeFraction())
                || !isFraction(positionSizingConfig.getPerOrderCeilingFraction())) {
            problems.add("stake fractions must be within (0, 1]");
        }
        if (positionSizingConfig.getMinStake().signum() < 0) {
            problems.add("min-stake must not be negative");
        }
        BigDecimal reserve = positionSizingConfig.getDcaReserveFactor();
        if (reserve.signum() <= 0 || reserve.compareTo(BigDecimal.ONE) > 0) {
            problems.add("dca-reserve-factor must be within (0, 1]");
        }
    }

    private void validateLadder(List<String> problems) {
        if (!dcaLadderConfig.isEnabled()) {
            return;
        }
        List<DcaLadderConfig.Level> levels = dcaLadderConfig.getLevels();
        for (int i = 0; i < levels.size(); i++) {
            DcaLadderConfig.Level level = levels.get(i);
            if (level.getTrigger() >= 0) {
                problems.add("dca level " + (i + 1) + " trigger must be negative");
            }
            if (level.getTrigger() <= stopLossConfig.getStaticFloor()) {
                problems.add("dca level " + (i + 1) + " trigger is at or below the static stop floor");
            }
            if (level.getMultiplier() <= 0) {
                problems.add("dca level " + (i + 1) + " multiplier must be positive");
            }
            if (i > 0) {
                DcaLadderConfig.Level previous = levels.get(i - 1);
                if (level.getTrigger() >= previous.getTrigger()) {
                    problems.add("dca level " + (i + 1) + " trigger must be more severe than level " + i);
                }
                if (level.getMultiplier() <= previous.getMultiplier()) {
                    problems.add("dca level " + (i + 1) + " multiplier must exceed level " + i);
                }
            }
        }
        if (dcaLadderConfig.getMinTimeBetweenEntries().isNegative()) {
            problems.add("dca min-time-between-entries must not be negative");
        }
    }

    private void validateStopLoss(List<String> problems) {
        if (stopLossConfig.getStaticFloor() >= 0 || stopLossConfig.getStaticFloor() <= -1) {
            problems.add("stop-loss static-floor must be within (-1, 0)");
        }
        if (stopLossConfig.getTrailingMinDistance() > stopLossConfig.getTrailingMaxDistance()) {
            problems.add("stop-loss trailing-min-distance must not exceed trailing-max-distance");
        }
        if (stopLossConfig.getTrailingFullProfit() <= 0) {
            problems.add("stop-loss trailing-full-profit must be positive");
        }
    }

    private void validateRebalance(List<String> problems) {
        double targetSum = rebalanceConfig.getTargets().values().stream()
                .mapToDouble(Double::doubleValue)
                .sum();
        if (targetSum > 1.0 + 1e-9) {
            problems.add("rebalance targets sum to " + targetSum + ", above 1.0");
        }
        if (rebalanceConfig.getMinPositionFraction().compareTo(rebalanceConfig.getMaxPositionFraction()) > 0) {
            problems.add("rebalance min-position-fraction must not exceed max-position-fraction");
        }
    }

    private void validateTakeProfit(List<String> problems) {
        if (!takeProfitConfig.isEnabled()) {
            return;
        }
        List<TakeProfitConfig.Level> levels = takeProfitConfig.getLevels();
        for (int i = 0; i < levels.size(); i++) {
            TakeProfitConfig.Level level = levels.get(i);
            if (level.getProfit() <= 0) {
                problems.add("take-profit level " + (i + 1) + " profit must be positive");
            }
            if (level.getExitFraction() <= 0 || level.getExitFraction() > 1) {
                problems.add("take-profit level " + (i + 1) + " exit-fraction must be within (0, 1]");
            }
            if (i > 0 && level.getProfit() <= levels.get(i - 1).getProfit()) {
                problems.add("take-profit level " + (i + 1) + " profit must exceed level " + i);
            }
        }
    }

    private static boolean isFraction(BigDecimal value) {
        return value != null && value.signum() > 0 && value.compareTo(BigDecimal.ONE) <= 0;
    }
}
