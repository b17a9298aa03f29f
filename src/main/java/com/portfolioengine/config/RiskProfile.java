package com.portfolioengine.config;

import com.portfolioengine.exception.EngineConfigurationException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;

/**
 * Parameter set derived from a single risk level in [0, 100].
 *
 * <p>Every value is a linear interpolation between a conservative end (level 0) and an
 * aggressive end (level 100). The ladder has {@code dcaMaxOrders} rungs spaced evenly down to
 * {@code dcaDeepestTrigger}, which is kept within 80% of the static stop so every rung is
 * reachable before the stop fires. Rung i sizes at {@code 1 + i x (dcaMultiplier - 1)}, so
 * both severity and size grow strictly with depth.
 */
@Getter
public final class RiskProfile {

    private final int level;
    private final BigDecimal maxDrawdown;
    private final BigDecimal maxTotalRisk;
    private final BigDecimal riskPerTrade;
    private final BigDecimal baseStakeFraction;
    private final BigDecimal maxStakeFraction;
    private final double staticStop;
    private final int dcaMaxOrders;
    private final double dcaDeepestTrigger;
    private final double dcaMultiplier;
    private final double rebalanceThreshold;

    private RiskProfile(int level) {
        double l = level / 100.0;
        this.level = level;
        this.maxDrawdown = fraction(0.05 + l * 0.20);
        this.maxTotalRisk = fraction(0.10 + l * 0.25);
        this.riskPerTrade = fraction(0.01 + l * 0.02);
        this.baseStakeFraction = fraction(0.05 + l * 0.10);
        this.maxStakeFraction = fraction(0.10 + l * 0.25);
        this.staticStop = round(-0.04 - l * 0.08);
        this.dcaMaxOrders = (int) Math.floor(2 + l * 3);
        this.dcaDeepestTrigger = round(Math.max(-0.03 - l * 0.09, 0.8 * staticStop));
        this.dcaMultiplier = round(1.2 + l * 0.8);
        this.rebalanceThreshold = round(0.20 - l * 0.05);
    }

    /**
     * @throws EngineConfigurationException if the level is outside [0, 100]
     */
    public static RiskProfile forLevel(int level) {
        if (level < 0 || level > 100) {
            throw new EngineConfigurationException("engine.risk.level must be within [0, 100], got " + level);
        }
        return new RiskProfile(level);
    }

    /** Ladder rungs as (trigger, multiplier) pairs, least severe first. */
    public List<double[]> ladder() {
        List<double[]> rungs = new ArrayList<>();
        for (int i = 1; i <= dcaMaxOrders; i++) {
            rungs.add(new double[] {round(dcaDeepestTrigger * i / dcaMaxOrders), round(1 + i * (dcaMultiplier - 1))});
        }
        return rungs;
    }

    private static BigDecimal fraction(double value) {
        return BigDecimal.valueOf(value).setScale(4, RoundingMode.HALF_UP);
    }

    private static double round(double value) {
        return BigDecimal.valueOf(value).setScale(4, RoundingMode.HALF_UP).doubleValue();
    }
}
