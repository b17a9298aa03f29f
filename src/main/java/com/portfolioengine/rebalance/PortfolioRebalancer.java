package com.portfolioengine.rebalance;

import com.portfolioengine.domain.enums.RebalanceDirection;
import com.portfolioengine.domain.enums.RebalanceReason;
import com.portfolioengine.domain.model.CategoryAllocation;
import com.portfolioengine.domain.model.IndicatorKeys;
import com.portfolioengine.domain.model.InstrumentSnapshot;
import com.portfolioengine.domain.model.RebalanceProposal;
import com.portfolioengine.observability.DecisionLogger;
import com.portfolioengine.regime.RegimeClassifier;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Compares category allocations with their targets and proposes corrective moves.
 *
 * <p>A category gets a proposal only when its drift exceeds the threshold and the implied
 * move (drift x capital) is at least the minimum rebalance amount. The amount is then
 * clamped into the configured position bounds. Market gates skip a proposal when the
 * category's representative snapshot is missing, too volatile or too thin, and skip
 * increases into a strong downtrend.
 *
 * <p>The stable category only absorbs uncommitted balance; it never receives proposals of
 * its own because moving capital out of other categories already raises it.
 */
@Component
public class PortfolioRebalancer {

    private static final Logger log = LoggerFactory.getLogger(PortfolioRebalancer.class);

    private final RebalanceConfig rebalanceConfig;
    private final RegimeClassifier regimeClassifier;
    private final DecisionLogger decisionLogger;

    public PortfolioRebalancer(
            RebalanceConfig rebalanceConfig, RegimeClassifier regimeClassifier, DecisionLogger decisionLogger) {
        this.rebalanceConfig = rebalanceConfig;
        this.regimeClassifier = regimeClassifier;
        this.decisionLogger = decisionLogger;
    }

    // ========================
    // ALLOCATION TABLE
    // ========================

    /**
     * Builds the allocation table from committed stakes per category. Uncommitted balance
     * (capital minus all stakes) counts towards the stable category. Categories holding
     * stake without a target get a target of zero.
     */
    public List<CategoryAllocation> buildAllocationTable(Map<String, BigDecimal> stakeByCategory, BigDecimal totalCapital) {
        List<CategoryAllocation> table = new ArrayList<>();
        if (totalCapital == null || totalCapital.signum() <= 0) {
            return table;
        }

        BigDecimal committed = stakeByCategory.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal uncommitted = totalCapital.subtract(committed).max(BigDecimal.ZERO);

        Set<String> categories = new LinkedHashSet<>(rebalanceConfig.getTargets().keySet());
        categories.addAll(stakeByCategory.keySet());
        categories.add(rebalanceConfig.getStableCategory());

        for (String category : categories) {
            BigDecimal value = stakeByCategory.getOrDefault(category, BigDecimal.ZERO);
            if (category.equals(rebalanceConfig.getStableCategory())) {
                value = value.add(uncommitted);
            }
            double fraction = value.divide(totalCapital, 6, RoundingMode.HALF_UP).doubleValue();
            double target = rebalanceConfig.getTargets().getOrDefault(category, 0.0);
            table.add(new CategoryAllocation(category, value, fraction, target));
        }
        return table;
    }

    // ========================
    // PROPOSALS
    // ========================

    /**
     * @param categorySnapshots representative snapshot per category, used by the market gates
     */
    public List<RebalanceProposal> propose(
            List<CategoryAllocation> table, BigDecimal totalCapital, Map<String, InstrumentSnapshot> categorySnapshots) {
        List<RebalanceProposal> proposals = new ArrayList<>();
        if (totalCapital == null || totalCapital.signum() <= 0) {
            log.debug("Rebalance skipped: no capital");
            return proposals;
        }

        for (CategoryAllocation allocation : table) {
            if (allocation.category().equals(rebalanceConfig.getStableCategory())) {
                continue;
            }
            double drift = allocation.drift();
            if (drift <= rebalanceConfig.getThreshold()) {
                continue;
            }
            BigDecimal impliedMove = totalCapital.multiply(BigDecimal.valueOf(drift)).setScale(2, RoundingMode.DOWN);
            if (impliedMove.compareTo(rebalanceConfig.getMinRebalanceAmount()) < 0) {
                continue;
            }

            RebalanceProposal proposal = new RebalanceProposal(
                    allocation.category(),
                    allocation.isUnderTarget() ? RebalanceDirection.INCREASE : RebalanceDirection.DECREASE,
                    clampAmount(impliedMove, totalCapital),
                    allocation.isUnderTarget() ? RebalanceReason.UNDER_TARGET : RebalanceReason.OVER_TARGET,
                    drift);

            String skipReason = marketGate(proposal, categorySnapshots.get(allocation.category()));
            if (skipReason != null) {
                decisionLogger.logRebalance(proposal, false, skipReason);
                continue;
            }
            decisionLogger.logRebalance(proposal, true, "drift " + drift + " above " + rebalanceConfig.getThreshold());
            proposals.add(proposal);
        }
        return proposals;
    }

    private BigDecimal clampAmount(BigDecimal amount, BigDecimal totalCapital) {
        BigDecimal min = totalCapital.multiply(rebalanceConfig.getMinPositionFraction());
        BigDecimal max = totalCapital.multiply(rebalanceConfig.getMaxPositionFraction());
        return amount.max(min).min(max).setScale(2, RoundingMode.DOWN);
    }

    /** Returns why the proposal must be skipped, or null when the market allows it. */
    private String marketGate(RebalanceProposal proposal, InstrumentSnapshot snapshot) {
        if (snapshot == null) {
            return "no market data for category";
        }
        if (proposal.direction() == RebalanceDirection.INCREASE
                && regimeClassifier.isStrongDowntrend(snapshot, rebalanceConfig.getStrongDowntrendAdx())) {
            return "strong downtrend";
        }
        if (snapshot.has(IndicatorKeys.VOLATILITY)
                && snapshot.require(IndicatorKeys.VOLATILITY) > rebalanceConfig.getMaxPortfolioVolatility()) {
            return "volatility above ceiling";
        }
        if (snapshot.has(IndicatorKeys.VOLUME_RATIO)
                && snapshot.require(IndicatorKeys.VOLUME_RATIO) < rebalanceConfig.getMinVolumeRatio()) {
            return "volume too low";
        }
        return null;
    }
}
