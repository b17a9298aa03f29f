package com.portfolioengine.risk;

import com.portfolioengine.domain.enums.ExitReason;
import com.portfolioengine.domain.enums.PositionSide;
import com.portfolioengine.domain.model.AssetSymbols;
import com.portfolioengine.domain.model.IndicatorKeys;
import com.portfolioengine.domain.model.InstrumentSnapshot;
import com.portfolioengine.domain.model.OrderBookDepth;
import com.portfolioengine.event.EventPublisherHelper;
import com.portfolioengine.event.RiskEventType;
import com.portfolioengine.event.RiskLevel;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Final synchronous accept/reject check for every proposed order, organic or rebalance.
 *
 * <p>Entry and ladder checks read the allocation book and the sizing reservation, so the
 * engine calls them inside {@link RiskBudgetLedger#inTransaction}. All failing checks are
 * collected so the decision log shows every reason at once.
 *
 * <p>New exposure (entries and ladder orders) is also refused while a daily-loss pause or
 * the emergency stop is active, and when the instrument's base asset would exceed
 * {@code maxAssetAllocation}. Entries are further limited to {@code maxCorrelatedPositions}
 * open positions per correlation group.
 *
 * <p>Exits: STOP_LOSS and EMERGENCY always pass. Profit-taking exits on a barely profitable
 * position are delayed (rejected with EXIT_DELAYED and re-proposed on a later tick) unless
 * the move is overextended. Rebalance exits follow the same delay unless
 * {@code rebalanceExitBypassesProfitDelay} is set.
 */
@Component
public class TradeAdmissionGate {

    private static final Logger log = LoggerFactory.getLogger(TradeAdmissionGate.class);

    private final RiskLimits riskLimits;
    private final AdmissionConfig admissionConfig;
    private final AllocationBook allocationBook;
    private final RiskBudgetLedger riskBudgetLedger;
    private final DrawdownTracker drawdownTracker;
    private final EmergencyStopGuard emergencyStopGuard;
    private final EventPublisherHelper eventPublisherHelper;

    public TradeAdmissionGate(
            RiskLimits riskLimits,
            AdmissionConfig admissionConfig,
            AllocationBook allocationBook,
            RiskBudgetLedger riskBudgetLedger,
            DrawdownTracker drawdownTracker,
            EmergencyStopGuard emergencyStopGuard,
            EventPublisherHelper eventPublisherHelper) {
        this.riskLimits = riskLimits;
        this.admissionConfig = admissionConfig;
        this.allocationBook = allocationBook;
        this.riskBudgetLedger = riskBudgetLedger;
        this.drawdownTracker = drawdownTracker;
        this.emergencyStopGuard = emergencyStopGuard;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    // ========================
    // ENTRIES
    // ========================

    /**
     * Checks an order that opens a new position.
     *
     * @param reservation the sizing reservation; null or denied means the ledger refused
     */
    public AdmissionResult admitEntry(
            String instrumentId,
            String category,
            BigDecimal stake,
            ReservationResult reservation,
            BigDecimal totalCapital,
            OrderBookDepth depth) {
        return riskBudgetLedger.inTransaction(() -> {
            List<RiskViolation> violations = new ArrayList<>();
            checkOpenPositions(violations);
            checkCorrelatedPositions(violations, instrumentId);
            checkExposure(violations, instrumentId, category, stake, reservation, totalCapital, depth);
            return result(violations);
        });
    }

    /**
     * Checks an averaging order on an existing position. The position counts (overall and per
     * correlation group) are not affected, every other entry check applies.
     */
    public AdmissionResult admitLadder(
            String instrumentId,
            String category,
            BigDecimal stake,
            ReservationResult reservation,
            BigDecimal totalCapital,
            OrderBookDepth depth) {
        return riskBudgetLedger.inTransaction(() -> {
            List<RiskViolation> violations = new ArrayList<>();
            checkExposure(violations, instrumentId, category, stake, reservation, totalCapital, depth);
            return result(violations);
        });
    }

    // ========================
    // EXITS
    // ========================

    public AdmissionResult admitExit(
            ExitReason reason, PositionSide side, double profitRatio, InstrumentSnapshot snapshot) {
        if (reason.isUnconditional()) {
            return AdmissionResult.approved();
        }
        // The ROI table and the take-profit levels already encode the minimum profit.
        if (reason == ExitReason.ROI || reason == ExitReason.TAKE_PROFIT) {
            return AdmissionResult.approved();
        }
        if (reason == ExitReason.REBALANCE && admissionConfig.isRebalanceExitBypassesProfitDelay()) {
            return AdmissionResult.approved();
        }
        if (profitRatio >= admissionConfig.getMinProfitForSignalExit()) {
            return AdmissionResult.approved();
        }
        if (isOverextended(side, snapshot)) {
            log.debug("{} exit on thin profit {} allowed: overextended", reason, profitRatio);
            return AdmissionResult.approved();
        }
        return AdmissionResult.rejected(List.of(RiskViolation.of(
                RiskViolation.EXIT_DELAYED,
                String.format(
                        "%s exit at profit %.4f below %.4f without overextension",
                        reason, profitRatio, admissionConfig.getMinProfitForSignalExit()))));
    }

    // ========================
    // CHECKS
    // ========================

    private void checkOpenPositions(List<RiskViolation> violations) {
        Integer maxOpenPositions = riskLimits.getMaxOpenPositions();
        if (maxOpenPositions == null) {
            return;
        }
        int open = allocationBook.getOpenPositionCount();
        if (open >= maxOpenPositions) {
            violations.add(RiskViolation.of(
                    RiskViolation.MAX_OPEN_POSITIONS,
                    "Open positions " + open + " at maximum " + maxOpenPositions));
            eventPublisherHelper.publishRiskEvent(
                    this,
                    RiskEventType.MAX_POSITIONS_REACHED,
                    RiskLevel.WARNING,
                    "Maximum open positions reached",
                    Map.of("openPositions", open, "limit", maxOpenPositions));
        }
    }

    private void checkCorrelatedPositions(List<RiskViolation> violations, String instrumentId) {
        String group = correlationGroup(AssetSymbols.baseAsset(instrumentId));
        if (group == null) {
            return;
        }
        long correlated = allocationBook.getOpenInstruments().stream()
                .filter(open -> !open.equals(instrumentId))
                .filter(open -> group.equals(correlationGroup(AssetSymbols.baseAsset(open))))
                .count();
        int limit = admissionConfig.getMaxCorrelatedPositions();
        if (correlated >= limit) {
            violations.add(RiskViolation.of(
                    RiskViolation.MAX_CORRELATED_POSITIONS,
                    "Correlation group " + group + " holds " + correlated + " positions, maximum " + limit));
            eventPublisherHelper.publishRiskEvent(
                    this,
                    RiskEventType.POSITION_LIMIT_REACHED,
                    RiskLevel.INFO,
                    "Correlated position limit reached for " + group,
                    Map.of("group", group, "openPositions", correlated, "limit", limit));
        }
    }

    private void checkTradingPauses(List<RiskViolation> violations) {
        if (drawdownTracker.isTradingPaused()) {
            violations.add(RiskViolation.of(
                    RiskViolation.DAILY_LOSS_PAUSE,
                    "Daily loss limit reached, new exposure paused until " + drawdownTracker.getPausedUntil()));
        }
        if (emergencyStopGuard.isActive()) {
            violations.add(RiskViolation.of(
                    RiskViolation.EMERGENCY_STOP_ACTIVE,
                    "Emergency stop (" + emergencyStopGuard.getActiveReason() + ") active until "
                            + emergencyStopGuard.getActiveUntil()));
        }
    }

    private void checkAssetCeiling(
            List<RiskViolation> violations, String instrumentId, BigDecimal stake, BigDecimal totalCapital) {
        BigDecimal ceiling = admissionConfig.getMaxAssetAllocation();
        String asset = AssetSymbols.baseAsset(instrumentId);
        if (ceiling == null || asset == null) {
            return;
        }
        BigDecimal committed = allocationBook.instrumentStakes().entrySet().stream()
                .filter(entry -> asset.equals(AssetSymbols.baseAsset(entry.getKey())))
                .map(Map.Entry::getValue)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal proposedFraction = committed.add(stake).divide(totalCapital, 6, RoundingMode.HALF_UP);
        if (proposedFraction.compareTo(ceiling) > 0) {
            violations.add(RiskViolation.of(
                    RiskViolation.ASSET_ALLOCATION_EXCEEDED,
                    "Asset " + asset + " would hold " + proposedFraction + " of capital, ceiling " + ceiling));
            eventPublisherHelper.publishRiskEvent(
                    this,
                    RiskEventType.POSITION_LIMIT_REACHED,
                    RiskLevel.INFO,
                    "Asset allocation ceiling reached for " + asset,
                    Map.of("asset", asset, "proposedFraction", proposedFraction, "ceiling", ceiling));
        }
    }

    private String correlationGroup(String asset) {
        if (asset == null) {
            return null;
        }
        for (Map.Entry<String, List<String>> group : admissionConfig.getCorrelationGroups().entrySet()) {
            boolean member = group.getValue().stream().anyMatch(a -> a.toUpperCase(Locale.ROOT).equals(asset));
            if (member) {
                return group.getKey();
            }
        }
        return null;
    }

    private void checkExposure(
            List<RiskViolation> violations,
            String instrumentId,
            String category,
            BigDecimal stake,
            ReservationResult reservation,
            BigDecimal totalCapital,
            OrderBookDepth depth) {
        if (totalCapital == null || totalCapital.signum() <= 0) {
            violations.add(RiskViolation.of(RiskViolation.NO_CAPITAL, "Total capital unavailable"));
            return;
        }

        checkTradingPauses(violations);
        checkCategoryCeiling(violations, category, stake, totalCapital);
        checkAssetCeiling(violations, instrumentId, stake, totalCapital);

        if (reservation == null || reservation.isDenied()) {
            violations.add(RiskViolation.of(
                    RiskViolation.RISK_BUDGET_EXHAUSTED,
                    "Risk budget cannot cover stake " + stake + ", utilization "
                            + riskBudgetLedger.currentUtilization()));
        }

        BigDecimal maxSpread = riskLimits.getMaxSpread();
        if (maxSpread != null && depth != null) {
            double spread = depth.spreadFraction();
            if (!Double.isNaN(spread) && spread > maxSpread.doubleValue()) {
                violations.add(RiskViolation.of(
                        RiskViolation.SPREAD_TOO_WIDE,
                        String.format("Spread %.5f exceeds %s", spread, maxSpread.toPlainString())));
            }
        }

        BigDecimal maxDrawdown = riskLimits.getMaxDrawdown();
        if (maxDrawdown != null) {
            BigDecimal drawdown = drawdownTracker.currentDrawdown();
            if (drawdown.compareTo(maxDrawdown) >= 0) {
                violations.add(RiskViolation.of(
                        RiskViolation.MAX_DRAWDOWN_BREACHED,
                        "Drawdown " + drawdown + " from peak " + drawdownTracker.getPeakCapital()
                                + " at or above limit " + maxDrawdown));
                eventPublisherHelper.publishRiskEvent(
                        this,
                        RiskEventType.DRAWDOWN_LIMIT_BREACH,
                        RiskLevel.CRITICAL,
                        "Drawdown limit reached, new exposure refused",
                        Map.of("drawdown", drawdown, "limit", maxDrawdown));
            }
        }
    }

    private void checkCategoryCeiling(
            List<RiskViolation> violations, String category, BigDecimal stake, BigDecimal totalCapital) {
        BigDecimal ceiling = admissionConfig.getCategoryCeilings().getOrDefault(category, riskLimits.getMaxCategoryAllocation());
        if (ceiling == null) {
            return;
        }
        BigDecimal proposed = allocationBook.getCommittedStake(category).add(stake);
        BigDecimal proposedFraction = proposed.divide(totalCapital, 6, RoundingMode.HALF_UP);
        if (proposedFraction.compareTo(ceiling) > 0) {
            violations.add(RiskViolation.of(
                    RiskViolation.CATEGORY_CEILING_EXCEEDED,
                    "Category " + category + " would hold " + proposedFraction + " of capital, ceiling " + ceiling));
            eventPublisherHelper.publishRiskEvent(
                    this,
                    RiskEventType.CATEGORY_CEILING_REACHED,
                    RiskLevel.INFO,
                    "Category ceiling reached for " + category,
                    Map.of("category", category, "proposedFraction", proposedFraction, "ceiling", ceiling));
        }
    }

    private boolean isOverextended(PositionSide side, InstrumentSnapshot snapshot) {
        if (snapshot == null) {
            return false;
        }
        if (snapshot.has(IndicatorKeys.BB_WIDTH)
                && snapshot.require(IndicatorKeys.BB_WIDTH) > admissionConfig.getOverextendedBandWidth()) {
            return true;
        }
        if (!snapshot.has(IndicatorKeys.RSI)) {
            return false;
        }
        double rsi = snapshot.require(IndicatorKeys.RSI);
        return side == PositionSide.SHORT
                ? rsi < 100 - admissionConfig.getOverextendedRsi()
                : rsi > admissionConfig.getOverextendedRsi();
    }

    private AdmissionResult result(List<RiskViolation> violations) {
        if (violations.isEmpty()) {
            double utilization = riskBudgetLedger.currentUtilization();
            if (utilization >= admissionConfig.getUtilizationWarning()) {
                eventPublisherHelper.publishRiskEvent(
                        this,
                        RiskEventType.RISK_BUDGET_HIGH,
                        RiskLevel.INFO,
                        "Risk budget utilization high",
                        Map.of("utilization", utilization));
            }
            return AdmissionResult.approved();
        }
        return AdmissionResult.rejected(violations);
    }
}
