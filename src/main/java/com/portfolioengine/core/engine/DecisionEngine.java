package com.portfolioengine.core.engine;

import com.portfolioengine.dca.DcaLadderController;
import com.portfolioengine.dca.LadderDecision;
import com.portfolioengine.domain.enums.DecisionAction;
import com.portfolioengine.domain.enums.DecisionType;
import com.portfolioengine.domain.enums.ExitReason;
import com.portfolioengine.domain.enums.PositionSide;
import com.portfolioengine.domain.enums.Regime;
import com.portfolioengine.domain.model.Decision;
import com.portfolioengine.domain.model.Fill;
import com.portfolioengine.domain.model.IndicatorKeys;
import com.portfolioengine.domain.model.InstrumentSnapshot;
import com.portfolioengine.domain.model.PortfolioContext;
import com.portfolioengine.domain.model.Position;
import com.portfolioengine.domain.model.PositionSizingContext;
import com.portfolioengine.domain.model.RebalanceProposal;
import com.portfolioengine.domain.model.SignalResult;
import com.portfolioengine.domain.model.StopLossResult;
import com.portfolioengine.event.EventPublisherHelper;
import com.portfolioengine.observability.DecisionLogger;
import com.portfolioengine.observability.EngineMetricsService;
import com.portfolioengine.rebalance.CategoryResolver;
import com.portfolioengine.regime.RegimeClassifier;
import com.portfolioengine.risk.AdmissionResult;
import com.portfolioengine.risk.AllocationBook;
import com.portfolioengine.risk.DrawdownTracker;
import com.portfolioengine.risk.EmergencyStopGuard;
import com.portfolioengine.risk.ReservationId;
import com.portfolioengine.risk.RiskBudgetLedger;
import com.portfolioengine.risk.RiskViolation;
import com.portfolioengine.risk.TradeAdmissionGate;
import com.portfolioengine.signal.RoiTable;
import com.portfolioengine.signal.SignalEvaluator;
import com.portfolioengine.sizing.RiskBudgetedSizingService;
import com.portfolioengine.sizing.SizingResult;
import com.portfolioengine.stoploss.StopLossCalculator;
import com.portfolioengine.stoploss.StopLossConfig;
import com.portfolioengine.takeprofit.TakeProfitController;
import com.portfolioengine.takeprofit.TakeProfitDecision;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Per-instrument, per-tick decision: {@code evaluate(snapshot, position, portfolio) -> Decision}.
 *
 * <p>Order of work on one tick:
 * <ol>
 *   <li>Refresh the ledger's capital, the drawdown and daily-loss tracking and the emergency
 *       stop from the portfolio context and, for the benchmark instrument, its price</li>
 *   <li>Classify the regime</li>
 *   <li>With an open position: tighten the stop, then check exits (emergency, stop, signal,
 *       ROI) through the admission gate, then take-profit levels, then the DCA ladder</li>
 *   <li>When flat: evaluate entry signals, size the stake against the risk ledger and run
 *       the admission gate</li>
 * </ol>
 *
 * <p>Sizing, admission, commit and the allocation-book update of one order run inside a
 * single ledger transaction, so two instruments can never both pass the gate on the same
 * remaining budget. A reservation that is not committed by the end of the order is released.
 *
 * <p>The caller owns the position and must not evaluate the same instrument from two
 * threads at once ({@link InstrumentPipeline} serialises this). Any exception thrown while
 * evaluating is logged and turned into HOLD; it never escapes to the dispatcher.
 */
@Service
public class DecisionEngine {

    private static final Logger log = LoggerFactory.getLogger(DecisionEngine.class);

    static final String REBALANCE_TAG = "rebalance";

    private final RegimeClassifier regimeClassifier;
    private final SignalEvaluator signalEvaluator;
    private final RoiTable roiTable;
    private final RiskBudgetedSizingService sizingService;
    private final DcaLadderController dcaLadderController;
    private final TakeProfitController takeProfitController;
    private final StopLossCalculator stopLossCalculator;
    private final StopLossConfig stopLossConfig;
    private final TradeAdmissionGate admissionGate;
    private final RiskBudgetLedger riskBudgetLedger;
    private final AllocationBook allocationBook;
    private final DrawdownTracker drawdownTracker;
    private final EmergencyStopGuard emergencyStopGuard;
    private final CategoryResolver categoryResolver;
    private final DecisionLogger decisionLogger;
    private final EngineMetricsService metricsService;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    public DecisionEngine(
            RegimeClassifier regimeClassifier,
            SignalEvaluator signalEvaluator,
            RoiTable roiTable,
            RiskBudgetedSizingService sizingService,
            DcaLadderController dcaLadderController,
            TakeProfitController takeProfitController,
            StopLossCalculator stopLossCalculator,
            StopLossConfig stopLossConfig,
            TradeAdmissionGate admissionGate,
            RiskBudgetLedger riskBudgetLedger,
            AllocationBook allocationBook,
            DrawdownTracker drawdownTracker,
            EmergencyStopGuard emergencyStopGuard,
            CategoryResolver categoryResolver,
            DecisionLogger decisionLogger,
            EngineMetricsService metricsService,
            EventPublisherHelper eventPublisherHelper,
            Clock clock) {
        this.regimeClassifier = regimeClassifier;
        this.signalEvaluator = signalEvaluator;
        this.roiTable = roiTable;
        this.sizingService = sizingService;
        this.dcaLadderController = dcaLadderController;
        this.takeProfitController = takeProfitController;
        this.stopLossCalculator = stopLossCalculator;
        this.stopLossConfig = stopLossConfig;
        this.admissionGate = admissionGate;
        this.riskBudgetLedger = riskBudgetLedger;
        this.allocationBook = allocationBook;
        this.drawdownTracker = drawdownTracker;
        this.emergencyStopGuard = emergencyStopGuard;
        this.categoryResolver = categoryResolver;
        this.decisionLogger = decisionLogger;
        this.metricsService = metricsService;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    // ========================
    // EVALUATE
    // ========================

    /**
     * Evaluates one instrument for one tick.
     *
     * @param snapshot the latest snapshot; may be null or carry an unusable price
     * @param position the open position on the instrument, or null when flat
     * @param portfolio wallet, depth and clock values fetched by the caller
     * @return the decision; its {@code position} is the updated (or new, or closed) position
     */
    public Decision evaluate(InstrumentSnapshot snapshot, Position position, PortfolioContext portfolio) {
        String instrumentId = instrumentIdOf(snapshot, position);
        return metricsService.timeEvaluation(() -> {
            try {
                Decision decision = doEvaluate(instrumentId, snapshot, position, portfolio);
                if (decision.isActionable()) {
                    eventPublisherHelper.publishDecision(this, decision);
                }
                return decision;
            } catch (RuntimeException e) {
                log.warn("Evaluation of {} failed, holding: {}", instrumentId, e.getMessage(), e);
                decisionLogger.logFailure(instrumentId, e);
                metricsService.recordFailure();
                return Decision.hold(instrumentId, Regime.UNCERTAIN, position);
            }
        });
    }

    private Decision doEvaluate(
            String instrumentId, InstrumentSnapshot snapshot, Position position, PortfolioContext portfolio) {
        Instant now = nowOf(portfolio);
        refreshCapital(portfolio, now);

        boolean hasOpenPosition = position != null && !position.isClosed();
        if (snapshot == null || !snapshot.hasUsablePrice()) {
            return evaluateWithoutPrice(instrumentId, snapshot, hasOpenPosition ? position : null, portfolio, now);
        }
        emergencyStopGuard.observeBenchmark(instrumentId, snapshot.getPrice(), now);

        Regime regime = regimeClassifier.classify(snapshot);
        SignalResult signals = signalEvaluator.evaluate(regime, snapshot, hasOpenPosition ? position.getSide() : null);

        if (hasOpenPosition) {
            return evaluateOpenPosition(snapshot, regime, signals, position, portfolio, now);
        }
        return evaluateFlat(snapshot, regime, signals, portfolio, now);
    }

    /**
     * No usable price: the stop falls back to the static floor and only an emergency
     * liquidation may still act.
     */
    private Decision evaluateWithoutPrice(
            String instrumentId,
            InstrumentSnapshot snapshot,
            Position position,
            PortfolioContext portfolio,
            Instant now) {
        log.debug("No usable price for {}, holding", instrumentId);
        if (position == null) {
            return Decision.hold(instrumentId, Regime.UNCERTAIN, null);
        }
        updateStop(position, snapshot, now);
        if (isEmergency(portfolio)) {
            return exit(position, Regime.UNCERTAIN, ExitReason.EMERGENCY, "emergency", snapshot, now);
        }
        return Decision.hold(instrumentId, Regime.UNCERTAIN, position);
    }

    // ========================
    // OPEN POSITION
    // ========================

    private Decision evaluateOpenPosition(
            InstrumentSnapshot snapshot,
            Regime regime,
            SignalResult signals,
            Position position,
            PortfolioContext portfolio,
            Instant now) {
        double price = snapshot.getPrice();
        position.observePrice(price);
        updateStop(position, snapshot, now);

        double profitRatio = position.profitRatio(price);
        ExitReason exitReason = null;
        String exitTag = null;
        if (isEmergency(portfolio)) {
            exitReason = ExitReason.EMERGENCY;
            exitTag = "emergency";
        } else if (position.isStopHit(price)) {
            exitReason = ExitReason.STOP_LOSS;
            exitTag = "stop_loss";
        } else if (signals.exit()) {
            exitReason = ExitReason.SIGNAL;
            exitTag = signals.exitTag();
        } else if (roiTable.isReached(profitRatio, position.timeOpen(now))) {
            exitReason = ExitReason.ROI;
            exitTag = "roi";
        }

        if (exitReason != null) {
            AdmissionResult admission = admissionGate.admitExit(exitReason, position.getSide(), profitRatio, snapshot);
            if (admission.isApproved()) {
                return exit(position, regime, exitReason, exitTag, snapshot, now);
            }
            decisionLogger.logRejected(
                    position.getInstrumentId(), DecisionType.EXIT_DELAYED, exitTag, admission.getViolations());
            return Decision.rejected(position.getInstrumentId(), regime, position, exitTag, admission.getViolations());
        }

        TakeProfitDecision takeProfit = takeProfitController.evaluate(position, profitRatio);
        if (takeProfit.triggered()) {
            return takeProfit(snapshot, regime, position, takeProfit, profitRatio, now);
        }

        LadderDecision ladder = dcaLadderController.evaluate(position, price, portfolio.getTotalCapital(), now);
        if (ladder.triggered()) {
            return attemptLadder(snapshot, regime, position, ladder, portfolio, now);
        }
        return Decision.hold(position.getInstrumentId(), regime, position);
    }

    /**
     * Closes the share of the position the reached levels ask for. The reservations and the
     * allocation book shrink by the same ratio as the fills; a level that takes everything
     * left closes the position like any other exit.
     */
    private Decision takeProfit(
            InstrumentSnapshot snapshot,
            Regime regime,
            Position position,
            TakeProfitDecision takeProfit,
            double profitRatio,
            Instant now) {
        String tag = takeProfit.tag();
        AdmissionResult admission =
                admissionGate.admitExit(ExitReason.TAKE_PROFIT, position.getSide(), profitRatio, snapshot);
        if (admission.isRejected()) {
            decisionLogger.logRejected(position.getInstrumentId(), DecisionType.EXIT_DELAYED, tag, admission.getViolations());
            return Decision.rejected(position.getInstrumentId(), regime, position, tag, admission.getViolations());
        }
        if (takeProfit.closesPosition()) {
            position.takeProfit(takeProfit.levels(), takeProfit.exitFraction(), BigDecimal.ZERO);
            return exit(position, regime, ExitReason.TAKE_PROFIT, tag, snapshot, now);
        }

        BigDecimal keepRatio = BigDecimal.valueOf(takeProfit.keepRatio());
        BigDecimal closedStake = riskBudgetLedger.inTransaction(() -> {
            for (ReservationId reservationId : position.getReservationIds()) {
                riskBudgetLedger.shrink(reservationId, keepRatio);
            }
            BigDecimal closed = position.takeProfit(takeProfit.levels(), takeProfit.exitFraction(), keepRatio);
            allocationBook.recordDecrease(position.getInstrumentId(), position.getCategory(), closed, false);
            return closed;
        });

        Decision decision = Decision.builder()
                .instrumentId(position.getInstrumentId())
                .action(DecisionAction.EXIT)
                .regime(regime)
                .side(position.getSide())
                .stake(closedStake)
                .stopLevel(position.getStopOffset())
                .tag(tag)
                .exitReason(ExitReason.TAKE_PROFIT)
                .position(position)
                .build();
        decisionLogger.logAdmitted(decision, DecisionType.EXIT_ADMITTED, snapshot);
        log.info("Take-profit {} on {}: stake {} released, {} still open",
                tag, position.getInstrumentId(), closedStake, position.getCumulativeStake());
        return decision;
    }

    private Decision attemptLadder(
            InstrumentSnapshot snapshot,
            Regime regime,
            Position position,
            LadderDecision ladder,
            PortfolioContext portfolio,
            Instant now) {
        String tag = "ladder_" + ladder.level().level();
        PositionSizingContext sizingContext = PositionSizingContext.builder()
                .instrumentId(position.getInstrumentId())
                .category(position.getCategory())
                .totalCapital(portfolio.getTotalCapital())
                .volatility(volatilityOf(snapshot))
                .stopDistance(Math.abs(stopLossConfig.getStaticFloor()))
                .ladderLevel(ladder.level().level())
                .ladderMultiplier(ladder.level().sizeMultiplier())
                .allocationHeadroom(ladder.allocationHeadroom())
                .build();

        return riskBudgetLedger.inTransaction(() -> {
            SizingResult sizing = sizingService.size(sizingContext);
            try {
                if (sizing.isDeclined()) {
                    return reject(position.getInstrumentId(), regime, position, tag, DecisionType.LADDER_REJECTED,
                            List.of(declineViolation(sizing)));
                }
                AdmissionResult admission = admissionGate.admitLadder(
                        position.getInstrumentId(),
                        position.getCategory(),
                        sizing.getStake(),
                        sizing.getReservation(),
                        portfolio.getTotalCapital(),
                        portfolio.getDepth());
                if (admission.isRejected()) {
                    return reject(position.getInstrumentId(), regime, position, tag, DecisionType.LADDER_REJECTED,
                            admission.getViolations());
                }

                ReservationId reservationId = sizing.getReservationId();
                riskBudgetLedger.commit(reservationId);
                double limitPrice = dcaLadderController.ladderEntryPrice(
                        position.getSide(), snapshot.getPrice(), snapshot.find(IndicatorKeys.ATR).orElse(Double.NaN));
                Fill fill = Fill.ladder(sizing.getStake(), limitPrice, now, ladder.level().level());
                dcaLadderController.recordFill(position, ladder.level(), fill, reservationId);
                allocationBook.recordIncrease(position.getInstrumentId(), position.getCategory(), sizing.getStake());

                Decision decision = Decision.builder()
                        .instrumentId(position.getInstrumentId())
                        .action(DecisionAction.LADDER)
                        .regime(regime)
                        .side(position.getSide())
                        .stake(sizing.getStake())
                        .stopLevel(position.getStopOffset())
                        .tag(tag)
                        .ladderLevel(ladder.level().level())
                        .limitPrice(limitPrice)
                        .position(position)
                        .build();
                decisionLogger.logAdmitted(decision, DecisionType.LADDER_TRIGGERED, snapshot);
                return decision;
            } finally {
                releaseIfPending(sizing);
            }
        });
    }

    // ========================
    // FLAT
    // ========================

    private Decision evaluateFlat(
            InstrumentSnapshot snapshot, Regime regime, SignalResult signals, PortfolioContext portfolio, Instant now) {
        String instrumentId = snapshot.getInstrumentId();
        if (!signals.enter()) {
            return Decision.hold(instrumentId, regime, null);
        }
        if (signals.exit()) {
            log.debug("Entry {} on {} suppressed by exit {}", signals.entryTag(), instrumentId, signals.exitTag());
            return Decision.hold(instrumentId, regime, null);
        }
        return attemptEntry(snapshot, regime, signals.entrySide(), signals.entryTag(), null, portfolio, now);
    }

    private Decision attemptEntry(
            InstrumentSnapshot snapshot,
            Regime regime,
            PositionSide side,
            String tag,
            BigDecimal requestedStake,
            PortfolioContext portfolio,
            Instant now) {
        String instrumentId = snapshot.getInstrumentId();
        String category = categoryResolver.resolve(snapshot);
        PositionSizingContext sizingContext = PositionSizingContext.builder()
                .instrumentId(instrumentId)
                .category(category)
                .totalCapital(portfolio.getTotalCapital())
                .volatility(volatilityOf(snapshot))
                .stopDistance(Math.abs(stopLossConfig.getStaticFloor()))
                .requestedStake(requestedStake)
                .build();

        return riskBudgetLedger.inTransaction(() -> {
            SizingResult sizing = sizingService.size(sizingContext);
            try {
                if (sizing.isDeclined()) {
                    return reject(instrumentId, regime, null, tag, DecisionType.ENTRY_REJECTED,
                            List.of(declineViolation(sizing)));
                }
                AdmissionResult admission = admissionGate.admitEntry(
                        instrumentId,
                        category,
                        sizing.getStake(),
                        sizing.getReservation(),
                        portfolio.getTotalCapital(),
                        portfolio.getDepth());
                if (admission.isRejected()) {
                    return reject(instrumentId, regime, null, tag, DecisionType.ENTRY_REJECTED,
                            admission.getViolations());
                }

                ReservationId reservationId = sizing.getReservationId();
                riskBudgetLedger.commit(reservationId);
                Fill fill = requestedStake != null
                        ? Fill.rebalance(sizing.getStake(), snapshot.getPrice(), now)
                        : Fill.initial(sizing.getStake(), snapshot.getPrice(), now);
                Position position = new Position(
                        instrumentId, category, side, fill, reservationId, dcaLadderController.createLadder());
                allocationBook.recordOpen(instrumentId, category, sizing.getStake());
                updateStop(position, snapshot, now);

                Decision decision = Decision.builder()
                        .instrumentId(instrumentId)
                        .action(DecisionAction.ENTER)
                        .regime(regime)
                        .side(side)
                        .stake(sizing.getStake())
                        .stopLevel(position.getStopOffset())
                        .tag(tag)
                        .position(position)
                        .build();
                decisionLogger.logAdmitted(decision, DecisionType.ENTRY_ADMITTED, snapshot);
                return decision;
            } finally {
                releaseIfPending(sizing);
            }
        });
    }

    // ========================
    // REBALANCE
    // ========================

    /**
     * Applies a rebalance proposal to one instrument of the category. Increases open a long
     * position (or add to the existing long) with the proposal amount; decreases close the
     * given position. Both go through the same sizing clamps, ledger and admission gate as
     * organic orders.
     */
    public Decision applyRebalance(
            RebalanceProposal proposal, InstrumentSnapshot snapshot, Position position, PortfolioContext portfolio) {
        String instrumentId = instrumentIdOf(snapshot, position);
        return metricsService.timeEvaluation(() -> {
            try {
                Decision decision = doApplyRebalance(proposal, snapshot, position, portfolio);
                if (decision.isActionable()) {
                    eventPublisherHelper.publishDecision(this, decision);
                }
                return decision;
            } catch (RuntimeException e) {
                log.warn("Rebalance of {} on {} failed: {}", proposal.category(), instrumentId, e.getMessage(), e);
                decisionLogger.logFailure(instrumentId, e);
                metricsService.recordFailure();
                return Decision.hold(instrumentId, Regime.UNCERTAIN, position);
            }
        });
    }

    private Decision doApplyRebalance(
            RebalanceProposal proposal, InstrumentSnapshot snapshot, Position position, PortfolioContext portfolio) {
        Instant now = nowOf(portfolio);
        refreshCapital(portfolio, now);
        String instrumentId = instrumentIdOf(snapshot, position);
        boolean hasOpenPosition = position != null && !position.isClosed();

        if (snapshot == null || !snapshot.hasUsablePrice()) {
            return Decision.hold(instrumentId, Regime.UNCERTAIN, hasOpenPosition ? position : null);
        }
        Regime regime = regimeClassifier.classify(snapshot);

        switch (proposal.direction()) {
            case DECREASE -> {
                if (!hasOpenPosition) {
                    return Decision.hold(instrumentId, regime, null);
                }
                double profitRatio = position.profitRatio(snapshot.getPrice());
                AdmissionResult admission =
                        admissionGate.admitExit(ExitReason.REBALANCE, position.getSide(), profitRatio, snapshot);
                if (admission.isRejected()) {
                    decisionLogger.logRejected(instrumentId, DecisionType.EXIT_DELAYED, REBALANCE_TAG, admission.getViolations());
                    return Decision.rejected(instrumentId, regime, position, REBALANCE_TAG, admission.getViolations());
                }
                return exit(position, regime, ExitReason.REBALANCE, REBALANCE_TAG, snapshot, now);
            }
            case INCREASE -> {
                if (!hasOpenPosition) {
                    return attemptEntry(
                            snapshot, regime, PositionSide.LONG, REBALANCE_TAG, proposal.amount(), portfolio, now);
                }
                if (position.getSide() != PositionSide.LONG) {
                    log.debug("Rebalance increase skipped for {}: open position is short", instrumentId);
                    return Decision.hold(instrumentId, regime, position);
                }
                return attemptRebalanceAdd(snapshot, regime, position, proposal.amount(), portfolio, now);
            }
            default -> throw new IllegalStateException("Unknown rebalance direction " + proposal.direction());
        }
    }

    private Decision attemptRebalanceAdd(
            InstrumentSnapshot snapshot,
            Regime regime,
            Position position,
            BigDecimal amount,
            PortfolioContext portfolio,
            Instant now) {
        PositionSizingContext sizingContext = PositionSizingContext.builder()
                .instrumentId(position.getInstrumentId())
                .category(position.getCategory())
                .totalCapital(portfolio.getTotalCapital())
                .volatility(volatilityOf(snapshot))
                .stopDistance(Math.abs(stopLossConfig.getStaticFloor()))
                .requestedStake(amount)
                .build();

        return riskBudgetLedger.inTransaction(() -> {
            SizingResult sizing = sizingService.size(sizingContext);
            try {
                if (sizing.isDeclined()) {
                    return reject(position.getInstrumentId(), regime, position, REBALANCE_TAG,
                            DecisionType.ENTRY_REJECTED, List.of(declineViolation(sizing)));
                }
                AdmissionResult admission = admissionGate.admitLadder(
                        position.getInstrumentId(),
                        position.getCategory(),
                        sizing.getStake(),
                        sizing.getReservation(),
                        portfolio.getTotalCapital(),
                        portfolio.getDepth());
                if (admission.isRejected()) {
                    return reject(position.getInstrumentId(), regime, position, REBALANCE_TAG,
                            DecisionType.ENTRY_REJECTED, admission.getViolations());
                }

                ReservationId reservationId = sizing.getReservationId();
                riskBudgetLedger.commit(reservationId);
                position.addFill(Fill.rebalance(sizing.getStake(), snapshot.getPrice(), now), reservationId);
                allocationBook.recordIncrease(position.getInstrumentId(), position.getCategory(), sizing.getStake());

                Decision decision = Decision.builder()
                        .instrumentId(position.getInstrumentId())
                        .action(DecisionAction.ENTER)
                        .regime(regime)
                        .side(position.getSide())
                        .stake(sizing.getStake())
                        .stopLevel(position.getStopOffset())
                        .tag(REBALANCE_TAG)
                        .position(position)
                        .build();
                decisionLogger.logAdmitted(decision, DecisionType.ENTRY_ADMITTED, snapshot);
                return decision;
            } finally {
                releaseIfPending(sizing);
            }
        });
    }

    // ========================
    // HELPERS
    // ========================

    private Decision exit(
            Position position,
            Regime regime,
            ExitReason reason,
            String tag,
            InstrumentSnapshot snapshot,
            Instant now) {
        BigDecimal stake = position.getCumulativeStake();
        riskBudgetLedger.inTransaction(() -> {
            for (ReservationId reservationId : position.getReservationIds()) {
                riskBudgetLedger.release(reservationId);
            }
            allocationBook.recordDecrease(position.getInstrumentId(), position.getCategory(), stake, true);
        });
        Double stopOffset = position.getStopOffset();
        position.close(reason, now);

        Decision decision = Decision.builder()
                .instrumentId(position.getInstrumentId())
                .action(DecisionAction.EXIT)
                .regime(regime)
                .side(position.getSide())
                .stake(stake)
                .stopLevel(stopOffset)
                .tag(tag)
                .exitReason(reason)
                .position(position)
                .build();
        decisionLogger.logAdmitted(decision, DecisionType.EXIT_ADMITTED, snapshot);
        log.info("Exit {} on {} ({}), stake {} released", reason, position.getInstrumentId(), tag, stake);
        return decision;
    }

    /** Computes the stop for this tick and stores it on the position when it moved. */
    private void updateStop(Position position, InstrumentSnapshot snapshot, Instant now) {
        StopLossResult result = stopLossCalculator.calculate(position, snapshot, now);
        Double previous = position.getStopLevel();
        if (previous != null && result.stopLevel() == previous) {
            return;
        }
        position.updateStopLevel(result.stopLevel());

        Map<String, Object> candidates = new LinkedHashMap<>();
        candidates.put("staticFloor", result.staticFloor());
        candidates.put("volatility", result.volatilityCandidate());
        candidates.put("trailing", result.trailingCandidate());
        candidates.put("timeDecay", result.timeDecayCandidate());
        candidates.put("fallbackToStatic", result.fallbackToStatic());
        decisionLogger.logStopUpdated(position.getInstrumentId(), previous, result.stopLevel(), candidates);
    }

    private Decision reject(
            String instrumentId,
            Regime regime,
            Position position,
            String tag,
            DecisionType decisionType,
            List<RiskViolation> violations) {
        decisionLogger.logRejected(instrumentId, decisionType, tag, violations);
        metricsService.recordRejection();
        return Decision.rejected(instrumentId, regime, position, tag, violations);
    }

    private RiskViolation declineViolation(SizingResult sizing) {
        if (sizing.getReservation() != null && sizing.getReservation().isDenied()) {
            return RiskViolation.of(RiskViolation.RISK_BUDGET_EXHAUSTED, sizing.getDeclineReason());
        }
        if ("no capital".equals(sizing.getDeclineReason())) {
            return RiskViolation.of(RiskViolation.NO_CAPITAL, sizing.getDeclineReason());
        }
        return RiskViolation.of(RiskViolation.STAKE_TOO_SMALL, sizing.getDeclineReason());
    }

    private void releaseIfPending(SizingResult sizing) {
        ReservationId reservationId = sizing.getReservationId();
        if (reservationId != null && riskBudgetLedger.releaseIfPending(reservationId)) {
            log.debug("Released uncommitted reservation {}", reservationId);
        }
    }

    private void refreshCapital(PortfolioContext portfolio, Instant now) {
        if (portfolio.hasUsableCapital()) {
            riskBudgetLedger.updateTotalCapital(portfolio.getTotalCapital());
            drawdownTracker.observe(portfolio.getTotalCapital(), now);
            emergencyStopGuard.observeCapital(portfolio.getTotalCapital(), now);
        }
    }

    /** Caller-requested liquidation, or an emergency stop configured to close positions. */
    private boolean isEmergency(PortfolioContext portfolio) {
        return portfolio.isEmergencyExit() || emergencyStopGuard.shouldLiquidate();
    }

    private Instant nowOf(PortfolioContext portfolio) {
        return portfolio.getNow() != null ? portfolio.getNow() : clock.instant();
    }

    private static Double volatilityOf(InstrumentSnapshot snapshot) {
        return snapshot.has(IndicatorKeys.VOLATILITY) ? snapshot.require(IndicatorKeys.VOLATILITY) : null;
    }

    private static String instrumentIdOf(InstrumentSnapshot snapshot, Position position) {
        if (snapshot != null && snapshot.getInstrumentId() != null) {
            return snapshot.getInstrumentId();
        }
        return position != null ? position.getInstrumentId() : "unknown";
    }
}
