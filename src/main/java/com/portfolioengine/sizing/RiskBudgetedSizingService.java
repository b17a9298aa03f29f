package com.portfolioengine.sizing;

import com.portfolioengine.dca.DcaLadderConfig;
import com.portfolioengine.domain.model.PositionSizingContext;
import com.portfolioengine.event.EventPublisherHelper;
import com.portfolioengine.event.RiskEventType;
import com.portfolioengine.event.RiskLevel;
import com.portfolioengine.observability.DecisionLogger;
import com.portfolioengine.risk.ReservationResult;
import com.portfolioengine.risk.RiskBudgetLedger;
import com.portfolioengine.risk.RiskLimits;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns a raw stake into an order size backed by a ledger reservation.
 *
 * <p>Order of operations:
 * <ol>
 *   <li>raw stake from the configured {@link PositionSizer} (or the requested amount)</li>
 *   <li>initial entries with laddering enabled keep {@code dcaReserveFactor} of it</li>
 *   <li>ladder orders are multiplied by their level's multiplier</li>
 *   <li>clamp into [minStake, capital x maxStakeFraction], then the per-order ceiling and
 *       the position's allocation headroom</li>
 *   <li>reserve stake x assumed adverse move; on denial optionally retry with the stake the
 *       remaining budget supports, otherwise decline</li>
 * </ol>
 * Anything that ends below {@code minStake} is declined rather than sent.
 */
@Service
public class RiskBudgetedSizingService {

    private static final Logger log = LoggerFactory.getLogger(RiskBudgetedSizingService.class);

    private final PositionSizerFactory positionSizerFactory;
    private final PositionSizingConfig positionSizingConfig;
    private final DcaLadderConfig dcaLadderConfig;
    private final RiskBudgetLedger riskBudgetLedger;
    private final RiskLimits riskLimits;
    private final DecisionLogger decisionLogger;
    private final EventPublisherHelper eventPublisherHelper;

    public RiskBudgetedSizingService(
            PositionSizerFactory positionSizerFactory,
            PositionSizingConfig positionSizingConfig,
            DcaLadderConfig dcaLadderConfig,
            RiskBudgetLedger riskBudgetLedger,
            RiskLimits riskLimits,
            DecisionLogger decisionLogger,
            EventPublisherHelper eventPublisherHelper) {
        this.positionSizerFactory = positionSizerFactory;
        this.positionSizingConfig = positionSizingConfig;
        this.dcaLadderConfig = dcaLadderConfig;
        this.riskBudgetLedger = riskBudgetLedger;
        this.riskLimits = riskLimits;
        this.decisionLogger = decisionLogger;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    public SizingResult size(PositionSizingContext context) {
        BigDecimal capital = context.getTotalCapital();
        if (capital == null || capital.signum() <= 0) {
            return SizingResult.declined("no capital", null);
        }

        BigDecimal stake = clamp(proposedStake(context), context);
        if (stake.compareTo(positionSizingConfig.getMinStake()) < 0 || stake.signum() <= 0) {
            log.debug("Stake {} for {} below minimum {}", stake, context.getInstrumentId(), positionSizingConfig.getMinStake());
            return SizingResult.declined("stake below minimum", null);
        }

        ReservationResult reservation = riskBudgetLedger.reserve(riskOf(stake), context.getCategory());
        if (reservation.isGranted()) {
            return SizingResult.sized(stake, reservation, false);
        }

        decisionLogger.logReservationDenied(context.getCategory(), reservation.getRequested(), reservation.getAvailable());
        eventPublisherHelper.publishRiskEvent(
                this,
                RiskEventType.RISK_BUDGET_EXHAUSTED,
                RiskLevel.WARNING,
                "Risk budget cannot cover stake " + stake + " for " + context.getInstrumentId(),
                Map.of("requested", reservation.getRequested(), "available", reservation.getAvailable()));

        if (!positionSizingConfig.isTokenOnDenial()) {
            return SizingResult.declined("risk budget exhausted", reservation);
        }

        BigDecimal affordable = reservation.getAvailable()
                .divide(riskLimits.getAssumedAdverseMove(), 2, RoundingMode.DOWN);
        if (affordable.compareTo(positionSizingConfig.getMinStake()) < 0 || affordable.signum() <= 0) {
            return SizingResult.declined("risk budget exhausted", reservation);
        }

        ReservationResult reduced = riskBudgetLedger.reserve(riskOf(affordable), context.getCategory());
        if (reduced.isDenied()) {
            return SizingResult.declined("risk budget exhausted", reduced);
        }
        log.info("Stake for {} reduced from {} to {} to fit the risk budget", context.getInstrumentId(), stake, affordable);
        return SizingResult.sized(affordable, reduced, true);
    }

    /** Risk reserved for a stake: stake x assumed adverse move. */
    public BigDecimal riskOf(BigDecimal stake) {
        return stake.multiply(riskLimits.getAssumedAdverseMove()).setScale(4, RoundingMode.UP);
    }

    private BigDecimal proposedStake(PositionSizingContext context) {
        BigDecimal stake;
        if (context.getRequestedStake() != null) {
            stake = context.getRequestedStake();
        } else {
            stake = positionSizerFactory.getSizer(positionSizingConfig.getType()).calculateStake(context);
        }

        if (context.isLadderOrder()) {
            stake = stake.multiply(BigDecimal.valueOf(context.getLadderMultiplier()));
        } else if (dcaLadderConfig.isEnabled() && context.getRequestedStake() == null) {
            stake = stake.multiply(positionSizingConfig.getDcaReserveFactor());
        }
        return stake;
    }

    private BigDecimal clamp(BigDecimal stake, PositionSizingContext context) {
        BigDecimal capital = context.getTotalCapital();
        BigDecimal maxStake = capital.multiply(positionSizingConfig.getMaxStakeFraction());
        BigDecimal perOrderCeiling = capital.multiply(positionSizingConfig.getPerOrderCeilingFraction());

        BigDecimal clamped = stake.max(positionSizingConfig.getMinStake()).min(maxStake).min(perOrderCeiling);
        if (context.getAllocationHeadroom() != null) {
            clamped = clamped.min(context.getAllocationHeadroom());
        }
        return clamped.setScale(2, RoundingMode.DOWN);
    }
}
