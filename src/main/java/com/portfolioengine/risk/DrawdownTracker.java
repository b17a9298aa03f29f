package com.portfolioengine.risk;

import com.portfolioengine.event.EventPublisherHelper;
import com.portfolioengine.event.RiskEventType;
import com.portfolioengine.event.RiskLevel;
import com.portfolioengine.observability.DecisionLogger;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Tracks peak total capital, the drawdown from it, and the loss since the start of the UTC
 * trading day.
 *
 * <p>When {@link RiskLimits#getMaxDailyLoss()} is set and the day's loss reaches it, new
 * exposure is paused until {@code dailyLossPause} has passed, or until the next UTC day when
 * no pause length is configured. Open positions keep being managed during the pause. The
 * pause is lifted by the first observation at or after its end.
 *
 * <p>Every instrument evaluation reports capital, so state changes are synchronized; events
 * are published after the lock is released.
 */
@Component
public class DrawdownTracker {

    private static final Logger log = LoggerFactory.getLogger(DrawdownTracker.class);

    private final RiskLimits riskLimits;
    private final EventPublisherHelper eventPublisherHelper;
    private final DecisionLogger decisionLogger;

    private BigDecimal peakCapital = BigDecimal.ZERO;
    private BigDecimal currentCapital = BigDecimal.ZERO;
    private LocalDate tradingDay;
    private BigDecimal dayStartCapital = BigDecimal.ZERO;
    private Instant pausedUntil;

    public DrawdownTracker(
            RiskLimits riskLimits, EventPublisherHelper eventPublisherHelper, DecisionLogger decisionLogger) {
        this.riskLimits = riskLimits;
        this.eventPublisherHelper = eventPublisherHelper;
        this.decisionLogger = decisionLogger;
    }

    public void observe(BigDecimal capital, Instant now) {
        if (capital == null || capital.signum() <= 0) {
            return;
        }
        BigDecimal breachedLoss = null;
        Instant resumedAfter = null;
        Instant pauseEnd;
        synchronized (this) {
            currentCapital = capital;
            peakCapital = peakCapital.max(capital);

            LocalDate day = LocalDate.ofInstant(now, ZoneOffset.UTC);
            if (!day.equals(tradingDay)) {
                tradingDay = day;
                dayStartCapital = capital;
            }

            if (pausedUntil != null && !now.isBefore(pausedUntil)) {
                resumedAfter = pausedUntil;
                pausedUntil = null;
            }

            BigDecimal maxDailyLoss = riskLimits.getMaxDailyLoss();
            if (maxDailyLoss != null && pausedUntil == null) {
                BigDecimal loss = dailyLoss();
                if (loss.compareTo(maxDailyLoss) >= 0) {
                    pausedUntil = pauseEnd(now);
                    breachedLoss = loss;
                }
            }
            pauseEnd = pausedUntil;
        }

        if (resumedAfter != null) {
            log.info("Daily loss pause ended at {}, new exposure allowed", resumedAfter);
            decisionLogger.logTradingResumed("daily_loss", resumedAfter);
        }
        if (breachedLoss != null) {
            decisionLogger.logTradingPaused(
                    "daily_loss", pauseEnd, Map.of("dailyLoss", breachedLoss, "limit", riskLimits.getMaxDailyLoss()));
            eventPublisherHelper.publishRiskEvent(
                    this,
                    RiskEventType.DAILY_LOSS_LIMIT_BREACH,
                    RiskLevel.CRITICAL,
                    "Daily loss limit reached, new exposure paused",
                    Map.of("dailyLoss", breachedLoss, "limit", riskLimits.getMaxDailyLoss(), "resumeAt", pauseEnd));
        }
    }

    /** Drawdown from peak as a fraction (0.12 = 12% below peak); 0 before any capital was observed. */
    public synchronized BigDecimal currentDrawdown() {
        return lossAgainst(peakCapital);
    }

    /** Loss since the start of the trading day as a fraction; 0 when capital grew. */
    public synchronized BigDecimal dailyLoss() {
        return lossAgainst(dayStartCapital);
    }

    public synchronized boolean isTradingPaused() {
        return pausedUntil != null;
    }

    public synchronized Instant getPausedUntil() {
        return pausedUntil;
    }

    public synchronized BigDecimal getPeakCapital() {
        return peakCapital;
    }

    private BigDecimal lossAgainst(BigDecimal reference) {
        if (reference.signum() == 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal loss = BigDecimal.ONE.subtract(currentCapital.divide(reference, 6, RoundingMode.HALF_UP));
        return loss.signum() < 0 ? BigDecimal.ZERO : loss;
    }

    private Instant pauseEnd(Instant now) {
        if (riskLimits.getDailyLossPause() != null) {
            return now.plus(riskLimits.getDailyLossPause());
        }
        return LocalDate.ofInstant(now, ZoneOffset.UTC).plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();
    }
}
