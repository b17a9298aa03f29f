package com.portfolioengine.risk;

import com.portfolioengine.event.EventPublisherHelper;
import com.portfolioengine.event.RiskEventType;
import com.portfolioengine.event.RiskLevel;
import com.portfolioengine.observability.DecisionLogger;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Trips a portfolio-wide emergency stop on a market or portfolio crash.
 *
 * <p>Two triggers, each measured from the highest sample inside a sliding window:
 * <ul>
 *   <li>the benchmark instrument falls by {@code benchmarkDrop} within {@code benchmarkWindow}</li>
 *   <li>total capital falls by {@code portfolioDrop} within {@code portfolioWindow}</li>
 * </ul>
 * While active, the admission gate refuses new exposure, and open positions are liquidated
 * when {@code closeAllPositions} is set. The stop lifts itself with the first observation
 * after {@code pauseDuration}, or through {@link #resume()}. Both histories are cleared when
 * the stop trips so the same crash cannot trip it again right after it lifts.
 */
@Component
public class EmergencyStopGuard {

    private static final Logger log = LoggerFactory.getLogger(EmergencyStopGuard.class);

    private final EmergencyStopConfig emergencyStopConfig;
    private final EventPublisherHelper eventPublisherHelper;
    private final DecisionLogger decisionLogger;

    // Guarded by this
    private final Deque<Sample> benchmarkHistory = new ArrayDeque<>();
    private final Deque<Sample> capitalHistory = new ArrayDeque<>();
    private Instant activeUntil;
    private String activeReason;

    public EmergencyStopGuard(
            EmergencyStopConfig emergencyStopConfig,
            EventPublisherHelper eventPublisherHelper,
            DecisionLogger decisionLogger) {
        this.emergencyStopConfig = emergencyStopConfig;
        this.eventPublisherHelper = eventPublisherHelper;
        this.decisionLogger = decisionLogger;
    }

    // ========================
    // OBSERVATIONS
    // ========================

    /** Records a price of the benchmark instrument; prices of other instruments are ignored. */
    public void observeBenchmark(String instrumentId, double price, Instant now) {
        if (!emergencyStopConfig.isEnabled()
                || !(price > 0)
                || !emergencyStopConfig.getBenchmarkInstrument().equalsIgnoreCase(instrumentId)) {
            return;
        }
        observe("benchmark_crash", benchmarkHistory, price, now,
                emergencyStopConfig.getBenchmarkWindow(), emergencyStopConfig.getBenchmarkDrop());
    }

    public void observeCapital(BigDecimal capital, Instant now) {
        if (!emergencyStopConfig.isEnabled() || capital == null || capital.signum() <= 0) {
            return;
        }
        observe("portfolio_crash", capitalHistory, capital.doubleValue(), now,
                emergencyStopConfig.getPortfolioWindow(), emergencyStopConfig.getPortfolioDrop());
    }

    private void observe(String trigger, Deque<Sample> history, double value, Instant now, Duration window, double maxDrop) {
        Transition transition;
        synchronized (this) {
            transition = liftIfExpired(now);

            history.addLast(new Sample(now, value));
            Instant horizon = now.minus(window);
            while (!history.isEmpty() && history.peekFirst().at().isBefore(horizon)) {
                history.removeFirst();
            }
            double high = history.stream().mapToDouble(Sample::value).max().orElse(value);
            double drop = 1 - value / high;

            if (activeUntil == null && drop >= maxDrop) {
                activeUntil = now.plus(emergencyStopConfig.getPauseDuration());
                activeReason = trigger;
                benchmarkHistory.clear();
                capitalHistory.clear();
                transition = new Transition(transition.resumedAfter(), trigger, drop, activeUntil);
            }
        }
        publish(transition, maxDrop);
    }

    // ========================
    // STATE
    // ========================

    public synchronized boolean isActive() {
        return activeUntil != null;
    }

    /** True while the stop is active and configured to close open positions. */
    public synchronized boolean shouldLiquidate() {
        return activeUntil != null && emergencyStopConfig.isCloseAllPositions();
    }

    public synchronized Instant getActiveUntil() {
        return activeUntil;
    }

    public synchronized String getActiveReason() {
        return activeReason;
    }

    /** Lifts an active stop before its pause has run out. */
    public void resume() {
        Instant endedPause;
        synchronized (this) {
            endedPause = activeUntil;
            activeUntil = null;
            activeReason = null;
        }
        if (endedPause != null) {
            log.warn("Emergency stop lifted manually, pause would have ended at {}", endedPause);
            decisionLogger.logTradingResumed("emergency_stop", endedPause);
        }
    }

    private Transition liftIfExpired(Instant now) {
        if (activeUntil != null && !now.isBefore(activeUntil)) {
            Instant ended = activeUntil;
            activeUntil = null;
            activeReason = null;
            return new Transition(ended, null, 0, null);
        }
        return Transition.NONE;
    }

    private void publish(Transition transition, double maxDrop) {
        if (transition.resumedAfter() != null) {
            log.info("Emergency stop lifted after pause ending {}", transition.resumedAfter());
            decisionLogger.logTradingResumed("emergency_stop", transition.resumedAfter());
        }
        if (transition.trigger() != null) {
            Map<String, Object> details = Map.of(
                    "trigger", transition.trigger(), "drop", transition.drop(), "limit", maxDrop);
            decisionLogger.logTradingPaused("emergency_stop", transition.activeUntil(), details);
            eventPublisherHelper.publishRiskEvent(
                    this,
                    RiskEventType.EMERGENCY_STOP_TRIGGERED,
                    RiskLevel.CRITICAL,
                    "Emergency stop tripped by " + transition.trigger(),
                    Map.of("trigger", transition.trigger(), "drop", transition.drop(),
                            "resumeAt", transition.activeUntil(),
                            "closeAllPositions", emergencyStopConfig.isCloseAllPositions()));
        }
    }

    private record Sample(Instant at, double value) {}

    private record Transition(Instant resumedAfter, String trigger, double drop, Instant activeUntil) {
        static final Transition NONE = new Transition(null, null, 0, null);
    }
}
