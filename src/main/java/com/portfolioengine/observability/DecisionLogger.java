package com.portfolioengine.observability;

import com.portfolioengine.domain.enums.DecisionOutcome;
import com.portfolioengine.domain.enums.DecisionSeverity;
import com.portfolioengine.domain.enums.DecisionSource;
import com.portfolioengine.domain.enums.DecisionType;
import com.portfolioengine.domain.model.Decision;
import com.portfolioengine.domain.model.DecisionRecord;
import com.portfolioengine.domain.model.InstrumentSnapshot;
import com.portfolioengine.domain.model.RebalanceProposal;
import com.portfolioengine.event.DecisionLogEvent;
import com.portfolioengine.risk.RiskViolation;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Structured log of every decision the engine takes or refuses.
 *
 * <p>Records go into an in-memory ring buffer of the last {@value #RING_BUFFER_SIZE}
 * entries (newest first) and are published as {@link DecisionLogEvent}. WARNING and
 * CRITICAL records are also written to the application log, which is the only place
 * per-tick errors surface.
 */
@Service
public class DecisionLogger {

    private static final Logger logger = LoggerFactory.getLogger(DecisionLogger.class);

    static final int RING_BUFFER_SIZE = 1000;

    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;

    private final ConcurrentLinkedDeque<DecisionRecord> ringBuffer = new ConcurrentLinkedDeque<>();

    public DecisionLogger(ApplicationEventPublisher applicationEventPublisher, Clock clock) {
        this.applicationEventPublisher = applicationEventPublisher;
        this.clock = clock;
    }

    // ---- Core logging method ----

    public DecisionRecord log(
            DecisionSource source,
            String subject,
            DecisionType decisionType,
            DecisionOutcome outcome,
            String reasoning,
            Map<String, Object> dataContext,
            DecisionSeverity severity) {

        DecisionRecord decisionRecord = DecisionRecord.builder()
                .timestamp(clock.instant())
                .source(source)
                .subject(subject)
                .decisionType(decisionType)
                .outcome(outcome)
                .reasoning(reasoning)
                .dataContext(dataContext)
                .severity(severity)
                .build();

        if (severity == DecisionSeverity.WARNING) {
            logger.warn("[{}] {} {}: {}", source, decisionType, subject, reasoning);
        } else if (severity == DecisionSeverity.CRITICAL) {
            logger.error("[{}] {} {}: {}", source, decisionType, subject, reasoning);
        }

        persist(decisionRecord);
        return decisionRecord;
    }

    // ---- Engine decisions ----

    /**
     * Logs an admitted decision together with the snapshot values it was based on.
     */
    public void logAdmitted(Decision decision, DecisionType decisionType, InstrumentSnapshot snapshot) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("action", decision.getAction());
        context.put("regime", decision.getRegime());
        context.put("stake", decision.getStake());
        context.put("stopLevel", decision.getStopLevel());
        if (decision.getExitReason() != null) {
            context.put("exitReason", decision.getExitReason());
        }
        if (snapshot != null) {
            context.put("price", snapshot.getPrice());
            context.put("indicators", snapshot.getIndicators());
        }

        log(
                DecisionSource.DECISION_ENGINE,
                decision.getInstrumentId(),
                decisionType,
                DecisionOutcome.TRIGGERED,
                decision.getAction() + " " + decision.getTag(),
                context,
                DecisionSeverity.INFO);
    }

    /**
     * Logs a proposal refused by the admission gate.
     */
    public void logRejected(
            String instrumentId, DecisionType decisionType, String tag, List<RiskViolation> violations) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("tag", tag);
        context.put("violations", violations.stream().map(RiskViolation::toString).toList());

        log(
                DecisionSource.ADMISSION_GATE,
                instrumentId,
                decisionType,
                DecisionOutcome.REJECTED,
                violations.isEmpty() ? "rejected" : violations.get(0).toString(),
                context,
                decisionType == DecisionType.EXIT_DELAYED ? DecisionSeverity.DEBUG : DecisionSeverity.INFO);
    }

    public void logReservationDenied(String category, BigDecimal requested, BigDecimal available) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("requested", requested);
        context.put("available", available);

        log(
                DecisionSource.RISK_LEDGER,
                category,
                DecisionType.RESERVATION_DENIED,
                DecisionOutcome.REJECTED,
                "Risk budget cannot cover " + requested,
                context,
                DecisionSeverity.WARNING);
    }

    public void logStopUpdated(String instrumentId, Double previous, double current, Map<String, Object> candidates) {
        Map<String, Object> context = new LinkedHashMap<>(candidates);
        context.put("previous", previous);
        context.put("current", current);

        log(
                DecisionSource.STOP_LOSS,
                instrumentId,
                DecisionType.STOP_UPDATED,
                DecisionOutcome.INFO,
                "Stop moved to " + current,
                context,
                DecisionSeverity.DEBUG);
    }

    // ---- Trading pauses ----

    /**
     * Logs a portfolio-wide pause of new exposure (daily loss limit, emergency stop).
     */
    public void logTradingPaused(String reason, Instant resumeAt, Map<String, Object> details) {
        Map<String, Object> context = new LinkedHashMap<>(details);
        context.put("resumeAt", resumeAt);

        log(
                DecisionSource.SYSTEM,
                reason,
                DecisionType.TRADING_PAUSED,
                DecisionOutcome.TRIGGERED,
                "New exposure paused until " + resumeAt,
                context,
                DecisionSeverity.CRITICAL);
    }

    public void logTradingResumed(String reason, Instant pausedUntil) {
        log(
                DecisionSource.SYSTEM,
                reason,
                DecisionType.TRADING_RESUMED,
                DecisionOutcome.INFO,
                "Pause ended at " + pausedUntil,
                Map.of("pausedUntil", pausedUntil),
                DecisionSeverity.INFO);
    }

    // ---- Rebalance ----

    public void logRebalance(RebalanceProposal proposal, boolean proposed, String reasoning) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("direction", proposal.direction());
        context.put("amount", proposal.amount());
        context.put("drift", proposal.drift());
        context.put("reason", proposal.reason());

        log(
                DecisionSource.REBALANCER,
                proposal.category(),
                proposed ? DecisionType.REBALANCE_PROPOSED : DecisionType.REBALANCE_SKIPPED,
                proposed ? DecisionOutcome.TRIGGERED : DecisionOutcome.SKIPPED,
                reasoning,
                context,
                DecisionSeverity.INFO);
    }

    // ---- Failures ----

    /**
     * Logs a tick that threw. The tick's user-visible effect is "no action".
     */
    public void logFailure(String instrumentId, Exception exception) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("exception", exception.getClass().getSimpleName());

        log(
                DecisionSource.DECISION_ENGINE,
                instrumentId,
                DecisionType.EVALUATION_FAILED,
                DecisionOutcome.FAILED,
                String.valueOf(exception.getMessage()),
                context,
                DecisionSeverity.WARNING);
    }

    // ---- Ring buffer queries ----

    public List<DecisionRecord> getRecentDecisions(int count) {
        return ringBuffer.stream().limit(count).toList();
    }

    public List<DecisionRecord> getRecentDecisions(int count, DecisionType decisionType) {
        return ringBuffer.stream()
                .filter(r -> r.getDecisionType() == decisionType)
                .limit(count)
                .toList();
    }

    public int getBufferSize() {
        return ringBuffer.size();
    }

    // ---- Internal ----

    private void persist(DecisionRecord decisionRecord) {
        ringBuffer.addFirst(decisionRecord);
        while (ringBuffer.size() > RING_BUFFER_SIZE) {
            ringBuffer.removeLast();
        }

        try {
            applicationEventPublisher.publishEvent(new DecisionLogEvent(this, decisionRecord));
        } catch (Exception e) {
            // Publishing must never fail the evaluation path
            logger.error("Failed to publish DecisionLogEvent: {}", e.getMessage());
        }
    }
}
