package com.portfolioengine.observability;

import com.portfolioengine.domain.model.Decision;
import com.portfolioengine.event.DecisionEvent;
import com.portfolioengine.event.RebalanceEvent;
import com.portfolioengine.event.RiskEvent;
import com.portfolioengine.risk.AllocationBook;
import com.portfolioengine.risk.RiskBudgetLedger;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.function.Supplier;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Registers and updates the engine's Micrometer meters:
 * <ul>
 *   <li><b>engine.decisions</b> (counter, tag action): admitted ENTER / LADDER / EXIT decisions</li>
 *   <li><b>engine.decisions.rejected</b> (counter): proposals refused by the admission gate</li>
 *   <li><b>engine.evaluation.failures</b> (counter): ticks that degraded to no action</li>
 *   <li><b>engine.risk.events</b> (counter, tag type)</li>
 *   <li><b>engine.rebalance.proposals</b> (counter)</li>
 *   <li><b>engine.evaluation.latency</b> (timer)</li>
 *   <li><b>engine.ledger.utilization</b> and <b>engine.positions.open</b> (gauges)</li>
 * </ul>
 */
@Service
public class EngineMetricsService {

    private final MeterRegistry meterRegistry;
    private final Counter rejectedCounter;
    private final Counter failureCounter;
    private final Counter rebalanceProposalCounter;
    private final Timer evaluationTimer;

    public EngineMetricsService(
            MeterRegistry meterRegistry, RiskBudgetLedger riskBudgetLedger, AllocationBook allocationBook) {
        this.meterRegistry = meterRegistry;

        this.rejectedCounter = Counter.builder("engine.decisions.rejected")
                .description("Proposals refused by the admission gate")
                .register(meterRegistry);

        this.failureCounter = Counter.builder("engine.evaluation.failures")
                .description("Evaluations that threw and degraded to no action")
                .register(meterRegistry);

        this.rebalanceProposalCounter = Counter.builder("engine.rebalance.proposals")
                .description("Rebalance proposals produced")
                .register(meterRegistry);

        this.evaluationTimer = Timer.builder("engine.evaluation.latency")
                .description("Time to evaluate one instrument tick")
                .publishPercentiles(0.5, 0.95, 0.99)
                .maximumExpectedValue(Duration.ofSeconds(1))
                .register(meterRegistry);

        meterRegistry.gauge("engine.ledger.utilization", riskBudgetLedger, RiskBudgetLedger::currentUtilization);
        meterRegistry.gauge("engine.positions.open", allocationBook, AllocationBook::getOpenPositionCount);
    }

    public <T> T timeEvaluation(Supplier<T> evaluation) {
        return evaluationTimer.record(evaluation);
    }

    public void recordRejection() {
        rejectedCounter.increment();
    }

    public void recordFailure() {
        failureCounter.increment();
    }

    @EventListener
    @Order(20)
    public void onDecision(DecisionEvent event) {
        Decision decision = event.getDecision();
        String action = decision.isPartialExit() ? "PARTIAL_EXIT" : decision.getAction().name();
        meterRegistry.counter("engine.decisions", "action", action).increment();
    }

    @EventListener
    @Order(20)
    public void onRiskEvent(RiskEvent event) {
        meterRegistry.counter("engine.risk.events", "type", event.getEventType().name()).increment();
    }

    @EventListener
    @Order(20)
    public void onRebalanceCycle(RebalanceEvent event) {
        rebalanceProposalCounter.increment(event.getProposals().size());
    }
}
