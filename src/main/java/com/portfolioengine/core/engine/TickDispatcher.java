package com.portfolioengine.core.engine;

import com.portfolioengine.domain.model.Decision;
import com.portfolioengine.domain.model.InstrumentSnapshot;
import com.portfolioengine.domain.model.PortfolioContext;
import com.portfolioengine.domain.model.Position;
import com.portfolioengine.domain.model.RebalanceProposal;
import com.portfolioengine.market.InMemoryMarketDataStore;
import com.portfolioengine.market.OrderBookQuery;
import com.portfolioengine.market.WalletQuery;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Entry point for the snapshot feed: stores each snapshot and evaluates its instrument on
 * the evaluation pool.
 *
 * <p><b>Concurrency model:</b> one {@link InstrumentPipeline} per instrument, created on
 * first sight with computeIfAbsent. Different instruments evaluate in parallel; the same
 * instrument is serialised by its pipeline lock. Lock order is always pipeline first, then
 * the ledger, so rebalance orders routed through here cannot deadlock with ticks.
 *
 * <p>A failing instrument never affects the others: the engine already turns exceptions
 * into HOLD, and anything that still escapes is logged here and yields an empty result.
 */
@Service
public class TickDispatcher {

    private static final Logger log = LoggerFactory.getLogger(TickDispatcher.class);

    private final ConcurrentHashMap<String, InstrumentPipeline> pipelines = new ConcurrentHashMap<>();

    private final DecisionEngine decisionEngine;
    private final InMemoryMarketDataStore marketDataStore;
    private final OrderBookQuery orderBookQuery;
    private final WalletQuery walletQuery;
    private final Executor evaluationExecutor;
    private final Clock clock;

    public TickDispatcher(
            DecisionEngine decisionEngine,
            InMemoryMarketDataStore marketDataStore,
            OrderBookQuery orderBookQuery,
            WalletQuery walletQuery,
            @Qualifier("evaluationExecutor") Executor evaluationExecutor,
            Clock clock) {
        this.decisionEngine = decisionEngine;
        this.marketDataStore = marketDataStore;
        this.orderBookQuery = orderBookQuery;
        this.walletQuery = walletQuery;
        this.evaluationExecutor = evaluationExecutor;
        this.clock = clock;
    }

    // ========================
    // TICKS
    // ========================

    /**
     * Stores the snapshot and schedules its evaluation.
     *
     * @return the decision, or empty when the evaluation itself could not run
     */
    public CompletableFuture<Optional<Decision>> submit(InstrumentSnapshot snapshot) {
        marketDataStore.putSnapshot(snapshot);
        String instrumentId = snapshot.getInstrumentId();
        return CompletableFuture.supplyAsync(() -> Optional.of(evaluateNow(instrumentId, false)), evaluationExecutor)
                .exceptionally(e -> {
                    log.error("Tick for {} failed: {}", instrumentId, e.getMessage(), e);
                    return Optional.empty();
                });
    }

    /** Submits one tick for several instruments and waits for all of them. */
    public Map<String, Decision> submitAll(List<InstrumentSnapshot> snapshots) {
        Map<String, CompletableFuture<Optional<Decision>>> futures = new LinkedHashMap<>();
        for (InstrumentSnapshot snapshot : snapshots) {
            futures.put(snapshot.getInstrumentId(), submit(snapshot));
        }
        CompletableFuture.allOf(futures.values().toArray(CompletableFuture[]::new)).join();

        Map<String, Decision> decisions = new LinkedHashMap<>();
        futures.forEach((instrumentId, future) -> future.join().ifPresent(d -> decisions.put(instrumentId, d)));
        return decisions;
    }

    /** Evaluates an instrument synchronously on the caller's thread against its latest snapshot. */
    public Decision evaluateNow(String instrumentId, boolean emergencyExit) {
        InstrumentSnapshot snapshot = marketDataStore.latest(instrumentId).orElse(null);
        PortfolioContext context = portfolioContext(instrumentId, emergencyExit);
        return pipeline(instrumentId).apply(position -> decisionEngine.evaluate(snapshot, position, context));
    }

    /** Forces an exit on every open position. */
    public List<Decision> liquidateAll() {
        List<Decision> decisions = new ArrayList<>();
        for (String instrumentId : pipelines.keySet()) {
            if (pipeline(instrumentId).read(position -> position != null)) {
                decisions.add(evaluateNow(instrumentId, true));
            }
        }
        log.warn("Liquidated {} positions", decisions.size());
        return decisions;
    }

    // ========================
    // REBALANCE ROUTING
    // ========================

    public Decision applyRebalance(RebalanceProposal proposal, String instrumentId) {
        InstrumentSnapshot snapshot = marketDataStore.latest(instrumentId).orElse(null);
        PortfolioContext context = portfolioContext(instrumentId, false);
        return pipeline(instrumentId)
                .apply(position -> decisionEngine.applyRebalance(proposal, snapshot, position, context));
    }

    /** Instrument holding the largest open stake in the category, if any. */
    public Optional<String> largestPosition(String category) {
        String largest = null;
        BigDecimal largestStake = BigDecimal.ZERO;
        for (InstrumentPipeline pipeline : pipelines.values()) {
            BigDecimal stake = pipeline.read(position -> position != null && category.equals(position.getCategory())
                    ? position.getCumulativeStake()
                    : BigDecimal.ZERO);
            if (stake.compareTo(largestStake) > 0) {
                largest = pipeline.getInstrumentId();
                largestStake = stake;
            }
        }
        return Optional.ofNullable(largest);
    }

    // ========================
    // QUERIES
    // ========================

    public Optional<Position> getPosition(String instrumentId) {
        InstrumentPipeline pipeline = pipelines.get(instrumentId);
        return pipeline == null ? Optional.empty() : Optional.ofNullable(pipeline.read(position -> position));
    }

    public List<Position> getOpenPositions() {
        return pipelines.values().stream()
                .map(pipeline -> pipeline.read(position -> position))
                .filter(position -> position != null)
                .sorted(Comparator.comparing(Position::getInstrumentId))
                .toList();
    }

    public Optional<Decision> getLastDecision(String instrumentId) {
        InstrumentPipeline pipeline = pipelines.get(instrumentId);
        return pipeline == null ? Optional.empty() : pipeline.getLastDecision();
    }

    private InstrumentPipeline pipeline(String instrumentId) {
        return pipelines.computeIfAbsent(instrumentId, InstrumentPipeline::new);
    }

    private PortfolioContext portfolioContext(String instrumentId, boolean emergencyExit) {
        return PortfolioContext.builder()
                .totalCapital(walletQuery.totalCapital())
                .depth(orderBookQuery.depth(instrumentId).orElse(null))
                .now(clock.instant())
                .emergencyExit(emergencyExit)
                .build();
    }
}
