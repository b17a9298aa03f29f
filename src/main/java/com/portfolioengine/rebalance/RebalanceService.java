package com.portfolioengine.rebalance;

import com.portfolioengine.core.engine.TickDispatcher;
import com.portfolioengine.domain.enums.RebalanceDirection;
import com.portfolioengine.domain.model.CategoryAllocation;
import com.portfolioengine.domain.model.Decision;
import com.portfolioengine.domain.model.InstrumentSnapshot;
import com.portfolioengine.domain.model.RebalanceProposal;
import com.portfolioengine.event.EventPublisherHelper;
import com.portfolioengine.market.SnapshotProvider;
import com.portfolioengine.market.WalletQuery;
import com.portfolioengine.risk.AllocationBook;
import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Runs the rebalance cycle on its own cadence, independent of ticks.
 *
 * <p>Each cycle reads the allocation book (under the ledger lock), asks the
 * {@link PortfolioRebalancer} for proposals and routes every proposal through
 * {@link TickDispatcher} so it is evaluated by the same engine, ledger and admission gate as
 * an organic signal. Increases go to the category's existing position or its first
 * configured instrument with market data; decreases close the category's largest position.
 *
 * <p>Overlapping cycles are skipped rather than queued.
 */
@Service
public class RebalanceService {

    private static final Logger log = LoggerFactory.getLogger(RebalanceService.class);

    private final PortfolioRebalancer portfolioRebalancer;
    private final RebalanceConfig rebalanceConfig;
    private final AllocationBook allocationBook;
    private final TickDispatcher tickDispatcher;
    private final SnapshotProvider snapshotProvider;
    private final WalletQuery walletQuery;
    private final EventPublisherHelper eventPublisherHelper;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public RebalanceService(
            PortfolioRebalancer portfolioRebalancer,
            RebalanceConfig rebalanceConfig,
            AllocationBook allocationBook,
            TickDispatcher tickDispatcher,
            SnapshotProvider snapshotProvider,
            WalletQuery walletQuery,
            EventPublisherHelper eventPublisherHelper) {
        this.portfolioRebalancer = portfolioRebalancer;
        this.rebalanceConfig = rebalanceConfig;
        this.allocationBook = allocationBook;
        this.tickDispatcher = tickDispatcher;
        this.snapshotProvider = snapshotProvider;
        this.walletQuery = walletQuery;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    @Scheduled(
            fixedDelayString = "${engine.rebalance.interval-ms:86400000}",
            initialDelayString = "${engine.rebalance.initial-delay-ms:60000}")
    public void scheduledCycle() {
        if (!rebalanceConfig.isEnabled()) {
            return;
        }
        runCycle();
    }

    /**
     * Runs one cycle now. Public so operators and tests can trigger it outside the schedule.
     *
     * @return the decisions produced by the routed proposals
     */
    public List<Decision> runCycle() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Rebalance cycle already running, skipping");
            return List.of();
        }
        try {
            BigDecimal totalCapital = walletQuery.totalCapital();
            if (totalCapital == null || totalCapital.signum() <= 0) {
                log.info("Rebalance skipped: no capital");
                return List.of();
            }

            List<CategoryAllocation> table =
                    portfolioRebalancer.buildAllocationTable(allocationBook.snapshot(), totalCapital);

            Map<String, String> instruments = new HashMap<>();
            Map<String, InstrumentSnapshot> snapshots = new HashMap<>();
            for (CategoryAllocation allocation : table) {
                representativeInstrument(allocation.category()).ifPresent(instrumentId -> {
                    instruments.put(allocation.category(), instrumentId);
                    snapshotProvider.latest(instrumentId).ifPresent(s -> snapshots.put(allocation.category(), s));
                });
            }

            List<RebalanceProposal> proposals = portfolioRebalancer.propose(table, totalCapital, snapshots);
            List<Decision> decisions = proposals.stream()
                    .map(proposal -> route(proposal, instruments.get(proposal.category())))
                    .flatMap(Optional::stream)
                    .toList();
            int admitted = (int) decisions.stream().filter(Decision::isActionable).count();

            log.info("Rebalance cycle: {} proposals, {} admitted", proposals.size(), admitted);
            eventPublisherHelper.publishRebalanceCycle(this, proposals, admitted);
            return decisions;
        } finally {
            running.set(false);
        }
    }

    private Optional<Decision> route(RebalanceProposal proposal, String instrumentId) {
        if (proposal.direction() == RebalanceDirection.DECREASE) {
            instrumentId = tickDispatcher.largestPosition(proposal.category()).orElse(null);
        }
        if (instrumentId == null) {
            log.debug("No instrument to apply {} rebalance of {}", proposal.direction(), proposal.category());
            return Optional.empty();
        }
        return Optional.of(tickDispatcher.applyRebalance(proposal, instrumentId));
    }

    /** Existing largest position of the category, else its first configured instrument with data. */
    private Optional<String> representativeInstrument(String category) {
        Optional<String> held = tickDispatcher.largestPosition(category);
        if (held.isPresent()) {
            return held;
        }
        return rebalanceConfig.getCategoryInstruments().getOrDefault(category, List.of()).stream()
                .filter(instrumentId -> snapshotProvider.latest(instrumentId).isPresent())
                .findFirst();
    }
}
