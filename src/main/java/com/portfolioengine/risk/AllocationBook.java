package com.portfolioengine.risk;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Committed stake per category and per instrument, and the number of open positions.
 *
 * <p>Shares the {@link RiskBudgetLedger} lock, so an entry's position-count check, category
 * ceiling check, reservation and bookkeeping can be applied as one transaction, and the
 * rebalancer reads a table that is consistent with the ledger.
 */
@Component
public class AllocationBook {

    private final RiskBudgetLedger riskBudgetLedger;

    // Guarded by the ledger lock
    private final Map<String, BigDecimal> stakeByCategory = new HashMap<>();
    private final Map<String, Integer> positionsByCategory = new HashMap<>();
    private final Map<String, BigDecimal> stakeByInstrument = new HashMap<>();
    private int openPositions;

    public AllocationBook(RiskBudgetLedger riskBudgetLedger) {
        this.riskBudgetLedger = riskBudgetLedger;
    }

    public void recordOpen(String instrumentId, String category, BigDecimal stake) {
        riskBudgetLedger.inTransaction(() -> {
            stakeByCategory.merge(category, stake, BigDecimal::add);
            stakeByInstrument.merge(instrumentId, stake, BigDecimal::add);
            positionsByCategory.merge(category, 1, Integer::sum);
            openPositions++;
        });
    }

    public void recordIncrease(String instrumentId, String category, BigDecimal stake) {
        riskBudgetLedger.inTransaction(() -> {
            stakeByCategory.merge(category, stake, BigDecimal::add);
            stakeByInstrument.merge(instrumentId, stake, BigDecimal::add);
        });
    }

    /**
     * Removes stake from a category. {@code positionClosed} also decrements the position counts
     * and forgets the instrument.
     */
    public void recordDecrease(String instrumentId, String category, BigDecimal stake, boolean positionClosed) {
        riskBudgetLedger.inTransaction(() -> {
            stakeByCategory.computeIfPresent(category, (k, v) -> {
                BigDecimal remaining = v.subtract(stake);
                return remaining.signum() <= 0 ? null : remaining;
            });
            if (positionClosed) {
                stakeByInstrument.remove(instrumentId);
                positionsByCategory.computeIfPresent(category, (k, v) -> v <= 1 ? null : v - 1);
                openPositions = Math.max(0, openPositions - 1);
            } else {
                stakeByInstrument.computeIfPresent(instrumentId, (k, v) -> {
                    BigDecimal remaining = v.subtract(stake);
                    return remaining.signum() <= 0 ? null : remaining;
                });
            }
        });
    }

    public int getOpenPositionCount() {
        return riskBudgetLedger.inTransaction(() -> openPositions);
    }

    public int getOpenPositionCount(String category) {
        return riskBudgetLedger.inTransaction(() -> positionsByCategory.getOrDefault(category, 0));
    }

    public BigDecimal getCommittedStake(String category) {
        return riskBudgetLedger.inTransaction(() -> stakeByCategory.getOrDefault(category, BigDecimal.ZERO));
    }

    public BigDecimal getTotalCommittedStake() {
        return riskBudgetLedger.inTransaction(
                () -> stakeByCategory.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add));
    }

    /** Copy of committed stake per open instrument. */
    public Map<String, BigDecimal> instrumentStakes() {
        return riskBudgetLedger.inTransaction(() -> new HashMap<>(stakeByInstrument));
    }

    public Set<String> getOpenInstruments() {
        return riskBudgetLedger.inTransaction(() -> Set.copyOf(stakeByInstrument.keySet()));
    }

    /** Copy of committed stake per category. */
    public Map<String, BigDecimal> snapshot() {
        return riskBudgetLedger.inTransaction(() -> new HashMap<>(stakeByCategory));
    }
}
