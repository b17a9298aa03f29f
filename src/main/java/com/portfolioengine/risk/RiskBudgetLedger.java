package com.portfolioengine.risk;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Process-wide risk budget: the only portfolio state shared between instrument pipelines.
 *
 * <p>Invariant: the sum of active reservations never exceeds
 * {@code totalCapital x maxTotalRisk}. Every read-check-write sequence runs while holding
 * {@link #lock}, so two instruments can never both pass a check that only one of them can
 * satisfy. The lock is reentrant; callers that must combine a reservation with other
 * portfolio checks (position count, category ceilings in {@link AllocationBook}) wrap the
 * whole sequence in {@link #inTransaction(Supplier)}.
 *
 * <p>When total capital shrinks below what is already reserved, existing reservations are
 * kept and every new request is denied until enough risk is released.
 */
@Component
public class RiskBudgetLedger {

    private static final Logger log = LoggerFactory.getLogger(RiskBudgetLedger.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final BigDecimal maxTotalRisk;
    private final Clock clock;

    // Guarded by lock
    private final Map<ReservationId, Reservation> reservations = new LinkedHashMap<>();
    private final Map<String, BigDecimal> reservedByCategory = new HashMap<>();
    private BigDecimal totalCapital = BigDecimal.ZERO;
    private BigDecimal reservedRisk = BigDecimal.ZERO;

    public RiskBudgetLedger(RiskLimits riskLimits, Clock clock) {
        this.maxTotalRisk = riskLimits.getMaxTotalRisk();
        this.clock = clock;
    }

    // ========================
    // RESERVATIONS
    // ========================

    /**
     * Atomically checks the budget and, if it allows, records a pending reservation.
     *
     * @param amount risk amount (stake x assumed adverse move), must be positive
     * @param category category the stake belongs to
     * @return GRANTED with the new id, or INSUFFICIENT_BUDGET with what is still available
     */
    public ReservationResult reserve(BigDecimal amount, String category) {
        if (amount == null || amount.signum() <= 0) {
            return ReservationResult.insufficientBudget(amount, availableBudget());
        }
        lock.lock();
        try {
            BigDecimal available = availableBudgetLocked();
            if (amount.compareTo(available) > 0) {
                log.debug("Reservation of {} for {} denied, available {}", amount, category, available);
                return ReservationResult.insufficientBudget(amount, available);
            }
            ReservationId id = ReservationId.next();
            reservations.put(id, new Reservation(id, category, amount, clock.instant()));
            reservedRisk = reservedRisk.add(amount);
            reservedByCategory.merge(category, amount, BigDecimal::add);
            return ReservationResult.granted(id, amount, available.subtract(amount));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks a pending reservation as consumed by an admitted order.
     *
     * @throws IllegalStateException if the reservation does not exist
     */
    public void commit(ReservationId id) {
        lock.lock();
        try {
            Reservation reservation = reservations.get(id);
            if (reservation == null) {
                throw new IllegalStateException("Unknown reservation " + id);
            }
            reservation.commit();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the reserved risk to the budget. Releasing an unknown or already released id
     * is a no-op so cleanup paths can call this unconditionally.
     *
     * @return true if a reservation was removed
     */
    public boolean release(ReservationId id) {
        if (id == null) {
            return false;
        }
        lock.lock();
        try {
            Reservation reservation = reservations.remove(id);
            if (reservation == null) {
                return false;
            }
            reservedRisk = reservedRisk.subtract(reservation.getAmount());
            reservedByCategory.computeIfPresent(reservation.getCategory(), (k, v) -> {
                BigDecimal remaining = v.subtract(reservation.getAmount());
                return remaining.signum() <= 0 ? null : remaining;
            });
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Keeps {@code keepRatio} of a reservation and returns the rest to the budget, for
     * positions that are partly closed. A ratio of zero releases the reservation.
     *
     * @return the amount returned to the budget; zero for an unknown id
     */
    public BigDecimal shrink(ReservationId id, BigDecimal keepRatio) {
        if (keepRatio == null || keepRatio.signum() < 0 || keepRatio.compareTo(BigDecimal.ONE) > 0) {
            throw new IllegalArgumentException("Keep ratio must be within [0, 1], got " + keepRatio);
        }
        if (id == null) {
            return BigDecimal.ZERO;
        }
        lock.lock();
        try {
            Reservation reservation = reservations.get(id);
            if (reservation == null) {
                return BigDecimal.ZERO;
            }
            BigDecimal amount = reservation.getAmount();
            BigDecimal kept = amount.multiply(keepRatio, MathContext.DECIMAL64);
            if (kept.signum() == 0) {
                release(id);
                return amount;
            }
            BigDecimal returned = amount.subtract(kept);
            reservation.shrinkTo(kept);
            reservedRisk = reservedRisk.subtract(returned);
            reservedByCategory.computeIfPresent(reservation.getCategory(), (k, v) -> {
                BigDecimal remaining = v.subtract(returned);
                return remaining.signum() <= 0 ? null : remaining;
            });
            log.debug("Reservation {} shrunk to {}, {} returned", id, kept, returned);
            return returned;
        } finally {
            lock.unlock();
        }
    }

    /** Releases the reservation only if it was never committed. */
    public boolean releaseIfPending(ReservationId id) {
        if (id == null) {
            return false;
        }
        lock.lock();
        try {
            Reservation reservation = reservations.get(id);
            return reservation != null && reservation.isPending() && release(id);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs the action while holding the ledger lock. Everything the action does against the
     * ledger and the allocation book is observed by other threads as one step.
     */
    public <T> T inTransaction(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void inTransaction(Runnable action) {
        inTransaction(() -> {
            action.run();
            return null;
        });
    }

    // ========================
    // CAPITAL
    // ========================

    public void updateTotalCapital(BigDecimal capital) {
        lock.lock();
        try {
            BigDecimal next = capital != null && capital.signum() > 0 ? capital : BigDecimal.ZERO;
            if (next.compareTo(totalCapital) != 0) {
                log.debug("Ledger capital updated {} -> {}", totalCapital, next);
            }
            totalCapital = next;
        } finally {
            lock.unlock();
        }
    }

    // ========================
    // QUERIES
    // ========================

    /** Reserved risk as a fraction of the risk ceiling, 0 when there is no capital. */
    public double currentUtilization() {
        lock.lock();
        try {
            BigDecimal ceiling = ceilingLocked();
            if (ceiling.signum() == 0) {
                return reservedRisk.signum() == 0 ? 0.0 : 1.0;
            }
            return reservedRisk.divide(ceiling, 6, RoundingMode.HALF_UP).doubleValue();
        } finally {
            lock.unlock();
        }
    }

    public BigDecimal availableBudget() {
        lock.lock();
        try {
            return availableBudgetLocked();
        } finally {
            lock.unlock();
        }
    }

    public BigDecimal getReservedRisk() {
        lock.lock();
        try {
            return reservedRisk;
        } finally {
            lock.unlock();
        }
    }

    public BigDecimal getReservedRisk(String category) {
        lock.lock();
        try {
            return reservedByCategory.getOrDefault(category, BigDecimal.ZERO);
        } finally {
            lock.unlock();
        }
    }

    public BigDecimal getCeiling() {
        lock.lock();
        try {
            return ceilingLocked();
        } finally {
            lock.unlock();
        }
    }

    public BigDecimal getTotalCapital() {
        lock.lock();
        try {
            return totalCapital;
        } finally {
            lock.unlock();
        }
    }

    public List<Reservation> getActiveReservations() {
        lock.lock();
        try {
            return new ArrayList<>(reservations.values());
        } finally {
            lock.unlock();
        }
    }

    public BigDecimal getMaxTotalRisk() {
        return maxTotalRisk;
    }

    private BigDecimal ceilingLocked() {
        return totalCapital.multiply(maxTotalRisk);
    }

    private BigDecimal availableBudgetLocked() {
        BigDecimal available = ceilingLocked().subtract(reservedRisk);
        return available.signum() < 0 ? BigDecimal.ZERO : available;
    }
}
