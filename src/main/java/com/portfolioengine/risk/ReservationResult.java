package com.portfolioengine.risk;

import java.math.BigDecimal;
import lombok.Getter;

/**
 * Outcome of {@link RiskBudgetLedger#reserve}. Either GRANTED with a reservation id, or
 * INSUFFICIENT_BUDGET carrying the budget that was still available at the time.
 *
 * <p>Denial is a normal result, never an exception: the caller simply does not trade.
 */
@Getter
public class ReservationResult {

    private final boolean granted;
    private final ReservationId reservationId;
    private final BigDecimal requested;
    private final BigDecimal available;

    private ReservationResult(
            boolean granted, ReservationId reservationId, BigDecimal requested, BigDecimal available) {
        this.granted = granted;
        this.reservationId = reservationId;
        this.requested = requested;
        this.available = available;
    }

    public static ReservationResult granted(ReservationId reservationId, BigDecimal requested, BigDecimal available) {
        return new ReservationResult(true, reservationId, requested, available);
    }

    public static ReservationResult insufficientBudget(BigDecimal requested, BigDecimal available) {
        return new ReservationResult(false, null, requested, available);
    }

    public boolean isDenied() {
        return !granted;
    }
}
