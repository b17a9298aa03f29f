package com.portfolioengine.sizing;

import com.portfolioengine.risk.ReservationId;
import com.portfolioengine.risk.ReservationResult;
import java.math.BigDecimal;
import lombok.Getter;

/**
 * Stake decided for one order together with the ledger reservation that backs it.
 *
 * <p>A declined result carries a zero stake; its {@code reservation} is the denied ledger
 * response when the ledger was the reason, or null when the order was too small to send.
 */
@Getter
public class SizingResult {

    private final BigDecimal stake;
    private final ReservationResult reservation;
    private final boolean reduced;
    private final String declineReason;

    private SizingResult(BigDecimal stake, ReservationResult reservation, boolean reduced, String declineReason) {
        this.stake = stake;
        this.reservation = reservation;
        this.reduced = reduced;
        this.declineReason = declineReason;
    }

    public static SizingResult sized(BigDecimal stake, ReservationResult reservation, boolean reduced) {
        return new SizingResult(stake, reservation, reduced, null);
    }

    public static SizingResult declined(String reason, ReservationResult reservation) {
        return new SizingResult(BigDecimal.ZERO, reservation, false, reason);
    }

    public boolean isDeclined() {
        return declineReason != null;
    }

    public ReservationId getReservationId() {
        return reservation != null && reservation.isGranted() ? reservation.getReservationId() : null;
    }
}
