package com.portfolioengine.risk;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Getter;

/**
 * An amount of risk budget held against the ledger ceiling.
 *
 * <p>A reservation starts PENDING while the tick that requested it is still deciding, and
 * becomes COMMITTED once the order it covers is admitted. Pending reservations never
 * outlive their tick.
 */
@Getter
public class Reservation {

    public enum State {
        PENDING,
        COMMITTED
    }

    private final ReservationId id;
    private final String category;
    private BigDecimal amount;
    private final Instant createdAt;
    private volatile State state = State.PENDING;

    Reservation(ReservationId id, String category, BigDecimal amount, Instant createdAt) {
        this.id = id;
        this.category = category;
        this.amount = amount;
        this.createdAt = createdAt;
    }

    /** Mutated only under the ledger lock. */
    void shrinkTo(BigDecimal remaining) {
        this.amount = remaining;
    }

    void commit() {
        this.state = State.COMMITTED;
    }

    public boolean isPending() {
        return state == State.PENDING;
    }
}
