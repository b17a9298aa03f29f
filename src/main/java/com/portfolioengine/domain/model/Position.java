package com.portfolioengine.domain.model;

import com.portfolioengine.domain.enums.ExitReason;
import com.portfolioengine.domain.enums.PositionSide;
import com.portfolioengine.risk.ReservationId;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import lombok.Getter;

/**
 * An open (or just closed) position on one instrument.
 *
 * <p>Owned by the instrument's evaluation pipeline: only that pipeline mutates it, so no
 * field is guarded. Portfolio-level figures derived from it (category stake, reserved
 * risk) live in the ledger and are updated by the engine under the ledger lock.
 *
 * <p>The open price is the stake-weighted average entry price of all fills, so the
 * profit ratio and stop offsets move with each averaging order. The stop level is a ratio
 * against that price: after a ladder fill lowers a long's open price, the same stop level
 * lands at a lower absolute price (higher for a short).
 *
 * <p>Take-profit levels shrink every fill by the same ratio, which leaves the open price and
 * therefore the stop price where they were.
 */
@Getter
public class Position {

    private final String positionId;
    private final String instrumentId;
    private final String category;
    private final PositionSide side;
    private final Instant openedAt;
    private final List<Fill> fills = new ArrayList<>();
    private final List<ReservationId> reservationIds = new ArrayList<>();
    private final DcaLadderState ladder;

    /**
     * Current protective stop as the profit ratio at which the position is closed, so -0.06
     * means "exit at a 6% loss" for either side. Null until first computed. Larger is tighter.
     */
    private Double stopLevel;

    /** Best price seen since entry: highest for longs, lowest for shorts. */
    private double bestFavorablePrice;

    /** 1-based take-profit levels already taken. */
    private final Set<Integer> takenProfitLevels = new TreeSet<>();

    /** Share of the position closed by take-profit levels, relative to its size before the first one. */
    private double takenProfitFraction;

    private boolean closed;
    private Instant closedAt;
    private ExitReason exitReason;

    public Position(
            String instrumentId,
            String category,
            PositionSide side,
            Fill initialFill,
            ReservationId reservationId,
            DcaLadderState ladder) {
        this.positionId = UUID.randomUUID().toString();
        this.instrumentId = instrumentId;
        this.category = category;
        this.side = side;
        this.openedAt = initialFill.timestamp();
        this.ladder = ladder != null ? ladder : DcaLadderState.disabled();
        this.bestFavorablePrice = initialFill.price();
        this.fills.add(initialFill);
        if (reservationId != null) {
            this.reservationIds.add(reservationId);
        }
    }

    public void addFill(Fill fill, ReservationId reservationId) {
        if (closed) {
            throw new IllegalStateException("Position " + positionId + " is closed");
        }
        fills.add(fill);
        if (reservationId != null) {
            reservationIds.add(reservationId);
        }
    }

    /**
     * Records take-profit levels and keeps {@code keepRatio} of every fill. A ratio of zero
     * only records the levels; the caller closes the position.
     *
     * @return the stake closed by the reduction
     */
    public BigDecimal takeProfit(List<Integer> levels, double exitFraction, BigDecimal keepRatio) {
        if (closed) {
            throw new IllegalStateException("Position " + positionId + " is closed");
        }
        if (keepRatio.signum() < 0 || keepRatio.compareTo(BigDecimal.ONE) > 0) {
            throw new IllegalArgumentException("Keep ratio must be within [0, 1], got " + keepRatio);
        }
        takenProfitLevels.addAll(levels);
        takenProfitFraction += exitFraction;
        if (keepRatio.signum() == 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal before = getCumulativeStake();
        fills.replaceAll(fill -> new Fill(
                fill.size().multiply(keepRatio, MathContext.DECIMAL64),
                fill.price(),
                fill.timestamp(),
                fill.type(),
                fill.ladderLevel()));
        return before.subtract(getCumulativeStake());
    }

    public BigDecimal getCumulativeStake() {
        return fills.stream().map(Fill::size).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /** Stake-weighted average entry price. */
    public double getOpenPrice() {
        // Average price of equal-currency stakes is the harmonic mean weighted by stake.
        BigDecimal stake = getCumulativeStake();
        BigDecimal units = BigDecimal.ZERO;
        for (Fill fill : fills) {
            units = units.add(fill.size().divide(BigDecimal.valueOf(fill.price()), MathContext.DECIMAL64));
        }
        return stake.divide(units, MathContext.DECIMAL64).doubleValue();
    }

    /** Signed profit ratio at the given price; positive means the position is in profit. */
    public double profitRatio(double price) {
        double openPrice = getOpenPrice();
        if (openPrice <= 0) {
            return 0;
        }
        return side.sign() * (price - openPrice) / openPrice;
    }

    public Instant getLastFillAt() {
        return fills.get(fills.size() - 1).timestamp();
    }

    public Duration timeOpen(Instant now) {
        return Duration.between(openedAt, now);
    }

    public void observePrice(double price) {
        if (side == PositionSide.LONG ? price > bestFavorablePrice : price < bestFavorablePrice) {
            bestFavorablePrice = price;
        }
    }

    /**
     * Records a newly computed stop. Callers are expected to pass a value that is never looser
     * than the current one; this is re-checked here.
     */
    public void updateStopLevel(double newStopLevel) {
        if (stopLevel != null && newStopLevel < stopLevel) {
            throw new IllegalArgumentException(
                    "Stop for " + positionId + " would loosen from " + stopLevel + " to " + newStopLevel);
        }
        this.stopLevel = newStopLevel;
    }

    /**
     * Stop as a fractional offset from the open price: negative for longs, positive for shorts.
     */
    public Double getStopOffset() {
        return stopLevel == null ? null : side.sign() * stopLevel;
    }

    public double getStopPrice() {
        if (stopLevel == null) {
            return Double.NaN;
        }
        return getOpenPrice() * (1 + getStopOffset());
    }

    public boolean isStopHit(double price) {
        return stopLevel != null && profitRatio(price) <= stopLevel;
    }

    public void close(ExitReason reason, Instant at) {
        this.closed = true;
        this.exitReason = reason;
        this.closedAt = at;
    }

    public List<Fill> getFills() {
        return Collections.unmodifiableList(fills);
    }

    public List<ReservationId> getReservationIds() {
        return Collections.unmodifiableList(reservationIds);
    }

    public Set<Integer> getTakenProfitLevels() {
        return Collections.unmodifiableSet(takenProfitLevels);
    }
}
