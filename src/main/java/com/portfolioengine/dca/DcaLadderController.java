package com.portfolioengine.dca;

import com.portfolioengine.domain.enums.LadderStatus;
import com.portfolioengine.domain.enums.PositionSide;
import com.portfolioengine.domain.model.DcaLadderState;
import com.portfolioengine.domain.model.DcaLevel;
import com.portfolioengine.domain.model.Fill;
import com.portfolioengine.domain.model.Position;
import com.portfolioengine.risk.ReservationId;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decides when an open position receives its next averaging order.
 *
 * <p>A rung fires only when all of these hold:
 * <ol>
 *   <li>it is the first unused rung of the position's ladder</li>
 *   <li>the position's profit ratio is at or below the rung's trigger</li>
 *   <li>at least {@code minTimeBetweenEntries} has passed since the position's last fill</li>
 *   <li>the position still has room under {@code maxPositionAllocation x capital}</li>
 * </ol>
 * {@link #evaluate} only reads state. The rung is consumed by {@link #recordFill} once the
 * order has been admitted, so a rung refused by the gate can fire on a later tick, while an
 * admitted rung can never fire again.
 */
@Component
public class DcaLadderController {

    private static final Logger log = LoggerFactory.getLogger(DcaLadderController.class);

    private final DcaLadderConfig dcaLadderConfig;

    public DcaLadderController(DcaLadderConfig dcaLadderConfig) {
        this.dcaLadderConfig = dcaLadderConfig;
    }

    /** Creates the ladder for a newly opened position from the configured rungs. */
    public DcaLadderState createLadder() {
        if (!dcaLadderConfig.isEnabled()) {
            return DcaLadderState.disabled();
        }
        List<DcaLevel> levels = new ArrayList<>();
        List<DcaLadderConfig.Level> configured = dcaLadderConfig.getLevels();
        for (int i = 0; i < configured.size(); i++) {
            levels.add(new DcaLevel(i + 1, configured.get(i).getTrigger(), configured.get(i).getMultiplier()));
        }
        return new DcaLadderState(levels);
    }

    public LadderDecision evaluate(Position position, double price, BigDecimal totalCapital, Instant now) {
        if (!dcaLadderConfig.isEnabled() || position.isClosed()) {
            return LadderDecision.notTriggered("disabled");
        }
        DcaLadderState ladder = position.getLadder();
        if (ladder.getStatus() == LadderStatus.EXHAUSTED) {
            return LadderDecision.notTriggered("exhausted");
        }
        DcaLevel next = ladder.nextLevel().orElse(null);
        if (next == null) {
            return LadderDecision.notTriggered("exhausted");
        }

        double profitRatio = position.profitRatio(price);
        if (profitRatio > next.triggerProfitRatio()) {
            return LadderDecision.notTriggered("above trigger");
        }

        Duration sinceLastFill = Duration.between(position.getLastFillAt(), now);
        if (sinceLastFill.compareTo(dcaLadderConfig.getMinTimeBetweenEntries()) < 0) {
            log.debug(
                    "Ladder level {} for {} waiting: {} since last fill",
                    next.level(),
                    position.getInstrumentId(),
                    sinceLastFill);
            return LadderDecision.notTriggered("spacing");
        }

        if (totalCapital == null || totalCapital.signum() <= 0) {
            return LadderDecision.notTriggered("no capital");
        }
        BigDecimal maxAllocation = totalCapital.multiply(dcaLadderConfig.getMaxPositionAllocation());
        BigDecimal headroom = maxAllocation.subtract(position.getCumulativeStake());
        if (headroom.signum() <= 0) {
            return LadderDecision.notTriggered("allocation cap");
        }

        return LadderDecision.trigger(next, headroom);
    }

    /**
     * Consumes the rung and appends the admitted fill to the position.
     *
     * @throws IllegalStateException if the rung is not the next unused one
     */
    public void recordFill(Position position, DcaLevel level, Fill fill, ReservationId reservationId) {
        DcaLadderState ladder = position.getLadder();
        ladder.markTriggered(level);
        position.addFill(fill, reservationId);
        ladder.settle();
        log.info(
                "Ladder level {} filled for {}: stake {} at {}, ladder {}",
                level.level(),
                position.getInstrumentId(),
                fill.size(),
                fill.price(),
                ladder.getStatus());
    }

    /**
     * Limit price for a ladder order: below market for longs (above for shorts) by
     * {@code min(maxLimitDiscount, atrDiscountFactor x atr / price)}. Unknown ATR or
     * price returns the price unchanged.
     */
    public double ladderEntryPrice(PositionSide side, double price, double atr) {
        if (price <= 0 || Double.isNaN(atr) || atr <= 0) {
            return price;
        }
        double discount = Math.min(dcaLadderConfig.getMaxLimitDiscount(), dcaLadderConfig.getAtrDiscountFactor() * atr / price);
        return side == PositionSide.LONG ? price * (1 - discount) : price * (1 + discount);
    }
}
