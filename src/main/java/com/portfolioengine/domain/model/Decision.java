package com.portfolioengine.domain.model;

import com.portfolioengine.domain.enums.DecisionAction;
import com.portfolioengine.domain.enums.ExitReason;
import com.portfolioengine.domain.enums.PositionSide;
import com.portfolioengine.domain.enums.Regime;
import com.portfolioengine.risk.RiskViolation;
import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Result of evaluating one instrument on one tick.
 *
 * <p>{@code position} is the updated position after the decision was applied: a freshly
 * created position for ENTER, the same position with an extra fill for LADDER, the closed
 * position for a full EXIT, the still open, reduced position for a partial take-profit
 * EXIT, or the open position with a possibly tightened stop for HOLD.
 * Rejected proposals come back as HOLD with the gate's violations attached.
 */
@Getter
@Builder
@ToString
public class Decision {

    private final String instrumentId;
    private final DecisionAction action;
    private final Regime regime;
    private final PositionSide side;

    /** Capital committed (entry, ladder) or released (exit) by this decision. */
    @Builder.Default
    private final BigDecimal stake = BigDecimal.ZERO;

    /** Stop offset from the open price (negative for longs, positive for shorts); null without a position. */
    private final Double stopLevel;

    private final String tag;
    private final ExitReason exitReason;

    /** 1-based ladder level for LADDER decisions, 0 otherwise. */
    private final int ladderLevel;

    /** Suggested limit price for ladder orders; NaN when the order should go at market. */
    @Builder.Default
    private final double limitPrice = Double.NaN;

    private final Position position;

    @Builder.Default
    private final List<RiskViolation> violations = List.of();

    public boolean isEnter() {
        return action == DecisionAction.ENTER;
    }

    public boolean isExit() {
        return action == DecisionAction.EXIT;
    }

    /** An EXIT that left part of the position open. */
    public boolean isPartialExit() {
        return isExit() && position != null && !position.isClosed();
    }

    public boolean isActionable() {
        return action != DecisionAction.HOLD;
    }

    public static Decision hold(String instrumentId, Regime regime, Position position) {
        return Decision.builder()
                .instrumentId(instrumentId)
                .action(DecisionAction.HOLD)
                .regime(regime)
                .side(position != null ? position.getSide() : null)
                .stopLevel(position != null ? position.getStopOffset() : null)
                .position(position)
                .build();
    }

    public static Decision rejected(
            String instrumentId, Regime regime, Position position, String tag, List<RiskViolation> violations) {
        return Decision.builder()
                .instrumentId(instrumentId)
                .action(DecisionAction.HOLD)
                .regime(regime)
                .side(position != null ? position.getSide() : null)
                .stopLevel(position != null ? position.getStopOffset() : null)
                .position(position)
                .tag(tag)
                .violations(List.copyOf(violations))
                .build();
    }
}
