package com.portfolioengine.dca;

import com.portfolioengine.domain.model.DcaLevel;
import java.math.BigDecimal;

/**
 * Whether a ladder rung should fire this tick. When {@code triggered} is false,
 * {@code reason} says which condition held it back.
 *
 * @param allocationHeadroom how much more stake the position may take before hitting its cap
 */
public record LadderDecision(boolean triggered, DcaLevel level, BigDecimal allocationHeadroom, String reason) {

    static LadderDecision notTriggered(String reason) {
        return new LadderDecision(false, null, BigDecimal.ZERO, reason);
    }

    static LadderDecision trigger(DcaLevel level, BigDecimal allocationHeadroom) {
        return new LadderDecision(true, level, allocationHeadroom, null);
    }
}
