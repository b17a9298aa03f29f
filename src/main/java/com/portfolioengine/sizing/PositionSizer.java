package com.portfolioengine.sizing;

import com.portfolioengine.domain.enums.PositionSizingType;
import com.portfolioengine.domain.model.PositionSizingContext;
import java.math.BigDecimal;

/**
 * Computes the raw stake for an order before clamping, ladder multipliers and the ledger.
 *
 * <p>Resolved by {@link PositionSizerFactory} based on {@link PositionSizingType}.
 */
public interface PositionSizer {

    /**
     * @return raw stake in account currency, never negative
     */
    BigDecimal calculateStake(PositionSizingContext positionSizingContext);

    PositionSizingType getType();
}
