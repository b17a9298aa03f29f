package com.portfolioengine.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/**
 * Already-fetched external values handed to one evaluation: wallet total, optional
 * top of book, the evaluation instant, and whether the caller demands liquidation.
 */
@Getter
@Builder
public class PortfolioContext {

    private final BigDecimal totalCapital;

    /** Null when the order-book collaborator has no depth for the instrument. */
    private final OrderBookDepth depth;

    private final Instant now;

    private final boolean emergencyExit;

    public boolean hasUsableCapital() {
        return totalCapital != null && totalCapital.signum() > 0;
    }
}
