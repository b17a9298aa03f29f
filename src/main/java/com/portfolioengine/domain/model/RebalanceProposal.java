package com.portfolioengine.domain.model;

import com.portfolioengine.domain.enums.RebalanceDirection;
import com.portfolioengine.domain.enums.RebalanceReason;
import java.math.BigDecimal;

/**
 * A proposed capital move into or out of a category. Consumed by the same evaluation path
 * as organic signals within the rebalance cycle that produced it; never stored.
 */
public record RebalanceProposal(
        String category, RebalanceDirection direction, BigDecimal amount, RebalanceReason reason, double drift) {}
