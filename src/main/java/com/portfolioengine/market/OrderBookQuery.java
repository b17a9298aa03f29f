package com.portfolioengine.market;

import com.portfolioengine.domain.model.OrderBookDepth;
import java.util.Optional;

/**
 * Optional top-of-book lookup, used only by the admission gate's spread check.
 */
public interface OrderBookQuery {

    Optional<OrderBookDepth> depth(String instrumentId);
}
