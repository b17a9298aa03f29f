package com.portfolioengine.domain.model;

import com.portfolioengine.domain.enums.FillType;
import com.portfolioengine.exception.DegenerateInputException;
import java.math.BigDecimal;
import java.time.Instant;

/**
 * An accepted order on a position. {@code size} is the committed stake in account currency.
 * {@code ladderLevel} is 1-based for LADDER fills and 0 otherwise.
 */
public record Fill(BigDecimal size, double price, Instant timestamp, FillType type, int ladderLevel) {

    public Fill {
        if (!(price > 0) || Double.isInfinite(price)) {
            throw new DegenerateInputException("Fill price must be positive, got " + price);
        }
        if (size == null || size.signum() <= 0) {
            throw new DegenerateInputException("Fill size must be positive, got " + size);
        }
    }

    public static Fill initial(BigDecimal size, double price, Instant timestamp) {
        return new Fill(size, price, timestamp, FillType.INITIAL, 0);
    }

    public static Fill ladder(BigDecimal size, double price, Instant timestamp, int level) {
        return new Fill(size, price, timestamp, FillType.LADDER, level);
    }

    public static Fill rebalance(BigDecimal size, double price, Instant timestamp) {
        return new Fill(size, price, timestamp, FillType.REBALANCE, 0);
    }

    public String tag() {
        return switch (type) {
            case INITIAL -> "initial";
            case LADDER -> "ladder_" + ladderLevel;
            case REBALANCE -> "rebalance";
        };
    }
}
