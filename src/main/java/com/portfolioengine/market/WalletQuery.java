package com.portfolioengine.market;

import java.math.BigDecimal;

/**
 * Returns the account's total capital (committed stakes plus free balance).
 * Zero means the balance is unknown, and the engine then takes no new exposure.
 */
public interface WalletQuery {

    BigDecimal totalCapital();
}
