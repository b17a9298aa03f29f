package com.portfolioengine.domain.model;

import java.math.BigDecimal;

/**
 * One row of the allocation table: what a category currently holds against its target.
 *
 * @param currentValue sum of open stakes in the category (uncommitted balance for "stable")
 * @param currentFraction currentValue / total capital
 * @param targetFraction configured target share of total capital
 */
public record CategoryAllocation(
        String category, BigDecimal currentValue, double currentFraction, double targetFraction) {

    public double drift() {
        return Math.abs(currentFraction - targetFraction);
    }

    public boolean isUnderTarget() {
        return currentFraction < targetFraction;
    }
}
