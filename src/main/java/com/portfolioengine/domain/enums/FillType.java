package com.portfolioengine.domain.enums;

/**
 * Distinguishes fills on a position. A LADDER fill also carries its ladder level.
 */
public enum FillType {
    INITIAL,
    LADDER,
    REBALANCE
}
