package com.portfolioengine.domain.enums;

/**
 * Reason codes carried by rebalance proposals.
 */
public enum RebalanceReason {
    UNDER_TARGET,
    OVER_TARGET
}
