package com.portfolioengine.event;

/**
 * Severity level for a {@link RiskEvent}.
 */
public enum RiskLevel {

    /** Threshold approaching, nothing refused yet. */
    INFO,

    /** A limit refused an order. */
    WARNING,

    /** New exposure is refused across the whole portfolio until the condition clears. */
    CRITICAL
}
