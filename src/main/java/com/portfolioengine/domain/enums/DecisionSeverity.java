package com.portfolioengine.domain.enums;

/**
 * Severity of a decision log entry. DEBUG entries are kept in the ring buffer only;
 * WARNING and CRITICAL are also written to the application log.
 */
public enum DecisionSeverity {
    DEBUG,
    INFO,
    WARNING,
    CRITICAL
}
