package com.portfolioengine.domain.enums;

/**
 * The result of a decision evaluation.
 *
 * <p>Used to quickly filter the decision log:
 * <ul>
 *   <li>TRIGGERED -- The condition was met and action was taken (entry, ladder order, exit)</li>
 *   <li>SKIPPED -- The condition was evaluated but no action was needed (normal cycle)</li>
 *   <li>REJECTED -- The action was blocked (admission gate, exhausted risk budget)</li>
 *   <li>FAILED -- Evaluation threw and the tick degraded to no action</li>
 *   <li>INFO -- Informational entry, no action involved (startup, rebalance cycle summaries)</li>
 * </ul>
 */
public enum DecisionOutcome {
    TRIGGERED,
    SKIPPED,
    REJECTED,
    FAILED,
    INFO
}
