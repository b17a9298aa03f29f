package com.portfolioengine.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Error taxonomy of the decision engine.
 *
 * <p>{@link #CONFIGURATION_ERROR} aborts startup. The other codes are raised and handled
 * within a single tick and degrade to "no action". An exceeded risk budget is not an error:
 * the ledger reports it as a denied reservation.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    CONFIGURATION_ERROR("CONFIGURATION_ERROR"),
    DATA_UNAVAILABLE("DATA_UNAVAILABLE"),
    DEGENERATE_INPUT("DEGENERATE_INPUT");

    private final String code;
}
