package com.portfolioengine.exception;

import java.util.Map;

/**
 * A required indicator, snapshot or balance was not supplied for this tick.
 */
public class DataUnavailableException extends BaseException {

    public DataUnavailableException(String message) {
        super(ErrorCode.DATA_UNAVAILABLE, message);
    }

    public DataUnavailableException(String instrumentId, String indicator) {
        super(
                ErrorCode.DATA_UNAVAILABLE,
                "Indicator " + indicator + " missing for " + instrumentId,
                Map.of("instrumentId", instrumentId, "indicator", indicator));
    }
}
