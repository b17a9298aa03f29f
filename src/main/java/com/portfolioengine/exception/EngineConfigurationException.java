package com.portfolioengine.exception;

import java.util.Map;

/**
 * Thrown while the application context starts when engine configuration is inconsistent
 * (unordered DCA thresholds, category targets above 100%, inverted clamp bounds).
 */
public class EngineConfigurationException extends BaseException {

    public EngineConfigurationException(String message) {
        super(ErrorCode.CONFIGURATION_ERROR, message);
    }

    public EngineConfigurationException(String message, Map<String, Object> details) {
        super(ErrorCode.CONFIGURATION_ERROR, message, details);
    }
}
