package com.portfolioengine.signal;

public enum SignalFamilyType {
    TREND_FOLLOWING,
    MEAN_REVERSION,
    RISK_EXIT
}
