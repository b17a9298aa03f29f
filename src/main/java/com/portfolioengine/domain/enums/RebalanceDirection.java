package com.portfolioengine.domain.enums;

public enum RebalanceDirection {
    INCREASE,
    DECREASE
}
