package com.portfolioengine.takeprofit;

import java.util.List;

/**
 * Levels reached on this tick and how much of the position they close.
 *
 * @param levels 1-based levels taken by this decision, ascending
 * @param exitFraction share of the pre-take-profit position closed now
 * @param keepRatio share of the current stake that stays open; 0 when the position closes
 */
public record TakeProfitDecision(List<Integer> levels, double exitFraction, double keepRatio) {

    static final TakeProfitDecision NONE = new TakeProfitDecision(List.of(), 0, 1);

    public boolean triggered() {
        return !levels.isEmpty();
    }

    public boolean closesPosition() {
        return triggered() && keepRatio <= 0;
    }

    /** Tag of the highest level taken, e.g. {@code take_profit_2}. */
    public String tag() {
        return levels.isEmpty() ? null : "take_profit_" + levels.get(levels.size() - 1);
    }
}
