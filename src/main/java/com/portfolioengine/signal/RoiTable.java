package com.portfolioengine.signal;

import java.time.Duration;
import java.util.Map;
import java.util.TreeMap;
import org.springframework.stereotype.Component;

/**
 * Time-based take-profit: the longer a position has been open, the smaller the profit that
 * is enough to close it.
 */
@Component
public class RoiTable {

    private final RoiConfig roiConfig;

    public RoiTable(RoiConfig roiConfig) {
        this.roiConfig = roiConfig;
    }

    /**
     * Returns true when the profit ratio reaches the entry of the table that applies to the
     * given time open (the largest key not above it).
     */
    public boolean isReached(double profitRatio, Duration timeOpen) {
        if (!roiConfig.isEnabled() || roiConfig.getTable().isEmpty()) {
            return false;
        }
        TreeMap<Long, Double> table = new TreeMap<>(roiConfig.getTable());
        Map.Entry<Long, Double> applicable = table.floorEntry(Math.max(0, timeOpen.toMinutes()));
        return applicable != null && profitRatio >= applicable.getValue();
    }
}
