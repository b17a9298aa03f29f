package com.portfolioengine.signal;

import java.util.Map;
import java.util.TreeMap;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Minimum-return table. Properties prefix: {@code engine.roi.*}.
 *
 * <p>Keys are minutes since the position opened; values are the profit ratio that is
 * enough to take profit from that minute on.
 */
@Data
@Component
@ConfigurationProperties(prefix = "engine.roi")
public class RoiConfig {

    private boolean enabled = true;

    private Map<Long, Double> table = new TreeMap<>(Map.of(0L, 0.20, 40L, 0.10, 80L, 0.05, 120L, 0.02, 240L, 0.01));
}
