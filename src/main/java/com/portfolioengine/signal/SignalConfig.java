package com.portfolioengine.signal;

import java.util.EnumSet;
import java.util.Set;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Predicate thresholds for each signal family. Properties prefix: {@code engine.signal.*}.
 *
 * <p>Each nested block belongs to one {@link SignalFamily}. Families not listed in
 * {@code enabledFamilies} are skipped entirely.
 */
@Data
@Component
@ConfigurationProperties(prefix = "engine.signal")
public class SignalConfig {

    private Set<SignalFamilyType> enabledFamilies = EnumSet.allOf(SignalFamilyType.class);

    /** When false, only long entries are proposed. */
    private boolean shortingEnabled = false;

    private TrendFollowing trendFollowing = new TrendFollowing();
    private MeanReversion meanReversion = new MeanReversion();
    private RiskExit riskExit = new RiskExit();

    @Data
    public static class TrendFollowing {
        /** Volume must exceed its moving average by this ratio to confirm a cross. */
        private double minVolumeRatio = 1.1;
    }

    @Data
    public static class MeanReversion {
        private double oversoldLevel = 25.0;
        private double overboughtLevel = 75.0;
        /** Price within this fraction of a band edge counts as touching it. */
        private double bandTouchTolerance = 0.01;
        /** Long exit once the oscillator turns down from above this level (mirrored for shorts). */
        private double exitLevel = 80.0;
    }

    @Data
    public static class RiskExit {
        /** Band width above which volatility is considered to have spiked. */
        private double volatilitySpikeBandWidth = 0.25;
        private double overextendedRsi = 72.0;
        /** Price position within the bands (0 = lower, 1 = upper) counted as overextended. */
        private double overextendedBandPosition = 0.8;
    }
}
