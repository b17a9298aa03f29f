package com.portfolioengine.config;

import com.portfolioengine.dca.DcaLadderConfig;
import com.portfolioengine.rebalance.RebalanceConfig;
import com.portfolioengine.sizing.PositionSizingConfig;
import com.portfolioengine.stoploss.StopLossConfig;
import jakarta.annotation.PostConstruct;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Pushes the values of a configured {@link RiskProfile} into the per-component config beans.
 *
 * <p>A property that is present in the environment always wins over the derived value, so
 * a risk level can be combined with individual overrides.
 */
@Component
public class RiskProfileApplier {

    private static final Logger log = LoggerFactory.getLogger(RiskProfileApplier.class);

    private final Environment environment;
    private final PositionSizingConfig positionSizingConfig;
    private final StopLossConfig stopLossConfig;
    private final DcaLadderConfig dcaLadderConfig;
    private final RebalanceConfig rebalanceConfig;

    public RiskProfileApplier(
            Environment environment,
            PositionSizingConfig positionSizingConfig,
            StopLossConfig stopLossConfig,
            DcaLadderConfig dcaLadderConfig,
            RebalanceConfig rebalanceConfig) {
        this.environment = environment;
        this.positionSizingConfig = positionSizingConfig;
        this.stopLossConfig = stopLossConfig;
        this.dcaLadderConfig = dcaLadderConfig;
        this.rebalanceConfig = rebalanceConfig;
    }

    @PostConstruct
    public void apply() {
        Integer level = environment.getProperty("engine.risk.level", Integer.class);
        if (level == null) {
            return;
        }
        RiskProfile profile = RiskProfile.forLevel(level);

        if (!environment.containsProperty("engine.sizing.base-stake-fraction")) {
            positionSizingConfig.setBaseStakeFraction(profile.getBaseStakeFraction());
        }
        if (!environment.containsProperty("engine.sizing.max-stake-fraction")) {
            positionSizingConfig.setMaxStakeFraction(profile.getMaxStakeFraction());
        }
        if (!environment.containsProperty("engine.sizing.risk-per-trade")) {
            positionSizingConfig.setRiskPerTrade(profile.getRiskPerTrade());
        }
        if (!environment.containsProperty("engine.stop-loss.static-floor")) {
            stopLossConfig.setStaticFloor(profile.getStaticStop());
        }
        if (!environment.containsProperty("engine.dca.levels[0].trigger")) {
            List<DcaLadderConfig.Level> levels = profile.ladder().stream()
                    .map(rung -> new DcaLadderConfig.Level(rung[0], rung[1]))
                    .collect(Collectors.toList());
            dcaLadderConfig.setLevels(levels);
        }
        if (!environment.containsProperty("engine.rebalance.threshold")) {
            rebalanceConfig.setThreshold(profile.getRebalanceThreshold());
        }

        log.info(
                "Risk level {} applied: base stake {}, static stop {}, {} ladder levels, rebalance threshold {}",
                level,
                positionSizingConfig.getBaseStakeFraction(),
                stopLossConfig.getStaticFloor(),
                dcaLadderConfig.getLevels().size(),
                rebalanceConfig.getThreshold());
    }
}
