package com.portfolioengine.unit.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.portfolioengine.config.RiskProfile;
import com.portfolioengine.config.RiskProfileApplier;
import com.portfolioengine.dca.DcaLadderConfig;
import com.portfolioengine.exception.EngineConfigurationException;
import com.portfolioengine.rebalance.RebalanceConfig;
import com.portfolioengine.sizing.PositionSizingConfig;
import com.portfolioengine.stoploss.StopLossConfig;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.mock.env.MockEnvironment;

/**
 * Unit tests for RiskProfile derivation and for RiskProfileApplier pushing the derived
 * values into the component configs.
 */
class RiskProfileTest {

    // ==== Derivation ====

    @Nested
    @DisplayName("Derivation")
    class Derivation {

        @Test
        @DisplayName("Level 0 is the conservative end")
        void conservativeEnd() {
            RiskProfile profile = RiskProfile.forLevel(0);

            assertThat(profile.getMaxTotalRisk()).isEqualByComparingTo("0.10");
            assertThat(profile.getMaxDrawdown()).isEqualByComparingTo("0.05");
            assertThat(profile.getStaticStop()).isEqualTo(-0.04);
            assertThat(profile.getDcaMaxOrders()).isEqualTo(2);
            assertThat(profile.getDcaMultiplier()).isEqualTo(1.2);
            assertThat(profile.getRebalanceThreshold()).isEqualTo(0.20);
        }

        @Test
        @DisplayName("Level 100 is the aggressive end")
        void aggressiveEnd() {
            RiskProfile profile = RiskProfile.forLevel(100);

            assertThat(profile.getMaxTotalRisk()).isEqualByComparingTo("0.35");
            assertThat(profile.getStaticStop()).isEqualTo(-0.12);
            assertThat(profile.getDcaMaxOrders()).isEqualTo(5);
            // -0.12 would sit on the stop; clamped to 80% of it
            assertThat(profile.getDcaDeepestTrigger()).isEqualTo(-0.096);
            assertThat(profile.getDcaMultiplier()).isEqualTo(2.0);
        }

        @ParameterizedTest
        @ValueSource(ints = {-1, 101})
        @DisplayName("Level outside [0, 100] is rejected")
        void outOfRange_rejected(int level) {
            assertThatThrownBy(() -> RiskProfile.forLevel(level))
                    .isInstanceOf(EngineConfigurationException.class)
                    .hasMessageContaining("engine.risk.level");
        }

        @ParameterizedTest
        @ValueSource(ints = {0, 25, 50, 75, 100})
        @DisplayName("Ladder grows in severity and size and stays above the static stop")
        void ladderMonotonic(int level) {
            RiskProfile profile = RiskProfile.forLevel(level);
            List<double[]> ladder = profile.ladder();

            assertThat(ladder).hasSize(profile.getDcaMaxOrders());
            for (int i = 0; i < ladder.size(); i++) {
                assertThat(ladder.get(i)[0]).isLessThan(0).isGreaterThan(profile.getStaticStop());
                if (i > 0) {
                    assertThat(ladder.get(i)[0]).isLessThan(ladder.get(i - 1)[0]);
                    assertThat(ladder.get(i)[1]).isGreaterThan(ladder.get(i - 1)[1]);
                }
            }
        }

        @Test
        @DisplayName("Level 100 ladder rungs are evenly spaced")
        void aggressiveLadder() {
            List<double[]> ladder = RiskProfile.forLevel(100).ladder();

            assertThat(ladder.get(0)[0]).isCloseTo(-0.0192, within(1e-9));
            assertThat(ladder.get(0)[1]).isCloseTo(2.0, within(1e-9));
            assertThat(ladder.get(4)[0]).isCloseTo(-0.096, within(1e-9));
            assertThat(ladder.get(4)[1]).isCloseTo(6.0, within(1e-9));
        }
    }

    // ==== Application ====

    @Nested
    @DisplayName("Application")
    class Application {

        private final PositionSizingConfig sizingConfig = new PositionSizingConfig();
        private final StopLossConfig stopLossConfig = new StopLossConfig();
        private final DcaLadderConfig dcaLadderConfig = new DcaLadderConfig();
        private final RebalanceConfig rebalanceConfig = new RebalanceConfig();

        private RiskProfileApplier applier(MockEnvironment environment) {
            return new RiskProfileApplier(environment, sizingConfig, stopLossConfig, dcaLadderConfig, rebalanceConfig);
        }

        @Test
        @DisplayName("No level leaves the configs untouched")
        void noLevel_noop() {
            applier(new MockEnvironment()).apply();

            assertThat(stopLossConfig.getStaticFloor()).isEqualTo(-0.15);
            assertThat(dcaLadderConfig.getLevels()).hasSize(3);
        }

        @Test
        @DisplayName("Level derives every unset value")
        void level_applied() {
            applier(new MockEnvironment().withProperty("engine.risk.level", "0")).apply();

            assertThat(sizingConfig.getBaseStakeFraction()).isEqualByComparingTo(new BigDecimal("0.05"));
            assertThat(stopLossConfig.getStaticFloor()).isEqualTo(-0.04);
            assertThat(dcaLadderConfig.getLevels()).hasSize(2);
            assertThat(rebalanceConfig.getThreshold()).isEqualTo(0.20);
        }

        @Test
        @DisplayName("Explicit property wins over the derived value")
        void explicitOverride_wins() {
            stopLossConfig.setStaticFloor(-0.2);
            MockEnvironment environment = new MockEnvironment()
                    .withProperty("engine.risk.level", "100")
                    .withProperty("engine.stop-loss.static-floor", "-0.2");

            applier(environment).apply();

            assertThat(stopLossConfig.getStaticFloor()).isEqualTo(-0.2);
            assertThat(dcaLadderConfig.getLevels()).hasSize(5);
        }
    }
}
